package org.x500canon.name;

/**
 * How attribute types written as dotted OIDs are ordered within a relative
 * distinguished name.
 */
public enum OidOrdering {
    /**
     * Dotted OIDs are compared as strings, so <tt>0.1.11.3</tt> sorts before
     * <tt>0.1.2.3</tt>. This is the ordering of the Java platform.
     */
    LEXICOGRAPHIC,
    /**
     * Dotted OIDs are compared arc by arc as integers, so <tt>0.1.2.3</tt>
     * sorts before <tt>0.1.11.3</tt>. This is the ordering of Android.
     */
    NUMERIC;

    /**
     * Returns the ordering selected by the numeric OID order flag.
     *
     * @param numericOidOrder
     *            whether dotted OIDs are compared numerically.
     * @return the ordering.
     */
    public static OidOrdering valueOf(boolean numericOidOrder) {
        return numericOidOrder ? NUMERIC : LEXICOGRAPHIC;
    }
}
