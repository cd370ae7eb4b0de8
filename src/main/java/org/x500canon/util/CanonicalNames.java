package org.x500canon.util;

import java.util.List;

import org.bouncycastle.asn1.x500.X500Name;
import org.x500canon.client.Canonicalizer;
import org.x500canon.name.OidOrdering;
import org.x500canon.name.OrderedName;
import org.x500canon.render.TypeAndValue;

/**
 * Static shortcuts to {@link Canonicalizer}.
 * <p>
 * Each method takes a <tt>numericOidOrder</tt> flag which selects
 * {@link OidOrdering#NUMERIC} when <tt>true</tt>; the overloads without it
 * use {@link OidOrdering#LEXICOGRAPHIC}.
 */
public final class CanonicalNames {
    private static final Canonicalizer LEXICOGRAPHIC = new Canonicalizer(OidOrdering.LEXICOGRAPHIC);
    private static final Canonicalizer NUMERIC = new Canonicalizer(OidOrdering.NUMERIC);

    private CanonicalNames() {
    }

    public static String canonicalName(X500Name name) {
        return canonicalName(name, false);
    }

    public static String canonicalName(X500Name name, boolean numericOidOrder) {
        return canonicalizer(numericOidOrder).canonicalName(name);
    }

    public static String friendlyName(X500Name name) {
        return friendlyName(name, false);
    }

    public static String friendlyName(X500Name name, boolean numericOidOrder) {
        return canonicalizer(numericOidOrder).friendlyName(name);
    }

    public static List<List<TypeAndValue>> comparisonName(X500Name name) {
        return comparisonName(name, false);
    }

    public static List<List<TypeAndValue>> comparisonName(X500Name name, boolean numericOidOrder) {
        return canonicalizer(numericOidOrder).comparisonName(name);
    }

    public static OrderedName orderedName(X500Name name) {
        return orderedName(name, false);
    }

    public static OrderedName orderedName(X500Name name, boolean numericOidOrder) {
        return canonicalizer(numericOidOrder).orderedName(name);
    }

    private static Canonicalizer canonicalizer(boolean numericOidOrder) {
        return numericOidOrder ? NUMERIC : LEXICOGRAPHIC;
    }
}
