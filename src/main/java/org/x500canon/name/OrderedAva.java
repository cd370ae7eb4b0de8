package org.x500canon.name;

/**
 * An attribute type and value pair prepared for ordering and rendering.
 * <p>
 * Carries both the raw value, which is escaped but otherwise as encoded, and
 * the normalized value used for comparison.
 */
public final class OrderedAva {
    /**
     * Flag of an attribute type with a keyword.
     */
    public static final int STANDARD_TYPE = 0;
    /**
     * Flag of an attribute type written as a dotted OID.
     */
    public static final int OID_TYPE = 1;

    private final int oidFlag;
    private final String type;
    private final String normalizedValue;
    private final String rawValue;

    public OrderedAva(int oidFlag, String type, String normalizedValue, String rawValue) {
        if (oidFlag != STANDARD_TYPE && oidFlag != OID_TYPE) {
            throw new IllegalArgumentException("Invalid OID flag: " + oidFlag);
        }
        if (type == null) {
            throw new NullPointerException("type must not be null");
        }
        if (normalizedValue == null) {
            throw new NullPointerException("normalizedValue must not be null");
        }
        if (rawValue == null) {
            throw new NullPointerException("rawValue must not be null");
        }
        this.oidFlag = oidFlag;
        this.type = type;
        this.normalizedValue = normalizedValue;
        this.rawValue = rawValue;
    }

    /**
     * Returns {@link #STANDARD_TYPE} or {@link #OID_TYPE}.
     *
     * @return the OID flag.
     */
    public int getOidFlag() {
        return oidFlag;
    }

    public boolean isStandardType() {
        return oidFlag == STANDARD_TYPE;
    }

    /**
     * Returns the lowercase keyword of a standard type, or the dotted OID.
     *
     * @return the type label.
     */
    public String getType() {
        return type;
    }

    public String getNormalizedValue() {
        return normalizedValue;
    }

    public String getRawValue() {
        return rawValue;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof OrderedAva)) {
            return false;
        }
        OrderedAva other = (OrderedAva) obj;
        return oidFlag == other.oidFlag
                && type.equals(other.type)
                && normalizedValue.equals(other.normalizedValue)
                && rawValue.equals(other.rawValue);
    }

    @Override
    public int hashCode() {
        int result = oidFlag;
        result = 31 * result + type.hashCode();
        result = 31 * result + normalizedValue.hashCode();
        result = 31 * result + rawValue.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "(" + oidFlag + ", " + type + ", " + normalizedValue + ", " + rawValue + ")";
    }
}
