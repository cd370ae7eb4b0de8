package org.x500canon.render;

/**
 * A type label and normalized value, as found in the comparison form of a
 * name.
 */
public final class TypeAndValue {
    private final String type;
    private final String value;

    public TypeAndValue(String type, String value) {
        if (type == null) {
            throw new NullPointerException("type must not be null");
        }
        if (value == null) {
            throw new NullPointerException("value must not be null");
        }
        this.type = type;
        this.value = value;
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TypeAndValue)) {
            return false;
        }
        TypeAndValue other = (TypeAndValue) obj;
        return type.equals(other.type) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return "(" + type + ", " + value + ")";
    }
}
