package org.x500canon.name;

/**
 * The two string forms of one attribute value.
 */
public final class NormalizedValue {
    private final String rawValue;
    private final String normalizedValue;

    NormalizedValue(String rawValue, String normalizedValue) {
        this.rawValue = rawValue;
        this.normalizedValue = normalizedValue;
    }

    /**
     * Returns the value with special characters escaped, before whitespace,
     * case and Unicode normalization.
     *
     * @return the raw value.
     */
    public String getRawValue() {
        return rawValue;
    }

    /**
     * Returns the value in the form used for comparison.
     *
     * @return the normalized value.
     */
    public String getNormalizedValue() {
        return normalizedValue;
    }
}
