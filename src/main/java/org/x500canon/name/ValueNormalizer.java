package org.x500canon.name;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

import org.apache.commons.codec.binary.Hex;
import org.x500canon.asn1.AttributeValue;
import org.x500canon.asn1.AttributeValue.DirectoryString;
import org.x500canon.asn1.AttributeValue.Other;

/**
 * Converts attribute values into their raw and normalized string forms.
 * <p>
 * A directory string is escaped to give the raw form. The normalized form is
 * derived from the raw form:
 * <ol>
 * <li>each run of spaces (U+0020) is collapsed to a single space;</li>
 * <li>characters up to and including U+0020 are stripped from both ends, as
 * {@link String#trim()} does;</li>
 * <li>the string is uppercased and then lowercased;</li>
 * <li>the result is decomposed to Unicode normalization form KD.</li>
 * </ol>
 * Control characters inside the value and non-ASCII whitespace are kept
 * until NFKD, which maps compatibility spaces such as U+3000 to U+0020. A
 * value consisting only of whitespace normalizes to the empty string.
 * <p>
 * Any other value is written as <tt>#</tt> followed by the lowercase hex of
 * its DER encoding, in both forms.
 */
public final class ValueNormalizer {
    private static final String SPECIAL_CHARACTERS = ",+<>;\"\\";
    private static final Pattern SPACES = Pattern.compile(" +");

    private final AttributeValue.Visitor<NormalizedValue> visitor =
            new AttributeValue.Visitor<NormalizedValue>() {
                @Override
                public NormalizedValue visitDirectoryString(DirectoryString value) {
                    String raw = escape(value.getString());
                    return new NormalizedValue(raw, normalize(raw));
                }

                @Override
                public NormalizedValue visitOther(Other value) {
                    String hex = "#" + new String(Hex.encodeHex(value.getEncoded()));
                    return new NormalizedValue(hex, hex);
                }
            };

    /**
     * Converts the given attribute value.
     *
     * @param value
     *            the attribute value.
     * @return the raw and normalized forms of the value.
     */
    public NormalizedValue convert(AttributeValue value) {
        if (value == null) {
            throw new NullPointerException("value must not be null");
        }
        return value.accept(visitor);
    }

    /**
     * Escapes the characters <tt>, + &lt; &gt; ; " \</tt> with a backslash,
     * and a leading <tt>#</tt> with one more backslash.
     *
     * @param s
     *            the decoded string.
     * @return the raw value.
     */
    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        if (sb.length() > 0 && sb.charAt(0) == '#') {
            sb.insert(0, '\\');
        }
        return sb.toString();
    }

    /**
     * Derives the normalized value from a raw value.
     *
     * @param raw
     *            the escaped value.
     * @return the normalized value.
     */
    public static String normalize(String raw) {
        String collapsed = SPACES.matcher(raw).replaceAll(" ").trim();
        // Uppercasing first maps characters such as dotless i and sharp s
        // to the same lowercase form as their counterparts.
        String folded = collapsed.toUpperCase(Locale.US).toLowerCase(Locale.US);
        return Normalizer.normalize(folded, Normalizer.Form.NFKD);
    }
}
