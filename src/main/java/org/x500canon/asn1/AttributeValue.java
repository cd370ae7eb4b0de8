package org.x500canon.asn1;

import java.io.IOException;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1PrintableString;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.ASN1UTF8String;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.x500canon.oid.StandardAttributeType;

/**
 * The value of an attribute type and value pair, classified for
 * canonicalization.
 * <p>
 * A value is either a {@link DirectoryString} which is handled as text, or
 * {@link Other} which is handled as its DER encoding. Only UTF8String and
 * PrintableString values of a standard attribute type are text; every other
 * value, including TeletexString and BMPString values and any value of an
 * attribute type without a keyword, falls through to {@link Other}.
 * <p>
 * The encoding of an {@link Other} value is the DER re-encoding of the
 * parsed value, not the bytes it was read from. A value that arrived in a
 * BER-only form, such as a constructed string, therefore renders differently
 * from <tt>X500Principal</tt>, which prints the original bytes.
 */
public abstract class AttributeValue {
    private static final Logger LOGGER = LoggerFactory.getLogger(AttributeValue.class);

    private AttributeValue() {
    }

    /**
     * Classifies the given value of the given attribute type.
     *
     * @param type
     *            the attribute type.
     * @param value
     *            the attribute value.
     * @return the classified value.
     */
    public static AttributeValue getInstance(ASN1ObjectIdentifier type, ASN1Encodable value) {
        if (type == null) {
            throw new NullPointerException("type must not be null");
        }
        if (value == null) {
            throw new NullPointerException("value must not be null");
        }
        if (StandardAttributeType.forOid(type) != null && isDirectoryString(value)) {
            return new DirectoryString(nativeString((ASN1String) value));
        }
        return new Other(derEncoding(value));
    }

    private static boolean isDirectoryString(ASN1Encodable value) {
        return value instanceof ASN1UTF8String || value instanceof ASN1PrintableString;
    }

    private static String nativeString(ASN1String value) {
        String s;
        try {
            s = value.getString();
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Undecodable directory string, using empty string", e);
            return "";
        }
        return s == null ? "" : s;
    }

    private static byte[] derEncoding(ASN1Encodable value) {
        try {
            return value.toASN1Primitive().getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Passes this value to the matching method of the visitor.
     *
     * @param <T>
     *            the visitor result type.
     * @param visitor
     *            the visitor.
     * @return the visitor result.
     */
    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * Callback for the two kinds of attribute value.
     *
     * @param <T> type of the result
     */
    public interface Visitor<T> {
        T visitDirectoryString(DirectoryString value);

        T visitOther(Other value);
    }

    /**
     * A UTF8String or PrintableString value of a standard attribute type.
     */
    public static final class DirectoryString extends AttributeValue {
        private final String string;

        DirectoryString(String string) {
            this.string = string;
        }

        /**
         * Returns the decoded string, which is empty if the value could not
         * be decoded.
         *
         * @return the string.
         */
        public String getString() {
            return string;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitDirectoryString(this);
        }
    }

    /**
     * Any value which is not handled as text.
     */
    public static final class Other extends AttributeValue {
        private final byte[] encoded;

        Other(byte[] encoded) {
            this.encoded = encoded;
        }

        /**
         * Returns the DER encoding of the value, tag and length included.
         * For a value decoded from BER this is the re-encoded form.
         *
         * @return a copy of the encoding.
         */
        public byte[] getEncoded() {
            return encoded.clone();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitOther(this);
        }
    }
}
