package org.x500canon.oid;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;

/**
 * Attribute types which have a keyword in the canonical name form.
 * <p>
 * These are the RFC 2253 keywords. Any other attribute type is written as its
 * dotted OID.
 *
 * <pre>
 * cn      commonName             (2.5.4.3)
 * c       countryName            (2.5.4.6)
 * l       localityName           (2.5.4.7)
 * st      stateOrProvinceName    (2.5.4.8)
 * street  streetAddress          (2.5.4.9)
 * o       organizationName       (2.5.4.10)
 * ou      organizationalUnitName (2.5.4.11)
 * uid     userId                 (0.9.2342.19200300.100.1.1)
 * dc      domainComponent        (0.9.2342.19200300.100.1.25)
 * </pre>
 */
public enum StandardAttributeType {
    COMMON_NAME("2.5.4.3", "cn"),
    COUNTRY_NAME("2.5.4.6", "c"),
    LOCALITY_NAME("2.5.4.7", "l"),
    STATE_OR_PROVINCE_NAME("2.5.4.8", "st"),
    STREET_ADDRESS("2.5.4.9", "street"),
    ORGANIZATION_NAME("2.5.4.10", "o"),
    ORGANIZATIONAL_UNIT_NAME("2.5.4.11", "ou"),
    USER_ID("0.9.2342.19200300.100.1.1", "uid"),
    DOMAIN_COMPONENT("0.9.2342.19200300.100.1.25", "dc");

    private static final Map<String, StandardAttributeType> BY_OID;

    static {
        Map<String, StandardAttributeType> byOid = new HashMap<String, StandardAttributeType>();
        for (StandardAttributeType type : values()) {
            byOid.put(type.oid.getId(), type);
        }
        BY_OID = Collections.unmodifiableMap(byOid);
    }

    private final ASN1ObjectIdentifier oid;
    private final String abbreviation;

    private StandardAttributeType(String oid, String abbreviation) {
        this.oid = new ASN1ObjectIdentifier(oid);
        this.abbreviation = abbreviation;
    }

    /**
     * Returns the object identifier of this attribute type.
     *
     * @return the OID.
     */
    public ASN1ObjectIdentifier getOid() {
        return oid;
    }

    /**
     * Returns the lowercase keyword used in the canonical form.
     *
     * @return the keyword, for example <tt>cn</tt>.
     */
    public String getAbbreviation() {
        return abbreviation;
    }

    /**
     * Looks up the standard attribute type with the given dotted OID.
     * <p>
     * Only exact matches are found.
     *
     * @param dotted
     *            the dotted OID string.
     * @return the attribute type, or <tt>null</tt> if the OID is not a
     *         standard one.
     */
    public static StandardAttributeType forOid(String dotted) {
        return BY_OID.get(dotted);
    }

    /**
     * Looks up the standard attribute type with the given OID.
     *
     * @param oid
     *            the OID.
     * @return the attribute type, or <tt>null</tt> if the OID is not a
     *         standard one.
     */
    public static StandardAttributeType forOid(ASN1ObjectIdentifier oid) {
        return forOid(oid.getId());
    }
}
