package org.x500canon.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.x500canon.NameFixtures.ava;
import static org.x500canon.NameFixtures.cn;
import static org.x500canon.NameFixtures.commonName;
import static org.x500canon.NameFixtures.decode;
import static org.x500canon.NameFixtures.name;
import static org.x500canon.NameFixtures.rdn;

import java.util.Arrays;
import java.util.List;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERUTF8String;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.util.encoders.Hex;
import org.junit.Test;
import org.x500canon.NameFixtures;
import org.x500canon.asn1.X500Names;
import org.x500canon.name.OrderedAva;
import org.x500canon.render.TypeAndValue;

public class CanonicalNamesTest {
    private static final String COMPLEX_CANONICAL_PREFIX =
            "cn=\\#y,cn=#\\,\\;\\+\\\\+cn=bar+cn=foo+cn=ii+cn=i\u0307i+cn=zz+cn=\u00dfss,"
            + "cn=x \t\t \u732bx,1.2.840.113549.1.9.1=#1603784079,";

    @Test
    public void testSimpleCanonicalName() {
        X500Name name = decode(NameFixtures.SIMPLE_NAME);

        assertEquals("c=xx,ou=b,cn=bar+cn=foo,ou=a", CanonicalNames.canonicalName(name));
        assertEquals("c=xx,ou=b,cn=bar+cn=foo,ou=a", CanonicalNames.canonicalName(name, true));
    }

    @Test
    public void testSimpleFriendlyName() {
        assertEquals("C=xx, OU=b, CN=bar +CN= Foo, OU=a",
                CanonicalNames.friendlyName(decode(NameFixtures.SIMPLE_NAME)));
    }

    @Test
    public void testSimpleComparisonName() {
        List<List<TypeAndValue>> expected = Arrays.asList(
                Arrays.asList(new TypeAndValue("c", "xx")),
                Arrays.asList(new TypeAndValue("ou", "b")),
                Arrays.asList(new TypeAndValue("cn", "bar"), new TypeAndValue("cn", "foo")),
                Arrays.asList(new TypeAndValue("ou", "a")));

        assertEquals(expected, CanonicalNames.comparisonName(decode(NameFixtures.SIMPLE_NAME)));
    }

    @Test
    public void testComplexCanonicalName() {
        X500Name name = decode(NameFixtures.COMPLEX_NAME);

        assertEquals(COMPLEX_CANONICAL_PREFIX + "o=org+0.1.11.3=#0c023432+0.1.2.3=#0c023337",
                CanonicalNames.canonicalName(name));
        assertEquals(COMPLEX_CANONICAL_PREFIX + "o=org+0.1.2.3=#0c023337+0.1.11.3=#0c023432",
                CanonicalNames.canonicalName(name, true));
    }

    @Test
    public void testComplexFriendlyName() {
        assertEquals("CN=\\\\#y, CN= #\\\\,\\\\;\\\\+\\\\\\\\+CN=bar  +CN=foo  +CN=Ii   "
                + "+CN=\u0130\u0131 +CN=zz+CN=\u1e9e\u00df, CN= x \\t\\t \u732bx, "
                + "1.2.840.113549.1.9.1=#1603784079, O=org+0.1.11.3=#0c023432+0.1.2.3=#0c023337",
                CanonicalNames.friendlyName(decode(NameFixtures.COMPLEX_NAME)));
    }

    @Test
    public void testOrderedNameKeepsRawValues() {
        List<List<OrderedAva>> rdns =
                CanonicalNames.orderedName(decode(NameFixtures.COMPLEX_NAME)).getRdns();

        assertEquals(5, rdns.size());
        assertEquals(" x \t\t \u732bx", rdns.get(2).get(0).getRawValue());
        assertEquals("x \t\t \u732bx", rdns.get(2).get(0).getNormalizedValue());
    }

    @Test
    public void testCaseAndSpaceInsensitiveEquality() {
        assertEquals("cn=foo bar", CanonicalNames.canonicalName(commonName("Foo  Bar")));
        assertEquals("cn=foo bar", CanonicalNames.canonicalName(commonName(" foo bar ")));
        assertEquals("cn=foo\tbar", CanonicalNames.canonicalName(commonName("foo\tbar")));
    }

    @Test
    public void testSpecialCaseFolding() {
        X500Name name = name(rdn(cn("Ii   "), cn("\u0130\u0131 "), cn("\u1e9e\u00df"), cn("bar  ")));

        assertEquals("cn=bar+cn=ii+cn=i\u0307i+cn=\u00dfss", CanonicalNames.canonicalName(name));
    }

    @Test
    public void testControlCharacters() {
        StringBuilder sb = new StringBuilder();
        for (char c = 0; c < 32; c++) {
            sb.append(c);
        }
        String control = sb.toString();

        assertEquals("cn=foo", CanonicalNames.canonicalName(commonName(control + "foo")));
        assertEquals("cn=foo", CanonicalNames.canonicalName(commonName("foo" + control + " ")));
        assertEquals("cn=foo" + control + "bar",
                CanonicalNames.canonicalName(commonName("\tfoo" + control + "bar  ")));
        assertEquals("cn=\u007f\u0000foo \u0000bar   ",
                CanonicalNames.canonicalName(commonName("  \u0000 \u007f\u0000foo  \u0000bar \u3000\u3000  ")));
    }

    @Test
    public void testWhitespaceOnlyValueNormalizesToEmpty() {
        assertEquals("cn=", CanonicalNames.canonicalName(commonName("   ")));
        assertEquals("CN=   ", CanonicalNames.friendlyName(commonName("   ")));
    }

    @Test
    public void testNumericOidOrder() {
        X500Name name = name(rdn(
                ava(new ASN1ObjectIdentifier("0.1.11.3"), new DERUTF8String("b")),
                ava(new ASN1ObjectIdentifier("0.1.2.3"), new DERUTF8String("a"))));

        assertEquals("0.1.11.3=#0c0162+0.1.2.3=#0c0161", CanonicalNames.canonicalName(name, false));
        assertEquals("0.1.2.3=#0c0161+0.1.11.3=#0c0162", CanonicalNames.canonicalName(name, true));
    }

    @Test
    public void testUndecodableStringIsEmpty() throws Exception {
        // CN UTF8String holding the invalid byte 0xff
        X500Name name = X500Names.fromEncoded(Hex.decode("300c310a300806035504030c01ff"));

        assertEquals("cn=", CanonicalNames.canonicalName(name));
        assertEquals("CN=", CanonicalNames.friendlyName(name));
    }

    @Test
    public void testHexOfBerValueIsDerEncoding() throws Exception {
        // constructed OCTET STRING under 0.1.2.3
        X500Name name = X500Names.fromEncoded(Hex.decode("300e310c300a060301020324030401aa"));

        assertEquals("0.1.2.3=#0401aa", CanonicalNames.canonicalName(name));
    }

    @Test
    public void testEmptyName() {
        assertEquals("", CanonicalNames.canonicalName(name()));
        assertEquals("", CanonicalNames.friendlyName(name()));
        assertTrue(CanonicalNames.comparisonName(name()).isEmpty());
        assertTrue(CanonicalNames.orderedName(name()).isEmpty());
    }

    @Test
    public void testDifferentValuesDiffer() {
        assertNotEquals(CanonicalNames.canonicalName(commonName("foo")),
                CanonicalNames.canonicalName(commonName("fo o")));
    }
}
