/*
 * Copyright (c) 2009-2012 David Grant
 * Copyright (c) 2010 ThruPoint Ltd
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package org.x500canon.client;

import java.security.cert.X509Certificate;
import java.util.List;

import javax.security.auth.x500.X500Principal;

import org.bouncycastle.asn1.x500.X500Name;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.x500canon.asn1.NameDecodingException;
import org.x500canon.asn1.X500Names;
import org.x500canon.name.NameAssembler;
import org.x500canon.name.OidOrdering;
import org.x500canon.name.OrderedName;
import org.x500canon.render.CanonicalNameRenderer;
import org.x500canon.render.ComparisonNameRenderer;
import org.x500canon.render.FriendlyNameRenderer;
import org.x500canon.render.NameRenderer;
import org.x500canon.render.TypeAndValue;

/**
 * The <tt>Canonicalizer</tt> class computes the canonical form of X.509
 * distinguished names, as used to decide whether two certificate issuer or
 * subject names are the same.
 * <p>
 * Typical usage might look like so:
 *
 * <pre>
 * Canonicalizer canonicalizer = canonicalizer()
 *         .oidOrdering(OidOrdering.NUMERIC)
 *         .build();
 *
 * X500Name issuer = X500Names.issuerOf(certificate);
 * String canonical = canonicalizer.canonicalName(issuer);
 * boolean same = canonicalizer.equivalent(issuer, caCertificate.getSubjectX500Principal());
 * </pre>
 *
 * The canonical form follows <tt>X500Principal.getName(CANONICAL)</tt>: RDNs
 * are in reverse encoding order, the pairs of each RDN are sorted, and
 * UTF8String and PrintableString values are escaped, whitespace-trimmed,
 * case-folded and NFKD-normalized. Other values are written as hex.
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public final class Canonicalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Canonicalizer.class);

    private final NameAssembler assembler;
    private final NameRenderer<String> canonicalRenderer = new CanonicalNameRenderer();
    private final NameRenderer<String> friendlyRenderer = new FriendlyNameRenderer();
    private final NameRenderer<List<List<TypeAndValue>>> comparisonRenderer =
            new ComparisonNameRenderer();

    /**
     * Constructs a new <tt>Canonicalizer</tt> which orders dotted OIDs
     * lexicographically, as the Java platform does.
     */
    public Canonicalizer() {
        this(OidOrdering.LEXICOGRAPHIC);
    }

    /**
     * Constructs a new <tt>Canonicalizer</tt> using the provided OID
     * ordering.
     *
     * @param ordering
     *            the ordering of attribute types written as dotted OIDs.
     */
    public Canonicalizer(final OidOrdering ordering) {
        if (ordering == null) {
            throw new NullPointerException("OID ordering should not be null");
        }
        this.assembler = new NameAssembler(ordering);
    }

    private Canonicalizer(Builder builder) {
        this(builder.ordering);
    }

    public OidOrdering getOidOrdering() {
        return assembler.getOrdering();
    }

    /**
     * Returns the name in canonical order, with both raw and normalized
     * values.
     *
     * @param name
     *            the name.
     * @return the ordered name.
     */
    public OrderedName orderedName(X500Name name) {
        return assembler.assemble(name);
    }

    /**
     * Returns the canonical form of the name, for example
     * <tt>c=xx,ou=b,cn=bar+cn=foo,ou=a</tt>.
     *
     * @param name
     *            the name.
     * @return the canonical form.
     */
    public String canonicalName(X500Name name) {
        return canonicalRenderer.render(orderedName(name));
    }

    /**
     * Returns the canonical form of the name held by the principal.
     *
     * @param principal
     *            the principal.
     * @return the canonical form.
     * @throws NameDecodingException
     *             if the principal's encoding cannot be decoded.
     */
    public String canonicalName(X500Principal principal) throws NameDecodingException {
        return canonicalName(X500Names.fromPrincipal(principal));
    }

    /**
     * Returns the canonical form of a DER-encoded name.
     *
     * @param encoded
     *            the DER encoding of the name.
     * @return the canonical form.
     * @throws NameDecodingException
     *             if the bytes are not a valid encoding of a name.
     */
    public String canonicalName(byte[] encoded) throws NameDecodingException {
        return canonicalName(X500Names.fromEncoded(encoded));
    }

    /**
     * Returns the canonical form of the issuer name of a certificate.
     *
     * @param certificate
     *            the certificate.
     * @return the canonical form of the issuer.
     * @throws NameDecodingException
     *             if the certificate cannot be read.
     */
    public String canonicalIssuerName(X509Certificate certificate) throws NameDecodingException {
        return canonicalName(X500Names.issuerOf(certificate));
    }

    /**
     * Returns the canonical form of the subject name of a certificate.
     *
     * @param certificate
     *            the certificate.
     * @return the canonical form of the subject.
     * @throws NameDecodingException
     *             if the certificate cannot be read.
     */
    public String canonicalSubjectName(X509Certificate certificate) throws NameDecodingException {
        return canonicalName(X500Names.subjectOf(certificate));
    }

    /**
     * Returns a form of the name for people to read, in canonical order but
     * with raw values, for example <tt>C=xx, OU=b, CN=bar +CN= Foo, OU=a</tt>.
     * <p>
     * This form is not suitable for comparison.
     *
     * @param name
     *            the name.
     * @return the friendly form.
     */
    public String friendlyName(X500Name name) {
        return friendlyRenderer.render(orderedName(name));
    }

    /**
     * Returns the canonical form of the name as nested lists of type and
     * normalized value.
     *
     * @param name
     *            the name.
     * @return the RDNs, each a list of pairs.
     */
    public List<List<TypeAndValue>> comparisonName(X500Name name) {
        return comparisonRenderer.render(orderedName(name));
    }

    /**
     * Returns whether the two names have the same canonical form.
     *
     * @param a
     *            the first name.
     * @param b
     *            the second name.
     * @return <tt>true</tt> if the names are equivalent.
     */
    public boolean equivalent(X500Name a, X500Name b) {
        String canonicalA = canonicalName(a);
        String canonicalB = canonicalName(b);
        boolean equivalent = canonicalA.equals(canonicalB);
        if (!equivalent) {
            LOGGER.debug("Names differ: {} and {}", canonicalA, canonicalB);
        }
        return equivalent;
    }

    /**
     * Returns whether a name and the name held by a principal have the same
     * canonical form.
     *
     * @param a
     *            the name.
     * @param b
     *            the principal.
     * @return <tt>true</tt> if the names are equivalent.
     * @throws NameDecodingException
     *             if the principal's encoding cannot be decoded.
     */
    public boolean equivalent(X500Name a, X500Principal b) throws NameDecodingException {
        return equivalent(a, X500Names.fromPrincipal(b));
    }

    public static final class Builder {

        public static Builder canonicalizer() {
            return new Builder();
        }

        private OidOrdering ordering = OidOrdering.LEXICOGRAPHIC;

        public Builder oidOrdering(OidOrdering ordering) {
            this.ordering = ordering;
            return this;
        }

        public Builder numericOidOrder(boolean numericOidOrder) {
            this.ordering = OidOrdering.valueOf(numericOidOrder);
            return this;
        }

        public Canonicalizer build() {
            return new Canonicalizer(this);
        }
    }
}
