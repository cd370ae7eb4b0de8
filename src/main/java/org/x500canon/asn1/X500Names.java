package org.x500canon.asn1;

import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;

import javax.security.auth.x500.X500Principal;

import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;

/**
 * Decodes distinguished names from the forms callers usually hold them in.
 */
public final class X500Names {

    private X500Names() {
    }

    /**
     * Decodes a DER-encoded <tt>Name</tt>. Every attribute type and value
     * pair is decoded, so a name returned by this method can be
     * canonicalized without error.
     *
     * @param encoded
     *            the DER encoding.
     * @return the decoded name.
     * @throws NameDecodingException
     *             if the bytes are not a valid encoding of a name.
     */
    public static X500Name fromEncoded(byte[] encoded) throws NameDecodingException {
        if (encoded == null) {
            throw new NullPointerException("encoded must not be null");
        }
        try {
            X500Name name = X500Name.getInstance(encoded);
            for (RDN rdn : name.getRDNs()) {
                rdn.getTypesAndValues();
            }
            return name;
        } catch (RuntimeException e) {
            // Bouncy Castle reports structural errors with assorted unchecked
            // exceptions, from IllegalArgumentException to ClassCastException
            throw new NameDecodingException("Invalid distinguished name encoding", e);
        }
    }

    /**
     * Decodes the name held by a principal.
     *
     * @param principal
     *            the principal.
     * @return the decoded name.
     * @throws NameDecodingException
     *             if the encoding of the principal cannot be decoded.
     */
    public static X500Name fromPrincipal(X500Principal principal) throws NameDecodingException {
        if (principal == null) {
            throw new NullPointerException("principal must not be null");
        }
        return fromEncoded(principal.getEncoded());
    }

    /**
     * Returns the issuer name of a certificate as encoded in the certificate.
     *
     * @param certificate
     *            the certificate.
     * @return the issuer name.
     * @throws NameDecodingException
     *             if the certificate cannot be encoded.
     */
    public static X500Name issuerOf(X509Certificate certificate) throws NameDecodingException {
        return holderOf(certificate).getIssuer();
    }

    /**
     * Returns the subject name of a certificate as encoded in the
     * certificate.
     *
     * @param certificate
     *            the certificate.
     * @return the subject name.
     * @throws NameDecodingException
     *             if the certificate cannot be encoded.
     */
    public static X500Name subjectOf(X509Certificate certificate) throws NameDecodingException {
        return holderOf(certificate).getSubject();
    }

    private static JcaX509CertificateHolder holderOf(X509Certificate certificate)
            throws NameDecodingException {
        if (certificate == null) {
            throw new NullPointerException("certificate must not be null");
        }
        try {
            return new JcaX509CertificateHolder(certificate);
        } catch (CertificateEncodingException e) {
            throw new NameDecodingException("Unable to read certificate names", e);
        }
    }
}
