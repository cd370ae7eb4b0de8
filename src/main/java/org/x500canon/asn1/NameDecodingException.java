package org.x500canon.asn1;

/**
 * This exception is thrown when a distinguished name cannot be decoded from
 * the encoding supplied by the caller.
 */
public class NameDecodingException extends Exception {
    private static final long serialVersionUID = 6720873124625961547L;

    /**
     * Creates a new <tt>NameDecodingException</tt> with the provided cause.
     *
     * @param cause
     *            the cause of this exception.
     */
    public NameDecodingException(final Throwable cause) {
        super(cause);
    }

    /**
     * Creates a new <tt>NameDecodingException</tt> with the provided message
     * and cause.
     *
     * @param message
     *            the description of the problem.
     * @param cause
     *            the cause of this exception.
     */
    public NameDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
