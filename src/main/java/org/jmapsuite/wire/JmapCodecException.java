package org.jmapsuite.wire;

/**
 * Raised when a JMAP payload cannot be decoded into the request/response envelope.
 */
public final class JmapCodecException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public JmapCodecException(final String message) {
        super(message);
    }

    public JmapCodecException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
