package org.jmapsuite.client;

/**
 * The round trip to the server failed: network, HTTP status or an undecodable body.
 */
public class JmapTransportException extends Exception {
    private static final long serialVersionUID = 1L;

    public JmapTransportException(final String message) {
        super(message);
    }

    public JmapTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
