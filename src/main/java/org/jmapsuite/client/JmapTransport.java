package org.jmapsuite.client;

import org.jmapsuite.wire.JmapRequest;
import org.jmapsuite.wire.JmapResponse;

/**
 * Black-box request/response function in front of the server under test.
 *
 * <p>Implementations perform one blocking round trip per call and must hand back the
 * method responses exactly as the server sent them, correlation ids included.
 */
public interface JmapTransport {
    String name();

    JmapResponse send(JmapRequest request) throws JmapTransportException;
}
