package org.abstractica.cloudsession.impl.transport;

import java.net.URI;
import java.util.Map;

/**
 * Opens text-frame connections to a cloud server.
 *
 * <p>Transport handles the physical connection without any knowledge of
 * packets, variables or reconnection. Each call to {@link #connect} yields
 * one independent connection whose lifecycle is reported to the given
 * listener.</p>
 */
public interface Transport
{
    /**
     * Starts opening a connection.
     *
     * <p>Returns immediately. The outcome is reported to the listener:
     * {@link TransportListener#onOpen} on success, or
     * {@link TransportListener#onError} followed by
     * {@link TransportListener#onClose} on failure. Implementations may
     * invoke the listener before this method returns.</p>
     *
     * @param uri      the server URI
     * @param headers  extra handshake headers
     * @param listener receives the connection's lifecycle callbacks
     * @return a handle to the connection
     */
    TransportConnection connect(URI uri, Map<String, String> headers, TransportListener listener);
}
