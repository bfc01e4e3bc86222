package org.abstractica.cloudsession;

/**
 * Session statistics for monitoring and observability.
 *
 * <p>Statistics are pollable counters accumulated over the session's
 * lifetime, across reconnects.</p>
 */
public interface SessionStats
{
    /**
     * Returns the number of packets written to a transport.
     *
     * @return packets sent, including handshakes
     */
    long getPacketsSent();

    /**
     * Returns the number of packets that were buffered because no
     * connection was open.
     *
     * @return packets queued
     */
    long getPacketsQueued();

    /**
     * Returns the number of inbound frames received.
     *
     * @return frames received
     */
    long getFramesReceived();

    /**
     * Returns the number of inbound segments dropped as malformed.
     *
     * @return malformed segments
     */
    long getMalformedSegments();

    /**
     * Returns the number of transports opened or attempted.
     *
     * @return connection attempts
     */
    long getConnectionAttempts();

    /**
     * Returns the number of connections that reached the open state.
     *
     * @return successful opens
     */
    long getSuccessfulOpens();
}
