package org.abstractica.cloudsession.impl.session;

/**
 * State of a session's connection.
 */
public enum ConnectionState
{
    /**
     * Created but not started.
     */
    IDLE,

    /**
     * A transport is being opened.
     */
    CONNECTING,

    /**
     * A transport is open; packets are sent directly.
     */
    OPEN,

    /**
     * The last transport closed; a reconnect is scheduled.
     */
    CLOSED,

    /**
     * Closed for good, by the application or because the reconnect
     * policy gave up. Writes are only kept locally.
     */
    TERMINATED
}
