package org.abstractica.cloudsession;

import java.util.Objects;

/**
 * Events emitted by a {@link CloudSession}.
 *
 * <p>Sealed interface so listeners registered for {@code CloudEvent.class}
 * can switch exhaustively over every event kind.</p>
 */
public sealed interface CloudEvent
{
    /**
     * A connection to the cloud server was opened and the handshake sent.
     */
    record Open() implements CloudEvent {}

    /**
     * The connection was closed.
     *
     * @param code   WebSocket close status code
     * @param reason close reason, may be empty
     */
    record Close(int code, String reason) implements CloudEvent
    {
        public Close
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * The transport reported an error. A {@link Close} follows.
     *
     * @param cause the underlying failure
     */
    record TransportError(Throwable cause) implements CloudEvent
    {
        public TransportError
        {
            Objects.requireNonNull(cause, "cause");
        }
    }

    /**
     * The initial variable state sent by the server has been loaded.
     *
     * <p>Fires at most once per session.</p>
     */
    record Setup() implements CloudEvent {}

    /**
     * A known variable received a new value from the server.
     *
     * @param name  full variable name, including the cloud prefix
     * @param value new value
     */
    record Set(String name, String value) implements CloudEvent
    {
        public Set
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * The server reported a variable this session had not seen before.
     *
     * @param name  full variable name, including the cloud prefix
     * @param value initial value
     */
    record AddVariable(String name, String value) implements CloudEvent
    {
        public AddVariable
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }
}
