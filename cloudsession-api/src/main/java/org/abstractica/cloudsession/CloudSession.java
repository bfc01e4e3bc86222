package org.abstractica.cloudsession;

import org.abstractica.cloudsession.handlers.EventListener;

import java.util.Map;
import java.util.Optional;

/**
 * A connection to a cloud variable server for one project room.
 *
 * <p>The session keeps a local copy of every cloud variable it has seen.
 * Writes update that copy immediately and are sent to the server, or
 * buffered until the next connection if none is open. Reads are served
 * from the local copy and never touch the network. Dropped connections
 * are re-established according to the session's {@link ReconnectPolicy}
 * until {@link #close()} is called.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CloudSession session = factory.builder()
 *     .credentials(new Credentials("alice", sessionId))
 *     .roomId(RoomId.of(123456789L))
 *     .build();
 *
 * session.on(CloudEvent.Setup.class, (s, e) ->
 *     LOG.info("Score is {}", s.get("score").orElse("0")));
 *
 * session.set("score", 42);
 * }</pre>
 */
public interface CloudSession extends AutoCloseable
{
    /**
     * Marker placed in front of every cloud variable name.
     */
    String CLOUD_PREFIX = "☁ ";

    /**
     * Opens the first connection.
     *
     * <p>Sessions built by a factory are started unless the builder was
     * told otherwise. Calling this on a started session has no effect.</p>
     *
     * @throws IllegalStateException if the session has been closed
     */
    void start();

    /**
     * Closes the session.
     *
     * <p>Cancels any pending reconnect and closes the open connection, if
     * any. The session does not reconnect afterwards. Idempotent.</p>
     */
    @Override
    void close();

    /**
     * Sets a cloud variable.
     *
     * <p>The value must be numeric and no longer than the endpoint allows.
     * Invalid values are logged and ignored.</p>
     *
     * @param name  variable name, prefixed automatically if autoprefix is on
     * @param value the value
     * @return true if the value was accepted, false if it was rejected
     */
    boolean set(String name, String value);

    /**
     * Sets a cloud variable to a whole number.
     *
     * @param name  variable name, prefixed automatically if autoprefix is on
     * @param value the value
     * @return true if the value was accepted, false if it was rejected
     */
    boolean set(String name, long value);

    /**
     * Returns the last known value of a cloud variable.
     *
     * @param name variable name, prefixed automatically if autoprefix is on
     * @return the value, or empty if the variable has not been seen
     */
    Optional<String> get(String name);

    /**
     * Returns a snapshot of every known variable keyed by full name.
     *
     * @return immutable map of variables
     */
    Map<String, String> variables();

    /**
     * Turns autoprefixing on. When on, {@link #set} and {@link #get} add
     * {@link #CLOUD_PREFIX} to names that lack it. On by default.
     */
    void enableAutoPrefix();

    /**
     * Turns autoprefixing off. Names are then used exactly as given.
     */
    void disableAutoPrefix();

    /**
     * Returns whether autoprefixing is on.
     *
     * @return true if names are prefixed automatically
     */
    boolean isAutoPrefix();

    /**
     * Registers a listener for events of the given type.
     *
     * <p>Registering for {@code CloudEvent.class} receives every event.
     * The same listener may be registered more than once and is then
     * invoked once per registration.</p>
     *
     * @param type     the event class
     * @param listener the listener
     * @param <E>      the event type
     * @return a handle that unregisters the listener
     */
    <E extends CloudEvent> Subscription on(Class<E> type, EventListener<? super E> listener);

    /**
     * Registers a listener that is removed after its first invocation.
     *
     * @param type     the event class
     * @param listener the listener
     * @param <E>      the event type
     * @return a handle that unregisters the listener if it has not fired yet
     */
    <E extends CloudEvent> Subscription once(Class<E> type, EventListener<? super E> listener);

    /**
     * Removes the earliest registration of a listener for the given type.
     *
     * @param type     the event class
     * @param listener the listener
     * @param <E>      the event type
     * @return true if a registration was removed
     */
    <E extends CloudEvent> boolean off(Class<E> type, EventListener<? super E> listener);

    /**
     * Returns whether a connection is currently open.
     *
     * @return true if open
     */
    boolean isOpen();

    /**
     * Returns the room this session is connected to.
     *
     * @return the room id
     */
    RoomId getRoomId();

    /**
     * Returns the server this session is connected to.
     *
     * @return the endpoint
     */
    CloudEndpoint getEndpoint();

    /**
     * Returns session statistics.
     *
     * @return the statistics
     */
    SessionStats getStats();
}
