package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.CloudEndpoint;
import org.abstractica.cloudsession.CloudEvent;
import org.abstractica.cloudsession.CloudSession;
import org.abstractica.cloudsession.Credentials;
import org.abstractica.cloudsession.ReconnectPolicy;
import org.abstractica.cloudsession.RoomId;
import org.abstractica.cloudsession.SessionStats;
import org.abstractica.cloudsession.Subscription;
import org.abstractica.cloudsession.handlers.EventListener;
import org.abstractica.cloudsession.impl.protocol.SetVariable;
import org.abstractica.cloudsession.impl.store.VariableStore;
import org.abstractica.cloudsession.impl.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of the CloudSession interface.
 *
 * <p>Writes are applied to the local variable store as soon as they are
 * accepted, before the server has seen them, so a read always reflects the
 * caller's own last write whatever the state of the connection. Values
 * coming back from the server overwrite the local copy as they arrive.</p>
 */
public class DefaultCloudSession implements CloudSession
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultCloudSession.class);

    private final Object lock = new Object();
    private final Credentials credentials;
    private final RoomId roomId;
    private final CloudEndpoint endpoint;
    private final VariableStore store;
    private final EventDispatcher dispatcher;
    private final DefaultSessionStats stats;
    private final ConnectionManager connectionManager;

    private volatile boolean autoPrefix = true;

    /**
     * Creates a session. Call {@link #start()} to connect.
     */
    DefaultCloudSession(
            Credentials credentials,
            RoomId roomId,
            CloudEndpoint endpoint,
            Transport transport,
            ReconnectPolicy reconnectPolicy,
            TaskScheduler scheduler
    )
    {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");

        this.store = new VariableStore();
        this.dispatcher = new EventDispatcher();
        this.stats = new DefaultSessionStats();
        this.connectionManager = new ConnectionManager(
                lock,
                credentials,
                roomId,
                endpoint,
                transport,
                reconnectPolicy,
                scheduler,
                store,
                stats,
                new Callback());
    }

    // ========== Lifecycle ==========

    @Override
    public void start()
    {
        connectionManager.start();
    }

    @Override
    public void close()
    {
        connectionManager.shutdown();
    }

    // ========== Variables ==========

    @Override
    public boolean set(String name, String value)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");

        String fullName = resolveName(name);

        if (!CloudValues.isNumeric(value))
        {
            LOG.warn("Invalid cloud variable value for '{}'. Can only contain numbers.", fullName);
            return false;
        }
        if (value.length() > endpoint.maxValueLength())
        {
            LOG.warn("Value for '{}' is too long ({} characters). Maximum of {} digits.",
                    fullName, value.length(), endpoint.maxValueLength());
            return false;
        }

        synchronized (lock)
        {
            connectionManager.send(new SetVariable(credentials.username(), roomId, fullName, value));
            store.apply(fullName, value);
        }
        return true;
    }

    @Override
    public boolean set(String name, long value)
    {
        return set(name, Long.toString(value));
    }

    @Override
    public Optional<String> get(String name)
    {
        Objects.requireNonNull(name, "name");

        String fullName = resolveName(name);
        synchronized (lock)
        {
            return store.get(fullName);
        }
    }

    @Override
    public Map<String, String> variables()
    {
        synchronized (lock)
        {
            return store.snapshot();
        }
    }

    private String resolveName(String name)
    {
        return autoPrefix ? CloudValues.withPrefix(name) : name;
    }

    // ========== Autoprefix ==========

    @Override
    public void enableAutoPrefix()
    {
        autoPrefix = true;
    }

    @Override
    public void disableAutoPrefix()
    {
        autoPrefix = false;
    }

    @Override
    public boolean isAutoPrefix()
    {
        return autoPrefix;
    }

    // ========== Events ==========

    @Override
    public <E extends CloudEvent> Subscription on(Class<E> type, EventListener<? super E> listener)
    {
        synchronized (lock)
        {
            Subscription registration = dispatcher.add(type, listener, false);
            return () -> cancel(registration);
        }
    }

    @Override
    public <E extends CloudEvent> Subscription once(Class<E> type, EventListener<? super E> listener)
    {
        synchronized (lock)
        {
            Subscription registration = dispatcher.add(type, listener, true);
            return () -> cancel(registration);
        }
    }

    @Override
    public <E extends CloudEvent> boolean off(Class<E> type, EventListener<? super E> listener)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");

        synchronized (lock)
        {
            return dispatcher.remove(type, listener);
        }
    }

    private void cancel(Subscription registration)
    {
        synchronized (lock)
        {
            registration.cancel();
        }
    }

    private void emit(CloudEvent event)
    {
        dispatcher.dispatch(this, event);
    }

    // ========== Accessors ==========

    @Override
    public boolean isOpen()
    {
        return connectionManager.isOpen();
    }

    @Override
    public RoomId getRoomId()
    {
        return roomId;
    }

    @Override
    public CloudEndpoint getEndpoint()
    {
        return endpoint;
    }

    @Override
    public SessionStats getStats()
    {
        return stats;
    }

    /**
     * Returns the connection state.
     *
     * @return the current state
     */
    public ConnectionState getConnectionState()
    {
        return connectionManager.getState();
    }

    /**
     * Returns the attempt count used for reconnect backoff.
     *
     * @return the attempt count
     */
    public int getConnectionAttempts()
    {
        return connectionManager.getAttempts();
    }

    /**
     * Returns the number of packets waiting for a connection.
     *
     * @return queued packet count
     */
    public int getQueuedPacketCount()
    {
        return connectionManager.getQueuedPacketCount();
    }

    @Override
    public String toString()
    {
        return "CloudSession[room=" + roomId + ", endpoint=" + endpoint.uri()
                + ", user=" + credentials.username() + "]";
    }

    // ========== Connection Callbacks ==========

    /**
     * Translates connection manager callbacks into session events.
     */
    private final class Callback implements SessionCallback
    {
        @Override
        public void onOpen()
        {
            emit(new CloudEvent.Open());
        }

        @Override
        public void onClose(int code, String reason)
        {
            emit(new CloudEvent.Close(code, reason));
        }

        @Override
        public void onError(Throwable cause)
        {
            emit(new CloudEvent.TransportError(cause));
        }

        @Override
        public void onVariable(String name, String value, VariableStore.ApplyResult result)
        {
            if (result == VariableStore.ApplyResult.CREATED)
            {
                emit(new CloudEvent.AddVariable(name, value));
            }
            else
            {
                emit(new CloudEvent.Set(name, value));
            }
        }

        @Override
        public void onSetup()
        {
            emit(new CloudEvent.Setup());
        }
    }
}
