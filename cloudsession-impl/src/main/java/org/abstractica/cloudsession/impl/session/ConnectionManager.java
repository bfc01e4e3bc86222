package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.CloudEndpoint;
import org.abstractica.cloudsession.Credentials;
import org.abstractica.cloudsession.ReconnectPolicy;
import org.abstractica.cloudsession.RoomId;
import org.abstractica.cloudsession.impl.protocol.Handshake;
import org.abstractica.cloudsession.impl.protocol.Packet;
import org.abstractica.cloudsession.impl.protocol.PacketCodec;
import org.abstractica.cloudsession.impl.protocol.SetVariable;
import org.abstractica.cloudsession.impl.reliability.OutboundQueue;
import org.abstractica.cloudsession.impl.store.VariableStore;
import org.abstractica.cloudsession.impl.transport.Transport;
import org.abstractica.cloudsession.impl.transport.TransportConnection;
import org.abstractica.cloudsession.impl.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Owns a session's transport and drives its connection lifecycle.
 *
 * <p>State machine:</p>
 * <pre>
 * IDLE -start-> CONNECTING -open-> OPEN -close-> CLOSED -delay-> CONNECTING ...
 *                    \_______________close________/^
 * any -shutdown-> TERMINATED
 * </pre>
 *
 * <p>Each connection attempt is an epoch. Callbacks from a transport that
 * is no longer the current epoch are ignored, so at most one transport is
 * live at a time. All state is guarded by the session lock passed in at
 * construction.</p>
 */
public class ConnectionManager
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    /**
     * Close status reported when the session itself is closed.
     */
    public static final int NORMAL_CLOSURE = 1000;

    /**
     * Frames no longer than this never trigger the setup notification.
     */
    private static final int SETUP_FRAME_MIN_LENGTH = 3;

    private final Object lock;
    private final Credentials credentials;
    private final RoomId roomId;
    private final CloudEndpoint endpoint;
    private final Transport transport;
    private final ReconnectPolicy reconnectPolicy;
    private final TaskScheduler scheduler;
    private final VariableStore store;
    private final OutboundQueue outboundQueue;
    private final DefaultSessionStats stats;
    private final SessionCallback callback;

    private ConnectionState state;
    private Epoch currentEpoch;
    private int attempts;
    private boolean setupFired;
    private Runnable pendingReconnect;

    /**
     * Creates a connection manager. Nothing happens until {@link #start()}.
     */
    ConnectionManager(
            Object lock,
            Credentials credentials,
            RoomId roomId,
            CloudEndpoint endpoint,
            Transport transport,
            ReconnectPolicy reconnectPolicy,
            TaskScheduler scheduler,
            VariableStore store,
            DefaultSessionStats stats,
            SessionCallback callback
    )
    {
        this.lock = Objects.requireNonNull(lock, "lock");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.store = Objects.requireNonNull(store, "store");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.callback = Objects.requireNonNull(callback, "callback");

        this.outboundQueue = new OutboundQueue();
        this.state = ConnectionState.IDLE;
        this.attempts = 0;
    }

    // ========== Lifecycle ==========

    /**
     * Opens the first connection. No effect unless the manager is idle.
     *
     * @throws IllegalStateException if the manager has been shut down
     */
    public void start()
    {
        synchronized (lock)
        {
            if (state == ConnectionState.TERMINATED)
            {
                throw new IllegalStateException("Session is closed");
            }
            if (state != ConnectionState.IDLE)
            {
                return;
            }
            LOG.info("Connecting to {} for room {}", endpoint.uri(), roomId);
            connect();
        }
    }

    /**
     * Tears down the connection for good.
     *
     * <p>Cancels a pending reconnect, closes the current transport and
     * stops the scheduler. If a transport was open, a close is reported
     * to the session. Idempotent.</p>
     */
    public void shutdown()
    {
        synchronized (lock)
        {
            if (state == ConnectionState.TERMINATED)
            {
                return;
            }

            ConnectionState previousState = state;
            state = ConnectionState.TERMINATED;
            LOG.info("Closing session for room {}", roomId);

            cancelPendingReconnect();

            Epoch epoch = currentEpoch;
            currentEpoch = null;
            if (epoch != null)
            {
                epoch.closeQuietly();
            }

            scheduler.shutdown();

            if (previousState == ConnectionState.OPEN)
            {
                callback.onClose(NORMAL_CLOSURE, "Session closed");
            }
        }
    }

    // ========== Sending ==========

    /**
     * Sends a packet now if a connection is open, otherwise queues it for
     * the next connection.
     *
     * @param packet the packet
     */
    public void send(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");

        synchronized (lock)
        {
            if (state == ConnectionState.OPEN)
            {
                write(currentEpoch, packet);
            }
            else if (state == ConnectionState.TERMINATED)
            {
                LOG.debug("Session closed, not sending {}", packet.method());
            }
            else
            {
                outboundQueue.enqueue(packet);
                stats.recordPacketQueued();
                LOG.debug("No open connection, queued {} ({} pending)", packet.method(), outboundQueue.size());
            }
        }
    }

    private void write(Epoch epoch, Packet packet)
    {
        try
        {
            epoch.connection.send(PacketCodec.encode(packet));
            stats.recordPacketSent();
        }
        catch (IllegalStateException e)
        {
            // Transport closed under us; its close callback is on the way.
            // Only variable updates are kept; the next open sends its own handshake.
            if (packet instanceof SetVariable)
            {
                LOG.debug("Connection no longer writable, queueing {}: {}", packet.method(), e.getMessage());
                outboundQueue.enqueue(packet);
                stats.recordPacketQueued();
            }
            else
            {
                LOG.debug("Connection no longer writable, dropping {}: {}", packet.method(), e.getMessage());
            }
        }
    }

    // ========== Connecting ==========

    private void connect()
    {
        state = ConnectionState.CONNECTING;
        stats.recordConnectionAttempt();

        Epoch epoch = new Epoch();
        currentEpoch = epoch;

        try
        {
            TransportConnection handle = transport.connect(endpoint.uri(), buildHeaders(), epoch);
            epoch.attach(handle);
        }
        catch (RuntimeException e)
        {
            LOG.warn("Could not start connection to {}: {}", endpoint.uri(), e.getMessage());
            handleError(epoch, e);
            handleClose(epoch, 1006, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Builds the handshake headers for the endpoint's credential strategy.
     *
     * @return header name to value
     */
    Map<String, String> buildHeaders()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        if (endpoint.credentialStrategy() == CloudEndpoint.CredentialStrategy.SESSION_COOKIE)
        {
            headers.put("Cookie", "scratchsessionsid=" + credentials.sessionId() + ";");
        }
        headers.put("Origin", endpoint.origin());
        return Collections.unmodifiableMap(headers);
    }

    private void scheduleReconnect()
    {
        OptionalLong delay = reconnectPolicy.nextDelayMs(attempts);
        if (delay.isEmpty())
        {
            LOG.warn("Reconnect policy gave up after {} attempts; room {} stays offline", attempts, roomId);
            state = ConnectionState.TERMINATED;
            scheduler.shutdown();
            return;
        }

        long delayMs = Math.max(0, delay.getAsLong());
        LOG.info("Reconnecting to {} in {} ms (attempt {})", endpoint.uri(), delayMs, attempts + 1);
        pendingReconnect = scheduler.schedule(this::reconnect, delayMs);
    }

    private void reconnect()
    {
        synchronized (lock)
        {
            pendingReconnect = null;
            if (state != ConnectionState.CLOSED)
            {
                return;
            }
            attempts++;
            connect();
        }
    }

    private void cancelPendingReconnect()
    {
        if (pendingReconnect != null)
        {
            pendingReconnect.run();
            pendingReconnect = null;
        }
    }

    // ========== Transport Events ==========

    private void handleOpen(Epoch epoch, TransportConnection connection)
    {
        synchronized (lock)
        {
            if (epoch != currentEpoch || state != ConnectionState.CONNECTING)
            {
                connection.close();
                return;
            }

            epoch.attach(connection);
            epoch.connection = connection;
            state = ConnectionState.OPEN;
            attempts = 1;
            stats.recordOpen();
            LOG.info("Connected to {} for room {}", endpoint.uri(), roomId);

            write(epoch, new Handshake(credentials.username(), roomId));

            for (Packet queued : outboundQueue.drain())
            {
                write(epoch, queued);
            }

            callback.onOpen();
        }
    }

    private void handleMessage(Epoch epoch, String frame)
    {
        synchronized (lock)
        {
            if (epoch != currentEpoch || state != ConnectionState.OPEN)
            {
                return;
            }

            boolean initialSetup = !setupFired
                    && frame.length() >= SETUP_FRAME_MIN_LENGTH
                    && store.isEmpty();

            PacketCodec.DecodeResult result = PacketCodec.decode(frame);
            stats.recordFrame(result.malformedSegments());
            if (result.malformedSegments() > 0)
            {
                LOG.debug("Dropped {} malformed segment(s) from frame", result.malformedSegments());
            }

            for (Packet packet : result.packets())
            {
                if (packet instanceof SetVariable set)
                {
                    VariableStore.ApplyResult applied = store.apply(set.name(), set.value());
                    callback.onVariable(set.name(), set.value(), applied);
                    if (state == ConnectionState.TERMINATED)
                    {
                        return;
                    }
                }
                else
                {
                    LOG.debug("Ignoring inbound {} packet", packet.method());
                }
            }

            if (initialSetup)
            {
                setupFired = true;
                callback.onSetup();
            }
        }
    }

    private void handleClose(Epoch epoch, int code, String reason)
    {
        synchronized (lock)
        {
            if (epoch != currentEpoch || epoch.closed)
            {
                return;
            }
            epoch.closed = true;
            epoch.connection = null;

            if (state != ConnectionState.OPEN && state != ConnectionState.CONNECTING)
            {
                return;
            }

            LOG.info("Connection to {} closed: {} {}", endpoint.uri(), code, reason);
            state = ConnectionState.CLOSED;
            callback.onClose(code, reason);

            if (state == ConnectionState.CLOSED)
            {
                scheduleReconnect();
            }
        }
    }

    private void handleError(Epoch epoch, Throwable error)
    {
        synchronized (lock)
        {
            if (epoch != currentEpoch || epoch.closed)
            {
                return;
            }
            LOG.warn("Connection error on {}: {}", endpoint.uri(), error.getMessage());
            callback.onError(error);
        }
    }

    // ========== Accessors ==========

    public ConnectionState getState()
    {
        synchronized (lock)
        {
            return state;
        }
    }

    public boolean isOpen()
    {
        return getState() == ConnectionState.OPEN;
    }

    /**
     * Returns the attempt count used for reconnect backoff.
     *
     * @return attempts since the last successful open, counting it as 1
     */
    public int getAttempts()
    {
        synchronized (lock)
        {
            return attempts;
        }
    }

    /**
     * Returns the number of packets waiting for a connection.
     *
     * @return queued packet count
     */
    public int getQueuedPacketCount()
    {
        synchronized (lock)
        {
            return outboundQueue.size();
        }
    }

    // ========== Epoch ==========

    /**
     * One connection attempt and the transport listener bound to it.
     */
    private final class Epoch implements TransportListener
    {
        private TransportConnection handle;
        private TransportConnection connection;
        private boolean closed;

        void attach(TransportConnection handle)
        {
            if (this.handle == null)
            {
                this.handle = handle;
            }
        }

        void closeQuietly()
        {
            closed = true;
            connection = null;
            if (handle != null)
            {
                try
                {
                    handle.close();
                }
                catch (RuntimeException e)
                {
                    LOG.debug("Error closing transport: {}", e.getMessage());
                }
            }
        }

        @Override
        public void onOpen(TransportConnection connection)
        {
            handleOpen(this, connection);
        }

        @Override
        public void onMessage(String frame)
        {
            handleMessage(this, frame);
        }

        @Override
        public void onClose(int code, String reason)
        {
            handleClose(this, code, reason);
        }

        @Override
        public void onError(Throwable error)
        {
            handleError(this, error);
        }
    }
}
