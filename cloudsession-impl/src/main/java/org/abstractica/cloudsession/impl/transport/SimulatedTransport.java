package org.abstractica.cloudsession.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simulated transport for testing and local development.
 *
 * <p>No network is involved. Every call to {@link #connect} creates a
 * {@link SimulatedConnection} that stays pending until the test drives it:
 * open it, push server frames into it, drop it or close it. All listener
 * callbacks run synchronously on the thread that drives the connection.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 * SimulatedTransport transport = new SimulatedTransport();
 * // ... build a session with the transport ...
 * SimulatedConnection connection = transport.lastConnection();
 * connection.open();
 * connection.receive("{\"method\":\"set\",\"name\":\"☁ x\",\"value\":\"3\"}\n");
 * connection.drop(new IOException("reset"));
 * }</pre>
 */
public class SimulatedTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTransport.class);

    private final List<SimulatedConnection> connections = new CopyOnWriteArrayList<>();
    private volatile boolean autoOpen;

    /**
     * Creates a transport whose connections wait to be opened explicitly.
     */
    public SimulatedTransport()
    {
        this(false);
    }

    /**
     * Creates a transport.
     *
     * @param autoOpen whether new connections open immediately inside {@link #connect}
     */
    public SimulatedTransport(boolean autoOpen)
    {
        this.autoOpen = autoOpen;
    }

    /**
     * Sets whether new connections open immediately.
     *
     * @param autoOpen true to open connections inside {@link #connect}
     */
    public void setAutoOpen(boolean autoOpen)
    {
        this.autoOpen = autoOpen;
    }

    @Override
    public TransportConnection connect(URI uri, Map<String, String> headers, TransportListener listener)
    {
        SimulatedConnection connection = new SimulatedConnection(
                Objects.requireNonNull(uri, "uri"),
                Map.copyOf(Objects.requireNonNull(headers, "headers")),
                Objects.requireNonNull(listener, "listener"));
        connections.add(connection);
        LOG.debug("Simulated connection #{} to {}", connections.size(), uri);

        if (autoOpen)
        {
            connection.open();
        }
        return connection;
    }

    /**
     * Returns every connection created so far, oldest first.
     *
     * @return the connections
     */
    public List<SimulatedConnection> connections()
    {
        return List.copyOf(connections);
    }

    /**
     * Returns the most recently created connection.
     *
     * @return the connection
     * @throws IllegalStateException if none was created
     */
    public SimulatedConnection lastConnection()
    {
        if (connections.isEmpty())
        {
            throw new IllegalStateException("No connection has been created");
        }
        return connections.get(connections.size() - 1);
    }

    /**
     * Returns the number of connections created so far.
     *
     * @return connection count
     */
    public int connectionCount()
    {
        return connections.size();
    }

    /**
     * A connection driven by the test.
     */
    public static final class SimulatedConnection implements TransportConnection
    {
        private enum State
        {
            PENDING,
            OPEN,
            CLOSED
        }

        private final URI uri;
        private final Map<String, String> headers;
        private final TransportListener listener;
        private final List<String> sent = new ArrayList<>();
        private State state = State.PENDING;
        private boolean closedLocally;

        private SimulatedConnection(URI uri, Map<String, String> headers, TransportListener listener)
        {
            this.uri = uri;
            this.headers = headers;
            this.listener = listener;
        }

        // ========== Driven by the test ==========

        /**
         * Completes the opening handshake.
         */
        public void open()
        {
            synchronized (this)
            {
                if (state != State.PENDING)
                {
                    throw new IllegalStateException("Connection is " + state);
                }
                state = State.OPEN;
            }
            listener.onOpen(this);
        }

        /**
         * Delivers a frame from the server.
         *
         * @param frame the frame text
         */
        public void receive(String frame)
        {
            synchronized (this)
            {
                if (state != State.OPEN)
                {
                    throw new IllegalStateException("Connection is " + state);
                }
            }
            listener.onMessage(frame);
        }

        /**
         * Fails the connection: reports the error, then an abnormal close.
         *
         * @param error the failure to report
         */
        public void drop(Throwable error)
        {
            if (finish())
            {
                listener.onError(error);
                listener.onClose(WebSocketTransport.ABNORMAL_CLOSURE, String.valueOf(error.getMessage()));
            }
        }

        /**
         * Closes the connection from the server side.
         *
         * @param code   close status code
         * @param reason close reason
         */
        public void closeFromServer(int code, String reason)
        {
            if (finish())
            {
                listener.onClose(code, reason);
            }
        }

        private synchronized boolean finish()
        {
            if (state == State.CLOSED)
            {
                return false;
            }
            state = State.CLOSED;
            return true;
        }

        // ========== Inspection ==========

        public URI uri()
        {
            return uri;
        }

        public Map<String, String> headers()
        {
            return headers;
        }

        /**
         * Returns every frame sent over this connection, in order.
         *
         * @return the sent frames
         */
        public synchronized List<String> sentFrames()
        {
            return List.copyOf(sent);
        }

        /**
         * Returns whether the client closed this connection.
         *
         * @return true if {@link #close()} was called
         */
        public synchronized boolean isClosedLocally()
        {
            return closedLocally;
        }

        // ========== TransportConnection ==========

        @Override
        public synchronized void send(String text)
        {
            if (state != State.OPEN)
            {
                throw new IllegalStateException("Connection is " + state);
            }
            sent.add(text);
        }

        @Override
        public synchronized boolean isOpen()
        {
            return state == State.OPEN;
        }

        @Override
        public synchronized void close()
        {
            closedLocally = true;
            state = State.CLOSED;
        }
    }
}
