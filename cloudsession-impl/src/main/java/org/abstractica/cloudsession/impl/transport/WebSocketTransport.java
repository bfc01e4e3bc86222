package org.abstractica.cloudsession.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport over the JDK WebSocket client.
 *
 * <p>Fragmented messages are reassembled before they are reported, and
 * binary messages are decoded as UTF-8 text. A failure is always reported
 * as an error followed by a close with status 1006, whether the connection
 * never opened or dropped later.</p>
 */
public class WebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);

    /**
     * Default time allowed for the opening handshake.
     */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Close status reported when a connection ends without a close frame.
     */
    public static final int ABNORMAL_CLOSURE = 1006;

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    /**
     * Creates a transport with a new HTTP client and the default timeout.
     */
    public WebSocketTransport()
    {
        this(HttpClient.newHttpClient(), DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * Creates a transport using the given HTTP client.
     *
     * @param httpClient     client used to open WebSockets
     * @param connectTimeout time allowed for the opening handshake
     */
    public WebSocketTransport(HttpClient httpClient, Duration connectTimeout)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public TransportConnection connect(URI uri, Map<String, String> headers, TransportListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(listener, "listener");

        Connection connection = new Connection(uri, listener);

        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout);
        headers.forEach(builder::header);

        LOG.debug("Opening WebSocket to {}", uri);
        builder.buildAsync(uri, connection).whenComplete((webSocket, error) ->
        {
            if (error != null)
            {
                connection.fail(unwrap(error));
            }
        });

        return connection;
    }

    private static Throwable unwrap(Throwable error)
    {
        if ((error instanceof CompletionException || error instanceof ExecutionException)
                && error.getCause() != null)
        {
            return error.getCause();
        }
        return error;
    }

    /**
     * One WebSocket connection and its JDK listener.
     */
    private static final class Connection implements TransportConnection, WebSocket.Listener
    {
        private final URI uri;
        private final TransportListener listener;
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();

        private volatile WebSocket webSocket;
        private volatile boolean closeRequested;
        private CompletableFuture<WebSocket> sendChain;

        Connection(URI uri, TransportListener listener)
        {
            this.uri = uri;
            this.listener = listener;
        }

        // ========== TransportConnection ==========

        @Override
        public synchronized void send(String text)
        {
            Objects.requireNonNull(text, "text");
            if (!isOpen())
            {
                throw new IllegalStateException("Connection to " + uri + " is not open");
            }

            // The JDK client allows one outstanding send; chain them.
            sendChain = sendChain
                    .thenCompose(ws -> ws.sendText(text, true))
                    .exceptionally(error ->
                    {
                        LOG.warn("Send to {} failed: {}", uri, unwrap(error).getMessage());
                        return webSocket;
                    });
        }

        @Override
        public boolean isOpen()
        {
            WebSocket ws = webSocket;
            return ws != null && !closeRequested && !finished.get() && !ws.isOutputClosed();
        }

        @Override
        public synchronized void close()
        {
            if (closeRequested)
            {
                return;
            }
            closeRequested = true;

            WebSocket ws = webSocket;
            if (ws == null || ws.isOutputClosed())
            {
                return;
            }

            sendChain.thenCompose(w -> w.sendClose(WebSocket.NORMAL_CLOSURE, ""))
                    .whenComplete((w, error) ->
                    {
                        if (error != null)
                        {
                            LOG.debug("Close handshake with {} failed, aborting: {}", uri, error.getMessage());
                            ws.abort();
                        }
                    });
        }

        // ========== WebSocket.Listener ==========

        @Override
        public void onOpen(WebSocket webSocket)
        {
            synchronized (this)
            {
                this.webSocket = webSocket;
                this.sendChain = CompletableFuture.completedFuture(webSocket);
            }

            if (closeRequested)
            {
                LOG.debug("Connection to {} opened after close was requested", uri);
                webSocket.abort();
                return;
            }

            LOG.debug("WebSocket to {} open", uri);
            webSocket.request(1);
            listener.onOpen(this);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last)
        {
            textBuffer.append(data);
            if (last)
            {
                String frame = textBuffer.toString();
                textBuffer.setLength(0);
                deliver(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last)
        {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            binaryBuffer.writeBytes(bytes);
            if (last)
            {
                String frame = binaryBuffer.toString(StandardCharsets.UTF_8);
                binaryBuffer.reset();
                deliver(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason)
        {
            if (finished.compareAndSet(false, true))
            {
                LOG.debug("WebSocket to {} closed: {} {}", uri, statusCode, reason);
                listener.onClose(statusCode, reason == null ? "" : reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error)
        {
            fail(error);
        }

        // ========== Helpers ==========

        private void deliver(String frame)
        {
            if (!finished.get())
            {
                listener.onMessage(frame);
            }
        }

        void fail(Throwable error)
        {
            if (finished.compareAndSet(false, true))
            {
                LOG.debug("WebSocket to {} failed", uri, error);
                listener.onError(error);
                String message = error.getMessage();
                listener.onClose(ABNORMAL_CLOSURE, message == null ? error.getClass().getSimpleName() : message);
            }
        }
    }
}
