package io.parley.core.gateway;

import io.parley.core.config.model.GatewayConfig;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OkHttpBrainTransport implements BrainTransport {
    private static final Logger LOG = LoggerFactory.getLogger(OkHttpBrainTransport.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient client;
    private final Object lock = new Object();
    private WebSocket webSocket;
    private SocketListener current;

    public OkHttpBrainTransport(GatewayConfig config) {
        this(new OkHttpClient.Builder()
            .connectTimeout(config.connectTimeout())
            .readTimeout(Duration.ZERO)
            .writeTimeout(Duration.ofSeconds(20))
            .pingInterval(keepAlive(config))
            .build());
    }

    public OkHttpBrainTransport(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public void open(URI uri, Duration connectTimeout, TransportListener listener) throws IOException {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        close();

        Request request = new Request.Builder().url(uri.toString()).build();
        SocketListener socketListener = new SocketListener(listener);
        WebSocket socket = client.newWebSocket(request, socketListener);
        try {
            socketListener.opened.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            socket.cancel();
            throw new IOException("Timed out after " + connectTimeout.toMillis() + "ms opening " + uri);
        } catch (ExecutionException e) {
            socket.cancel();
            Throwable cause = e.getCause();
            throw new IOException("Failed to open " + uri + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            socket.cancel();
            throw new InterruptedIOException("Interrupted while opening " + uri);
        }

        synchronized (lock) {
            webSocket = socket;
            current = socketListener;
        }
    }

    @Override
    public boolean send(String frame) {
        synchronized (lock) {
            if (webSocket == null || current.closed.get()) {
                return false;
            }
            return webSocket.send(frame);
        }
    }

    @Override
    public boolean probe() {
        synchronized (lock) {
            return webSocket != null && !current.closed.get();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (webSocket == null) {
                return;
            }
            current.closed.set(true);
            if (!webSocket.close(NORMAL_CLOSURE, "client closing")) {
                webSocket.cancel();
            }
            webSocket = null;
            current = null;
        }
    }

    private static Duration keepAlive(GatewayConfig config) {
        if (config.pingIntervalMs() <= 0) {
            throw new IllegalArgumentException("pingIntervalMs must be positive: keep-alive pings are the only liveness check");
        }
        return Duration.ofMillis(config.pingIntervalMs());
    }

    private static final class SocketListener extends WebSocketListener {
        private final TransportListener delegate;
        private final CompletableFuture<Void> opened = new CompletableFuture<>();
        private final AtomicBoolean closed = new AtomicBoolean();

        private SocketListener(TransportListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.complete(null);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            if (!closed.get()) {
                delegate.onMessage(text);
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            if (!closed.get()) {
                delegate.onMessage(bytes.utf8());
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            fireClosed("closed by brain (" + code + (reason == null || reason.isBlank() ? "" : " " + reason) + ")", null);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (opened.completeExceptionally(t)) {
                return;
            }
            fireClosed("transport failure: " + t.getMessage(), t);
        }

        private void fireClosed(String reason, Throwable cause) {
            if (!opened.isDone() || !closed.compareAndSet(false, true)) {
                return;
            }
            LOG.debug("WebSocket closed: {}", reason);
            delegate.onClosed(reason, cause);
        }
    }
}
