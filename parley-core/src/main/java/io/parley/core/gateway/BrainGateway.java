package io.parley.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.parley.core.config.model.GatewayConfig;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single logical connection to the brain.
 *
 * <p>Requests are correlated by {@code request_id}, so any number may be in flight and responses may
 * arrive in any order. Unexpected closures and failed health probes move the gateway to RECONNECTING;
 * requests registered meanwhile are held and (re)sent once the transport is back, if still within their
 * timeout. Exhausting the attempt ceiling moves the gateway to FATAL and fails everything pending.
 */
public final class BrainGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BrainGateway.class);
    private static final String DEFAULT_MESSAGE_TYPE = "conversation";

    private final GatewayConfig config;
    private final URI uri;
    private final BrainTransport transport;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final List<GatewayStatusListener> statusListeners = new CopyOnWriteArrayList<>();
    private final Object lifecycleLock = new Object();

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong totalReconnects = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();

    private volatile GatewayStatus status = GatewayStatus.DISCONNECTED;
    private volatile boolean closed;
    private volatile int connectionGeneration;
    private volatile int reconnectAttempt;
    private volatile Instant lastSendAt;
    private volatile Instant lastReceiveAt;
    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> reconnectTask;

    public BrainGateway(GatewayConfig config) {
        this(config, new OkHttpBrainTransport(config), Clock.systemUTC());
    }

    public BrainGateway(GatewayConfig config, BrainTransport transport, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.uri = URI.create(Objects.requireNonNull(config.uri(), "gateway uri must not be null"));
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("parley-gateway"));
    }

    // Lifecycle

    public void connect() throws ConnectionFailureException {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new ConnectionFailureException("Brain gateway is closed");
            }
            if (status == GatewayStatus.CONNECTED) {
                return;
            }
            cancelReconnect();
            reconnectAttempt = 0;
            setStatus(GatewayStatus.CONNECTING);
            try {
                openTransport();
            } catch (ConnectionFailureException e) {
                LOG.error("Failed to connect to brain at {}: {}", uri, e.getMessage());
                setStatus(GatewayStatus.DISCONNECTED);
                throw e;
            }
            retransmitPending();
        }
    }

    public void disconnect() {
        synchronized (lifecycleLock) {
            cancelReconnect();
            stopHealthProbe();
            invalidateConnection();
            setStatus(GatewayStatus.DISCONNECTED);
            failAllPending(request -> new ConnectionLostException("Gateway disconnected"));
            LOG.info("Disconnected from brain at {}", uri);
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            closed = true;
            disconnect();
        }
        scheduler.shutdownNow();
    }

    public void onStatusChange(GatewayStatusListener listener) {
        statusListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public GatewayStatus status() {
        return status;
    }

    public boolean isConnected() {
        return status == GatewayStatus.CONNECTED;
    }

    // Request / response

    public JsonNode send(Map<String, Object> payload, Duration timeout) throws GatewayException {
        return send(payload, timeout, null);
    }

    /**
     * Sends one request and blocks until its response settles.
     *
     * @param streamSink receives {@code stream_chunk} content for this request, in arrival order; may be null
     * @throws ResponseTimeoutException when nothing settles the request within {@code timeout}
     * @throws ConnectionLostException when the gateway is disconnected, or shuts down while waiting
     * @throws BrainErrorException when the brain answers with an {@code error} field
     */
    public JsonNode send(Map<String, Object> payload, Duration timeout, Consumer<String> streamSink)
        throws GatewayException {
        Objects.requireNonNull(payload, "payload must not be null");
        Duration budget = timeout == null || timeout.isZero() || timeout.isNegative()
            ? config.responseTimeout()
            : timeout;

        String requestId = UUID.randomUUID().toString();
        PendingRequest request = new PendingRequest(
            requestId,
            frame(requestId, payload),
            clock.instant(),
            budget,
            streamSink
        );
        pending.put(requestId, request);
        try {
            GatewayStatus current = status;
            if (closed) {
                request.fail(new ConnectionLostException("Brain gateway is closed"));
            } else if (current == GatewayStatus.FATAL) {
                request.fail(new ReconnectExhaustedException("Brain gateway gave up reconnecting; call connect() to retry"));
            } else if (current == GatewayStatus.DISCONNECTED) {
                request.fail(new ConnectionLostException("Brain gateway is not connected"));
            } else if (current == GatewayStatus.CONNECTED) {
                if (!transmit(request)) {
                    request.fail(new ConnectionLostException("Connection lost while sending " + requestId));
                    handleConnectionLoss("send failed", null);
                }
            } else {
                LOG.debug("Holding request {} until the brain connection is back ({})", requestId, current.wireValue());
            }
            return request.await();
        } catch (ResponseTimeoutException e) {
            LOG.warn("Brain response timed out for request {} after {}ms", requestId, budget.toMillis());
            throw e;
        } finally {
            pending.remove(requestId);
        }
    }

    public GatewayHealth healthReport() {
        long samples = latencySamples.get();
        double avgLatencyMs = samples == 0 ? 0.0 : totalLatencyNanos.get() / (double) samples / 1_000_000.0;
        return new GatewayHealth(
            status,
            uri.toString(),
            messagesSent.get(),
            messagesReceived.get(),
            pending.size(),
            Math.round(avgLatencyMs * 100.0) / 100.0,
            reconnectAttempt,
            totalReconnects.get(),
            lastSendAt,
            lastReceiveAt
        );
    }

    int pendingCount() {
        return pending.size();
    }

    private ObjectNode frame(String requestId, Map<String, Object> payload) {
        ObjectNode message = mapper.createObjectNode();
        message.put("request_id", requestId);
        message.put("type", DEFAULT_MESSAGE_TYPE);
        JsonNode body = mapper.valueToTree(payload);
        if (body instanceof ObjectNode objectBody) {
            message.setAll(objectBody);
        }
        message.put("request_id", requestId);
        return message;
    }

    private boolean transmit(PendingRequest request) {
        String frame = request.encodeFor(connectionGeneration, mapper);
        if (frame == null) {
            LOG.debug("Request {} already sent on this connection", request.requestId());
            return true;
        }
        boolean sent;
        try {
            sent = transport.send(frame);
        } catch (RuntimeException e) {
            LOG.warn("Transport rejected request {}", request.requestId(), e);
            sent = false;
        }
        if (sent) {
            messagesSent.incrementAndGet();
            lastSendAt = clock.instant();
        }
        return sent;
    }

    private void dispatch(String frame) {
        messagesReceived.incrementAndGet();
        lastReceiveAt = clock.instant();

        if (frame.length() > config.maxMessageSizeBytes()) {
            LOG.warn("Dropping oversized brain frame ({} chars)", frame.length());
            return;
        }
        JsonNode message;
        try {
            message = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            LOG.warn("Received non-JSON frame from brain: {}", truncate(frame, 200));
            return;
        }
        if (message == null || !message.isObject()) {
            LOG.warn("Received non-object frame from brain: {}", truncate(frame, 200));
            return;
        }

        String requestId = text(message, "request_id");
        String type = text(message, "type");
        if (type == null) {
            type = "response";
        }
        PendingRequest request = requestId == null ? null : pending.get(requestId);

        if ("stream_chunk".equals(type)) {
            if (request == null) {
                LOG.debug("Dropping stream chunk for unknown request {}", requestId);
                return;
            }
            String chunk = text(message, "content");
            request.deliverChunk(chunk == null ? "" : chunk);
            return;
        }
        if (request == null) {
            LOG.debug("Unsolicited brain message type={} request_id={}", type, requestId);
            return;
        }
        if ("stream_end".equals(type) && !isPresent(message.get("content"))) {
            ((ObjectNode) message).put("content", request.streamedText());
        }
        settle(request, message);
    }

    private void settle(PendingRequest request, JsonNode message) {
        JsonNode error = message.get("error");
        boolean settled;
        if (isPresent(error)) {
            String detail = error.isTextual() ? error.asText() : error.toString();
            settled = request.fail(new BrainErrorException(request.requestId(), detail));
        } else {
            settled = request.resolve(message);
        }
        if (settled) {
            Duration latency = Duration.between(request.sentAt(), clock.instant());
            totalLatencyNanos.addAndGet(Math.max(0, latency.toNanos()));
            latencySamples.incrementAndGet();
        } else {
            LOG.debug("Ignoring duplicate settlement for request {}", request.requestId());
        }
    }

    // Reconnection

    private void openTransport() throws ConnectionFailureException {
        int generation = connectionGeneration + 1;
        connectionGeneration = generation;
        try {
            transport.open(uri, config.connectTimeout(), new GenerationListener(generation));
        } catch (Exception e) {
            throw new ConnectionFailureException("Cannot reach brain at " + uri + ": " + e.getMessage(), e);
        }
        setStatus(GatewayStatus.CONNECTED);
        reconnectAttempt = 0;
        startHealthProbe();
        LOG.info("Connected to brain at {}", uri);
    }

    private void handleConnectionLoss(String reason, Throwable cause) {
        synchronized (lifecycleLock) {
            if (status != GatewayStatus.CONNECTED) {
                return;
            }
            if (cause == null) {
                LOG.warn("Brain connection lost: {}", reason);
            } else {
                LOG.warn("Brain connection lost: {}", reason, cause);
            }
            stopHealthProbe();
            invalidateConnection();
            setStatus(GatewayStatus.RECONNECTING);
            reconnectAttempt = 0;
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        int attempt = reconnectAttempt + 1;
        reconnectAttempt = attempt;
        int ceiling = config.reconnectMaxAttempts();
        if (ceiling > 0 && attempt > ceiling) {
            setStatus(GatewayStatus.FATAL);
            LOG.error("Max reconnection attempts ({}) exhausted for {}", ceiling, uri);
            failAllPending(request -> new ReconnectExhaustedException(
                "Brain reconnection failed after " + ceiling + " attempts"
            ));
            return;
        }
        Duration delay = config.reconnectDelay(attempt);
        LOG.info("Reconnect attempt {} in {}ms", attempt, delay.toMillis());
        reconnectTask = scheduler.schedule(this::attemptReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect() {
        synchronized (lifecycleLock) {
            if (status != GatewayStatus.RECONNECTING) {
                return;
            }
            int attempt = reconnectAttempt;
            totalReconnects.incrementAndGet();
            try {
                openTransport();
                LOG.info("Reconnected to brain on attempt {}", attempt);
                retransmitPending();
            } catch (ConnectionFailureException e) {
                LOG.warn("Reconnect attempt {} failed: {}", attempt, e.getMessage());
                scheduleReconnect();
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure during reconnect attempt {}", attempt, e);
                scheduleReconnect();
            }
        }
    }

    private void retransmitPending() {
        Instant now = clock.instant();
        for (PendingRequest request : pending.values()) {
            if (request.isDone() || request.isExpired(now)) {
                continue;
            }
            if (!transmit(request)) {
                LOG.warn("Retransmit of request {} failed", request.requestId());
                return;
            }
            LOG.debug("Sent request {} after reconnect (transmission {})", request.requestId(), request.transmissions());
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    // Health probe

    private void startHealthProbe() {
        stopHealthProbe();
        long interval = config.healthCheckInterval().toMillis();
        healthTask = scheduler.scheduleAtFixedRate(this::probeHealth, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHealthProbe() {
        if (healthTask != null) {
            healthTask.cancel(false);
            healthTask = null;
        }
    }

    private void probeHealth() {
        if (status != GatewayStatus.CONNECTED) {
            return;
        }
        boolean alive;
        try {
            alive = transport.probe();
        } catch (RuntimeException e) {
            LOG.warn("Health probe raised", e);
            alive = false;
        }
        if (!alive) {
            handleConnectionLoss("health probe failed", null);
        }
    }

    // Internals

    private void invalidateConnection() {
        connectionGeneration = connectionGeneration + 1;
        try {
            transport.close();
        } catch (RuntimeException e) {
            LOG.debug("Transport close failed: {}", e.getMessage());
        }
    }

    private void failAllPending(Function<PendingRequest, GatewayException> failure) {
        for (PendingRequest request : pending.values()) {
            request.fail(failure.apply(request));
        }
        pending.clear();
    }

    private void setStatus(GatewayStatus next) {
        GatewayStatus previous = status;
        status = next;
        if (previous == next) {
            return;
        }
        LOG.info("Gateway status: {} -> {}", previous.wireValue(), next.wireValue());
        for (GatewayStatusListener listener : statusListeners) {
            try {
                listener.onStatusChange(previous, next);
            } catch (RuntimeException e) {
                LOG.warn("Gateway status listener failed", e);
            }
        }
    }

    private static boolean isPresent(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isBlank();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static String truncate(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class GenerationListener implements TransportListener {
        private final int generation;

        private GenerationListener(int generation) {
            this.generation = generation;
        }

        @Override
        public void onMessage(String frame) {
            if (generation != connectionGeneration) {
                return;
            }
            try {
                dispatch(frame);
            } catch (RuntimeException e) {
                LOG.error("Failed to dispatch brain frame", e);
            }
        }

        @Override
        public void onClosed(String reason, Throwable cause) {
            if (generation != connectionGeneration) {
                return;
            }
            handleConnectionLoss(reason == null ? "connection closed" : reason, cause);
        }
    }
}
