package io.parley.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One outstanding request. The result slot settles once; later resolve/fail calls return false.
 */
final class PendingRequest {
    private static final Logger LOG = LoggerFactory.getLogger(PendingRequest.class);

    private final String requestId;
    private final ObjectNode message;
    private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
    private final Instant sentAt;
    private final Duration timeout;
    private final Consumer<String> streamSink;
    private final StringBuilder streamed = new StringBuilder();
    private int transmissions;
    private int transmittedOn;

    PendingRequest(String requestId, ObjectNode message, Instant sentAt, Duration timeout, Consumer<String> streamSink) {
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.sentAt = Objects.requireNonNull(sentAt, "sentAt must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.streamSink = streamSink;
    }

    String requestId() {
        return requestId;
    }

    Instant sentAt() {
        return sentAt;
    }

    Duration timeout() {
        return timeout;
    }

    boolean isDone() {
        return result.isDone();
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(sentAt.plus(timeout));
    }

    /**
     * Frame to put on the given connection, or null when that connection already carried this request.
     * Retransmits keep the request id and carry an attempt counter.
     */
    synchronized String encodeFor(int generation, ObjectMapper mapper) {
        if (transmissions > 0 && generation == transmittedOn) {
            return null;
        }
        transmittedOn = generation;
        transmissions++;
        if (transmissions > 1) {
            message.put("retransmit", true);
            message.put("attempt", transmissions);
        }
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request " + requestId, e);
        }
    }

    synchronized int transmissions() {
        return transmissions;
    }

    void deliverChunk(String chunk) {
        if (result.isDone()) {
            return;
        }
        synchronized (this) {
            streamed.append(chunk);
        }
        if (streamSink == null) {
            return;
        }
        try {
            streamSink.accept(chunk);
        } catch (RuntimeException e) {
            LOG.warn("Stream sink failed for request {}", requestId, e);
        }
    }

    synchronized String streamedText() {
        return streamed.toString();
    }

    boolean resolve(JsonNode response) {
        return result.complete(response);
    }

    boolean fail(GatewayException error) {
        return result.completeExceptionally(error);
    }

    JsonNode await() throws GatewayException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ResponseTimeoutException timedOut = new ResponseTimeoutException(requestId, timeout);
            if (fail(timedOut)) {
                throw timedOut;
            }
            return await();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayException gatewayException) {
                throw gatewayException;
            }
            throw new GatewayException("Request " + requestId + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(new ConnectionLostException("Interrupted while waiting for " + requestId, e));
            throw new ConnectionLostException("Interrupted while waiting for " + requestId, e);
        }
    }
}
