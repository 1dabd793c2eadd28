package io.parley.core.gateway;

import static io.parley.core.gateway.ScriptedBrainTransport.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.config.model.GatewayConfig;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpBrainTransportTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private MockWebServer server;
    private BrainGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (gateway != null) {
            gateway.close();
        }
        server.shutdown();
    }

    @Test
    void shouldExchangeStreamedConversationOverWebSocket() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new EchoBrain(false)));
        GatewayConfig config = config();
        gateway = new BrainGateway(config, new OkHttpBrainTransport(config), Clock.systemUTC());
        gateway.connect();
        List<String> chunks = new CopyOnWriteArrayList<>();

        JsonNode response = gateway.send(Map.of("user_message", "hello brain"), Duration.ofSeconds(5), chunks::add);

        assertThat(chunks).containsExactly("echo: ", "hello brain");
        assertThat(response.path("content").path("response_text").asText()).isEqualTo("echo: hello brain");
        assertThat(gateway.healthReport().avgLatencyMs()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void shouldReconnectAfterBrainClosesSocket() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new EchoBrain(true)));
        server.enqueue(new MockResponse().withWebSocketUpgrade(new EchoBrain(false)));
        GatewayConfig config = config();
        gateway = new BrainGateway(config, new OkHttpBrainTransport(config), Clock.systemUTC());
        List<GatewayStatus> seen = new CopyOnWriteArrayList<>();
        gateway.onStatusChange((previous, current) -> seen.add(current));
        gateway.connect();

        gateway.send(Map.of("user_message", "first"), Duration.ofSeconds(5));
        waitUntil(() -> seen.contains(GatewayStatus.RECONNECTING) && gateway.status() == GatewayStatus.CONNECTED);

        JsonNode response = gateway.send(Map.of("user_message", "second"), Duration.ofSeconds(5));
        assertThat(response.path("content").path("response_text").asText()).isEqualTo("echo: second");
        assertThat(gateway.healthReport().totalReconnects()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void shouldFailToOpenWhenServerRefusesUpgrade() {
        server.enqueue(new MockResponse().setResponseCode(503));
        GatewayConfig config = config();
        gateway = new BrainGateway(config, new OkHttpBrainTransport(config), Clock.systemUTC());

        assertThatThrownBy(() -> gateway.connect()).isInstanceOf(ConnectionFailureException.class);
        assertThat(gateway.status()).isEqualTo(GatewayStatus.DISCONNECTED);
    }

    @Test
    void shouldRequireKeepAlivePings() {
        GatewayConfig withoutPings = new GatewayConfig("ws://127.0.0.1:9/brain", 2_000, 10, 100, 5, 0, 60_000, 5_000, 1024);

        assertThatThrownBy(() -> new OkHttpBrainTransport(withoutPings))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pingIntervalMs");
    }

    private GatewayConfig config() {
        String uri = server.url("/brain").toString().replaceFirst("^http", "ws");
        return new GatewayConfig(uri, 2_000, 10, 100, 5, 1_000, 60_000, 5_000, 1024 * 1024);
    }

    /** Streams the echoed message in two chunks, then answers. Optionally hangs up after the first answer. */
    private static final class EchoBrain extends WebSocketListener {
        private final boolean closeAfterReply;

        private EchoBrain(boolean closeAfterReply) {
            this.closeAfterReply = closeAfterReply;
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            try {
                JsonNode request = JSON.readTree(text);
                String id = request.path("request_id").asText();
                String message = request.path("user_message").asText();
                webSocket.send(JSON.writeValueAsString(Map.of("type", "stream_chunk", "request_id", id, "content", "echo: ")));
                webSocket.send(JSON.writeValueAsString(Map.of("type", "stream_chunk", "request_id", id, "content", message)));
                webSocket.send(JSON.writeValueAsString(Map.of(
                    "request_id", id,
                    "content", Map.of("response_text", "echo: " + message)
                )));
            } catch (IOException e) {
                webSocket.close(1011, e.getMessage());
                return;
            }
            if (closeAfterReply) {
                webSocket.close(1000, "bye");
            }
        }
    }
}
