package me.golemcore.chatbridge.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chatbridge.domain.model.ExchangeFailureKind;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.testsupport.http.StubHttpEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderHttpClientTest {

    private static final String URL = "http://llm.test/v1/chat/completions";

    private StubHttpEngine engine;
    private List<Long> backoffs;
    private ProviderHttpClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        engine = new StubHttpEngine();
        backoffs = new ArrayList<>();
        BridgeProperties properties = new BridgeProperties();
        properties.getHttp().setRetryMaxAttempts(3);
        properties.getHttp().setRetryInitialBackoff(100);
        properties.getHttp().setRetryMultiplier(2.0);
        client = new ProviderHttpClient(engine.client(), objectMapper, properties) {
            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                backoffs.add(backoffMs);
            }
        };
    }

    @Test
    void shouldPostBodyAndHeaders() {
        engine.enqueueJson(200, "{\"ok\":true}");

        JsonNode json = client.postJson(request());

        assertTrue(json.path("ok").asBoolean());
        StubHttpEngine.Recorded recorded = engine.lastRequest();
        assertEquals(URL, recorded.url());
        assertEquals("Bearer key", recorded.header("Authorization"));
        assertEquals("{\"model\":\"m\"}", recorded.body());
    }

    @Test
    void shouldRetryTransportFailuresWithBackoff() {
        engine.enqueueFailure(new SocketTimeoutException("timeout"));
        engine.enqueueFailure(new IOException("connection reset"));
        engine.enqueueJson(200, "{\"ok\":true}");

        JsonNode json = client.postJson(request());

        assertTrue(json.path("ok").asBoolean());
        assertEquals(3, engine.getRequestCount());
        assertEquals(List.of(100L, 200L), backoffs);
    }

    @Test
    void shouldFailWithNetworkKindAfterLastAttempt() {
        engine.enqueueFailure(new IOException("down"));
        engine.enqueueFailure(new IOException("down"));
        engine.enqueueFailure(new IOException("down"));

        ProviderCallException error = assertThrows(ProviderCallException.class, () -> client.postJson(request()));

        assertEquals(ExchangeFailureKind.NETWORK, error.getKind());
        assertEquals(3, engine.getRequestCount());
    }

    @Test
    void shouldReturnErrorEnvelopeWithoutRetrying() {
        engine.enqueueJson(429, "{\"error\":{\"message\":\"rate limited\"}}");

        JsonNode json = client.postJson(request());

        assertEquals("rate limited", json.path("error").path("message").asText());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldReportHttpStatusWhenErrorBodyIsNotJson() {
        engine.enqueueText(502, "<html>Bad gateway</html>", "text/html");

        ProviderCallException error = assertThrows(ProviderCallException.class, () -> client.postJson(request()));

        assertEquals(ExchangeFailureKind.PROVIDER, error.getKind());
        assertTrue(error.getMessage().startsWith("HTTP 502"));
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldReportSchemaFailureForUnreadableSuccessBody() {
        engine.enqueueText(200, "not json", "text/plain");

        ProviderCallException error = assertThrows(ProviderCallException.class, () -> client.postJson(request()));

        assertEquals(ExchangeFailureKind.SCHEMA, error.getKind());
    }

    @Test
    void shouldDownloadBytesWithContentType() {
        engine.enqueueBytes(200, new byte[] { 1, 2, 3 }, "image/png");

        ProviderHttpClient.Download download = client.download("http://img.test/a.png", Duration.ofSeconds(5));

        assertArrayEquals(new byte[] { 1, 2, 3 }, download.bytes());
        assertEquals("image/png", download.contentType());
    }

    @Test
    void shouldFailDownloadOnHttpError() {
        engine.enqueueBytes(404, new byte[0], "text/plain");

        ProviderCallException error = assertThrows(ProviderCallException.class,
                () -> client.download("http://img.test/missing.png", Duration.ofSeconds(5)));

        assertEquals(ExchangeFailureKind.PROVIDER, error.getKind());
    }

    private ProviderRequest request() {
        return ProviderRequest.builder()
                .provider(Provider.OPENAI)
                .url(URL)
                .header("Authorization", "Bearer key")
                .body(objectMapper.createObjectNode().put("model", "m"))
                .timeout(Duration.ofSeconds(5))
                .build();
    }
}
