package me.golemcore.chatbridge.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.chatbridge.domain.model.ContentPart;
import me.golemcore.chatbridge.domain.model.ExchangeFailureKind;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import me.golemcore.chatbridge.domain.model.Role;
import me.golemcore.chatbridge.domain.service.ImageDeduplicator;
import me.golemcore.chatbridge.domain.service.ResponseNormalizer;
import me.golemcore.chatbridge.domain.service.ResponseNormalizer.NormalizedReply;
import me.golemcore.chatbridge.domain.service.SizeRatioDuplicatePolicy;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.port.outbound.ProviderPort.RequestOptions;
import me.golemcore.chatbridge.testsupport.http.StubHttpEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicAdapterTest {

    private static final String MODEL = "claude-3-5-sonnet-20241022";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubHttpEngine engine;
    private AnthropicAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        engine = new StubHttpEngine();
        BridgeProperties properties = new BridgeProperties();
        properties.getProviders().getAnthropic().setApiKey("ant-key");
        properties.getProviders().getAnthropic().setUrl("http://anthropic.test/v1/messages");
        ProviderHttpClient httpClient = new ProviderHttpClient(engine.client(), objectMapper, properties) {
            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                // no waiting in tests
            }
        };
        adapter = new AnthropicAdapter(properties, httpClient, objectMapper,
                new RemoteImageFetcher(httpClient, properties));
    }

    @Test
    void shouldJoinSystemMessagesIntoSystemField() {
        List<Message> conversation = List.of(
                Message.system("Be brief."),
                Message.system("Answer in English."),
                Message.user("hello"),
                Message.assistant("hi"),
                Message.user("how are you"));

        ProviderRequest request = adapter.buildRequest(conversation, MODEL, 300);

        JsonNode body = request.getBody();
        assertEquals("Be brief.\n\nAnswer in English.", body.path("system").asText());
        assertEquals(3, body.path("messages").size());
        assertEquals("user", body.path("messages").get(0).path("role").asText());
        assertEquals("assistant", body.path("messages").get(1).path("role").asText());
        assertEquals("hi", body.path("messages").get(1).path("content").get(0).path("text").asText());
        assertEquals(300, body.path("max_tokens").asInt());
        assertEquals("ant-key", request.getHeaders().get("x-api-key"));
        assertNotNull(request.getHeaders().get("anthropic-version"));
        assertFalse(request.getHeaders().containsKey("Authorization"));
    }

    @Test
    void shouldSendInlineImagesAsBase64Sources() {
        Message user = Message.builder()
                .role(Role.USER)
                .part(ContentPart.text("what is this"))
                .part(ContentPart.image(new ImagePayload(new byte[] { 1, 2, 3 }, "image/png")))
                .build();

        ProviderRequest request = adapter.buildRequest(List.of(user), MODEL, 300);

        JsonNode blocks = request.getBody().path("messages").get(0).path("content");
        assertEquals(2, blocks.size());
        JsonNode source = blocks.get(1).path("source");
        assertEquals("image", blocks.get(1).path("type").asText());
        assertEquals("base64", source.path("type").asText());
        assertEquals("image/png", source.path("media_type").asText());
        assertEquals("AQID", source.path("data").asText());
    }

    @Test
    void shouldDownloadRemoteImagesBeforeSending() throws Exception {
        engine.enqueueBytes(200, new byte[] { 9, 9 }, "image/webp");
        engine.enqueueJson(200, """
                {"content":[{"type":"text","text":"A cat."}],
                 "usage":{"input_tokens":120,"output_tokens":5}}
                """);
        Message user = Message.builder()
                .role(Role.USER)
                .part(ContentPart.text("describe"))
                .part(ContentPart.remoteImage("http://images.test/cat.webp"))
                .build();

        ProviderResponse response = adapter.call(List.of(user), MODEL, 300, RequestOptions.defaults());

        assertEquals("A cat.", response.getText());
        assertEquals(125, response.getUsageTokens());
        assertEquals(2, engine.getRequestCount());
        assertEquals("http://images.test/cat.webp", engine.requests().get(0).url());
        JsonNode sent = objectMapper.readTree(engine.lastRequest().body());
        JsonNode source = sent.path("messages").get(0).path("content").get(1).path("source");
        assertEquals("image/webp", source.path("media_type").asText());
        assertEquals("CQk=", source.path("data").asText());
    }

    @Test
    void shouldOmitImageThatCannotBeFetched() throws Exception {
        engine.enqueueText(404, "not found", "text/plain");
        engine.enqueueJson(200, "{\"content\":[{\"type\":\"text\",\"text\":\"ok\"}]}");
        Message user = Message.builder()
                .role(Role.USER)
                .part(ContentPart.text("describe"))
                .part(ContentPart.remoteImage("http://images.test/missing.png"))
                .build();

        ProviderResponse response = adapter.call(List.of(user), MODEL, 300, RequestOptions.defaults());

        assertEquals("ok", response.getText());
        JsonNode sent = objectMapper.readTree(engine.lastRequest().body());
        JsonNode blocks = sent.path("messages").get(0).path("content");
        assertEquals(1, blocks.size());
        assertEquals("describe", blocks.get(0).path("text").asText());
    }

    @Test
    void shouldParseErrorEnvelope() {
        engine.enqueueJson(200, """
                {"type":"error","error":{"type":"overloaded_error","message":"Overloaded"}}
                """);

        ProviderResponse response = adapter.call(List.of(Message.user("hi")), MODEL, 300,
                RequestOptions.defaults());

        assertTrue(response.hasError());
        assertEquals("Overloaded", response.getError().message());
        assertEquals("overloaded_error", response.getError().type());
        assertEquals(0, response.getUsageTokens());
    }

    @Test
    void shouldRejectResponseWithoutContent() {
        engine.enqueueJson(200, "{\"id\":\"msg_1\"}");

        ProviderCallException exception = assertThrows(ProviderCallException.class,
                () -> adapter.call(List.of(Message.user("hi")), MODEL, 300, RequestOptions.defaults()));

        assertEquals(ExchangeFailureKind.SCHEMA, exception.getKind());
    }

    @Test
    void shouldRecoverTextAndEncodedImageFromRequestBlocks() {
        ImagePayload image = new ImagePayload(new byte[] { 4, 5, 6 }, "image/gif");
        Message user = Message.builder()
                .role(Role.USER)
                .part(ContentPart.text("What animal is this?"))
                .part(ContentPart.image(image))
                .build();
        JsonNode blocks = adapter.buildRequest(List.of(user), MODEL, 100)
                .getBody().path("messages").get(0).path("content");

        JsonNode source = blocks.get(1).path("source");
        assertEquals(image, ImagePayload.fromDataUrl(
                "data:" + source.path("media_type").asText() + ";base64," + source.path("data").asText()));

        ObjectNode reply = objectMapper.createObjectNode();
        reply.putArray("content").add(blocks.get(0).deepCopy());
        reply.putObject("usage").put("input_tokens", 3).put("output_tokens", 4);
        NormalizedReply normalized = new ResponseNormalizer(
                new ImageDeduplicator(new SizeRatioDuplicatePolicy(0.001))).normalize(adapter.parseResponse(reply));

        assertEquals("What animal is this?", normalized.text());
        assertTrue(normalized.images().isEmpty());
    }
}
