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

class OpenAiAdapterTest {

    private static final ImagePayload IMAGE = new ImagePayload(new byte[] { 1, 2, 3 }, "image/png");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubHttpEngine engine;
    private OpenAiAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new StubHttpEngine();
        BridgeProperties properties = new BridgeProperties();
        properties.getProviders().getOpenai().setApiKey("sk-test");
        properties.getProviders().getOpenai().setUrl("http://openai.test/v1/chat/completions");
        ProviderHttpClient httpClient = new ProviderHttpClient(engine.client(), objectMapper, properties);
        adapter = new OpenAiAdapter(properties, httpClient, objectMapper);
    }

    @Test
    void shouldBuildTypedUserContentAndStringSystemContent() {
        Message user = Message.builder()
                .role(Role.USER)
                .part(ContentPart.text("What is this?"))
                .part(ContentPart.image(IMAGE))
                .part(ContentPart.remoteImage("https://example.com/cat.jpg"))
                .build();

        ProviderRequest request = adapter.buildRequest(List.of(Message.system("Be brief"), user), "gpt-4o", 300);

        JsonNode body = request.getBody();
        assertEquals("gpt-4o", body.path("model").asText());
        assertEquals(300, body.path("max_tokens").asInt());
        JsonNode messages = body.path("messages");
        assertEquals("system", messages.get(0).path("role").asText());
        assertEquals("Be brief", messages.get(0).path("content").asText());
        JsonNode parts = messages.get(1).path("content");
        assertEquals("text", parts.get(0).path("type").asText());
        assertEquals(IMAGE.toDataUrl(), parts.get(1).path("image_url").path("url").asText());
        assertEquals("https://example.com/cat.jpg", parts.get(2).path("image_url").path("url").asText());
        assertEquals("Bearer sk-test", request.getHeaders().get("Authorization"));
    }

    @Test
    void shouldNotSendAssistantImages() {
        Message assistant = Message.builder()
                .role(Role.ASSISTANT)
                .part(ContentPart.text("Here you go"))
                .part(ContentPart.image(IMAGE))
                .build();

        ProviderRequest request = adapter.buildRequest(List.of(Message.user("draw"), assistant), "gpt-4o", 100);

        JsonNode content = request.getBody().path("messages").get(1).path("content");
        assertTrue(content.isTextual());
        assertEquals("Here you go", content.asText());
    }

    @Test
    void shouldParseTextAndUsage() {
        engine.enqueueJson(200, """
                {"choices":[{"message":{"role":"assistant","content":"Hello!"}}],
                 "usage":{"prompt_tokens":10,"completion_tokens":5,"total_tokens":15}}
                """);

        ProviderResponse response = adapter.call(List.of(Message.user("Hi")), "gpt-4o", 100,
                RequestOptions.defaults());

        assertFalse(response.hasError());
        assertEquals("Hello!", response.getText());
        assertEquals(15, response.getUsageTokens());
    }

    @Test
    void shouldSumPromptAndCompletionWhenTotalMissing() {
        engine.enqueueJson(200, """
                {"choices":[{"message":{"content":"ok"}}],"usage":{"prompt_tokens":7,"completion_tokens":3}}
                """);

        ProviderResponse response = adapter.call(List.of(Message.user("Hi")), "gpt-4o", 100,
                RequestOptions.defaults());

        assertEquals(10, response.getUsageTokens());
    }

    @Test
    void shouldParseContentPartsWithImages() {
        engine.enqueueJson(200, """
                {"choices":[{"message":{"content":[
                  {"type":"text","text":"A cat"},
                  {"type":"image_url","image_url":{"url":"data:image/png;base64,AQID"}},
                  {"inline_data":{"mime_type":"image/jpeg","data":"BAUG"}}
                ]}}]}
                """);

        ProviderResponse response = adapter.call(List.of(Message.user("cat")), "gpt-4o", 100,
                RequestOptions.defaults());

        assertEquals("A cat", response.getText());
        assertEquals(2, response.getContentImages().size());
        assertEquals("data:image/jpeg;base64,BAUG", response.getContentImages().get(1).url());
    }

    @Test
    void shouldSurfaceErrorEnvelope() {
        engine.enqueueJson(429, "{\"error\":{\"message\":\"rate limited\",\"type\":\"rate_limit\",\"code\":429}}");

        ProviderResponse response = adapter.call(List.of(Message.user("Hi")), "gpt-4o", 100,
                RequestOptions.defaults());

        assertTrue(response.hasError());
        assertEquals("rate limited", response.getError().message());
        assertEquals("rate_limit", response.getError().type());
        assertEquals("429", response.getError().code());
        assertEquals(0, response.getUsageTokens());
    }

    @Test
    void shouldNameErrorEnvelopeByCodeWhenMessageMissing() {
        engine.enqueueJson(500, "{\"error\":{\"code\":500}}");

        ProviderResponse response = adapter.call(List.of(Message.user("Hi")), "gpt-4o", 100,
                RequestOptions.defaults());

        assertTrue(response.hasError());
        assertEquals("Error code 500", response.getError().message());
    }

    @Test
    void shouldFailWithSchemaErrorWhenChoicesMissing() {
        engine.enqueueJson(200, "{\"id\":\"x\"}");

        ProviderCallException error = assertThrows(ProviderCallException.class,
                () -> adapter.call(List.of(Message.user("Hi")), "gpt-4o", 100, RequestOptions.defaults()));

        assertEquals(ExchangeFailureKind.SCHEMA, error.getKind());
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        BridgeProperties properties = new BridgeProperties();
        OpenAiAdapter unconfigured = new OpenAiAdapter(properties,
                new ProviderHttpClient(engine.client(), objectMapper, properties), objectMapper);

        assertFalse(unconfigured.isAvailable());
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldRecoverTextAndImageWhenRequestContentIsEchoedBack() {
        Message user = Message.builder()
                .role(Role.USER)
                .part(ContentPart.text("A cat on a mat"))
                .part(ContentPart.image(IMAGE))
                .build();
        JsonNode sentContent = adapter.buildRequest(List.of(user), "gpt-4o", 100)
                .getBody().path("messages").get(0).path("content");

        ObjectNode reply = objectMapper.createObjectNode();
        reply.putArray("choices").addObject().putObject("message")
                .put("role", "assistant")
                .set("content", sentContent.deepCopy());
        NormalizedReply normalized = normalizer().normalize(adapter.parseResponse(reply));

        assertEquals("A cat on a mat", normalized.text());
        assertEquals(List.of(IMAGE), normalized.images());
    }

    private static ResponseNormalizer normalizer() {
        return new ResponseNormalizer(new ImageDeduplicator(new SizeRatioDuplicatePolicy(0.001)));
    }
}
