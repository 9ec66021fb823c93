package me.golemcore.chatbridge.domain.service;

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Modalities;
import me.golemcore.chatbridge.domain.model.ModelSelector;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ResponseFormat;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private static final String CHAT_ID = "chat-1";
    private static final String SYSTEM_PROMPT = "You are helpful.";

    private BridgeProperties properties;
    private SessionService service;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        properties.getSession().setSystemPrompt(SYSTEM_PROMPT);
        properties.getSession().setMaxRounds(4);
        service = new SessionService(properties, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldCreateSessionWithDefaults() {
        ChatSession session = service.getOrCreate(CHAT_ID);

        assertEquals(CHAT_ID, session.getChatId());
        assertEquals(1, session.getConversation().size());
        assertTrue(session.getConversation().get(0).isSystemMessage());
        assertEquals(4, session.getMaxRounds());
        assertEquals(Provider.OPENAI, session.getModel().provider());
        assertEquals(ResponseFormat.AUTO, session.getResponseFormat());
        assertEquals(Modalities.AUTO, session.getModalities());
        assertNull(session.getAspectRatio());
        assertNull(session.getImageSize());
        assertEquals(0, session.getTokensUsed());
        assertSame(session, service.getOrCreate(CHAT_ID));
    }

    @Test
    void shouldNotifyListenersOnceWhenSessionIsCreated() {
        List<String> created = new ArrayList<>();
        service.onSessionCreated(session -> {
            throw new IllegalStateException("listener failure");
        });
        service.onSessionCreated(session -> created.add(session.getChatId()));

        ChatSession first = service.getOrCreate(CHAT_ID);
        service.getOrCreate(CHAT_ID);
        service.clear(CHAT_ID);
        service.setMaxRounds("other", 2);

        assertEquals(List.of(CHAT_ID, "other"), created);
        assertSame(first, service.getOrCreate(CHAT_ID));
    }

    @Test
    void shouldStartEmptyWhenSystemPromptIsBlank() {
        properties.getSession().setSystemPrompt("  ");

        ChatSession session = service.getOrCreate("other");

        assertTrue(session.getConversation().isEmpty());
        assertNull(session.getSystemPrompt());
    }

    @Test
    void shouldKeepSystemMessageAndLatestRoundWhenTrimming() {
        service.setMaxRounds(CHAT_ID, 1);
        ChatSession session = service.getOrCreate(CHAT_ID);
        session.addMessage(Message.user("u1"));
        session.addMessage(Message.assistant("a1"));
        session.addMessage(Message.user("u2"));
        session.addMessage(Message.assistant("a2"));
        session.addMessage(Message.user("u3"));

        service.trim(CHAT_ID);
        session.addMessage(Message.assistant("a3"));
        service.trim(CHAT_ID);

        List<Message> conversation = session.getConversation();
        assertEquals(3, conversation.size());
        assertTrue(conversation.get(0).isSystemMessage());
        assertEquals("u3", conversation.get(1).getText());
        assertEquals("a3", conversation.get(2).getText());
    }

    @Test
    void shouldReturnRemovedCount() {
        service.setMaxRounds(CHAT_ID, 1);
        ChatSession session = service.getOrCreate(CHAT_ID);
        session.addMessage(Message.user("u1"));
        session.addMessage(Message.assistant("a1"));
        session.addMessage(Message.user("u2"));
        session.addMessage(Message.assistant("a2"));

        assertEquals(2, service.trim(CHAT_ID));
        assertEquals(0, service.trim(CHAT_ID));
    }

    @Test
    void shouldNotDropAssistantWhenNothingWasCut() {
        ChatSession session = service.getOrCreate(CHAT_ID);
        session.addMessage(Message.assistant("greeting"));

        assertEquals(0, service.trim(CHAT_ID));
        assertEquals(2, session.getConversation().size());
    }

    @Test
    void shouldResetConversationOnClear() {
        ChatSession session = service.getOrCreate(CHAT_ID);
        session.addMessage(Message.user("hello"));
        session.addMessage(Message.assistant("hi"));

        service.clear(CHAT_ID);

        assertEquals(1, session.getConversation().size());
        assertEquals(SYSTEM_PROMPT, session.getConversation().get(0).getText());
    }

    @Test
    void shouldFallBackToDefaultRoundsForInvalidValue() {
        service.setMaxRounds(CHAT_ID, 7);
        assertEquals(7, service.getOrCreate(CHAT_ID).getMaxRounds());

        service.setMaxRounds(CHAT_ID, 0);
        assertEquals(4, service.getOrCreate(CHAT_ID).getMaxRounds());
    }

    @Test
    void shouldUpdateModelAndFormat() {
        service.setModel(CHAT_ID, ModelSelector.parse("groq:llama3-70b-8192"));
        service.setResponseFormat(CHAT_ID, ResponseFormat.IMAGE);

        ChatSession session = service.getOrCreate(CHAT_ID);
        assertEquals(Provider.GROQ, session.getModel().provider());
        assertEquals(ResponseFormat.IMAGE, session.getResponseFormat());

        service.setResponseFormat(CHAT_ID, null);
        assertEquals(ResponseFormat.AUTO, session.getResponseFormat());
    }

    @Test
    void shouldUpdateImageSettings() {
        service.setImageSettings(CHAT_ID, Modalities.TEXT_IMAGE, "16:9", "4K");

        ChatSession session = service.getOrCreate(CHAT_ID);
        assertEquals(Modalities.TEXT_IMAGE, session.getModalities());
        assertEquals("16:9", session.getAspectRatio());
        assertEquals("4K", session.getImageSize());
    }

    @Test
    void shouldListOnlyActiveSessions() {
        service.getOrCreate("a");
        service.getOrCreate("b");

        service.deactivate("a");

        List<ChatSession> active = service.listActive();
        assertEquals(1, active.size());
        assertEquals("b", active.get(0).getChatId());
        assertTrue(service.find("a").isPresent());
        assertTrue(service.find("missing").isEmpty());
    }
}
