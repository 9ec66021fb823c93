package me.golemcore.chatbridge.adapter.inbound.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chatbridge.adapter.outbound.llm.ProviderHttpClient;
import me.golemcore.chatbridge.domain.model.InboundMessage;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.testsupport.http.StubHttpEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelegramAdapterTest {

    private static final long USER_ID = 123L;
    private static final long CHAT_ID = 100L;

    private BridgeProperties properties;
    private StubHttpEngine engine;
    private TelegramClient telegramClient;
    private TelegramAdapter adapter;
    private Consumer<InboundMessage> messageHandler;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new BridgeProperties();
        properties.getTelegram().setEnabled(true);
        properties.getTelegram().setToken("test-token");
        engine = new StubHttpEngine();
        telegramClient = mock(TelegramClient.class);
        adapter = new TelegramAdapter(properties, mock(TelegramBotsLongPollingApplication.class),
                new ProviderHttpClient(engine.client(), new ObjectMapper(), properties));
        adapter.setTelegramClient(telegramClient);
        messageHandler = mock(Consumer.class);
        adapter.onMessage(messageHandler);
    }

    @Test
    void shouldForwardTextMessage() {
        adapter.consume(createUpdate(textMessage("Hello bot")));

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(messageHandler).accept(captor.capture());
        assertEquals("100", captor.getValue().chatId());
        assertEquals("Hello bot", captor.getValue().text());
        assertTrue(captor.getValue().images().isEmpty());
    }

    @Test
    void shouldRejectUserOutsideAllowList() throws Exception {
        properties.getTelegram().setAllowFrom(List.of("999", "trusted_user"));
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));

        adapter.consume(createUpdate(textMessage("Hello")));

        verify(messageHandler, never()).accept(any());
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, timeout(2000)).execute(captor.capture());
        assertEquals("You are not authorized to use this bot.", captor.getValue().getText());
    }

    @Test
    void shouldAuthorizeByIdOrUserName() {
        properties.getTelegram().setAllowFrom(List.of("42", "alice"));

        assertTrue(adapter.isAuthorized("42", null));
        assertTrue(adapter.isAuthorized("7", "alice"));
        assertFalse(adapter.isAuthorized("7", "bob"));

        properties.getTelegram().setAllowFrom(List.of());
        assertTrue(adapter.isAuthorized("7", "bob"));
    }

    @Test
    void shouldDownloadLargestFittingPhotoAndMergeCaption() throws Exception {
        PhotoSize small = photo("small", 320, 240);
        PhotoSize medium = photo("medium", 1280, 960);
        PhotoSize huge = photo("huge", 4000, 3000);
        Message message = baseMessage();
        when(message.hasText()).thenReturn(false);
        when(message.getCaption()).thenReturn("What is this?");
        when(message.hasPhoto()).thenReturn(true);
        when(message.getPhoto()).thenReturn(List.of(small, medium, huge));
        File file = mock(File.class);
        when(file.getFilePath()).thenReturn("photos/file_1.jpg");
        when(telegramClient.execute(any(GetFile.class))).thenReturn(file);
        engine.enqueueBytes(200, new byte[] { 7, 7, 7 }, "image/jpeg");

        adapter.consume(createUpdate(message));

        ArgumentCaptor<GetFile> getFile = ArgumentCaptor.forClass(GetFile.class);
        verify(telegramClient).execute(getFile.capture());
        assertEquals("medium", getFile.getValue().getFileId());
        assertEquals("https://api.telegram.org/file/bottest-token/photos/file_1.jpg", engine.lastRequest().url());

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(messageHandler).accept(captor.capture());
        assertEquals("What is this?", captor.getValue().text());
        assertEquals(1, captor.getValue().images().size());
        assertArrayEquals(new byte[] { 7, 7, 7 }, captor.getValue().images().get(0).bytes());
        assertEquals("image/jpeg", captor.getValue().images().get(0).mimeType());
    }

    @Test
    void shouldIgnoreMessageWithoutTextOrUsablePhoto() {
        Message message = baseMessage();
        when(message.hasText()).thenReturn(false);
        when(message.hasPhoto()).thenReturn(true);
        when(message.getPhoto()).thenReturn(List.of(photo("huge", 5000, 5000)));

        adapter.consume(createUpdate(message));

        verify(messageHandler, never()).accept(any());
    }

    @Test
    void shouldMergeCaptionAfterText() {
        assertEquals("text \n\n caption", TelegramAdapter.mergeCaption("text", "caption"));
        assertEquals("caption", TelegramAdapter.mergeCaption("", "caption"));
        assertEquals("text", TelegramAdapter.mergeCaption("text", null));
    }

    @Test
    void shouldSelectNothingWhenNoPhotoFits() {
        Optional<PhotoSize> selected = TelegramAdapter.selectPhoto(List.of(photo("a", 3000, 100)), 2048);

        assertTrue(selected.isEmpty());
    }

    @Test
    void shouldSplitLongRepliesIntoSeveralMessages() throws Exception {
        properties.getTelegram().setMaxMessageLength(80);
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));
        String text = "A".repeat(50) + "\n\n" + "B".repeat(50);

        adapter.sendMessage("100", text).get();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, times(2)).execute(captor.capture());
        assertEquals("A".repeat(50), captor.getAllValues().get(0).getText());
        assertEquals("B".repeat(50), captor.getAllValues().get(1).getText());
        assertEquals("100", captor.getAllValues().get(0).getChatId());
    }

    @Test
    void shouldSplitAtLineBreakThenHardSplit() {
        assertEquals(List.of("A".repeat(50), "B".repeat(50)),
                TelegramAdapter.splitAtNewlines("A".repeat(50) + "\n" + "B".repeat(50), 80));
        assertEquals(List.of("A".repeat(80), "A".repeat(80), "A".repeat(40)),
                TelegramAdapter.splitAtNewlines("A".repeat(200), 80));
        assertEquals(List.of("short"), TelegramAdapter.splitAtNewlines("short", 80));
    }

    @Test
    void shouldNotStartWhenDisabled() {
        properties.getTelegram().setEnabled(false);
        TelegramBotsLongPollingApplication application = mock(TelegramBotsLongPollingApplication.class);
        TelegramAdapter disabled = new TelegramAdapter(properties, application,
                new ProviderHttpClient(engine.client(), new ObjectMapper(), properties));

        disabled.start();

        assertFalse(disabled.isRunning());
        verifyNoInteractions(application);
    }

    private Message textMessage(String text) {
        Message message = baseMessage();
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        return message;
    }

    private Message baseMessage() {
        User user = mock(User.class);
        when(user.getId()).thenReturn(USER_ID);
        when(user.getUserName()).thenReturn("tester");
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(CHAT_ID);
        when(message.getFrom()).thenReturn(user);
        return message;
    }

    private static PhotoSize photo(String fileId, int width, int height) {
        PhotoSize photo = mock(PhotoSize.class);
        when(photo.getFileId()).thenReturn(fileId);
        when(photo.getWidth()).thenReturn(width);
        when(photo.getHeight()).thenReturn(height);
        return photo;
    }

    private static Update createUpdate(Message message) {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }
}
