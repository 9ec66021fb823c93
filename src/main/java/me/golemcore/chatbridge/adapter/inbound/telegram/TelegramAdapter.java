/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.chatbridge.adapter.inbound.telegram;

import me.golemcore.chatbridge.adapter.outbound.llm.ProviderHttpClient;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.InboundMessage;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.port.inbound.ChannelPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Long polling for incoming messages via Telegram Bot API
 * <li>User authorization via {@code bridge.telegram.allow-from}
 * <li>Photo download, picking the largest size within the configured bound
 * <li>Caption merged into the message text
 * <li>Message splitting for Telegram's 4096 character limit
 * <li>Photo and document sending
 * </ul>
 *
 * <p>
 * Slash commands are forwarded like any other text; the run coordinator routes
 * them. The adapter is always available as a Spring bean but only starts
 * polling if {@code bridge.telegram.enabled=true} and a token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String FILE_URL_TEMPLATE = "https://api.telegram.org/file/bot%s/%s";
    private static final String CAPTION_SEPARATOR = " \n\n ";
    private static final int TELEGRAM_MAX_CAPTION_LENGTH = 1024;

    private final BridgeProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final ProviderHttpClient httpClient;

    private TelegramClient telegramClient;
    private volatile Consumer<InboundMessage> messageHandler;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled())
            return;

        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void onMessage(Consumer<InboundMessage> handler) {
        this.messageHandler = handler;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleMessage(org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage) {
        String chatId = telegramMessage.getChatId().toString();
        if (telegramMessage.getFrom() != null && !isAuthorized(telegramMessage.getFrom().getId().toString(),
                telegramMessage.getFrom().getUserName())) {
            log.warn("[Telegram] Unauthorized user: {} in chat: {}", telegramMessage.getFrom().getId(), chatId);
            sendMessage(chatId, "You are not authorized to use this bot.");
            return;
        }

        String text = telegramMessage.hasText() ? telegramMessage.getText() : "";
        text = mergeCaption(text, telegramMessage.getCaption());

        List<ImagePayload> images = new ArrayList<>();
        if (telegramMessage.hasPhoto()) {
            selectPhoto(telegramMessage.getPhoto(), properties.getTelegram().getMaxPhotoSize())
                    .flatMap(this::downloadPhoto)
                    .ifPresent(images::add);
        }

        if (text.isEmpty() && images.isEmpty()) {
            log.debug("[Telegram] Ignoring message without text or usable photo in chat {}", chatId);
            return;
        }

        InboundMessage inbound = new InboundMessage(chatId, text, images, List.of());
        Consumer<InboundMessage> handler = this.messageHandler;
        if (handler != null) {
            handler.accept(inbound);
        } else {
            log.warn("[Telegram] No message handler registered, dropping message for chat {}", chatId);
        }
    }

    static String mergeCaption(String text, String caption) {
        if (caption == null || caption.isBlank()) {
            return text;
        }
        if (text == null || text.isEmpty()) {
            return caption;
        }
        return text + CAPTION_SEPARATOR + caption;
    }

    /**
     * Largest photo whose width and height both fit within {@code maxSize}.
     * Telegram lists sizes in ascending order.
     */
    static Optional<PhotoSize> selectPhoto(List<PhotoSize> photos, int maxSize) {
        if (photos == null) {
            return Optional.empty();
        }
        for (int i = photos.size() - 1; i >= 0; i--) {
            PhotoSize photo = photos.get(i);
            if (photo.getWidth() != null && photo.getHeight() != null
                    && photo.getWidth() <= maxSize && photo.getHeight() <= maxSize) {
                return Optional.of(photo);
            }
        }
        return Optional.empty();
    }

    private Optional<ImagePayload> downloadPhoto(PhotoSize photo) {
        try {
            org.telegram.telegrambots.meta.api.objects.File file = telegramClient.execute(
                    new GetFile(photo.getFileId()));
            String url = String.format(FILE_URL_TEMPLATE, properties.getTelegram().getToken(), file.getFilePath());
            ProviderHttpClient.Download download = httpClient.download(url,
                    Duration.ofMillis(properties.getHttp().getImageFetchTimeout()));
            if (download.bytes().length == 0) {
                log.warn("[Telegram] Downloaded photo is empty: fileId={}", photo.getFileId());
                return Optional.empty();
            }
            log.debug("[Telegram] Downloaded photo {}x{} ({} bytes)", photo.getWidth(), photo.getHeight(),
                    download.bytes().length);
            return Optional.of(new ImagePayload(download.bytes(), ImagePayload.DEFAULT_MIME_TYPE));
        } catch (TelegramApiException | ProviderCallException e) {
            log.warn("[Telegram] Failed to download photo {}: {}", photo.getFileId(), e.getMessage());
            return Optional.empty();
        }
    }

    boolean isAuthorized(String userId, String userName) {
        List<String> allowFrom = properties.getTelegram().getAllowFrom();
        if (allowFrom == null || allowFrom.isEmpty()) {
            return true;
        }
        return allowFrom.contains(userId) || (userName != null && allowFrom.contains(userName));
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String text) {
        return CompletableFuture.runAsync(() -> {
            try {
                for (String chunk : splitAtNewlines(text, properties.getTelegram().getMaxMessageLength())) {
                    telegramClient.execute(SendMessage.builder()
                            .chatId(chatId)
                            .text(chunk)
                            .build());
                }
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send message to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            // hard split
            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }

    @Override
    public CompletableFuture<Void> sendPhoto(String chatId, byte[] imageData, String mimeType, String caption) {
        String filename = "image." + extensionOf(mimeType);
        return CompletableFuture.runAsync(() -> {
            try {
                SendPhoto.SendPhotoBuilder<?, ?> builder = SendPhoto.builder()
                        .chatId(chatId)
                        .photo(new InputFile(new ByteArrayInputStream(imageData), filename));

                if (caption != null && !caption.isBlank()) {
                    builder.caption(truncateCaption(caption));
                }

                telegramClient.execute(builder.build());
                log.debug("[Telegram] Sent photo '{}' ({} bytes) to chat: {}", filename, imageData.length, chatId);
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send photo '{}' to chat: {}", filename, chatId, e);
                throw new IllegalStateException("Failed to send photo", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendDocument(String chatId, byte[] fileData, String filename, String caption) {
        return CompletableFuture.runAsync(() -> {
            try {
                SendDocument.SendDocumentBuilder<?, ?> builder = SendDocument.builder()
                        .chatId(chatId)
                        .document(new InputFile(new ByteArrayInputStream(fileData), filename));

                if (caption != null && !caption.isBlank()) {
                    builder.caption(truncateCaption(caption));
                }

                telegramClient.execute(builder.build());
                log.debug("[Telegram] Sent document '{}' ({} bytes) to chat: {}", filename, fileData.length, chatId);
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send document '{}' to chat: {}", filename, chatId, e);
                throw new IllegalStateException("Failed to send document", e);
            }
        });
    }

    private static String extensionOf(String mimeType) {
        if (mimeType == null || !mimeType.contains("/")) {
            return "jpg";
        }
        String subtype = mimeType.substring(mimeType.indexOf('/') + 1);
        return "jpeg".equals(subtype) ? "jpg" : subtype;
    }

    private String truncateCaption(String caption) {
        if (caption.length() <= TELEGRAM_MAX_CAPTION_LENGTH)
            return caption;
        return caption.substring(0, TELEGRAM_MAX_CAPTION_LENGTH - 3) + "...";
    }
}
