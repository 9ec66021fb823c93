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

package me.golemcore.chatbridge.domain.service;

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.ContentPart;
import me.golemcore.chatbridge.domain.model.ExchangeFailureKind;
import me.golemcore.chatbridge.domain.model.ExchangeResult;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.InboundMessage;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Modalities;
import me.golemcore.chatbridge.domain.model.ModelSelector;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.domain.model.ProviderError;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import me.golemcore.chatbridge.domain.model.Role;
import me.golemcore.chatbridge.domain.service.ResponseNormalizer.NormalizedReply;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.plugin.context.ExchangeHook;
import me.golemcore.chatbridge.plugin.context.PluginPipeline;
import me.golemcore.chatbridge.port.outbound.ModelCatalogPort;
import me.golemcore.chatbridge.port.outbound.ProviderPort;
import me.golemcore.chatbridge.port.outbound.ProviderPort.RequestOptions;
import me.golemcore.chatbridge.port.outbound.ProviderRegistryPort;
import me.golemcore.chatbridge.port.outbound.SessionPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Runs one exchange: a user turn in, an assistant turn out.
 *
 * <p>
 * Order of operations: user text and image hooks, append the user turn and
 * trim, provider call, normalization and deduplication, assistant text and
 * image hooks, append the assistant turn and trim, {@code on_message_complete}.
 * Provider, network and schema failures end the exchange with an error reply
 * and no assistant turn; nothing is thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeOrchestrator {

    static final String UNAVAILABLE_REPLY = "The AI service is temporarily unavailable. Please try again later.";
    static final String SCHEMA_ERROR_REPLY = "API error occurred.";
    static final String PROVIDER_ERROR_PREFIX = "API Error: ";

    private final SessionPort sessionPort;
    private final ProviderRegistryPort providerRegistry;
    private final PluginPipeline pluginPipeline;
    private final ResponseNormalizer responseNormalizer;
    private final ModelCatalogPort modelCatalog;
    private final BridgeProperties properties;
    private final Clock clock;

    @PostConstruct
    public void init() {
        sessionPort.onSessionCreated(this::startSession);
    }

    /**
     * Fires {@code on_session_start} once per session, whichever operation
     * created it.
     */
    void startSession(ChatSession session) {
        synchronized (session) {
            if (session.isSessionStarted()) {
                return;
            }
            session.setSessionStarted(true);
        }
        pluginPipeline.fire(ExchangeHook.ON_SESSION_START, session);
    }

    public ExchangeResult exchange(InboundMessage inbound) {
        ChatSession session = sessionPort.getOrCreate(inbound.chatId());
        synchronized (session) {
            try {
                return runExchange(session, inbound);
            } catch (RuntimeException e) {
                log.error("[Exchange] Unexpected failure for chat {}", inbound.chatId(), e);
                return failure(ExchangeFailureKind.SCHEMA, SCHEMA_ERROR_REPLY, null);
            }
        }
    }

    private ExchangeResult runExchange(ChatSession session, InboundMessage inbound) {
        String chatId = session.getChatId();

        try {
            String userText = pluginPipeline.applyText(ExchangeHook.PRE_USER_TEXT, inbound.text(), session);
            userText = pluginPipeline.applyText(ExchangeHook.POST_USER_TEXT, userText, session);
            List<ImagePayload> userImages = pluginPipeline.applyImages(ExchangeHook.PRE_USER_IMAGES,
                    inbound.images(), userText, session);
            userImages = pluginPipeline.applyImages(ExchangeHook.POST_USER_IMAGES, userImages, userText, session);

            session.addMessage(buildMessage(Role.USER, userText, userImages, inbound.imageUrls()));
            sessionPort.trim(chatId);

            ModelSelector model = session.getModel();
            ProviderResponse response;
            try {
                ProviderPort adapter = providerRegistry.get(model.provider());
                response = adapter.call(List.copyOf(session.getConversation()), model.modelId(),
                        properties.getSession().getMaxTokens(), buildOptions(session));
            } catch (ProviderCallException e) {
                return callFailure(chatId, model, e);
            }
            if (response.hasError()) {
                ProviderError error = response.getError();
                log.warn("[Exchange] {} returned error for chat {}: {}", model, chatId, error.message());
                return failure(ExchangeFailureKind.PROVIDER, PROVIDER_ERROR_PREFIX + error.message(), error);
            }

            NormalizedReply reply = responseNormalizer.normalize(response);
            String replyText = pluginPipeline.applyText(ExchangeHook.PRE_ASSISTANT_TEXT, reply.text(), session);
            replyText = pluginPipeline.applyText(ExchangeHook.POST_ASSISTANT_TEXT, replyText, session);
            List<ImagePayload> replyImages = pluginPipeline.applyImages(ExchangeHook.PRE_ASSISTANT_IMAGES,
                    reply.images(), replyText, session);
            replyImages = pluginPipeline.applyImages(ExchangeHook.POST_ASSISTANT_IMAGES, replyImages, replyText,
                    session);

            session.addMessage(buildMessage(Role.ASSISTANT, replyText, replyImages, List.of()));
            session.addTokens(response.getUsageTokens());
            session.setUpdatedAt(clock.instant());
            sessionPort.trim(chatId);

            log.info("[Exchange] chat={} model={} tokens={} images={}", chatId, model, response.getUsageTokens(),
                    replyImages.size());
            NormalizedReply filtered = ResponseFormatFilter.apply(session.getResponseFormat(), replyText,
                    replyImages);
            return ExchangeResult.builder()
                    .text(filtered.text())
                    .images(filtered.images())
                    .tokens(response.getUsageTokens())
                    .build();
        } finally {
            pluginPipeline.fire(ExchangeHook.ON_MESSAGE_COMPLETE, session);
        }
    }

    private ExchangeResult callFailure(String chatId, ModelSelector model, ProviderCallException e) {
        return switch (e.getKind()) {
        case NETWORK -> {
            log.warn("[Exchange] {} unreachable for chat {}: {}", model, chatId, e.getMessage());
            yield failure(ExchangeFailureKind.NETWORK, UNAVAILABLE_REPLY, null);
        }
        case PROVIDER -> {
            log.warn("[Exchange] {} failed for chat {}: {}", model, chatId, e.getMessage());
            ProviderError error = e.getProviderError() != null
                    ? e.getProviderError()
                    : ProviderError.of(e.getMessage());
            yield failure(ExchangeFailureKind.PROVIDER, PROVIDER_ERROR_PREFIX + error.message(), error);
        }
        case SCHEMA -> {
            log.error("[Exchange] Unexpected response from {} for chat {}: {}", model, chatId, e.getMessage());
            yield failure(ExchangeFailureKind.SCHEMA, SCHEMA_ERROR_REPLY, null);
        }
        };
    }

    private static ExchangeResult failure(ExchangeFailureKind kind, String text, ProviderError error) {
        return ExchangeResult.builder()
                .text(text)
                .tokens(0)
                .failure(kind)
                .providerError(error)
                .build();
    }

    private RequestOptions buildOptions(ChatSession session) {
        ModelSelector model = session.getModel();
        List<String> modalities = session.getModalities().wireValues();
        if (session.getModalities() == Modalities.AUTO && model.provider() == Provider.OPENROUTER
                && modelCatalog.supportsImageOutput(model.modelId())) {
            modalities = Modalities.TEXT_IMAGE.wireValues();
        }
        return new RequestOptions(modalities, session.getAspectRatio(), session.getImageSize(), null);
    }

    private Message buildMessage(Role role, String text, List<ImagePayload> images, List<String> imageUrls) {
        Message.MessageBuilder builder = Message.builder().role(role).timestamp(clock.instant());
        String safeText = text != null ? text : "";
        if (!safeText.isEmpty() || (images.isEmpty() && imageUrls.isEmpty())) {
            builder.part(ContentPart.text(safeText));
        }
        images.forEach(image -> builder.part(ContentPart.image(image)));
        imageUrls.forEach(url -> builder.part(ContentPart.remoteImage(url)));
        return builder.build();
    }
}
