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

package me.golemcore.chatbridge.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chatbridge.domain.model.ExchangeFailureKind;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Blocking HTTP transport for provider calls and image downloads.
 *
 * <p>
 * Every call gets a whole-call timeout. Transport failures ({@link IOException})
 * are retried with exponential backoff up to the configured attempt count;
 * HTTP error statuses and unreadable bodies are surfaced immediately. An
 * interrupted thread stops retrying.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderHttpClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final BridgeProperties properties;

    /**
     * Posts the request body and returns the parsed JSON response. Non-2xx
     * responses carrying a JSON error envelope are returned as-is so the adapter
     * can extract it.
     */
    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed
    public JsonNode postJson(ProviderRequest providerRequest) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(providerRequest.getBody());
        } catch (JsonProcessingException e) {
            throw new ProviderCallException(ExchangeFailureKind.SCHEMA, "Failed to serialize request", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(providerRequest.getUrl())
                .post(RequestBody.create(payload, JSON));
        for (Map.Entry<String, String> header : providerRequest.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        Duration timeout = providerRequest.getTimeout() != null
                ? providerRequest.getTimeout()
                : Duration.ofMillis(properties.getHttp().getRequestTimeout());
        String label = "[LLM] " + providerRequest.getProvider();

        return execute(builder.build(), timeout, label, response -> {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            JsonNode json = readJson(raw);
            if (json == null || !json.isObject()) {
                if (!response.isSuccessful()) {
                    throw new ProviderCallException(ExchangeFailureKind.PROVIDER,
                            "HTTP " + response.code() + (response.message().isBlank() ? "" : " " + response.message()));
                }
                log.warn("{} Unreadable response body ({} chars)", label, raw.length());
                throw new ProviderCallException(ExchangeFailureKind.SCHEMA, "Response is not a JSON object");
            }
            if (!response.isSuccessful() && !json.path("error").isObject()) {
                throw new ProviderCallException(ExchangeFailureKind.PROVIDER, "HTTP " + response.code());
            }
            return json;
        });
    }

    /**
     * Downloads a resource, typically an image referenced by URL.
     */
    @SuppressWarnings("PMD.CloseResource")
    public Download download(String url, Duration timeout) {
        Request request = new Request.Builder().url(url).get().build();
        return execute(request, timeout, "[HTTP] GET", response -> {
            if (!response.isSuccessful()) {
                throw new ProviderCallException(ExchangeFailureKind.PROVIDER,
                        "Download failed with HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new ProviderCallException(ExchangeFailureKind.SCHEMA, "Download returned empty body");
            }
            MediaType mediaType = body.contentType();
            String contentType = mediaType != null ? mediaType.type() + "/" + mediaType.subtype() : null;
            return new Download(body.bytes(), contentType);
        });
    }

    private <T> T execute(Request request, Duration timeout, String label, ResponseHandler<T> handler) {
        BridgeProperties.HttpProperties http = properties.getHttp();
        int maxAttempts = Math.max(1, http.getRetryMaxAttempts());
        long backoffMs = http.getRetryInitialBackoff();

        IOException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ProviderCallException(ExchangeFailureKind.NETWORK, "Call cancelled");
            }
            Call call = okHttpClient.newCall(request);
            call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try (Response response = call.execute()) {
                return handler.handle(response);
            } catch (IOException e) {
                lastError = e;
                if (attempt >= maxAttempts) {
                    break;
                }
                log.warn("{} Network error (attempt {}/{}), retrying in {}ms: {}",
                        label, attempt, maxAttempts, backoffMs, e.getMessage());
                try {
                    sleepBeforeRetry(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ProviderCallException(ExchangeFailureKind.NETWORK, "Call cancelled", ie);
                }
                backoffMs = (long) (backoffMs * http.getRetryMultiplier());
            }
        }
        log.error("{} Network error after {} attempts: {}", label, maxAttempts,
                lastError != null ? lastError.getMessage() : "unknown");
        throw new ProviderCallException(ExchangeFailureKind.NETWORK,
                "Network error after " + maxAttempts + " attempts", lastError);
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    private JsonNode readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    @FunctionalInterface
    private interface ResponseHandler<T> {
        T handle(Response response) throws IOException;
    }

    /**
     * Downloaded bytes and the reported content type, which may be null.
     */
    public record Download(byte[] bytes, String contentType) {
    }
}
