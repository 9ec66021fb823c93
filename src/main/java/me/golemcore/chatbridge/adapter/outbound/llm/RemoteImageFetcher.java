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

import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves images referenced by remote URL into inline payloads for backends
 * that only accept base64 image sources.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemoteImageFetcher {

    private final ProviderHttpClient httpClient;
    private final BridgeProperties properties;

    /**
     * Downloads the image. Returns empty when the download fails or the
     * response is not an image.
     */
    public Optional<ImagePayload> fetch(String url) {
        if (url.startsWith("data:")) {
            return decodeDataUrl(url);
        }
        Duration timeout = Duration.ofMillis(properties.getHttp().getImageFetchTimeout());
        try {
            ProviderHttpClient.Download download = httpClient.download(url, timeout);
            if (download.bytes().length == 0) {
                log.warn("[LLM] Remote image {} is empty", url);
                return Optional.empty();
            }
            String mimeType = resolveMimeType(download.contentType(), url);
            if (mimeType == null) {
                log.warn("[LLM] Remote image {} has non-image content type {}", url, download.contentType());
                return Optional.empty();
            }
            log.debug("[LLM] Fetched remote image {} ({} bytes, {})", url, download.bytes().length, mimeType);
            return Optional.of(new ImagePayload(download.bytes(), mimeType));
        } catch (ProviderCallException e) {
            log.warn("[LLM] Failed to fetch remote image {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ImagePayload> decodeDataUrl(String url) {
        try {
            return Optional.of(ImagePayload.fromDataUrl(url));
        } catch (RuntimeException e) {
            log.warn("[LLM] Skipping malformed image data URL: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String resolveMimeType(String contentType, String url) {
        if (contentType != null) {
            String normalized = contentType.toLowerCase(Locale.ROOT);
            if (normalized.startsWith("image/")) {
                return normalized;
            }
            if (!"application/octet-stream".equals(normalized)) {
                return null;
            }
        }
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.endsWith(".png")) {
            return "image/png";
        }
        if (path.endsWith(".gif")) {
            return "image/gif";
        }
        if (path.endsWith(".webp")) {
            return "image/webp";
        }
        return ImagePayload.DEFAULT_MIME_TYPE;
    }
}
