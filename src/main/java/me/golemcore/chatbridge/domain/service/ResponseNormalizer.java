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

import me.golemcore.chatbridge.domain.model.ImageCandidate;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.ImageProcessingException;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a parsed provider response into the canonical (text, images) reply.
 *
 * <p>
 * Providers that return generated images both in a per-message side array and
 * inline in the content are resolved by precedence: the side array wins when
 * any of its entries is usable, and the content images are only consulted
 * otherwise. Decoded images then go through the {@link ImageDeduplicator}.
 * Remote URLs are not downloaded; they become {@code [Image URL: ...]} markers
 * in the text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseNormalizer {

    private static final String IMAGE_URL_MARKER = "[Image URL: %s]";

    private final ImageDeduplicator imageDeduplicator;

    public NormalizedReply normalize(ProviderResponse response) {
        List<ImageCandidate> candidates = hasUsableEntry(response.getSideImages())
                ? response.getSideImages()
                : response.getContentImages();

        StringBuilder text = new StringBuilder(response.getText() != null ? response.getText() : "");
        List<ImagePayload> decoded = new ArrayList<>();
        for (ImageCandidate candidate : candidates) {
            if (!candidate.isWellFormed()) {
                continue;
            }
            if (candidate.isDataUrl()) {
                try {
                    decoded.add(ImagePayload.fromDataUrl(candidate.url()));
                } catch (ImageProcessingException e) {
                    log.warn("[Exchange] Skipping image: {}", e.getMessage());
                }
            } else {
                appendBlock(text, String.format(IMAGE_URL_MARKER, candidate.url()));
            }
        }

        for (String notice : response.getNotices()) {
            appendBlock(text, notice);
        }

        List<ImagePayload> images = imageDeduplicator.deduplicate(decoded);
        if (images.size() < decoded.size()) {
            log.debug("[Exchange] Deduplicated {} images down to {}", decoded.size(), images.size());
        }
        return new NormalizedReply(text.toString(), images);
    }

    private boolean hasUsableEntry(List<ImageCandidate> sideImages) {
        for (ImageCandidate candidate : sideImages) {
            if (!candidate.isWellFormed()) {
                continue;
            }
            if (!candidate.isDataUrl()) {
                return true;
            }
            try {
                ImagePayload.fromDataUrl(candidate.url());
                return true;
            } catch (ImageProcessingException e) {
                log.debug("[Exchange] Side-array image unusable: {}", e.getMessage());
            }
        }
        return false;
    }

    private static void appendBlock(StringBuilder text, String block) {
        if (text.length() > 0) {
            text.append("\n\n");
        }
        text.append(block);
    }

    /**
     * Canonical reply. Text may be empty when only images came back.
     */
    public record NormalizedReply(String text, List<ImagePayload> images) {

        public NormalizedReply {
            text = text != null ? text : "";
            images = images != null ? List.copyOf(images) : List.of();
        }
    }
}
