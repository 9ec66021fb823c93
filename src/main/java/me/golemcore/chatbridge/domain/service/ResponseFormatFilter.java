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

import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.ResponseFormat;
import me.golemcore.chatbridge.domain.service.ResponseNormalizer.NormalizedReply;

import java.util.List;

/**
 * Applies a session's response format preference to a reply before delivery.
 * The conversation history always keeps the unfiltered reply.
 */
public final class ResponseFormatFilter {

    static final String IMAGE_GENERATED = "[Image generated]";
    static final String IMAGE_REQUESTED_NONE_GENERATED = "[Note: Image format requested, but no image was generated]";
    static final String NO_IMAGE_IN_RESPONSE = "[Note: no image was generated for this response]";

    private ResponseFormatFilter() {
    }

    public static NormalizedReply apply(ResponseFormat format, String text, List<ImagePayload> images) {
        String safeText = text != null ? text : "";
        List<ImagePayload> safeImages = images != null ? images : List.of();
        ResponseFormat effective = format != null ? format : ResponseFormat.AUTO;

        return switch (effective) {
        case TEXT -> new NormalizedReply(safeText, List.of());
        case IMAGE -> safeImages.isEmpty()
                ? new NormalizedReply(join(IMAGE_REQUESTED_NONE_GENERATED, safeText), List.of())
                : new NormalizedReply("", safeImages);
        case BOTH -> filterBoth(safeText, safeImages);
        case AUTO -> new NormalizedReply(safeText, safeImages);
        };
    }

    private static NormalizedReply filterBoth(String text, List<ImagePayload> images) {
        if (text.isBlank() && !images.isEmpty()) {
            return new NormalizedReply(IMAGE_GENERATED, images);
        }
        if (images.isEmpty()) {
            return new NormalizedReply(join(text, NO_IMAGE_IN_RESPONSE), List.of());
        }
        return new NormalizedReply(text, images);
    }

    private static String join(String first, String second) {
        if (first.isBlank()) {
            return second;
        }
        if (second.isBlank()) {
            return first;
        }
        return first + "\n\n" + second;
    }
}
