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

package me.golemcore.chatbridge.domain.model;

import java.util.List;

/**
 * User input received from a channel. Images arrive as decoded payloads,
 * image URLs as remote references.
 */
public record InboundMessage(String chatId, String text, List<ImagePayload> images, List<String> imageUrls) {

    public InboundMessage {
        text = text != null ? text : "";
        images = images != null ? List.copyOf(images) : List.of();
        imageUrls = imageUrls != null ? List.copyOf(imageUrls) : List.of();
    }

    public static InboundMessage text(String chatId, String text) {
        return new InboundMessage(chatId, text, List.of(), List.of());
    }

    public boolean isCommand() {
        return text.startsWith("/");
    }
}
