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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A single message of the canonical, provider-neutral conversation.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    Role role;

    @Singular("part")
    List<ContentPart> content;

    Instant timestamp;

    public static Message system(String text) {
        return Message.builder().role(Role.SYSTEM).part(ContentPart.text(text)).build();
    }

    public static Message user(String text) {
        return Message.builder().role(Role.USER).part(ContentPart.text(text)).build();
    }

    public static Message assistant(String text) {
        return Message.builder().role(Role.ASSISTANT).part(ContentPart.text(text)).build();
    }

    public boolean isSystemMessage() {
        return role == Role.SYSTEM;
    }

    public boolean isUserMessage() {
        return role == Role.USER;
    }

    public boolean isAssistantMessage() {
        return role == Role.ASSISTANT;
    }

    /**
     * Text parts joined with newlines.
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Text text) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(text.value());
            }
        }
        return sb.toString();
    }

    /**
     * First text part, or an empty string.
     */
    public String getFirstText() {
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Text text) {
                return text.value();
            }
        }
        return "";
    }

    public List<ImagePayload> getImages() {
        List<ImagePayload> images = new ArrayList<>();
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Image image) {
                images.add(image.payload());
            }
        }
        return images;
    }

    public boolean hasImages() {
        return content.stream()
                .anyMatch(part -> part instanceof ContentPart.Image || part instanceof ContentPart.RemoteImage);
    }
}
