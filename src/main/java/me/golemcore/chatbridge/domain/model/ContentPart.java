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

import java.util.Objects;

/**
 * One piece of a message body. A part is either text, an inline image with an
 * explicit mime type, or an image known only by its remote URL.
 */
public interface ContentPart {

    static ContentPart text(String value) {
        return new Text(value);
    }

    static ContentPart image(ImagePayload payload) {
        return new Image(payload);
    }

    static ContentPart remoteImage(String url) {
        return new RemoteImage(url);
    }

    /**
     * Text part. The value is stored as given and never re-encoded.
     */
    record Text(String value) implements ContentPart {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Inline image part.
     */
    record Image(ImagePayload payload) implements ContentPart {
        public Image {
            Objects.requireNonNull(payload, "payload");
        }

        public String mimeType() {
            return payload.mimeType();
        }
    }

    /**
     * Image referenced by an http(s) URL. Adapters for backends that do not
     * accept URLs resolve it before submission.
     */
    record RemoteImage(String url) implements ContentPart {
        public RemoteImage {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("Remote image URL is required");
            }
        }
    }
}
