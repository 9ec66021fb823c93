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
 * Output modalities requested from image-capable models.
 */
public enum Modalities {
    AUTO("auto", List.of()),
    TEXT("text", List.of("text")),
    IMAGE("image", List.of("image")),
    TEXT_IMAGE("text+image", List.of("image", "text"));

    private final String id;
    private final List<String> wireValues;

    Modalities(String id, List<String> wireValues) {
        this.id = id;
        this.wireValues = wireValues;
    }

    public String id() {
        return id;
    }

    /**
     * Value of the {@code modalities} request field. Empty for {@link #AUTO}.
     */
    public List<String> wireValues() {
        return wireValues;
    }

    public static Modalities fromId(String value) {
        if (value != null) {
            for (Modalities modalities : values()) {
                if (modalities.id.equalsIgnoreCase(value.trim())) {
                    return modalities;
                }
            }
        }
        throw new IllegalArgumentException("Unknown modalities: " + value);
    }
}
