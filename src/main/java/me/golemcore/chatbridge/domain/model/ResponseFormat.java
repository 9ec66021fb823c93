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

import java.util.Locale;

/**
 * Per-session preference for which parts of a reply reach the user.
 */
public enum ResponseFormat {
    AUTO, TEXT, IMAGE, BOTH;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup. Unknown or empty values resolve to {@link #AUTO}.
     */
    public static ResponseFormat fromId(String value) {
        if (value == null) {
            return AUTO;
        }
        for (ResponseFormat format : values()) {
            if (format.id().equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        return AUTO;
    }

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        for (ResponseFormat format : values()) {
            if (format.id().equalsIgnoreCase(value.trim())) {
                return true;
            }
        }
        return false;
    }
}
