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

package me.golemcore.chatbridge.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound delivery of replies to a chat.
 */
public interface DeliveryPort {

    CompletableFuture<Void> sendMessage(String chatId, String text);

    CompletableFuture<Void> sendPhoto(String chatId, byte[] imageData, String mimeType, String caption);

    /**
     * Sends a file. Default implementation is a no-op; channels override it.
     */
    default CompletableFuture<Void> sendDocument(String chatId, byte[] fileData, String filename, String caption) {
        return CompletableFuture.completedFuture(null);
    }
}
