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

import java.util.List;

/**
 * Outcome of one exchange as handed back to the caller. Failed exchanges carry
 * the user-facing error text in {@code text} and no images.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeResult {

    @Builder.Default
    String text = "";

    @Singular
    List<ImagePayload> images;

    long tokens;

    ExchangeFailureKind failure;

    ProviderError providerError;

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean hasImages() {
        return !images.isEmpty();
    }
}
