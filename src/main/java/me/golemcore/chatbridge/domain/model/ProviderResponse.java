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
 * Parsed backend response before normalization. Images found in the
 * per-message side array and images embedded in the content are kept apart.
 */
@Value
@Builder(toBuilder = true)
public class ProviderResponse {

    @Builder.Default
    String text = "";

    @Singular
    List<ImageCandidate> sideImages;

    @Singular
    List<ImageCandidate> contentImages;

    long usageTokens;

    ProviderError error;

    @Singular
    List<String> notices;

    public boolean hasError() {
        return error != null;
    }

    public static ProviderResponse failed(ProviderError error) {
        return ProviderResponse.builder().error(error).build();
    }
}
