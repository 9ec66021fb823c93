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

import java.util.List;

/**
 * Live catalog of OpenRouter model ids.
 */
public interface ModelCatalogPort {

    List<String> listModels();

    List<String> filter(String query, boolean caseSensitive);

    boolean contains(String modelId);

    /**
     * Whether the model lists {@code image} among its output modalities.
     */
    boolean supportsImageOutput(String modelId);
}
