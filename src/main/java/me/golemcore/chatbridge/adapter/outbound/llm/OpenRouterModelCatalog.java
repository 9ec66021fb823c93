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

package me.golemcore.chatbridge.adapter.outbound.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.infrastructure.http.FeignClientFactory;
import me.golemcore.chatbridge.port.outbound.ModelCatalogPort;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Live OpenRouter model catalog fetched through Feign and cached for
 * {@code bridge.catalog.cache-ttl} milliseconds. A failed refresh keeps the
 * previous listing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenRouterModelCatalog implements ModelCatalogPort {

    private static final String IMAGE_MODALITY = "image";

    private final FeignClientFactory feignClientFactory;
    private final BridgeProperties properties;
    private final Clock clock;

    private OpenRouterModelsApi api;
    private Map<String, ModelInfo> models = Collections.emptyMap();
    private Instant fetchedAt;

    @Override
    public List<String> listModels() {
        return new ArrayList<>(snapshot().keySet());
    }

    @Override
    public List<String> filter(String query, boolean caseSensitive) {
        if (query == null || query.isBlank()) {
            return listModels();
        }
        String needle = caseSensitive ? query : query.toLowerCase(Locale.ROOT);
        return snapshot().keySet().stream()
                .filter(id -> (caseSensitive ? id : id.toLowerCase(Locale.ROOT)).contains(needle))
                .toList();
    }

    @Override
    public boolean contains(String modelId) {
        return modelId != null && snapshot().containsKey(modelId);
    }

    @Override
    public boolean supportsImageOutput(String modelId) {
        ModelInfo info = snapshot().get(modelId);
        if (info == null || info.getArchitecture() == null) {
            return false;
        }
        List<String> outputs = info.getArchitecture().getOutputModalities();
        return outputs != null && outputs.contains(IMAGE_MODALITY);
    }

    private synchronized Map<String, ModelInfo> snapshot() {
        Duration ttl = Duration.ofMillis(properties.getCatalog().getCacheTtl());
        Instant now = clock.instant();
        if (fetchedAt != null && now.isBefore(fetchedAt.plus(ttl))) {
            return models;
        }
        try {
            ModelsResponse response = api().listModels();
            List<ModelInfo> data = response != null && response.getData() != null ? response.getData() : List.of();
            models = data.stream()
                    .filter(model -> model.getId() != null)
                    .collect(Collectors.toMap(ModelInfo::getId, Function.identity(), (a, b) -> a,
                            LinkedHashMap::new));
            fetchedAt = now;
            log.info("[LLM] Loaded {} OpenRouter models", models.size());
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to load OpenRouter models: {}", e.getMessage());
        }
        return models;
    }

    private OpenRouterModelsApi api() {
        if (api == null) {
            api = feignClientFactory.create(OpenRouterModelsApi.class, properties.getCatalog().getBaseUrl());
        }
        return api;
    }

    public interface OpenRouterModelsApi {
        @RequestLine("GET /models")
        ModelsResponse listModels();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsResponse {
        private List<ModelInfo> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelInfo {
        private String id;
        private String name;
        private Architecture architecture;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Architecture {
        @JsonProperty("input_modalities")
        private List<String> inputModalities;
        @JsonProperty("output_modalities")
        private List<String> outputModalities;
    }
}
