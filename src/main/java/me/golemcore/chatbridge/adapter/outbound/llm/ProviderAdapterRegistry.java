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

import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.port.outbound.ProviderPort;
import me.golemcore.chatbridge.port.outbound.ProviderRegistryPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes the provider adapter beans by backend.
 *
 * @see ChatCompletionsAdapter
 * @see AnthropicAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderAdapterRegistry implements ProviderRegistryPort {

    private final List<ProviderPort> adapters;

    private final Map<Provider, ProviderPort> adaptersByProvider = new EnumMap<>(Provider.class);

    @PostConstruct
    public void init() {
        for (ProviderPort adapter : adapters) {
            ProviderPort previous = adaptersByProvider.put(adapter.getProvider(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for provider " + adapter.getProvider());
            }
            log.info("[LLM] Registered adapter: {} (available: {})", adapter.getProvider().id(),
                    adapter.isAvailable());
        }
    }

    @Override
    public ProviderPort get(Provider provider) {
        ProviderPort adapter = adaptersByProvider.get(provider);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for provider " + provider);
        }
        return adapter;
    }

    @Override
    public List<Provider> getAvailableProviders() {
        return adaptersByProvider.values().stream()
                .filter(ProviderPort::isAvailable)
                .map(ProviderPort::getProvider)
                .toList();
    }
}
