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

package me.golemcore.chatbridge.plugin.context;

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.plugin.api.PluginAiHelper;
import me.golemcore.chatbridge.plugin.api.PluginContext;
import me.golemcore.chatbridge.port.outbound.DeliveryPort;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Builds the context handed to hooks and plugin commands.
 */
@Component
@RequiredArgsConstructor
public class PluginContextFactory {

    private final PluginAiHelper aiHelper;
    private final ObjectProvider<DeliveryPort> deliveryProvider;
    private final BridgeProperties properties;

    public PluginContext create(ChatSession session) {
        ChatSession snapshot;
        synchronized (session) {
            snapshot = session.snapshot();
        }
        return new DefaultPluginContext(snapshot, aiHelper, deliveryProvider.getIfUnique(),
                properties.isKioskMode());
    }
}
