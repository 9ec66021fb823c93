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

package me.golemcore.chatbridge.port.inbound;

import me.golemcore.chatbridge.domain.model.InboundMessage;
import me.golemcore.chatbridge.port.outbound.DeliveryPort;

import java.util.function.Consumer;

/**
 * Bidirectional chat channel: delivers inbound user messages to a handler and
 * sends replies back.
 */
public interface ChannelPort extends DeliveryPort {

    /**
     * Channel type identifier, e.g. "telegram".
     */
    String getChannelType();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Registers the callback invoked for each inbound message.
     */
    void onMessage(Consumer<InboundMessage> handler);
}
