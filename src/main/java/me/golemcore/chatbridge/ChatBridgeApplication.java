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

package me.golemcore.chatbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the chat bridge.
 *
 * <p>
 * The bridge lets one chat converse with OpenAI, Anthropic, Groq or OpenRouter
 * models through a single canonical conversation model, and runs third-party
 * exchange plugins around every turn.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandRouter
 * Domain Layer       → ChatRunCoordinator, ExchangeOrchestrator, SessionService
 * Plugin Layer       → PluginRegistry, PluginPipeline
 * Infrastructure     → Provider adapters, OkHttp, Feign
 * </pre>
 */
@SpringBootApplication
public class ChatBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatBridgeApplication.class, args);
    }
}
