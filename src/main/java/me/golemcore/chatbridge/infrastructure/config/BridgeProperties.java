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

package me.golemcore.chatbridge.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the chat bridge, bound from
 * application.properties under the {@code bridge.*} prefix.
 *
 * <p>
 * Nested property classes group the subsystems:
 * <ul>
 * <li>{@link SessionProperties} - default model, round limit, system prompt</li>
 * <li>{@link ProvidersProperties} - API keys and endpoints per backend</li>
 * <li>{@link HttpProperties} - OkHttp timeouts and retry policy</li>
 * <li>{@link PluginsProperties} - extension classes, hook timeout, health</li>
 * <li>{@link TelegramProperties} - long-polling channel</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    private SessionProperties session = new SessionProperties();
    private ProvidersProperties providers = new ProvidersProperties();
    private HttpProperties http = new HttpProperties();
    private ImagesProperties images = new ImagesProperties();
    private PluginsProperties plugins = new PluginsProperties();
    private CatalogProperties catalog = new CatalogProperties();
    private TelegramProperties telegram = new TelegramProperties();
    private boolean kioskMode = false;

    @Data
    public static class SessionProperties {
        private String defaultModel = "openai:gpt-4o-mini";
        private int maxRounds = 4;
        private int maxTokens = 3000;
        private String systemPrompt;
    }

    @Data
    public static class ProvidersProperties {
        private ProviderProperties openai = new ProviderProperties("https://api.openai.com/v1/chat/completions");
        private ProviderProperties anthropic = new ProviderProperties("https://api.anthropic.com/v1/messages");
        private ProviderProperties groq = new ProviderProperties("https://api.groq.com/openai/v1/chat/completions");
        private ProviderProperties openrouter = new ProviderProperties(
                "https://openrouter.ai/api/v1/chat/completions");
        private String anthropicVersion = "2023-06-01";
        private String openrouterReferer = "https://github.com/golemcore/chatbridge";
        private String openrouterTitle = "Chat Bridge";
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String url;

        public ProviderProperties() {
        }

        public ProviderProperties(String url) {
            this.url = url;
        }
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private long requestTimeout = 120000;
        private int retryMaxAttempts = 3;
        private long retryInitialBackoff = 1000;
        private double retryMultiplier = 2.0;
        private long imageFetchTimeout = 30000;
    }

    @Data
    public static class ImagesProperties {
        private double nearDuplicateRatio = 0.001;
    }

    @Data
    public static class PluginsProperties {
        private List<String> classes = new ArrayList<>();
        private long hookTimeout = 5000;
        private int maxFailures = 3;
        private String helperModel = "openai/gpt-4o-mini";
        private int helperMaxTokens = 500;
        private long helperTimeout = 30000;
    }

    @Data
    public static class CatalogProperties {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private long cacheTtl = 3600000;
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
        private int maxMessageLength = 4096;
        private int maxPhotoSize = 2048;
    }
}
