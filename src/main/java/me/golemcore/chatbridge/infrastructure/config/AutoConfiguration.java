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

import me.golemcore.chatbridge.domain.service.ChatRunCoordinator;
import me.golemcore.chatbridge.domain.service.ImageDeduplicator;
import me.golemcore.chatbridge.domain.service.SizeRatioDuplicatePolicy;
import me.golemcore.chatbridge.port.inbound.ChannelPort;
import me.golemcore.chatbridge.port.outbound.ProviderRegistryPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring auto-configuration that wires channels to the run coordinator and
 * starts them on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Declares the shared clock, object mapper, image deduplicator and chat run
 * executor</li>
 * <li>Logs startup information (default model, kiosk mode, providers)</li>
 * <li>Routes every inbound channel message into {@link ChatRunCoordinator}</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BridgeProperties properties;
    private final List<ChannelPort> channelPorts;
    private final ChatRunCoordinator chatRunCoordinator;
    private final ProviderRegistryPort providerRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static ImageDeduplicator imageDeduplicator(BridgeProperties properties) {
        return new ImageDeduplicator(new SizeRatioDuplicatePolicy(properties.getImages().getNearDuplicateRatio()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService chatRunExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "chat-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Chat Bridge starting...");
        log.info("Default model: {}", properties.getSession().getDefaultModel());
        log.info("Kiosk mode: {}", properties.isKioskMode());
        log.info("Available providers: {}", providerRegistry.getAvailableProviders());

        for (ChannelPort channel : channelPorts) {
            channel.onMessage(inbound -> chatRunCoordinator.enqueue(inbound, channel));
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("GolemCore Chat Bridge started successfully");
    }
}
