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

import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.plugin.api.ExchangePlugin;
import me.golemcore.chatbridge.plugin.api.ExchangePluginFactory;
import me.golemcore.chatbridge.plugin.api.PluginCommand;
import me.golemcore.chatbridge.plugin.api.PluginContractException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates exchange extensions.
 *
 * <p>
 * Candidates come from {@link ExchangePluginFactory} beans first, then from the
 * class names in {@code bridge.plugins.classes} (either factories or plugins
 * with a public no-arg constructor). A candidate that breaks the contract is
 * rejected whole and never partially registered.
 */
@Component
@Slf4j
public class PluginRegistry {

    private final ObjectProvider<ExchangePluginFactory> factoryProvider;
    private final BridgeProperties properties;

    private boolean initialized;
    private List<RegisteredPlugin> plugins = List.of();

    public PluginRegistry(ObjectProvider<ExchangePluginFactory> factoryProvider, BridgeProperties properties) {
        this.factoryProvider = factoryProvider;
        this.properties = properties;
    }

    public synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        List<RegisteredPlugin> loaded = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();

        factoryProvider.orderedStream().forEach(factory -> tryRegister(
                factory.getClass().getName(), factory::create, loaded, names));
        for (String className : properties.getPlugins().getClasses()) {
            if (className == null || className.isBlank()) {
                continue;
            }
            tryRegister(className.trim(), () -> instantiate(className.trim()), loaded, names);
        }

        this.plugins = Collections.unmodifiableList(loaded);
        this.initialized = true;
        log.info("[Plugins] Loaded {} exchange plugins: {}", plugins.size(), names);
    }

    public List<RegisteredPlugin> getPlugins() {
        ensureInitialized();
        return plugins;
    }

    private void tryRegister(String source, PluginSupplier supplier, List<RegisteredPlugin> loaded,
            Set<String> names) {
        try {
            ExchangePlugin plugin = supplier.get();
            if (plugin == null) {
                throw new PluginContractException("Factory returned no plugin");
            }
            Map<String, PluginCommand> commands = validate(plugin);
            if (!names.add(plugin.getName())) {
                throw new PluginContractException("Duplicate plugin name: " + plugin.getName());
            }
            BridgeProperties.PluginsProperties config = properties.getPlugins();
            loaded.add(new RegisteredPlugin(plugin, commands,
                    new PluginHealthMonitor(plugin.getName(), config.getMaxFailures())));
            log.info("[Plugins] Registered plugin '{}' from {} with {} command(s)",
                    plugin.getName(), source, commands.size());
        } catch (PluginContractException e) {
            log.error("[Plugins] Rejected plugin candidate {}: {}", source, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Plugins] Failed to load plugin candidate {}", source, e);
        }
    }

    /**
     * Checks the candidate and returns a defensive copy of its command table.
     *
     * @throws PluginContractException
     *             on any violation
     */
    static Map<String, PluginCommand> validate(ExchangePlugin plugin) {
        String name = plugin.getName();
        if (name == null || name.isBlank()) {
            throw new PluginContractException("Plugin name is required");
        }
        Map<String, PluginCommand> commands;
        try {
            commands = plugin.getCommands();
        } catch (RuntimeException e) {
            throw new PluginContractException("getCommands() failed: " + e.getMessage(), e);
        }
        if (commands == null) {
            throw new PluginContractException("getCommands() returned null");
        }
        Map<String, PluginCommand> validated = new LinkedHashMap<>();
        for (Map.Entry<String, PluginCommand> entry : commands.entrySet()) {
            String commandName = entry.getKey();
            PluginCommand command = entry.getValue();
            if (commandName == null || commandName.isBlank() || commandName.startsWith("/")
                    || commandName.chars().anyMatch(Character::isWhitespace)) {
                throw new PluginContractException("Invalid command name: '" + commandName + "'");
            }
            if (command == null || command.handler() == null) {
                throw new PluginContractException("Command '" + commandName + "' has no handler");
            }
            if (command.description() == null) {
                throw new PluginContractException("Command '" + commandName + "' has no description");
            }
            validated.put(commandName, command);
        }
        return Collections.unmodifiableMap(validated);
    }

    static ExchangePlugin instantiate(String className) {
        Class<?> type;
        try {
            type = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new PluginContractException("Class not found: " + className, e);
        }
        if (!ExchangePlugin.class.isAssignableFrom(type) && !ExchangePluginFactory.class.isAssignableFrom(type)) {
            throw new PluginContractException("Missing hook methods: " + missingHooks(type));
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new PluginContractException("Class is not concrete: " + className);
        }
        Object instance;
        try {
            instance = type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new PluginContractException("Cannot instantiate " + className + ": " + e.getMessage(), e);
        }
        if (instance instanceof ExchangePluginFactory factory) {
            return factory.create();
        }
        return (ExchangePlugin) instance;
    }

    static List<String> missingHooks(Class<?> type) {
        Set<String> present = new LinkedHashSet<>();
        for (Method method : type.getMethods()) {
            present.add(method.getName());
        }
        List<String> missing = new ArrayList<>();
        for (Method required : ExchangePlugin.class.getMethods()) {
            if (!present.contains(required.getName()) && !missing.contains(required.getName())) {
                missing.add(required.getName());
            }
        }
        Collections.sort(missing);
        return missing;
    }

    @FunctionalInterface
    private interface PluginSupplier {
        ExchangePlugin get();
    }
}
