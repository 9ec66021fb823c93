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
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.plugin.api.ExchangePlugin;
import me.golemcore.chatbridge.plugin.api.PluginCommand;
import me.golemcore.chatbridge.plugin.api.PluginContext;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Runs extension hooks and commands with failure isolation.
 *
 * <p>
 * Each invocation runs on a worker thread and is joined with a hard timeout;
 * a worker that does not finish in time is cancelled. Exceptions, time-outs
 * and results of the wrong shape leave the input unchanged and count against
 * the extension's {@link PluginHealthMonitor}. Extensions chain in
 * registration order, each receiving the previous one's output.
 *
 * <p>
 * Every invocation works on its own copy of the plugin metadata, committed
 * to the session on the calling thread after the invocation succeeds.
 */
@Component
@Slf4j
public class PluginPipeline {

    private static final String COMMAND_PREFIX = "command_";

    private final PluginRegistry registry;
    private final PluginContextFactory contextFactory;
    private final BridgeProperties properties;
    private final ExecutorService hookExecutor;

    public PluginPipeline(PluginRegistry registry, PluginContextFactory contextFactory,
            BridgeProperties properties) {
        this.registry = registry;
        this.contextFactory = contextFactory;
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.hookExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "plugin-hook-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        hookExecutor.shutdownNow();
    }

    public String applyText(ExchangeHook hook, String text, ChatSession session) {
        String value = text;
        for (RegisteredPlugin extension : registry.getPlugins()) {
            ExchangePlugin plugin = extension.plugin();
            PluginContext context = contextFactory.create(session);
            String input = value;
            HookResult<String> result = invoke(extension, hook.hookName(), input,
                    () -> callTextHook(plugin, hook, input, context), Objects::nonNull);
            commitMetadata(result, session, context);
            value = result.value();
        }
        return value;
    }

    public List<ImagePayload> applyImages(ExchangeHook hook, List<ImagePayload> images, String text,
            ChatSession session) {
        List<ImagePayload> value = images;
        for (RegisteredPlugin extension : registry.getPlugins()) {
            ExchangePlugin plugin = extension.plugin();
            PluginContext context = contextFactory.create(session);
            List<ImagePayload> input = value;
            HookResult<List<ImagePayload>> result = invoke(extension, hook.hookName(), input,
                    () -> callImageHook(plugin, hook, new ArrayList<>(input), text, context),
                    PluginPipeline::isImageList);
            commitMetadata(result, session, context);
            value = result.value();
        }
        return value;
    }

    public void fire(ExchangeHook hook, ChatSession session) {
        for (RegisteredPlugin extension : registry.getPlugins()) {
            ExchangePlugin plugin = extension.plugin();
            PluginContext context = contextFactory.create(session);
            HookResult<Boolean> result = invoke(extension, hook.hookName(), Boolean.TRUE, () -> {
                if (hook == ExchangeHook.ON_SESSION_START) {
                    plugin.onSessionStart(context);
                } else if (hook == ExchangeHook.ON_MESSAGE_COMPLETE) {
                    plugin.onMessageComplete(context);
                } else {
                    throw new IllegalArgumentException("Not a lifecycle hook: " + hook);
                }
                return Boolean.TRUE;
            }, value -> true);
            commitMetadata(result, session, context);
        }
    }

    /**
     * Runs the first healthy extension's command with that name.
     */
    public CommandOutcome executeCommand(String commandName, ChatSession session, boolean kioskMode) {
        String name = commandName.startsWith("/") ? commandName.substring(1) : commandName;
        for (RegisteredPlugin extension : registry.getPlugins()) {
            PluginCommand command = extension.commands().get(name);
            if (command == null || !extension.health().isHealthy()) {
                continue;
            }
            if (kioskMode && !command.availableInKiosk()) {
                log.warn("[Plugins] Command /{} not available in kiosk mode", name);
                return CommandOutcome.NOT_FOUND;
            }
            PluginContext context = contextFactory.create(session);
            HookResult<Boolean> result = invoke(extension, COMMAND_PREFIX + name, Boolean.FALSE, () -> {
                command.handler().handle(session.getChatId(), context);
                return Boolean.TRUE;
            }, Objects::nonNull);
            commitMetadata(result, session, context);
            return result.state() == HookState.SUCCEEDED ? CommandOutcome.HANDLED : CommandOutcome.FAILED;
        }
        return CommandOutcome.NOT_FOUND;
    }

    /**
     * Command names and descriptions offered in the given mode, from healthy
     * extensions only.
     */
    public Map<String, String> listCommands(boolean kioskMode) {
        Map<String, String> result = new LinkedHashMap<>();
        for (RegisteredPlugin extension : registry.getPlugins()) {
            if (!extension.health().isHealthy()) {
                continue;
            }
            for (Map.Entry<String, PluginCommand> entry : extension.commands().entrySet()) {
                if (!kioskMode || entry.getValue().availableInKiosk()) {
                    result.putIfAbsent(entry.getKey(), entry.getValue().description());
                }
            }
        }
        return result;
    }

    <T> HookResult<T> invoke(RegisteredPlugin extension, String hookName, T input, Callable<T> call,
            Predicate<T> validShape) {
        PluginHealthMonitor health = extension.health();
        if (!health.isHealthy()) {
            return new HookResult<>(HookState.IDLE, input);
        }

        long timeoutMs = properties.getPlugins().getHookTimeout();
        Future<T> future = hookExecutor.submit(call);
        HookState state = HookState.RUNNING;
        T output = input;
        try {
            T result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (validShape.test(result)) {
                state = HookState.SUCCEEDED;
                output = result;
            } else {
                state = HookState.FAILED;
                log.warn("[Plugins] Hook {} of '{}' returned an invalid value", hookName, extension.name());
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            state = HookState.TIMED_OUT;
            log.warn("[Plugins] Hook {} of '{}' timed out after {}ms", hookName, extension.name(), timeoutMs);
        } catch (ExecutionException e) {
            state = HookState.FAILED;
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Plugins] Hook {} of '{}' failed: {}", hookName, extension.name(), safeMessage(cause),
                    cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new HookResult<>(HookState.IDLE, input);
        }

        if (state == HookState.SUCCEEDED) {
            health.recordSuccess(hookName);
        } else {
            health.recordFailure(hookName);
        }
        return new HookResult<>(state, output);
    }

    /**
     * Copies the metadata an invocation wrote back into the session. Only a
     * finished, successful worker is committed; a cancelled one keeps writing
     * into a map nobody reads again.
     */
    private static void commitMetadata(HookResult<?> result, ChatSession session, PluginContext context) {
        if (result.state() != HookState.SUCCEEDED) {
            return;
        }
        synchronized (session) {
            session.replacePluginMetadata(context.metadata());
        }
    }

    private static String callTextHook(ExchangePlugin plugin, ExchangeHook hook, String text,
            PluginContext context) {
        return switch (hook) {
        case PRE_USER_TEXT -> plugin.preUserText(text, context);
        case POST_USER_TEXT -> plugin.postUserText(text, context);
        case PRE_ASSISTANT_TEXT -> plugin.preAssistantText(text, context);
        case POST_ASSISTANT_TEXT -> plugin.postAssistantText(text, context);
        default -> throw new IllegalArgumentException("Not a text hook: " + hook);
        };
    }

    private static List<ImagePayload> callImageHook(ExchangePlugin plugin, ExchangeHook hook,
            List<ImagePayload> images, String text, PluginContext context) {
        return switch (hook) {
        case PRE_USER_IMAGES -> plugin.preUserImages(images, text, context);
        case POST_USER_IMAGES -> plugin.postUserImages(images, text, context);
        case PRE_ASSISTANT_IMAGES -> plugin.preAssistantImages(images, text, context);
        case POST_ASSISTANT_IMAGES -> plugin.postAssistantImages(images, text, context);
        default -> throw new IllegalArgumentException("Not an image hook: " + hook);
        };
    }

    private static boolean isImageList(List<ImagePayload> images) {
        if (images == null) {
            return false;
        }
        for (Object image : images) {
            if (!(image instanceof ImagePayload)) {
                return false;
            }
        }
        return true;
    }

    private static String safeMessage(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getSimpleName();
    }

    /**
     * Final state of one invocation and the value the pipeline continues with.
     */
    record HookResult<T>(HookState state, T value) {
    }

    /**
     * Result of a plugin command lookup and execution.
     */
    public enum CommandOutcome {
        HANDLED, NOT_FOUND, FAILED
    }
}
