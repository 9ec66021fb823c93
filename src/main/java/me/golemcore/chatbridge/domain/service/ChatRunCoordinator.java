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

package me.golemcore.chatbridge.domain.service;

import me.golemcore.chatbridge.domain.model.ExchangeResult;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.InboundMessage;
import me.golemcore.chatbridge.port.inbound.CommandPort;
import me.golemcore.chatbridge.port.outbound.DeliveryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serializes work per chat. Messages for a chat that arrive while its previous
 * message is still being handled are queued and run one after another; chats
 * run in parallel on the shared executor.
 *
 * <p>
 * {@code /stop} bypasses the queue: it cancels the running exchange and drops
 * everything queued for that chat.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatRunCoordinator {

    private static final int MAX_QUEUED_MESSAGES_PER_CHAT = 100;
    private static final String STOP_COMMAND = "stop";

    private final ExchangeOrchestrator exchangeOrchestrator;
    private final CommandPort commandPort;
    private final ExecutorService chatRunExecutor;

    private final Map<String, ChatRunner> runners = new ConcurrentHashMap<>();

    public void enqueue(InboundMessage inbound, DeliveryPort delivery) {
        Objects.requireNonNull(inbound, "inbound");
        if (isStopCommand(inbound)) {
            requestStop(inbound.chatId());
            delivery.sendMessage(inbound.chatId(), "Stopped.");
            return;
        }
        PendingMessage pending = new PendingMessage(inbound, delivery);
        while (!runners.computeIfAbsent(inbound.chatId(), ChatRunner::new).enqueue(pending)) {
            // runner retired between lookup and enqueue
            Thread.onSpinWait();
        }
    }

    public void requestStop(String chatId) {
        ChatRunner runner = runners.get(chatId);
        if (runner != null) {
            runner.requestStop();
            return;
        }
        log.info("[Stop] stop requested while no active runner: chatId={}", chatId);
    }

    void handle(InboundMessage inbound, DeliveryPort delivery) {
        if (inbound.isCommand()) {
            handleCommand(inbound, delivery);
            return;
        }
        ExchangeResult result = exchangeOrchestrator.exchange(inbound);
        if (Thread.currentThread().isInterrupted()) {
            log.info("[ChatRunCoordinator] exchange stopped, reply dropped: chatId={}", inbound.chatId());
            return;
        }
        deliver(inbound.chatId(), result, delivery);
    }

    private void handleCommand(InboundMessage inbound, DeliveryPort delivery) {
        List<String> tokens = Arrays.asList(inbound.text().substring(1).trim().split("\\s+"));
        String name = stripBotSuffix(tokens.get(0)).toLowerCase(Locale.ROOT);
        List<String> args = tokens.subList(1, tokens.size());
        if (name.isEmpty() || !commandPort.hasCommand(name)) {
            delivery.sendMessage(inbound.chatId(), "Unknown command: /" + name + ". Type /help for the list.");
            return;
        }
        CommandPort.CommandResult result = commandPort.execute(name, args, inbound.chatId());
        if (result != null && result.output() != null && !result.output().isBlank()) {
            delivery.sendMessage(inbound.chatId(), result.output());
        }
    }

    private void deliver(String chatId, ExchangeResult result, DeliveryPort delivery) {
        if (result.getText() != null && !result.getText().isBlank()) {
            delivery.sendMessage(chatId, result.getText());
        }
        for (ImagePayload image : result.getImages()) {
            delivery.sendPhoto(chatId, image.bytes(), image.mimeType(), null);
        }
    }

    private static boolean isStopCommand(InboundMessage inbound) {
        if (!inbound.isCommand()) {
            return false;
        }
        String first = inbound.text().substring(1).trim().split("\\s+")[0];
        return STOP_COMMAND.equalsIgnoreCase(stripBotSuffix(first));
    }

    // Telegram group commands look like /help@my_bot
    private static String stripBotSuffix(String command) {
        int at = command.indexOf('@');
        return at >= 0 ? command.substring(0, at) : command;
    }

    private record PendingMessage(InboundMessage inbound, DeliveryPort delivery) {
    }

    private final class ChatRunner {

        private final String chatId;
        private final Object lock = new Object();
        private final Deque<PendingMessage> queue = new ArrayDeque<>();

        private Future<?> runningTask;
        // cleared only when the task body has returned, a cancelled future reports done earlier
        private boolean running;
        private boolean retired;

        private ChatRunner(String chatId) {
            this.chatId = chatId;
        }

        boolean enqueue(PendingMessage pending) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (isRunning()) {
                    if (queue.size() >= MAX_QUEUED_MESSAGES_PER_CHAT) {
                        queue.removeFirst();
                        log.warn("[ChatRunCoordinator] queue limit reached ({}), dropped oldest message: chatId={}",
                                MAX_QUEUED_MESSAGES_PER_CHAT, chatId);
                    }
                    queue.addLast(pending);
                    return true;
                }
                startRunLocked(pending);
                return true;
            }
        }

        void requestStop() {
            Future<?> taskToCancel;
            synchronized (lock) {
                queue.clear();
                taskToCancel = runningTask;
            }
            if (taskToCancel != null) {
                boolean cancelled = taskToCancel.cancel(true);
                log.info("[Stop] cancel requested (cancelled={}): chatId={}", cancelled, chatId);
            } else {
                log.info("[Stop] stop requested while idle: chatId={}", chatId);
            }
        }

        private boolean isRunning() {
            return running;
        }

        private void startRunLocked(PendingMessage pending) {
            running = true;
            try {
                runningTask = chatRunExecutor.submit(() -> runPending(pending));
            } catch (RejectedExecutionException e) {
                log.error("[ChatRunCoordinator] executor rejected run: chatId={}", chatId, e);
                running = false;
                queue.clear();
                retired = true;
                runners.remove(chatId, this);
            }
        }

        private void runPending(PendingMessage pending) {
            try {
                handle(pending.inbound(), pending.delivery());
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                log.error("[ChatRunCoordinator] run failed: chatId={}: {}", chatId, e.getMessage(), e);
            } finally {
                onRunComplete();
            }
        }

        private void onRunComplete() {
            synchronized (lock) {
                running = false;
                runningTask = null;
                PendingMessage next = queue.pollFirst();
                if (next != null) {
                    startRunLocked(next);
                    return;
                }
                retired = true;
                runners.remove(chatId, this);
            }
        }
    }
}
