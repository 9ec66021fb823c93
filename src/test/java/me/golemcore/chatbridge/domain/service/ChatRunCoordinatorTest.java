package me.golemcore.chatbridge.domain.service;

import me.golemcore.chatbridge.domain.model.ExchangeFailureKind;
import me.golemcore.chatbridge.domain.model.ExchangeResult;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.InboundMessage;
import me.golemcore.chatbridge.port.inbound.CommandPort;
import me.golemcore.chatbridge.port.inbound.CommandPort.CommandResult;
import me.golemcore.chatbridge.port.outbound.DeliveryPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatRunCoordinatorTest {

    private static final String CHAT_ID = "100";

    private ExchangeOrchestrator orchestrator;
    private CommandPort commandPort;
    private DeliveryPort delivery;
    private ExecutorService executor;
    private ChatRunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ExchangeOrchestrator.class);
        commandPort = mock(CommandPort.class);
        delivery = mock(DeliveryPort.class);
        executor = Executors.newFixedThreadPool(4);
        coordinator = new ChatRunCoordinator(orchestrator, commandPort, executor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldDeliverTextAndImages() {
        ImagePayload image = new ImagePayload(new byte[] { 1, 2 }, "image/png");
        InboundMessage inbound = InboundMessage.text(CHAT_ID, "draw");
        when(orchestrator.exchange(inbound)).thenReturn(ExchangeResult.builder()
                .text("Done")
                .image(image)
                .build());

        coordinator.enqueue(inbound, delivery);

        verify(delivery, timeout(2000)).sendMessage(CHAT_ID, "Done");
        verify(delivery, timeout(2000)).sendPhoto(eq(CHAT_ID), eq(image.bytes()), eq("image/png"), any());
    }

    @Test
    void shouldDeliverErrorReplies() {
        InboundMessage inbound = InboundMessage.text(CHAT_ID, "hi");
        when(orchestrator.exchange(inbound)).thenReturn(ExchangeResult.builder()
                .text("API Error: rate limited")
                .failure(ExchangeFailureKind.PROVIDER)
                .build());

        coordinator.enqueue(inbound, delivery);

        verify(delivery, timeout(2000)).sendMessage(CHAT_ID, "API Error: rate limited");
    }

    @Test
    void shouldRunMessagesOfOneChatSequentially() throws Exception {
        InboundMessage first = InboundMessage.text(CHAT_ID, "first");
        InboundMessage second = InboundMessage.text(CHAT_ID, "second");
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        Gate gate = new Gate();
        doAnswer(invocation -> {
            track(concurrent, maxConcurrent);
            order.add("first");
            gate.await();
            concurrent.decrementAndGet();
            return ExchangeResult.builder().text("r1").build();
        }).when(orchestrator).exchange(first);
        doAnswer(invocation -> {
            track(concurrent, maxConcurrent);
            order.add("second");
            concurrent.decrementAndGet();
            return ExchangeResult.builder().text("r2").build();
        }).when(orchestrator).exchange(second);

        coordinator.enqueue(first, delivery);
        gate.awaitStarted();
        coordinator.enqueue(second, delivery);
        Thread.sleep(100);
        assertEquals(List.of("first"), order);
        gate.release();

        verify(delivery, timeout(2000)).sendMessage(CHAT_ID, "r2");
        assertEquals(List.of("first", "second"), order);
        assertEquals(1, maxConcurrent.get());
    }

    @Test
    void shouldStopRunningExchangeAndDropQueue() throws Exception {
        InboundMessage slow = InboundMessage.text(CHAT_ID, "slow");
        InboundMessage queued = InboundMessage.text(CHAT_ID, "queued");
        InboundMessage after = InboundMessage.text(CHAT_ID, "after");
        Gate gate = new Gate();
        doAnswer(invocation -> {
            gate.await();
            return ExchangeResult.builder().text("too late").build();
        }).when(orchestrator).exchange(slow);
        when(orchestrator.exchange(after)).thenReturn(ExchangeResult.builder().text("fresh").build());

        coordinator.enqueue(slow, delivery);
        gate.awaitStarted();
        coordinator.enqueue(queued, delivery);
        coordinator.enqueue(InboundMessage.text(CHAT_ID, "/stop"), delivery);
        coordinator.enqueue(after, delivery);

        verify(delivery).sendMessage(CHAT_ID, "Stopped.");
        verify(delivery, timeout(2000)).sendMessage(CHAT_ID, "fresh");
        verify(orchestrator, never()).exchange(queued);
        verify(delivery, never()).sendMessage(CHAT_ID, "too late");
    }

    @Test
    void shouldRouteCommandsWithArgumentsAndBotSuffix() {
        when(commandPort.hasCommand("maxrounds")).thenReturn(true);
        when(commandPort.execute(eq("maxrounds"), anyList(), eq(CHAT_ID)))
                .thenReturn(CommandResult.success("Max rounds set to 2"));

        coordinator.enqueue(InboundMessage.text(CHAT_ID, "/MaxRounds@bridge_bot 2"), delivery);

        verify(delivery, timeout(2000)).sendMessage(CHAT_ID, "Max rounds set to 2");
        verify(commandPort).execute("maxrounds", List.of("2"), CHAT_ID);
        verify(orchestrator, never()).exchange(any());
    }

    @Test
    void shouldRejectUnknownCommands() {
        coordinator.enqueue(InboundMessage.text(CHAT_ID, "/frobnicate"), delivery);

        verify(delivery, timeout(2000)).sendMessage(CHAT_ID, "Unknown command: /frobnicate. Type /help for the list.");
    }

    @Test
    void shouldStayQuietWhenCommandRepliedItself() throws Exception {
        when(commandPort.hasCommand("weather")).thenReturn(true);
        when(commandPort.execute(eq("weather"), anyList(), eq(CHAT_ID))).thenReturn(CommandResult.success(null));

        coordinator.enqueue(InboundMessage.text(CHAT_ID, "/weather"), delivery);

        verify(commandPort, timeout(2000)).execute(eq("weather"), anyList(), eq(CHAT_ID));
        Thread.sleep(50);
        verify(delivery, never()).sendMessage(any(), any());
    }

    @Test
    void shouldAcknowledgeStopWhenIdle() {
        coordinator.enqueue(InboundMessage.text(CHAT_ID, "/stop"), delivery);

        verify(delivery).sendMessage(CHAT_ID, "Stopped.");
        verify(orchestrator, never()).exchange(any());
    }

    private static void track(AtomicInteger concurrent, AtomicInteger maxConcurrent) {
        int now = concurrent.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
    }

    private static final class Gate {
        private final Object lock = new Object();
        private boolean released = false;
        private boolean started = false;

        void await() throws InterruptedException {
            synchronized (lock) {
                started = true;
                lock.notifyAll();
                while (!released) {
                    lock.wait();
                }
            }
        }

        void awaitStarted() throws InterruptedException {
            synchronized (lock) {
                while (!started) {
                    lock.wait();
                }
            }
        }

        void release() {
            synchronized (lock) {
                released = true;
                lock.notifyAll();
            }
        }
    }
}
