package me.golemcore.chatbridge.plugin.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PluginHealthMonitorTest {

    @Test
    void shouldDisableWhenTotalFailuresReachLimit() {
        PluginHealthMonitor monitor = new PluginHealthMonitor("watermark", 3);

        assertFalse(monitor.recordFailure("pre_user_text"));
        assertFalse(monitor.recordFailure("post_assistant_images"));
        assertTrue(monitor.isHealthy());
        assertTrue(monitor.recordFailure("pre_user_text"));

        assertFalse(monitor.isHealthy());
        assertEquals(2, monitor.getFailureCount("pre_user_text"));
        assertEquals(3, monitor.getTotalFailures());
    }

    @Test
    void shouldResetOnlySucceededHookCounter() {
        PluginHealthMonitor monitor = new PluginHealthMonitor("watermark", 3);
        monitor.recordFailure("pre_user_text");
        monitor.recordFailure("post_user_text");

        monitor.recordSuccess("pre_user_text");

        assertEquals(0, monitor.getFailureCount("pre_user_text"));
        assertEquals(1, monitor.getFailureCount("post_user_text"));
        assertEquals(1, monitor.getTotalFailures());
    }

    @Test
    void shouldStayDisabledAfterSuccess() {
        PluginHealthMonitor monitor = new PluginHealthMonitor("flaky", 1);
        assertTrue(monitor.recordFailure("on_message_complete"));

        monitor.recordSuccess("on_message_complete");

        assertFalse(monitor.isHealthy());
        assertFalse(monitor.recordFailure("on_message_complete"));
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new PluginHealthMonitor("x", 0));
    }
}
