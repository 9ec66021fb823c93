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

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Failure bookkeeping for one extension. Each hook or command name has its own
 * counter, reset when that hook succeeds; once the sum of all counters reaches
 * the limit the extension is disabled for the rest of the process lifetime.
 */
@Slf4j
public class PluginHealthMonitor {

    private final String pluginName;
    private final int maxFailures;
    private final Map<String, Integer> failureCounts = new HashMap<>();
    private boolean disabled;

    public PluginHealthMonitor(String pluginName, int maxFailures) {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be positive: " + maxFailures);
        }
        this.pluginName = pluginName;
        this.maxFailures = maxFailures;
    }

    /**
     * Records a failure.
     *
     * @return true if this failure disabled the extension
     */
    public synchronized boolean recordFailure(String hookName) {
        if (disabled) {
            return false;
        }
        failureCounts.merge(hookName, 1, Integer::sum);
        int total = getTotalFailures();
        if (total >= maxFailures) {
            disabled = true;
            log.error("[Plugins] Plugin '{}' disabled after {} failures (last: {})", pluginName, total, hookName);
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess(String hookName) {
        failureCounts.computeIfPresent(hookName, (name, count) -> 0);
    }

    public synchronized boolean isHealthy() {
        return !disabled;
    }

    public synchronized int getFailureCount(String hookName) {
        return failureCounts.getOrDefault(hookName, 0);
    }

    public synchronized int getTotalFailures() {
        int total = 0;
        for (int count : failureCounts.values()) {
            total += count;
        }
        return total;
    }

    public String getPluginName() {
        return pluginName;
    }
}
