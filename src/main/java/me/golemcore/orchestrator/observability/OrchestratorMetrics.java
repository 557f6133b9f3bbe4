package me.golemcore.orchestrator.observability;

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

import me.golemcore.orchestrator.domain.model.Dependency;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for requests, tool calls, reasoning turns and breaker
 * rejections. Reset on restart.
 */
@Component
public class OrchestratorMetrics {

    private final AtomicLong requestsReceived = new AtomicLong();
    private final AtomicLong requestsRejected = new AtomicLong();
    private final AtomicLong requestsCompleted = new AtomicLong();
    private final AtomicLong requestsFailed = new AtomicLong();
    private final AtomicLong requestsCancelled = new AtomicLong();
    private final AtomicLong reasoningTurns = new AtomicLong();
    private final Map<String, ToolStats> toolStats = new ConcurrentHashMap<>();
    private final Map<Dependency, AtomicLong> breakerRejections = new EnumMap<>(Dependency.class);

    public OrchestratorMetrics() {
        for (Dependency dependency : Dependency.values()) {
            breakerRejections.put(dependency, new AtomicLong());
        }
    }

    public void requestReceived() {
        requestsReceived.incrementAndGet();
    }

    public void requestRejected() {
        requestsRejected.incrementAndGet();
    }

    public void requestCompleted() {
        requestsCompleted.incrementAndGet();
    }

    public void requestFailed() {
        requestsFailed.incrementAndGet();
    }

    public void requestCancelled() {
        requestsCancelled.incrementAndGet();
    }

    public void reasoningTurn() {
        reasoningTurns.incrementAndGet();
    }

    public void toolCalled(String toolName, boolean success, long durationMs) {
        ToolStats stats = toolStats.computeIfAbsent(toolName, name -> new ToolStats());
        stats.calls.incrementAndGet();
        if (!success) {
            stats.failures.incrementAndGet();
        }
        stats.totalDurationMs.addAndGet(durationMs);
    }

    public void breakerRejected(Dependency dependency) {
        breakerRejections.get(dependency).incrementAndGet();
    }

    public long getRequestsReceived() {
        return requestsReceived.get();
    }

    public long getRequestsCompleted() {
        return requestsCompleted.get();
    }

    public long getRequestsFailed() {
        return requestsFailed.get();
    }

    public long getRequestsCancelled() {
        return requestsCancelled.get();
    }

    public long getToolCalls(String toolName) {
        ToolStats stats = toolStats.get(toolName);
        return stats != null ? stats.calls.get() : 0;
    }

    public long getBreakerRejections(Dependency dependency) {
        return breakerRejections.get(dependency).get();
    }

    /**
     * Point-in-time summary for the health endpoint.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("requestsReceived", requestsReceived.get());
        summary.put("requestsRejected", requestsRejected.get());
        summary.put("requestsCompleted", requestsCompleted.get());
        summary.put("requestsFailed", requestsFailed.get());
        summary.put("requestsCancelled", requestsCancelled.get());
        summary.put("reasoningTurns", reasoningTurns.get());

        Map<String, Object> tools = new TreeMap<>();
        toolStats.forEach((name, stats) -> {
            long calls = stats.calls.get();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("calls", calls);
            entry.put("failures", stats.failures.get());
            entry.put("avgDurationMs", calls > 0 ? stats.totalDurationMs.get() / calls : 0);
            tools.put(name, entry);
        });
        summary.put("tools", tools);

        Map<String, Object> rejections = new LinkedHashMap<>();
        breakerRejections.forEach((dependency, count) -> rejections.put(dependency.getId(), count.get()));
        summary.put("breakerRejections", rejections);
        return summary;
    }

    private static final class ToolStats {
        private final AtomicLong calls = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong totalDurationMs = new AtomicLong();
    }
}
