package me.golemcore.orchestrator.observability;

import me.golemcore.orchestrator.domain.model.Dependency;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OrchestratorMetricsTest {

    @Test
    void shouldAggregateToolCallsPerTool() {
        OrchestratorMetrics metrics = new OrchestratorMetrics();

        metrics.toolCalled("create", true, 10);
        metrics.toolCalled("create", false, 30);
        metrics.toolCalled("list", true, 5);

        assertEquals(2L, metrics.getToolCalls("create"));
        assertEquals(0L, metrics.getToolCalls("delete"));

        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> tools = (Map<String, Map<String, Object>>) metrics.summary().get("tools");
        assertEquals(1L, tools.get("create").get("failures"));
        assertEquals(20L, tools.get("create").get("avgDurationMs"));
    }

    @Test
    void shouldCountRequestOutcomesAndRejections() {
        OrchestratorMetrics metrics = new OrchestratorMetrics();

        metrics.requestReceived();
        metrics.requestReceived();
        metrics.requestRejected();
        metrics.requestCompleted();
        metrics.breakerRejected(Dependency.REASONING_BACKEND);

        Map<String, Object> summary = metrics.summary();
        assertEquals(2L, summary.get("requestsReceived"));
        assertEquals(1L, summary.get("requestsRejected"));
        assertEquals(1L, summary.get("requestsCompleted"));
        assertEquals(Map.of("tool-backend", 0L, "reasoning-backend", 1L), summary.get("breakerRejections"));
    }
}
