package me.golemcore.orchestrator.resilience;

import me.golemcore.orchestrator.domain.model.CircuitBreakerSnapshot;
import me.golemcore.orchestrator.domain.model.CircuitPhase;
import me.golemcore.orchestrator.domain.model.Dependency;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

class CircuitBreakerRegistryTest {

    private OrchestratorProperties properties;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void shouldCreateOneBreakerPerDependencyWithDefaults() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties, clock);

        CircuitBreaker tools = registry.get(Dependency.TOOL_BACKEND);
        CircuitBreaker reasoning = registry.get(Dependency.REASONING_BACKEND);

        assertNotSame(tools, reasoning);
        assertSame(tools, registry.get(Dependency.TOOL_BACKEND));
        assertEquals(5, tools.getConfig().getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), tools.getConfig().getRecoveryTimeout());
        assertEquals(3, tools.getConfig().getProbeQuota());
        assertEquals(3, reasoning.getConfig().getFailureThreshold());
        assertEquals(Duration.ofSeconds(60), reasoning.getConfig().getRecoveryTimeout());
        assertEquals(2, reasoning.getConfig().getProbeQuota());
    }

    @Test
    void shouldApplyConfiguredValues() {
        properties.getBreakers().getToolBackend().setFailureThreshold(2);
        properties.getBreakers().getToolBackend().setCallTimeout(Duration.ofMillis(500));

        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties, clock);

        assertEquals(2, registry.get(Dependency.TOOL_BACKEND).getConfig().getFailureThreshold());
        assertEquals(Duration.ofMillis(500), registry.get(Dependency.TOOL_BACKEND).getConfig().getCallTimeout());
    }

    @Test
    void shouldIsolateBreakersFromEachOther() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties, clock);
        CircuitBreaker reasoning = registry.get(Dependency.REASONING_BACKEND);
        for (int i = 0; i < 3; i++) {
            reasoning.acquire().failure(new IllegalStateException("down"));
        }

        List<CircuitBreakerSnapshot> snapshots = registry.snapshots();

        assertEquals(2, snapshots.size());
        assertEquals(CircuitPhase.CLOSED, snapshots.get(0).phase());
        assertEquals(Dependency.TOOL_BACKEND, snapshots.get(0).dependency());
        assertEquals(CircuitPhase.OPEN, snapshots.get(1).phase());
    }

    @Test
    void shouldResetAllBreakers() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties, clock);
        for (int i = 0; i < 5; i++) {
            registry.get(Dependency.TOOL_BACKEND).acquire().failure(new IllegalStateException("down"));
        }

        registry.resetAll();

        assertEquals(CircuitPhase.CLOSED, registry.get(Dependency.TOOL_BACKEND).getPhase());
    }
}
