package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.orchestrator.domain.model.CircuitBreakerSnapshot;
import me.golemcore.orchestrator.domain.model.CircuitPhase;
import me.golemcore.orchestrator.domain.service.ToolRegistry;
import me.golemcore.orchestrator.observability.OrchestratorMetrics;
import me.golemcore.orchestrator.port.outbound.ReasoningPort;
import me.golemcore.orchestrator.resilience.CircuitBreakerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health and breaker status endpoints. Status is {@code healthy} while every
 * breaker is closed, {@code degraded} otherwise.
 */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    static final String STATUS_HEALTHY = "healthy";
    static final String STATUS_DEGRADED = "degraded";

    private final CircuitBreakerRegistry circuitBreakers;
    private final ToolRegistry toolRegistry;
    private final OrchestratorMetrics metrics;
    private final ReasoningPort reasoningPort;

    @GetMapping
    public Mono<ResponseEntity<HealthResponse>> health() {
        List<CircuitBreakerSnapshot> snapshots = circuitBreakers.snapshots();
        boolean degraded = snapshots.stream().anyMatch(snapshot -> snapshot.phase() != CircuitPhase.CLOSED);

        HealthResponse response = HealthResponse.builder()
                .status(degraded ? STATUS_DEGRADED : STATUS_HEALTHY)
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .model(reasoningPort.getModel())
                .tools(toolRegistry.isInitialized() ? toolRegistry.names() : List.of())
                .breakers(toBreakerStatuses(snapshots))
                .metrics(metrics.summary())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping("/breakers/reset")
    public Mono<ResponseEntity<Map<String, HealthResponse.BreakerStatus>>> resetBreakers() {
        log.info("[API] Resetting all circuit breakers");
        circuitBreakers.resetAll();
        return Mono.just(ResponseEntity.ok(toBreakerStatuses(circuitBreakers.snapshots())));
    }

    private Map<String, HealthResponse.BreakerStatus> toBreakerStatuses(List<CircuitBreakerSnapshot> snapshots) {
        Map<String, HealthResponse.BreakerStatus> breakers = new LinkedHashMap<>();
        for (CircuitBreakerSnapshot snapshot : snapshots) {
            breakers.put(snapshot.dependency().getId(), HealthResponse.BreakerStatus.builder()
                    .phase(snapshot.phase().name())
                    .consecutiveFailures(snapshot.consecutiveFailures())
                    .consecutiveProbeSuccesses(snapshot.consecutiveProbeSuccesses())
                    .probesInFlight(snapshot.probesInFlight())
                    .openedAt(snapshot.openedAt())
                    .rejectedCalls(snapshot.rejectedCalls())
                    .failureThreshold(snapshot.failureThreshold())
                    .probeQuota(snapshot.probeQuota())
                    .build());
        }
        return breakers;
    }
}
