package me.golemcore.orchestrator.resilience;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.CircuitBreakerSnapshot;
import me.golemcore.orchestrator.domain.model.Dependency;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the process-wide circuit breakers, one per {@link Dependency}, built
 * from {@code orchestrator.breakers.*}. Injected wherever a dependency is
 * called.
 */
@Component
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<Dependency, CircuitBreaker> breakers = new EnumMap<>(Dependency.class);

    public CircuitBreakerRegistry(OrchestratorProperties properties, Clock clock) {
        register(Dependency.TOOL_BACKEND, properties.getBreakers().getToolBackend(), clock);
        register(Dependency.REASONING_BACKEND, properties.getBreakers().getReasoningBackend(), clock);
    }

    public CircuitBreaker get(Dependency dependency) {
        CircuitBreaker breaker = breakers.get(dependency);
        if (breaker == null) {
            throw new IllegalArgumentException("No circuit breaker for " + dependency);
        }
        return breaker;
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        List<CircuitBreakerSnapshot> snapshots = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            snapshots.add(breaker.snapshot());
        }
        return snapshots;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    private void register(Dependency dependency, OrchestratorProperties.BreakerProperties props, Clock clock) {
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
                .failureThreshold(props.getFailureThreshold())
                .recoveryTimeout(props.getRecoveryTimeout())
                .probeQuota(props.getProbeQuota())
                .callTimeout(props.getCallTimeout())
                .build();
        breakers.put(dependency, new CircuitBreaker(dependency, config, clock));
        log.info("[CircuitBreaker] Configured {}: threshold={}, recovery={}, probes={}, callTimeout={}",
                dependency.getId(), config.getFailureThreshold(), config.getRecoveryTimeout(),
                config.getProbeQuota(), config.getCallTimeout());
    }
}
