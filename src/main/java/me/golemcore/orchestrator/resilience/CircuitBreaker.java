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
import me.golemcore.orchestrator.domain.model.CircuitOpenException;
import me.golemcore.orchestrator.domain.model.CircuitPhase;
import me.golemcore.orchestrator.domain.model.Dependency;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Thread-safe circuit breaker guarding one external dependency.
 *
 * <p>
 * Phases and transitions:
 * <ul>
 * <li><b>Closed</b> - calls pass; each failure increments the consecutive
 * failure counter, each success resets it. Reaching the threshold opens the
 * breaker.</li>
 * <li><b>Open</b> - calls are rejected with {@link CircuitOpenException}
 * without reaching the dependency. Once the recovery timeout has elapsed since
 * opening, the next call moves the breaker to half-open.</li>
 * <li><b>Half-open</b> - at most {@code probeQuota} probe calls are let
 * through. When that many probes have succeeded the breaker closes; any probe
 * failure reopens it with a fresh {@code openedAt}.</li>
 * </ul>
 *
 * <p>
 * Every admitted call holds a {@link Permit} that must be completed exactly
 * once. Permits are stamped with the breaker generation, which changes on every
 * transition; an outcome reported for an older generation, or after the permit
 * was released, is discarded. All state lives behind the instance monitor, so
 * admission decisions and counter updates observe a consistent view.
 *
 * @since 1.0
 */
@Slf4j
public class CircuitBreaker {

    private final Dependency dependency;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitPhase phase = CircuitPhase.CLOSED;
    private int consecutiveFailures;
    private int consecutiveProbeSuccesses;
    private int probesInFlight;
    private Instant openedAt;
    private long generation;
    private String lastError;
    private final AtomicLong rejectedCalls = new AtomicLong();

    public CircuitBreaker(Dependency dependency, CircuitBreakerConfig config, Clock clock) {
        this.dependency = dependency;
        this.config = config.validate();
        this.clock = clock;
    }

    /**
     * Admit one call or reject it.
     *
     * @throws CircuitOpenException
     *             when the breaker is open, or half-open with no probe slot left
     */
    public synchronized Permit acquire() {
        if (phase == CircuitPhase.OPEN && recoveryTimeoutElapsed()) {
            transitionTo(CircuitPhase.HALF_OPEN);
        }

        switch (phase) {
        case CLOSED -> {
            return new Permit(generation, false);
        }
        case HALF_OPEN -> {
            if (consecutiveProbeSuccesses + probesInFlight < config.getProbeQuota()) {
                probesInFlight++;
                return new Permit(generation, true);
            }
            throw reject();
        }
        default -> throw reject();
        }
    }

    /**
     * Run a reactive call under this breaker. The supplier is not invoked when
     * the call is rejected. Completion (with or without a value) is a success,
     * an error is a failure, and cancellation releases the permit without
     * recording an outcome.
     */
    public <T> Mono<T> guard(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Permit permit;
            try {
                permit = acquire();
            } catch (CircuitOpenException e) {
                return Mono.error(e);
            }
            return Mono.defer(call)
                    .doOnSuccess(value -> permit.success())
                    .doOnError(permit::failure)
                    .doOnCancel(permit::release);
        });
    }

    /**
     * Multi-valued variant of {@link #guard(Supplier)}: the call succeeds when
     * the sequence completes.
     */
    public <T> Flux<T> guardMany(Supplier<Flux<T>> call) {
        return Flux.defer(() -> {
            Permit permit;
            try {
                permit = acquire();
            } catch (CircuitOpenException e) {
                return Flux.error(e);
            }
            return Flux.defer(call)
                    .doOnComplete(permit::success)
                    .doOnError(permit::failure)
                    .doOnCancel(permit::release);
        });
    }

    /**
     * Force the breaker back to closed with cleared counters.
     */
    public synchronized void reset() {
        if (phase != CircuitPhase.CLOSED) {
            transitionTo(CircuitPhase.CLOSED);
        }
        consecutiveFailures = 0;
        consecutiveProbeSuccesses = 0;
        probesInFlight = 0;
        lastError = null;
        log.info("[CircuitBreaker] Reset: dependency={}", dependency.getId());
    }

    /**
     * Current phase. An open breaker whose recovery timeout has elapsed still
     * reports open until the next call arrives.
     */
    public synchronized CircuitPhase getPhase() {
        return phase;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return CircuitBreakerSnapshot.builder()
                .dependency(dependency)
                .phase(phase)
                .consecutiveFailures(consecutiveFailures)
                .consecutiveProbeSuccesses(consecutiveProbeSuccesses)
                .probesInFlight(probesInFlight)
                .openedAt(openedAt)
                .rejectedCalls(rejectedCalls.get())
                .failureThreshold(config.getFailureThreshold())
                .probeQuota(config.getProbeQuota())
                .build();
    }

    public Dependency getDependency() {
        return dependency;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private synchronized void onSuccess(Permit permit) {
        if (permit.generation != generation) {
            log.debug("[CircuitBreaker] Discarding stale success: dependency={}", dependency.getId());
            return;
        }
        if (phase == CircuitPhase.HALF_OPEN && permit.probe) {
            probesInFlight--;
            consecutiveProbeSuccesses++;
            if (consecutiveProbeSuccesses >= config.getProbeQuota()) {
                transitionTo(CircuitPhase.CLOSED);
            }
        } else if (phase == CircuitPhase.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    private synchronized void onFailure(Permit permit, Throwable error) {
        if (permit.generation != generation) {
            log.debug("[CircuitBreaker] Discarding stale failure: dependency={}", dependency.getId());
            return;
        }
        lastError = describe(error);
        if (phase == CircuitPhase.HALF_OPEN && permit.probe) {
            transitionTo(CircuitPhase.OPEN);
        } else if (phase == CircuitPhase.CLOSED) {
            consecutiveFailures++;
            if (consecutiveFailures >= config.getFailureThreshold()) {
                transitionTo(CircuitPhase.OPEN);
            }
        }
    }

    private synchronized void onRelease(Permit permit) {
        if (permit.generation == generation && phase == CircuitPhase.HALF_OPEN && permit.probe) {
            probesInFlight--;
        }
    }

    private boolean recoveryTimeoutElapsed() {
        return !clock.instant().isBefore(openedAt.plus(config.getRecoveryTimeout()));
    }

    private void transitionTo(CircuitPhase next) {
        CircuitPhase previous = phase;
        int failures = consecutiveFailures;
        int probeSuccesses = consecutiveProbeSuccesses;
        phase = next;
        generation++;
        probesInFlight = 0;
        switch (next) {
        case OPEN -> openedAt = clock.instant();
        case HALF_OPEN -> consecutiveProbeSuccesses = 0;
        case CLOSED -> {
            consecutiveFailures = 0;
            consecutiveProbeSuccesses = 0;
            openedAt = null;
        }
        default -> {
            // no extra bookkeeping
        }
        }
        if (next == CircuitPhase.OPEN) {
            log.warn("[CircuitBreaker] state_change dependency={} from={} to={} failures={} lastError={}",
                    dependency.getId(), previous, next, failures, lastError);
        } else {
            log.info("[CircuitBreaker] state_change dependency={} from={} to={} failures={} probeSuccesses={}",
                    dependency.getId(), previous, next, failures, probeSuccesses);
        }
    }

    private CircuitOpenException reject() {
        rejectedCalls.incrementAndGet();
        log.debug("[CircuitBreaker] Rejected call: dependency={}, phase={}", dependency.getId(), phase);
        return new CircuitOpenException(snapshot());
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    /**
     * Admission ticket for one call. The first of {@link #success()},
     * {@link #failure(Throwable)} or {@link #release()} wins; later calls are
     * no-ops.
     */
    public final class Permit {

        private final long generation;
        private final boolean probe;
        private final AtomicBoolean completed = new AtomicBoolean(false);

        private Permit(long generation, boolean probe) {
            this.generation = generation;
            this.probe = probe;
        }

        public boolean isProbe() {
            return probe;
        }

        public void success() {
            if (completed.compareAndSet(false, true)) {
                onSuccess(this);
            }
        }

        public void failure(Throwable error) {
            if (completed.compareAndSet(false, true)) {
                onFailure(this, error);
            }
        }

        /**
         * Abandon the call: its outcome, if it ever arrives, is not counted.
         */
        public void release() {
            if (completed.compareAndSet(false, true)) {
                onRelease(this);
            }
        }
    }
}
