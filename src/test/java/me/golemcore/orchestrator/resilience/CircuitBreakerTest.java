package me.golemcore.orchestrator.resilience;

import me.golemcore.orchestrator.domain.model.CircuitOpenException;
import me.golemcore.orchestrator.domain.model.CircuitPhase;
import me.golemcore.orchestrator.domain.model.Dependency;
import me.golemcore.orchestrator.testsupport.MutableClock;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        breaker = newBreaker(5, 3);
    }

    private CircuitBreaker newBreaker(int threshold, int probeQuota) {
        return new CircuitBreaker(Dependency.TOOL_BACKEND, CircuitBreakerConfig.builder()
                .failureThreshold(threshold)
                .recoveryTimeout(Duration.ofSeconds(30))
                .probeQuota(probeQuota)
                .callTimeout(Duration.ofSeconds(5))
                .build(), clock);
    }

    private void fail(CircuitBreaker target, int times) {
        for (int i = 0; i < times; i++) {
            target.acquire().failure(new IllegalStateException("boom " + i));
        }
    }

    // ===== Closed =====

    @Test
    void shouldStayClosedBelowThreshold() {
        fail(breaker, 4);

        assertEquals(CircuitPhase.CLOSED, breaker.getPhase());
        assertEquals(4, breaker.snapshot().consecutiveFailures());
    }

    @Test
    void shouldResetFailureCountOnSuccess() {
        fail(breaker, 4);
        breaker.acquire().success();
        fail(breaker, 4);

        assertEquals(CircuitPhase.CLOSED, breaker.getPhase());
        assertEquals(4, breaker.snapshot().consecutiveFailures());
    }

    @Test
    void shouldOpenAfterThresholdAndRejectWithoutInvokingCall() {
        AtomicInteger invocations = new AtomicInteger();
        for (int i = 0; i < 5; i++) {
            StepVerifier.create(breaker.guard(() -> {
                invocations.incrementAndGet();
                return Mono.error(new IllegalStateException("backend down"));
            }))
                    .expectError(IllegalStateException.class)
                    .verify();
        }
        assertEquals(CircuitPhase.OPEN, breaker.getPhase());
        assertEquals(START, breaker.snapshot().openedAt());

        StepVerifier.create(breaker.guard(() -> {
            invocations.incrementAndGet();
            return Mono.just("never");
        }))
                .expectError(CircuitOpenException.class)
                .verify();

        assertEquals(5, invocations.get());
        assertEquals(1, breaker.snapshot().rejectedCalls());
    }

    @Test
    void shouldCountEmptyCompletionAsSuccess() {
        fail(breaker, 3);

        StepVerifier.create(breaker.guard(Mono::empty)).verifyComplete();

        assertEquals(0, breaker.snapshot().consecutiveFailures());
    }

    // ===== Open -> HalfOpen =====

    @Test
    void shouldRejectUntilRecoveryTimeoutElapses() {
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(29));

        CircuitOpenException rejected = assertThrows(CircuitOpenException.class, breaker::acquire);
        assertEquals(Dependency.TOOL_BACKEND, rejected.getDependency());
        assertEquals(CircuitPhase.OPEN, rejected.getSnapshot().phase());
    }

    @Test
    void shouldMoveToHalfOpenAfterRecoveryTimeoutAndCloseOnSingleProbe() {
        CircuitBreaker singleProbe = newBreaker(5, 1);
        fail(singleProbe, 5);
        clock.advance(Duration.ofSeconds(31));

        CircuitBreaker.Permit probe = singleProbe.acquire();

        assertTrue(probe.isProbe());
        assertEquals(CircuitPhase.HALF_OPEN, singleProbe.getPhase());
        probe.success();
        assertEquals(CircuitPhase.CLOSED, singleProbe.getPhase());
        assertNull(singleProbe.snapshot().openedAt());
        assertEquals(0, singleProbe.snapshot().consecutiveFailures());
    }

    @Test
    void shouldTransitionExactlyAtRecoveryTimeout() {
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(30));

        assertTrue(breaker.acquire().isProbe());
        assertEquals(CircuitPhase.HALF_OPEN, breaker.getPhase());
    }

    @Test
    void shouldReportOpenUntilNextCallArrives() {
        fail(breaker, 5);
        clock.advance(Duration.ofMinutes(5));

        assertEquals(CircuitPhase.OPEN, breaker.getPhase());
    }

    // ===== HalfOpen =====

    @Test
    void shouldRequireConsecutiveProbeSuccessesToClose() {
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(31));

        breaker.acquire().success();
        breaker.acquire().success();
        assertEquals(CircuitPhase.HALF_OPEN, breaker.getPhase());
        assertEquals(2, breaker.snapshot().consecutiveProbeSuccesses());

        breaker.acquire().success();
        assertEquals(CircuitPhase.CLOSED, breaker.getPhase());
    }

    @Test
    void shouldReopenOnAnyProbeFailure() {
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(31));
        breaker.acquire().success();
        breaker.acquire().success();

        breaker.acquire().failure(new IllegalStateException("still down"));

        assertEquals(CircuitPhase.OPEN, breaker.getPhase());
        assertEquals(clock.instant(), breaker.snapshot().openedAt());
        assertThrows(CircuitOpenException.class, breaker::acquire);
    }

    @Test
    void shouldLimitConcurrentProbesToQuota() {
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(31));

        List<CircuitBreaker.Permit> probes = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            probes.add(breaker.acquire());
        }

        assertThrows(CircuitOpenException.class, breaker::acquire);
        assertEquals(3, breaker.snapshot().probesInFlight());

        probes.get(0).release();
        assertNotNull(breaker.acquire());
    }

    @Test
    void shouldDiscardOutcomeOfCallStartedBeforeStateChange() {
        CircuitBreaker.Permit slowCall = breaker.acquire();
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(31));
        CircuitBreaker.Permit probe = breaker.acquire();

        slowCall.failure(new IllegalStateException("late"));

        assertEquals(CircuitPhase.HALF_OPEN, breaker.getPhase());
        probe.success();
        assertEquals(1, breaker.snapshot().consecutiveProbeSuccesses());
    }

    @Test
    void shouldReleasePermitWhenCallIsCancelled() {
        fail(breaker, 5);
        clock.advance(Duration.ofSeconds(31));
        Sinks.One<String> never = Sinks.one();

        StepVerifier.create(breaker.guard(never::asMono))
                .thenCancel()
                .verify();

        assertEquals(CircuitPhase.HALF_OPEN, breaker.getPhase());
        assertEquals(0, breaker.snapshot().probesInFlight());
    }

    @Test
    void shouldIgnoreSecondOutcomeOfSamePermit() {
        CircuitBreaker.Permit permit = breaker.acquire();
        permit.success();
        permit.failure(new IllegalStateException("ignored"));

        assertEquals(0, breaker.snapshot().consecutiveFailures());
    }

    // ===== Streams and reset =====

    @Test
    void shouldRecordFluxCompletionAsSuccessAndErrorAsFailure() {
        StepVerifier.create(breaker.guardMany(() -> Flux.just(1, 2, 3)))
                .expectNext(1, 2, 3)
                .verifyComplete();
        StepVerifier.create(breaker.guardMany(() -> Flux.concat(Flux.just(1),
                Flux.error(new IllegalStateException("mid-stream")))))
                .expectNext(1)
                .expectError(IllegalStateException.class)
                .verify();

        assertEquals(1, breaker.snapshot().consecutiveFailures());
    }

    @Test
    void shouldResetToClosed() {
        fail(breaker, 5);

        breaker.reset();

        assertEquals(CircuitPhase.CLOSED, breaker.getPhase());
        assertNotNull(breaker.acquire());
    }

    @Test
    void shouldRejectInvalidConfig() {
        CircuitBreakerConfig zeroThreshold = CircuitBreakerConfig.builder()
                .failureThreshold(0)
                .recoveryTimeout(Duration.ofSeconds(1))
                .probeQuota(1)
                .callTimeout(Duration.ofSeconds(1))
                .build();
        CircuitBreakerConfig zeroQuota = CircuitBreakerConfig.builder()
                .failureThreshold(1)
                .recoveryTimeout(Duration.ofSeconds(1))
                .probeQuota(0)
                .callTimeout(Duration.ofSeconds(1))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker(Dependency.TOOL_BACKEND, zeroThreshold, clock));
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker(Dependency.TOOL_BACKEND, zeroQuota, clock));
    }

    // ===== Concurrency =====

    @Test
    void shouldOpenExactlyOnceUnderConcurrentFailures() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(threads * 10);
        AtomicInteger rejected = new AtomicInteger();
        try {
            for (int i = 0; i < threads * 10; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        breaker.acquire().failure(new IllegalStateException("concurrent"));
                    } catch (CircuitOpenException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        finished.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(finished.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(CircuitPhase.OPEN, breaker.getPhase());
        assertEquals(rejected.get(), breaker.snapshot().rejectedCalls());
        assertFalse(rejected.get() > threads * 10 - 5);
    }

    // ===== Transition logging =====

    @Test
    void shouldLogCountsAsTheyStoodBeforeTransition() {
        Logger logger = (Logger) LoggerFactory.getLogger(CircuitBreaker.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            fail(breaker, 5);
            clock.advance(Duration.ofSeconds(31));
            for (int i = 0; i < 3; i++) {
                breaker.acquire().success();
            }
        } finally {
            logger.detachAppender(appender);
        }

        List<String> transitions = appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .filter(message -> message.contains("state_change"))
                .toList();
        assertEquals(3, transitions.size());
        assertTrue(transitions.get(0).contains("to=OPEN failures=5"));
        assertTrue(transitions.get(2).contains("to=CLOSED failures=5 probeSuccesses=3"));
    }
}
