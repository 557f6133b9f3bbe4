package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.CancellationToken;
import me.golemcore.orchestrator.domain.model.OrchestratorErrorKind;
import me.golemcore.orchestrator.domain.model.Request;
import me.golemcore.orchestrator.domain.model.RequestContext;
import me.golemcore.orchestrator.domain.model.StreamContractViolationException;
import me.golemcore.orchestrator.domain.model.StreamEvent;
import me.golemcore.orchestrator.domain.model.StreamEventType;
import me.golemcore.orchestrator.domain.model.StreamFrame;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventSinkTest {

    private static final String REQUEST_ID = "req_sink";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private OrchestratorProperties properties;
    private VirtualTimeScheduler scheduler;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        scheduler = VirtualTimeScheduler.create();
        context = new RequestContext(REQUEST_ID, new Request(REQUEST_ID, "in", "in", NOW), new CancellationToken());
    }

    private EventSink open() {
        return new EventStreamer(properties, scheduler).open(context);
    }

    private static StreamEvent thinking(String content) {
        return StreamEvent.thinking(REQUEST_ID, NOW, content);
    }

    private static StreamEvent done() {
        return StreamEvent.done(REQUEST_ID, NOW, "ok", List.of());
    }

    // ===== Ordering and termination =====

    @Test
    void shouldDeliverEventsInEmissionOrderAndCompleteAfterTerminal() {
        EventSink sink = open();
        for (int i = 0; i < 100; i++) {
            assertTrue(sink.emit(thinking("step " + i)));
        }
        sink.emit(done());

        List<StreamFrame> frames = sink.frames().collectList().block(Duration.ofSeconds(5));

        assertEquals(101, frames.size());
        for (int i = 0; i < 100; i++) {
            assertEquals("step " + i, frames.get(i).event().payload().get("content"));
        }
        assertEquals(StreamEventType.DONE, frames.get(100).event().type());
        assertTrue(sink.isTerminated());
    }

    @Test
    void shouldRejectEventsAfterTerminal() {
        EventSink sink = open();
        sink.emit(done());
        StreamEvent late = thinking("late");
        StreamEvent error = StreamEvent.error(REQUEST_ID, NOW, OrchestratorErrorKind.INTERNAL, "late error");

        assertThrows(StreamContractViolationException.class, () -> sink.emit(late));
        assertThrows(StreamContractViolationException.class, () -> sink.emit(error));
        assertTrue(sink.isTerminated());
    }

    @Test
    void shouldRejectEventsOfAnotherRequest() {
        EventSink sink = open();
        StreamEvent foreign = StreamEvent.thinking("req_other", NOW, "x");

        assertThrows(IllegalArgumentException.class, () -> sink.emit(foreign));
    }

    @Test
    void shouldRejectEventsAfterCloseWithoutCancellation() {
        EventSink sink = open();
        sink.close();
        sink.close();
        StreamEvent event = thinking("after close");

        assertThrows(StreamContractViolationException.class, () -> sink.emit(event));
        assertFalse(sink.isTerminated());
    }

    // ===== Cancellation =====

    @Test
    void shouldCancelRequestWhenClientDisconnects() {
        EventSink sink = open();

        StepVerifier.create(sink.frames())
                .then(() -> sink.emit(thinking("first")))
                .expectNextCount(1)
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertTrue(context.isCancelled());
        assertFalse(sink.emit(thinking("dropped")));
        assertFalse(sink.emit(done()));
        assertFalse(sink.isTerminated());
    }

    @Test
    void shouldAbandonRequestWhenClientStopsDraining() {
        properties.getStream().setBufferCapacity(8);
        properties.getStream().setEmitTimeout(Duration.ofMillis(50));
        EventSink sink = open();

        for (int i = 0; i < 8; i++) {
            assertTrue(sink.emit(thinking("queued " + i)));
        }
        assertFalse(sink.emit(thinking("overflow")));

        assertTrue(context.isCancelled());
    }

    // ===== Heartbeats =====

    @Test
    void shouldSendKeepAliveAfterIdleInterval() {
        EventSink sink = open();

        StepVerifier.create(sink.frames())
                .then(() -> sink.emit(thinking("working")))
                .expectNextMatches(frame -> !frame.isKeepAlive())
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(15)))
                .expectNextMatches(StreamFrame::isKeepAlive)
                .then(() -> sink.emit(done()))
                .expectNextMatches(frame -> frame.event().isTerminal())
                .verifyComplete();
    }

    @Test
    void shouldNotSendKeepAliveWhileEventsFlow() {
        EventSink sink = open();

        StepVerifier.create(sink.frames())
                .then(() -> {
                    scheduler.advanceTimeBy(Duration.ofSeconds(10));
                    sink.emit(thinking("a"));
                    scheduler.advanceTimeBy(Duration.ofSeconds(10));
                    sink.emit(thinking("b"));
                    scheduler.advanceTimeBy(Duration.ofSeconds(10));
                    sink.emit(done());
                })
                .expectNextMatches(frame -> "a".equals(frame.event().payload().get("content")))
                .expectNextMatches(frame -> "b".equals(frame.event().payload().get("content")))
                .expectNextMatches(frame -> frame.event().isTerminal())
                .verifyComplete();
    }

    @Test
    void shouldSurviveLongIdlePeriodWithoutDemand() {
        EventSink sink = open();

        StepVerifier.create(sink.frames(), 0)
                .then(() -> scheduler.advanceTimeBy(Duration.ofHours(1)))
                .then(() -> sink.emit(done()))
                .thenRequest(Long.MAX_VALUE)
                .recordWith(ArrayList::new)
                .thenConsumeWhile(frame -> true)
                .consumeRecordedWith(frames -> assertEquals(1,
                        frames.stream().filter(frame -> !frame.isKeepAlive() && frame.event().isTerminal()).count()))
                .verifyComplete();
    }

    @Test
    void shouldStopHeartbeatsAfterClose() {
        EventSink sink = open();

        StepVerifier.create(sink.frames())
                .then(sink::close)
                .then(() -> scheduler.advanceTimeBy(Duration.ofMinutes(5)))
                .verifyComplete();

        assertSame(context, sink.getContext());
    }

    @Test
    void shouldValidateStreamSettings() {
        properties.getStream().setBufferCapacity(0);

        assertThrows(IllegalArgumentException.class, () -> new EventStreamer(properties, scheduler));

        properties.getStream().setBufferCapacity(16);
        properties.getStream().setHeartbeatInterval(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, () -> new EventStreamer(properties, scheduler));
    }
}
