package me.golemcore.orchestrator.domain.service;

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
import me.golemcore.orchestrator.domain.model.RequestContext;
import me.golemcore.orchestrator.domain.model.StreamContractViolationException;
import me.golemcore.orchestrator.domain.model.StreamEvent;
import me.golemcore.orchestrator.domain.model.StreamFrame;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Outbound event channel of one request.
 *
 * <p>
 * The producer side ({@link #emit(StreamEvent)}, {@link #close()}) is
 * serialized, so events reach the client in emission order. The channel holds
 * at most {@code capacity} undelivered events; when it is full, {@code emit}
 * parks until the client catches up or the emit timeout passes, in which case
 * the client is treated as gone and the request is cancelled.
 *
 * <p>
 * The consumer side ({@link #frames()}) may be subscribed once. Cancelling
 * that subscription triggers the request's cancellation token; events emitted
 * afterwards are dropped. Keep-alive frames are interleaved whenever the
 * channel has been idle for the heartbeat interval; they are not events and
 * never count towards ordering.
 */
@Slf4j
public class EventSink {

    private static final long PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(1);
    private static final int HEARTBEAT_CHECKS_PER_INTERVAL = 5;

    private final RequestContext context;
    private final Sinks.Many<StreamEvent> events;
    private final Sinks.Empty<Void> closedSignal = Sinks.empty();
    private final Scheduler scheduler;
    private final long heartbeatIntervalMs;
    private final Duration emitTimeout;
    private final Flux<StreamFrame> frames;

    private volatile long lastActivityMs;
    private StreamEvent terminalEvent;
    private boolean closed;

    EventSink(RequestContext context, int capacity, Duration heartbeatInterval, Duration emitTimeout,
            Scheduler scheduler) {
        this.context = context;
        this.events = Sinks.many().unicast().onBackpressureBuffer(Queues.<StreamEvent>get(capacity).get());
        this.scheduler = scheduler;
        this.heartbeatIntervalMs = heartbeatInterval.toMillis();
        this.emitTimeout = emitTimeout;
        this.lastActivityMs = scheduler.now(TimeUnit.MILLISECONDS);
        this.frames = buildFrames(heartbeatInterval);
    }

    /**
     * Append an event to the stream.
     *
     * @return {@code true} if the event was queued for the client,
     *         {@code false} if it was dropped because the request was cancelled
     * @throws StreamContractViolationException
     *             if the stream already carries a terminal event or was closed
     */
    public synchronized boolean emit(StreamEvent event) {
        if (!context.id().equals(event.requestId())) {
            throw new IllegalArgumentException("Event for request " + event.requestId()
                    + " emitted on stream of " + context.id());
        }
        if (terminalEvent != null) {
            throw new StreamContractViolationException("Stream " + context.id() + " already terminated with "
                    + terminalEvent.type() + ", rejected " + event.type());
        }
        if (closed && !context.isCancelled()) {
            throw new StreamContractViolationException("Stream " + context.id() + " is closed, rejected "
                    + event.type());
        }
        if (context.isCancelled()) {
            log.debug("[Stream] Dropping {} for cancelled request {}", event.type(), context.id());
            return false;
        }

        if (event.isTerminal()) {
            terminalEvent = event;
            closedSignal.tryEmitEmpty();
        }
        boolean queued = push(event);
        if (event.isTerminal()) {
            closed = true;
            events.tryEmitComplete();
        }
        return queued;
    }

    /**
     * Close the channel without a terminal event. Used when the request was
     * cancelled; idempotent.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        closedSignal.tryEmitEmpty();
        events.tryEmitComplete();
    }

    /**
     * Outbound frames in emission order, interleaved with keep-alives.
     */
    public Flux<StreamFrame> frames() {
        return frames;
    }

    public synchronized boolean isTerminated() {
        return terminalEvent != null;
    }

    public RequestContext getContext() {
        return context;
    }

    private boolean push(StreamEvent event) {
        long deadline = System.nanoTime() + emitTimeout.toNanos();
        while (true) {
            Sinks.EmitResult result = events.tryEmitNext(event);
            switch (result) {
            case OK -> {
                lastActivityMs = scheduler.now(TimeUnit.MILLISECONDS);
                return true;
            }
            case FAIL_OVERFLOW, FAIL_ZERO_SUBSCRIBER, FAIL_NON_SERIALIZED -> {
                if (System.nanoTime() - deadline > 0) {
                    log.warn("[Stream] Client of {} did not drain events within {}, abandoning request",
                            context.id(), emitTimeout);
                    context.cancellation().cancel();
                    return false;
                }
                LockSupport.parkNanos(PARK_NANOS);
            }
            default -> {
                log.debug("[Stream] Event {} not delivered for {}: {}", event.type(), context.id(), result);
                return false;
            }
            }
        }
    }

    private Flux<StreamFrame> buildFrames(Duration heartbeatInterval) {
        Duration checkPeriod = heartbeatInterval.dividedBy(HEARTBEAT_CHECKS_PER_INTERVAL);
        if (checkPeriod.isZero()) {
            checkPeriod = Duration.ofMillis(1);
        }

        Flux<StreamFrame> eventFrames = events.asFlux().map(StreamFrame::of);
        Flux<StreamFrame> heartbeats = Flux.interval(checkPeriod, scheduler)
                .onBackpressureDrop()
                .filter(tick -> scheduler.now(TimeUnit.MILLISECONDS) - lastActivityMs >= heartbeatIntervalMs)
                .map(tick -> {
                    lastActivityMs = scheduler.now(TimeUnit.MILLISECONDS);
                    return StreamFrame.keepAlive();
                })
                .takeUntilOther(closedSignal.asMono());

        return Flux.merge(eventFrames, heartbeats)
                .doOnCancel(this::onClientCancel);
    }

    private void onClientCancel() {
        if (context.cancellation().cancel()) {
            log.info("[Stream] Client disconnected, cancelling request {}", context.id());
        }
        closedSignal.tryEmitEmpty();
    }
}
