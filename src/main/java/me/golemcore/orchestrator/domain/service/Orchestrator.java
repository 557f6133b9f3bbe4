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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.CircuitOpenException;
import me.golemcore.orchestrator.domain.model.Dependency;
import me.golemcore.orchestrator.domain.model.OrchestratorErrorKind;
import me.golemcore.orchestrator.domain.model.OrchestratorPhase;
import me.golemcore.orchestrator.domain.model.ReasoningBackendException;
import me.golemcore.orchestrator.domain.model.ReasoningFragment;
import me.golemcore.orchestrator.domain.model.ReasoningMessage;
import me.golemcore.orchestrator.domain.model.ReasoningRequest;
import me.golemcore.orchestrator.domain.model.RequestContext;
import me.golemcore.orchestrator.domain.model.StreamContractViolationException;
import me.golemcore.orchestrator.domain.model.StreamEvent;
import me.golemcore.orchestrator.domain.model.StreamFrame;
import me.golemcore.orchestrator.domain.model.ToolCallIntent;
import me.golemcore.orchestrator.domain.model.ToolCallResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.observability.OrchestratorMetrics;
import me.golemcore.orchestrator.observability.RequestEventLog;
import me.golemcore.orchestrator.port.outbound.ReasoningPort;
import me.golemcore.orchestrator.resilience.CircuitBreaker;
import me.golemcore.orchestrator.resilience.CircuitBreakerRegistry;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Top-level coordinator of a single request.
 *
 * <p>
 * Each run follows {@code Admitted -> Reasoning -> (Dispatching)* ->
 * Finalizing -> Done | Error}:
 * <ol>
 * <li>Opens a reasoning turn through the reasoning backend breaker. An open
 * breaker ends the run with {@code error{DependencyUnavailable}}.</li>
 * <li>Consumes the turn's fragments in order: text becomes
 * {@code response_delta}, thinking becomes {@code thinking}, tool-call intents
 * are dispatched and their results folded into the next turn.</li>
 * <li>A turn that produced tool calls is followed by another turn; a turn
 * without tool calls finalizes the run with {@code done}.</li>
 * <li>Backend failures and timeouts end the run with
 * {@code error{UpstreamFailure}}; nothing is retried within a run.</li>
 * </ol>
 *
 * <p>
 * Exactly one terminal event is emitted per run unless the client disconnects,
 * in which case the run is abandoned and nothing further is emitted. Each run
 * is one independent subscription; no per-request state is shared between
 * runs.
 */
@Service
@Slf4j
public class Orchestrator {

    static final String INITIAL_THINKING = "Processing your request and analyzing intent...";
    static final String DEFAULT_FINAL_OUTPUT = "Request processed successfully.";

    private final ReasoningPort reasoningPort;
    private final ToolCallDispatcher dispatcher;
    private final ToolRegistry toolRegistry;
    private final CircuitBreaker reasoningBreaker;
    private final EventStreamer eventStreamer;
    private final RequestEventLog eventLog;
    private final OrchestratorMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final OrchestratorProperties.ReasoningProperties reasoningProperties;
    private final Scheduler runScheduler = Schedulers.boundedElastic();

    public Orchestrator(ReasoningPort reasoningPort, ToolCallDispatcher dispatcher, ToolRegistry toolRegistry,
            CircuitBreakerRegistry circuitBreakers, EventStreamer eventStreamer, RequestEventLog eventLog,
            OrchestratorMetrics metrics, ObjectMapper objectMapper, OrchestratorProperties properties,
            Clock clock) {
        this.reasoningPort = reasoningPort;
        this.dispatcher = dispatcher;
        this.toolRegistry = toolRegistry;
        this.reasoningBreaker = circuitBreakers.get(Dependency.REASONING_BACKEND);
        this.eventStreamer = eventStreamer;
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.reasoningProperties = properties.getReasoning();
        this.clock = clock;
    }

    /**
     * Start the run of an admitted, tagged request and return its outbound
     * frames. The run starts when the frames are subscribed and is disposed
     * when that subscription is cancelled.
     */
    public Flux<StreamFrame> stream(RequestContext context) {
        EventSink sink = eventStreamer.open(context);
        Flux<StreamFrame> run = execute(context, sink)
                .subscribeOn(runScheduler)
                .thenMany(Flux.empty());
        return sink.frames().mergeWith(run);
    }

    /**
     * Drive the run to its terminal event. Never errors: every failure becomes a
     * terminal {@code error} event.
     */
    Mono<Void> execute(RequestContext context, EventSink sink) {
        RunState state = new RunState(context, clock.millis());
        return Mono.defer(() -> {
            eventLog.info(context, "request_started",
                    Map.of("inputLength", context.request().sanitizedInput().length()));
            state.phase = OrchestratorPhase.REASONING;
            state.history.add(ReasoningMessage.user(context.request().sanitizedInput()));
            sink.emit(StreamEvent.thinking(context.id(), clock.instant(), INITIAL_THINKING));
            return reasoningTurn(state, sink);
        })
                .then(Mono.fromRunnable(() -> finalizeRun(state, sink)))
                .onErrorResume(error -> {
                    fail(state, sink, error);
                    return Mono.empty();
                })
                .doOnCancel(() -> abandon(state, sink))
                .takeUntilOther(context.cancellation().whenCancelled())
                .doFinally(signal -> {
                    if (context.isCancelled()) {
                        abandon(state, sink);
                    }
                })
                .then();
    }

    private Mono<Void> reasoningTurn(RunState state, EventSink sink) {
        return Mono.defer(() -> {
            if (state.turns >= reasoningProperties.getMaxTurns()) {
                return Mono.error(new ReasoningBackendException(
                        "Reasoning did not finish within " + reasoningProperties.getMaxTurns() + " turns"));
            }
            state.turns++;
            metrics.reasoningTurn();
            TurnState turn = new TurnState();
            ReasoningRequest request = ReasoningRequest.builder()
                    .requestId(state.context.id())
                    .systemPrompt(reasoningProperties.getSystemPrompt())
                    .messages(List.copyOf(state.history))
                    .tools(toolRegistry.all())
                    .build();

            return reasoningBreaker
                    .guardMany(() -> reasoningPort.stream(request)
                            .timeout(reasoningBreaker.getConfig().getCallTimeout()))
                    .onErrorMap(this::isUpstreamError,
                            error -> new ReasoningBackendException(describeUpstream(error), error))
                    .concatMap(fragment -> handleFragment(state, turn, fragment, sink))
                    .then(Mono.defer(() -> {
                        state.history.add(ReasoningMessage.assistant(turn.text.toString(), turn.intents));
                        state.history.addAll(turn.toolMessages);
                        if (turn.intents.isEmpty()) {
                            return Mono.empty();
                        }
                        return reasoningTurn(state, sink);
                    }));
        });
    }

    private Mono<Void> handleFragment(RunState state, TurnState turn, ReasoningFragment fragment, EventSink sink) {
        String requestId = state.context.id();
        switch (fragment.kind()) {
        case TEXT -> {
            if (fragment.text() == null || fragment.text().isEmpty()) {
                return Mono.empty();
            }
            state.accumulated.append(fragment.text());
            turn.text.append(fragment.text());
            sink.emit(StreamEvent.responseDelta(requestId, clock.instant(), fragment.text(),
                    state.accumulated.toString()));
            return Mono.empty();
        }
        case THINKING -> {
            if (fragment.text() != null && !fragment.text().isBlank()) {
                sink.emit(StreamEvent.thinking(requestId, clock.instant(), fragment.text()));
            }
            return Mono.empty();
        }
        case TOOL_CALL -> {
            ToolCallIntent intent = withCallId(fragment.toolCall(), turn);
            state.phase = OrchestratorPhase.DISPATCHING;
            turn.intents.add(intent);
            state.toolsCalled.add(intent.toolName());
            return dispatcher.dispatch(intent, state.context, sink)
                    .doOnNext(result -> {
                        turn.toolMessages.add(ReasoningMessage.toolResult(intent.callId(), intent.toolName(),
                                renderToolResult(result)));
                        state.phase = OrchestratorPhase.REASONING;
                    })
                    .then();
        }
        default -> {
            return Mono.empty();
        }
        }
    }

    private void finalizeRun(RunState state, EventSink sink) {
        state.phase = OrchestratorPhase.FINALIZING;
        String finalOutput = state.accumulated.toString().isBlank() ? DEFAULT_FINAL_OUTPUT : state.accumulated.toString();
        List<String> toolsCalled = List.copyOf(state.toolsCalled);
        if (!sink.emit(StreamEvent.done(state.context.id(), clock.instant(), finalOutput, toolsCalled))) {
            return;
        }
        state.phase = OrchestratorPhase.DONE;
        metrics.requestCompleted();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("toolsCalled", toolsCalled);
        details.put("turns", state.turns);
        details.put("outputLength", finalOutput.length());
        eventLog.timed(state.context, "request_completed", clock.millis() - state.startedAt, details);
    }

    private void fail(RunState state, EventSink sink, Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof StreamContractViolationException) {
            log.error("[Orchestrator] Stream contract violated for {}", state.context.id(), cause);
            state.phase = OrchestratorPhase.ERROR;
            return;
        }
        if (state.context.isCancelled() || sink.isTerminated()) {
            log.debug("[Orchestrator] Not reporting failure of {}: {}", state.context.id(), cause.getMessage());
            return;
        }

        OrchestratorErrorKind kind;
        String message;
        if (cause instanceof CircuitOpenException open) {
            metrics.breakerRejected(open.getDependency());
            kind = OrchestratorErrorKind.DEPENDENCY_UNAVAILABLE;
            message = "Reasoning service is temporarily unavailable. Please try again later.";
        } else if (cause instanceof ReasoningBackendException) {
            kind = OrchestratorErrorKind.UPSTREAM_FAILURE;
            message = cause.getMessage();
        } else {
            log.error("[Orchestrator] Unexpected failure in {}", state.context.id(), cause);
            kind = OrchestratorErrorKind.INTERNAL;
            message = "Internal error while processing the request";
        }

        state.phase = OrchestratorPhase.ERROR;
        if (sink.emit(StreamEvent.error(state.context.id(), clock.instant(), kind, message))) {
            metrics.requestFailed();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errorKind", kind.getWireName());
        details.put("message", message);
        details.put("cause", cause.getClass().getSimpleName());
        eventLog.write(state.context, Level.WARN, "request_failed",
                clock.millis() - state.startedAt, details);
    }

    private void abandon(RunState state, EventSink sink) {
        if (!state.abandoned.compareAndSet(false, true) || state.phase.isTerminal()) {
            return;
        }
        metrics.requestCancelled();
        eventLog.info(state.context, "request_cancelled", Map.of("phase", state.phase.name()));
        sink.close();
    }

    private boolean isUpstreamError(Throwable error) {
        return !(error instanceof CircuitOpenException) && !(error instanceof StreamContractViolationException);
    }

    private String describeUpstream(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Reasoning backend timed out after " + reasoningBreaker.getConfig().getCallTimeout();
        }
        String message = error.getMessage();
        return "Reasoning backend failed: " + (message != null ? message : error.getClass().getSimpleName());
    }

    private ToolCallIntent withCallId(ToolCallIntent intent, TurnState turn) {
        if (intent.callId() != null && !intent.callId().isBlank()) {
            return intent;
        }
        return new ToolCallIntent("call_" + (turn.intents.size() + 1), intent.toolName(), intent.arguments(),
                intent.destructive());
    }

    private String renderToolResult(ToolCallResult result) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("success", result.isSuccess());
        if (result.isSuccess()) {
            content.put("result", result.getPayload());
        } else {
            content.put("errorKind", result.getErrorKind().getWireName());
            content.put("error", result.getErrorMessage());
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("[Orchestrator] Failed to serialize tool result: {}", e.getMessage());
            return result.isSuccess() ? "Success" : "Error: " + result.getErrorMessage();
        }
    }

    private static final class RunState {
        private final RequestContext context;
        private final long startedAt;
        private final StringBuilder accumulated = new StringBuilder();
        private final Set<String> toolsCalled = new LinkedHashSet<>();
        private final List<ReasoningMessage> history = new ArrayList<>();
        private final AtomicBoolean abandoned = new AtomicBoolean(false);
        private volatile OrchestratorPhase phase = OrchestratorPhase.ADMITTED;
        private int turns;

        private RunState(RequestContext context, long startedAt) {
            this.context = context;
            this.startedAt = startedAt;
        }
    }

    private static final class TurnState {
        private final StringBuilder text = new StringBuilder();
        private final List<ToolCallIntent> intents = new ArrayList<>();
        private final List<ReasoningMessage> toolMessages = new ArrayList<>();
    }
}
