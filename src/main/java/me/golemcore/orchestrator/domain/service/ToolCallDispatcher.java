package me.golemcore.orchestrator.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.CircuitOpenException;
import me.golemcore.orchestrator.domain.model.Dependency;
import me.golemcore.orchestrator.domain.model.RequestContext;
import me.golemcore.orchestrator.domain.model.StreamEvent;
import me.golemcore.orchestrator.domain.model.ToolBackendException;
import me.golemcore.orchestrator.domain.model.ToolCallIntent;
import me.golemcore.orchestrator.domain.model.ToolCallResult;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolErrorKind;
import me.golemcore.orchestrator.observability.OrchestratorMetrics;
import me.golemcore.orchestrator.observability.RequestEventLog;
import me.golemcore.orchestrator.port.outbound.ToolBackendPort;
import me.golemcore.orchestrator.resilience.CircuitBreaker;
import me.golemcore.orchestrator.resilience.CircuitBreakerRegistry;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Tool-call dispatch: registry lookup, destructive-action gating, local
 * argument validation, then a circuit-broken, time-limited tool backend call.
 *
 * <p>
 * Gated, unknown and locally invalid calls never reach the backend and never
 * touch the breaker; they produce a single failed {@code tool_call} event.
 * Calls that do reach the backend produce an {@code in_progress} event before
 * the call and a {@code success}/{@code failed} event after it. Every failure
 * is returned as a failed {@link ToolCallResult}, never as an error signal.
 *
 * <p>
 * If the request is cancelled while a call is in flight, the backend call is
 * left to complete but its result is discarded and not counted by the breaker.
 */
@Service
@Slf4j
public class ToolCallDispatcher {

    private final ToolRegistry toolRegistry;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final ToolArgumentValidator argumentValidator;
    private final ToolBackendPort toolBackendPort;
    private final CircuitBreaker breaker;
    private final RequestEventLog eventLog;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    public ToolCallDispatcher(ToolRegistry toolRegistry, ToolConfirmationPolicy confirmationPolicy,
            ToolArgumentValidator argumentValidator, ToolBackendPort toolBackendPort,
            CircuitBreakerRegistry circuitBreakers, RequestEventLog eventLog, OrchestratorMetrics metrics,
            Clock clock) {
        this.toolRegistry = toolRegistry;
        this.confirmationPolicy = confirmationPolicy;
        this.argumentValidator = argumentValidator;
        this.toolBackendPort = toolBackendPort;
        this.breaker = circuitBreakers.get(Dependency.TOOL_BACKEND);
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Dispatch one intent on behalf of a request, emitting its tool_call events
     * to the request's sink. Completes empty if the request is cancelled before
     * a result is available.
     */
    public Mono<ToolCallResult> dispatch(ToolCallIntent rawIntent, RequestContext context, EventSink sink) {
        return Mono.defer(() -> {
            if (context.isCancelled()) {
                return Mono.empty();
            }
            long startedAt = clock.millis();
            ToolCallIntent intent = normalize(rawIntent);
            Optional<ToolDescriptor> descriptor = toolRegistry.find(intent.toolName());

            if (confirmationPolicy.isDestructive(intent, descriptor.orElse(null))
                    && !confirmationPolicy.hasConfirmation(intent.arguments())) {
                log.info("[Tools] Blocked unconfirmed destructive call '{}' for {}", intent.toolName(),
                        context.id());
                return finish(context, sink, intent, ToolCallResult.failure(intent.callId(), intent.toolName(),
                        ToolErrorKind.INVALID_ARGUMENTS,
                        confirmationPolicy.describeAction(intent) + " requires explicit confirmation ("
                                + confirmationPolicy.getConfirmationField() + "=true)"),
                        startedAt);
            }

            if (descriptor.isEmpty()) {
                String available = String.join(", ", toolRegistry.names());
                return finish(context, sink, intent, ToolCallResult.failure(intent.callId(), intent.toolName(),
                        ToolErrorKind.NOT_FOUND,
                        "Unknown tool: " + intent.toolName() + ". Available tools: " + available),
                        startedAt);
            }

            Optional<String> violation = toolRegistry.schemaFor(intent.toolName())
                    .flatMap(schema -> argumentValidator.validate(schema, intent.arguments()));
            if (violation.isPresent()) {
                return finish(context, sink, intent, ToolCallResult.failure(intent.callId(), intent.toolName(),
                        ToolErrorKind.INVALID_ARGUMENTS, violation.get()), startedAt);
            }

            sink.emit(StreamEvent.toolCallStarted(context.id(), clock.instant(), intent));
            return breaker
                    .guard(() -> Mono
                            .fromFuture(() -> toolBackendPort.invoke(intent.toolName(), intent.arguments()), true)
                            .timeout(breaker.getConfig().getCallTimeout()))
                    .map(payload -> ToolCallResult.success(intent.callId(), intent.toolName(), payload))
                    .defaultIfEmpty(ToolCallResult.success(intent.callId(), intent.toolName(), Map.of()))
                    .onErrorResume(error -> Mono.just(toFailure(intent, error)))
                    .publishOn(Schedulers.boundedElastic())
                    .flatMap(result -> finish(context, sink, intent, result, startedAt));
        });
    }

    private Mono<ToolCallResult> finish(RequestContext context, EventSink sink, ToolCallIntent intent,
            ToolCallResult result, long startedAt) {
        long durationMs = clock.millis() - startedAt;
        result.setDurationMs(durationMs);

        if (context.isCancelled()) {
            log.debug("[Tools] Discarding result of '{}' for cancelled request {}", intent.toolName(),
                    context.id());
            return Mono.empty();
        }

        metrics.toolCalled(intent.toolName(), result.isSuccess(), durationMs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("toolName", intent.toolName());
        details.put("success", result.isSuccess());
        if (!result.isSuccess()) {
            details.put("errorKind", result.getErrorKind().getWireName());
            details.put("error", result.getErrorMessage());
        }
        eventLog.timed(context, "tool_call", durationMs, details);

        sink.emit(StreamEvent.toolCallFinished(context.id(), clock.instant(), intent, result));
        return Mono.just(result);
    }

    private ToolCallResult toFailure(ToolCallIntent intent, Throwable error) {
        Throwable cause = unwrap(error);
        ToolErrorKind kind;
        String message;
        if (cause instanceof CircuitOpenException open) {
            metrics.breakerRejected(Dependency.TOOL_BACKEND);
            kind = ToolErrorKind.DEPENDENCY_UNAVAILABLE;
            message = "Tool backend unavailable: " + open.getMessage();
        } else if (cause instanceof TimeoutException) {
            kind = ToolErrorKind.TIMEOUT;
            message = "Tool '" + intent.toolName() + "' timed out after " + breaker.getConfig().getCallTimeout();
        } else if (cause instanceof ToolBackendException backendError) {
            kind = backendError.getKind();
            message = backendError.getMessage();
        } else {
            log.error("[Tools] Tool execution failed: {}", intent.toolName(), cause);
            kind = ToolErrorKind.EXECUTION_FAILED;
            message = "Tool execution failed: " + safeCauseMessage(cause);
        }
        log.debug("[Tools] '{}' failed: {} ({})", intent.toolName(), kind, message);
        return ToolCallResult.failure(intent.callId(), intent.toolName(), kind, message);
    }

    private ToolCallIntent normalize(ToolCallIntent intent) {
        String toolName = sanitizeToolName(intent.toolName());
        if (toolName == null || toolName.equals(intent.toolName())) {
            return intent;
        }
        return new ToolCallIntent(intent.callId(), toolName, intent.arguments(), intent.destructive());
    }

    /**
     * Strip special tokens and garbage some models leak into tool call names,
     * e.g. {@code create<|channel|>commentary}.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
