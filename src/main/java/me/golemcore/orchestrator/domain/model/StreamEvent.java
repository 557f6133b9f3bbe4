package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle event of a single request, in emission order. {@code ERROR} and
 * {@code DONE} are terminal.
 */
@Builder
public record StreamEvent(StreamEventType type, String requestId, Instant timestamp, Map<String, Object> payload) {

    public static final String STATUS_IN_PROGRESS = "in_progress";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    public boolean isTerminal() {
        return type.isTerminal();
    }

    public static StreamEvent thinking(String requestId, Instant timestamp, String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", content);
        return of(StreamEventType.THINKING, requestId, timestamp, payload);
    }

    public static StreamEvent toolCallStarted(String requestId, Instant timestamp, ToolCallIntent intent) {
        Map<String, Object> payload = toolCallPayload(intent, STATUS_IN_PROGRESS);
        return of(StreamEventType.TOOL_CALL_STARTED, requestId, timestamp, payload);
    }

    public static StreamEvent toolCallFinished(String requestId, Instant timestamp, ToolCallIntent intent,
            ToolCallResult result) {
        Map<String, Object> payload = toolCallPayload(intent, result.isSuccess() ? STATUS_SUCCESS : STATUS_FAILED);
        if (result.isSuccess()) {
            payload.put("result", result.getPayload());
        } else {
            payload.put("errorKind", result.getErrorKind().getWireName());
            payload.put("error", result.getErrorMessage());
        }
        payload.put("durationMs", result.getDurationMs());
        return of(StreamEventType.TOOL_CALL_FINISHED, requestId, timestamp, payload);
    }

    public static StreamEvent responseDelta(String requestId, Instant timestamp, String delta, String accumulated) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("delta", delta);
        payload.put("accumulated", accumulated);
        return of(StreamEventType.RESPONSE_DELTA, requestId, timestamp, payload);
    }

    public static StreamEvent error(String requestId, Instant timestamp, OrchestratorErrorKind kind, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("errorKind", kind.getWireName());
        payload.put("message", message);
        payload.put("recoverable", kind.isRecoverable());
        return of(StreamEventType.ERROR, requestId, timestamp, payload);
    }

    public static StreamEvent done(String requestId, Instant timestamp, String finalOutput, List<String> toolsCalled) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("finalOutput", finalOutput);
        payload.put("toolsCalled", List.copyOf(toolsCalled));
        payload.put("success", true);
        return of(StreamEventType.DONE, requestId, timestamp, payload);
    }

    private static Map<String, Object> toolCallPayload(ToolCallIntent intent, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("callId", intent.callId());
        payload.put("toolName", intent.toolName());
        payload.put("arguments", intent.arguments());
        payload.put("status", status);
        return payload;
    }

    private static StreamEvent of(StreamEventType type, String requestId, Instant timestamp,
            Map<String, Object> payload) {
        return StreamEvent.builder()
                .type(type)
                .requestId(requestId)
                .timestamp(timestamp)
                .payload(Collections.unmodifiableMap(payload))
                .build();
    }
}
