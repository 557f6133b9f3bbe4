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
import lombok.Data;

import java.util.Map;

/**
 * Outcome of dispatching one tool call. Fed back into the reasoning loop and
 * forwarded to the event stream.
 */
@Data
@Builder
public class ToolCallResult {

    private String callId;
    private String toolName;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private Map<String, Object> payload;
    private ToolErrorKind errorKind;
    private String errorMessage;
    private long durationMs;

    /**
     * Creates a successful result carrying the backend response.
     */
    public static ToolCallResult success(String callId, String toolName, Map<String, Object> payload) {
        return ToolCallResult.builder()
                .callId(callId)
                .toolName(toolName)
                .success(true)
                .payload(payload)
                .build();
    }

    /**
     * Creates a failed result with a machine-readable kind.
     */
    public static ToolCallResult failure(String callId, String toolName, ToolErrorKind errorKind,
            String errorMessage) {
        return ToolCallResult.builder()
                .callId(callId)
                .toolName(toolName)
                .success(false)
                .errorKind(errorKind)
                .errorMessage(errorMessage)
                .build();
    }
}
