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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Conversation message exchanged with the reasoning backend within one
 * request. Roles: {@code user}, {@code assistant}, {@code tool}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasoningMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;
    private List<ToolCallIntent> toolCalls;
    private String toolCallId;
    private String toolName;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static ReasoningMessage user(String content) {
        return ReasoningMessage.builder().role(ROLE_USER).content(content).build();
    }

    public static ReasoningMessage assistant(String content, List<ToolCallIntent> toolCalls) {
        return ReasoningMessage.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .toolCalls(toolCalls)
                .build();
    }

    public static ReasoningMessage toolResult(String toolCallId, String toolName, String content) {
        return ReasoningMessage.builder()
                .role(ROLE_TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }
}
