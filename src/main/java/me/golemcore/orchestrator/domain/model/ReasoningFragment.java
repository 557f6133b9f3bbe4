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

/**
 * One element of the reasoning backend's output sequence.
 */
public record ReasoningFragment(Kind kind, String text, ToolCallIntent toolCall) {

    public enum Kind {
        TEXT, THINKING, TOOL_CALL
    }

    public static ReasoningFragment text(String text) {
        return new ReasoningFragment(Kind.TEXT, text, null);
    }

    public static ReasoningFragment thinking(String text) {
        return new ReasoningFragment(Kind.THINKING, text, null);
    }

    public static ReasoningFragment toolCall(ToolCallIntent intent) {
        return new ReasoningFragment(Kind.TOOL_CALL, null, intent);
    }
}
