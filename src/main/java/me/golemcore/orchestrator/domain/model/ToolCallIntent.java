package me.golemcore.orchestrator.domain.model;

import java.util.Map;

/**
 * Tool call requested by the reasoning backend. Consumed once by the
 * dispatcher.
 */
public record ToolCallIntent(String callId, String toolName, Map<String, Object> arguments, boolean destructive) {

    public ToolCallIntent {
        arguments = arguments != null ? arguments : Map.of();
    }

    public static ToolCallIntent of(String callId, String toolName, Map<String, Object> arguments) {
        return new ToolCallIntent(callId, toolName, arguments, false);
    }
}
