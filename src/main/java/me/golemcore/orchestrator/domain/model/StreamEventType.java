package me.golemcore.orchestrator.domain.model;

/**
 * Logical stream event variants with their wire event names. Tool call start
 * and finish share the {@code tool_call} wire name and differ by status.
 */
public enum StreamEventType {

    THINKING("thinking", false),

    TOOL_CALL_STARTED("tool_call", false),

    TOOL_CALL_FINISHED("tool_call", false),

    RESPONSE_DELTA("response_delta", false),

    ERROR("error", true),

    DONE("done", true);

    private final String wireName;
    private final boolean terminal;

    StreamEventType(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
