package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable classification of tool call failures.
 */
public enum ToolErrorKind {

    /**
     * Tool or target record does not exist.
     */
    NOT_FOUND("NotFound"),

    /**
     * Arguments violate the tool schema, or a destructive call lacks
     * confirmation.
     */
    INVALID_ARGUMENTS("InvalidArguments"),

    /**
     * Backend did not answer within the per-call timeout.
     */
    TIMEOUT("Timeout"),

    /**
     * Tool backend circuit breaker rejected the call.
     */
    DEPENDENCY_UNAVAILABLE("DependencyUnavailable"),

    /**
     * Backend failed for any other reason (process died, transport error,
     * unclassified tool error).
     */
    EXECUTION_FAILED("ExecutionFailed");

    private final String wireName;

    ToolErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
