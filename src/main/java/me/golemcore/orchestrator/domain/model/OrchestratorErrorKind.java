package me.golemcore.orchestrator.domain.model;

/**
 * Kinds of failure that end a run with a terminal {@code error} event.
 */
public enum OrchestratorErrorKind {

    /**
     * A dependency's circuit breaker rejected the call. The client may retry
     * later.
     */
    DEPENDENCY_UNAVAILABLE("DependencyUnavailable", true),

    /**
     * The reasoning backend failed or timed out mid-run.
     */
    UPSTREAM_FAILURE("UpstreamFailure", true),

    /**
     * Unexpected internal failure.
     */
    INTERNAL("Internal", false);

    private final String wireName;
    private final boolean recoverable;

    OrchestratorErrorKind(String wireName, boolean recoverable) {
        this.wireName = wireName;
        this.recoverable = recoverable;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
