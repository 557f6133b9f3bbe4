package me.golemcore.orchestrator.domain.model;

/**
 * External dependencies guarded by their own circuit breaker.
 */
public enum Dependency {

    TOOL_BACKEND("tool-backend"),

    REASONING_BACKEND("reasoning-backend");

    private final String id;

    Dependency(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
