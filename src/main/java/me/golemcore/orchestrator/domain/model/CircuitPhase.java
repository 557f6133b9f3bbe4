package me.golemcore.orchestrator.domain.model;

/**
 * Circuit breaker phases.
 */
public enum CircuitPhase {

    /**
     * Calls pass through; consecutive failures are counted.
     */
    CLOSED,

    /**
     * Calls are rejected without reaching the dependency.
     */
    OPEN,

    /**
     * A bounded number of probe calls are let through to test recovery.
     */
    HALF_OPEN
}
