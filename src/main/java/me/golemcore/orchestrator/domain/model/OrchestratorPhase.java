package me.golemcore.orchestrator.domain.model;

/**
 * Per-request run states.
 */
public enum OrchestratorPhase {
    ADMITTED, REASONING, DISPATCHING, FINALIZING, DONE, ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
