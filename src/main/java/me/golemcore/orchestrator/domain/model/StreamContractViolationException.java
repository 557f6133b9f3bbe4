package me.golemcore.orchestrator.domain.model;

/**
 * Programming error: an event was emitted after the request's stream reached
 * a terminal event or was closed.
 */
public class StreamContractViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public StreamContractViolationException(String message) {
        super(message);
    }
}
