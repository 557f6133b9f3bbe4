package me.golemcore.orchestrator.observability;

import org.slf4j.MDC;

/**
 * MDC scope putting a request's correlation id into log lines written inside
 * it.
 */
public final class RequestLogScope implements AutoCloseable {

    public static final String MDC_REQUEST_ID = "requestId";

    private final String previous;

    public RequestLogScope(String requestId) {
        this.previous = MDC.get(MDC_REQUEST_ID);
        if (requestId != null) {
            MDC.put(MDC_REQUEST_ID, requestId);
        }
    }

    @Override
    public void close() {
        if (previous != null) {
            MDC.put(MDC_REQUEST_ID, previous);
        } else {
            MDC.remove(MDC_REQUEST_ID);
        }
    }
}
