package me.golemcore.orchestrator.domain.model;

/**
 * Outbound frame: either a logical stream event or a keep-alive that carries
 * no event.
 */
public record StreamFrame(StreamEvent event) {

    private static final StreamFrame KEEP_ALIVE = new StreamFrame(null);

    public static StreamFrame of(StreamEvent event) {
        return new StreamFrame(event);
    }

    public static StreamFrame keepAlive() {
        return KEEP_ALIVE;
    }

    public boolean isKeepAlive() {
        return event == null;
    }
}
