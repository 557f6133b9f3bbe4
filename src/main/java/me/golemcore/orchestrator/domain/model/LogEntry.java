package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.Map;

/**
 * Structured request log record. Immutable once written.
 */
@Builder
public record LogEntry(String requestId, Instant timestamp, Level level, String eventType, Long durationMs,
        Map<String, Object> details) {
}
