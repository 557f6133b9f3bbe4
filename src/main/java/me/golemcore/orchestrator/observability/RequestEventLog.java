package me.golemcore.orchestrator.observability;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LogEntry;
import me.golemcore.orchestrator.domain.model.RequestContext;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured per-request log. Every entry is built from the request context,
 * so it always carries that request's correlation id; the id is also placed in
 * the MDC while the line is written.
 */
@Component
@Slf4j
public class RequestEventLog {

    private final Clock clock;

    public RequestEventLog(Clock clock) {
        this.clock = clock;
    }

    public LogEntry info(RequestContext context, String eventType, Map<String, Object> details) {
        return write(context, Level.INFO, eventType, null, details);
    }

    public LogEntry timed(RequestContext context, String eventType, long durationMs, Map<String, Object> details) {
        return write(context, Level.INFO, eventType, durationMs, details);
    }

    public LogEntry write(RequestContext context, Level level, String eventType, Long durationMs,
            Map<String, Object> details) {
        Map<String, Object> copy = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
        LogEntry entry = LogEntry.builder()
                .requestId(context.id())
                .timestamp(clock.instant())
                .level(level)
                .eventType(eventType)
                .durationMs(durationMs)
                .details(copy)
                .build();

        try (RequestLogScope ignored = new RequestLogScope(entry.requestId())) {
            String duration = durationMs != null ? " durationMs=" + durationMs : "";
            switch (level) {
            case ERROR -> log.error("[Request] {}{} {}", eventType, duration, copy);
            case WARN -> log.warn("[Request] {}{} {}", eventType, duration, copy);
            case DEBUG -> log.debug("[Request] {}{} {}", eventType, duration, copy);
            case TRACE -> log.trace("[Request] {}{} {}", eventType, duration, copy);
            default -> log.info("[Request] {}{} {}", eventType, duration, copy);
            }
        }
        return entry;
    }
}
