package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private String status;
    private long uptimeMs;
    private String model;
    private List<String> tools;
    private Map<String, BreakerStatus> breakers;
    private Map<String, Object> metrics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BreakerStatus {
        private String phase;
        private int consecutiveFailures;
        private int consecutiveProbeSuccesses;
        private int probesInFlight;
        private Instant openedAt;
        private long rejectedCalls;
        private int failureThreshold;
        private int probeQuota;
    }
}
