package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link AdmissionProperties} - inbound request limits</li>
 * <li>{@link BreakerProperties} - per-dependency circuit breaker tuning</li>
 * <li>{@link StreamProperties} - outbound event channel and heartbeats</li>
 * <li>{@link ReasoningProperties} - reasoning backend connection</li>
 * <li>{@link ToolsProperties} - tool backend process and confirmation
 * policy</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private AdmissionProperties admission = new AdmissionProperties();
    private BreakersProperties breakers = new BreakersProperties();
    private StreamProperties stream = new StreamProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class AdmissionProperties {
        private int maxInputLength = 5000;
        private long maxBodyBytes = 65536;
    }

    @Data
    public static class BreakersProperties {
        private BreakerProperties toolBackend = BreakerProperties.of(5, Duration.ofSeconds(30), 3,
                Duration.ofSeconds(30));
        private BreakerProperties reasoningBackend = BreakerProperties.of(3, Duration.ofSeconds(60), 2,
                Duration.ofSeconds(30));
    }

    @Data
    public static class BreakerProperties {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int probeQuota = 3;
        private Duration callTimeout = Duration.ofSeconds(30);

        static BreakerProperties of(int failureThreshold, Duration recoveryTimeout, int probeQuota,
                Duration callTimeout) {
            BreakerProperties props = new BreakerProperties();
            props.setFailureThreshold(failureThreshold);
            props.setRecoveryTimeout(recoveryTimeout);
            props.setProbeQuota(probeQuota);
            props.setCallTimeout(callTimeout);
            return props;
        }
    }

    @Data
    public static class StreamProperties {
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private int bufferCapacity = 256;
        private Duration emitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ReasoningProperties {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
        private String apiKey;
        private String model = "gemini-2.5-flash";
        private Double temperature = 0.3;
        private int maxTurns = 10;
        private String systemPrompt = "You are a task management assistant. Use the available tools to create, "
                + "list, update and delete todos. Deleting a todo requires the user's explicit confirmation; "
                + "pass confirmation=true only after the user has confirmed.";
    }

    @Data
    public static class ToolsProperties {
        private String mcpCommand;
        private Map<String, String> mcpEnv = new HashMap<>();
        private Duration startupTimeout = Duration.ofSeconds(10);
        private List<String> destructive = new ArrayList<>(List.of("delete", "delete_todo"));
        private String confirmationField = "confirmation";
    }
}
