package me.golemcore.orchestrator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Orchestrator.
 *
 * <p>
 * GolemCore Orchestrator turns a user message into an ordered stream of
 * lifecycle events while a reasoning backend decides which todo tools to call.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Request Admission</b> - Length, encoding and control-character checks
 * before any work starts</li>
 * <li><b>Circuit Breakers</b> - One breaker per tool and reasoning backend with
 * half-open probing</li>
 * <li><b>Tool Dispatch</b> - MCP tool backend with destructive-action
 * confirmation</li>
 * <li><b>Event Streaming</b> - Server-sent events with heartbeats and
 * disconnect cancellation</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ChatController, HealthController
 * Domain Layer       → Orchestrator, ToolCallDispatcher, EventStreamer
 * Infrastructure     → MCP tool backend, langchain4j reasoning backend
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
