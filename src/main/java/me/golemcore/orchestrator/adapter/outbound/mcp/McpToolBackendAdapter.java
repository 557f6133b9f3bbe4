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

package me.golemcore.orchestrator.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ToolBackendException;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolErrorKind;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ToolBackendPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool backend adapter over a single stdio MCP server started from
 * {@code orchestrator.tools.mcp-command}. The server process is started on
 * first use and restarted on the next call if it has died.
 */
@Component
@Slf4j
public class McpToolBackendAdapter implements ToolBackendPort {

    private final OrchestratorProperties.ToolsProperties toolsProperties;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    private McpClient client;

    public McpToolBackendAdapter(OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.toolsProperties = properties.getTools();
        this.requestTimeout = properties.getBreakers().getToolBackend().getCallTimeout();
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<List<ToolDescriptor>> listTools() {
        return CompletableFuture.supplyAsync(() -> {
            McpClient started = ensureStarted();
            return started.getTools();
        });
    }

    @Override
    public CompletableFuture<Map<String, Object>> invoke(String toolName, Map<String, Object> arguments) {
        McpClient started;
        try {
            started = ensureStarted();
        } catch (ToolBackendException e) {
            return CompletableFuture.failedFuture(e);
        }
        return started.callTool(toolName, arguments);
    }

    private synchronized McpClient ensureStarted() {
        if (client != null && client.isRunning()) {
            return client;
        }
        String command = toolsProperties.getMcpCommand();
        if (command == null || command.isBlank()) {
            throw new ToolBackendException(ToolErrorKind.EXECUTION_FAILED,
                    "Tool backend is not configured (orchestrator.tools.mcp-command)");
        }
        if (client != null) {
            log.warn("[MCP] Server process is not running, restarting");
            client.close();
        }
        McpClient fresh = new McpClient(command, toolsProperties.getMcpEnv(), toolsProperties.getStartupTimeout(),
                requestTimeout, objectMapper);
        try {
            fresh.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolBackendException(ToolErrorKind.EXECUTION_FAILED, "Interrupted while starting MCP server", e);
        } catch (Exception e) { // NOSONAR - start failures are reported as backend failures
            throw new ToolBackendException(ToolErrorKind.EXECUTION_FAILED,
                    "Failed to start MCP server: " + e.getMessage(), e);
        }
        client = fresh;
        return client;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
