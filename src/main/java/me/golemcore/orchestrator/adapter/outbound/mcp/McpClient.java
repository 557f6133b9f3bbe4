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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ToolBackendException;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for the MCP (Model Context Protocol) tool server over
 * stdio.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Start the server process (via shell command)
 * <li>Send initialize request (JSON-RPC handshake)
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call)
 * <li>Close the process
 * </ol>
 *
 * <p>
 * Responses are read on a daemon thread and matched to requests by JSON-RPC
 * id. Tool failures are classified into {@link ToolErrorKind}: JSON-RPC
 * {@code -32602} and validation messages map to {@code InvalidArguments},
 * "not found" messages to {@code NotFound}, anything else to
 * {@code ExecutionFailed}.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * @see McpToolBackendAdapter
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final int INVALID_PARAMS = -32602;
    private static final int METHOD_NOT_FOUND = -32601;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String command;
    private final Map<String, String> env;
    private final Duration startupTimeout;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile List<ToolDescriptor> cachedTools = List.of();

    public McpClient(String command, Map<String, String> env, Duration startupTimeout, Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.command = command;
        this.env = env;
        this.startupTimeout = startupTimeout;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    /**
     * Start the MCP server process, send initialize, and fetch available tools.
     */
    public List<ToolDescriptor> start() throws IOException, InterruptedException, ExecutionException,
            TimeoutException {
        log.info("[MCP] Starting server: {}", command);

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.redirectErrorStream(false);
        if (env != null) {
            pb.environment().putAll(env);
        }

        process = pb.start();
        running = true;

        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader");
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr");
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            long timeoutMs = startupTimeout.toMillis();
            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-orchestrator",
                            "version", "1.0.0")))
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("[MCP] Initialized: {}", initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = sendRequest("tools/list", Map.of())
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            List<ToolDescriptor> tools = parseToolDescriptors(toolsResult);
            log.info("[MCP] Available tools: {}", tools.stream().map(ToolDescriptor::getName).toList());
            cachedTools = tools;
            return tools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP] Initialization failed, cleaning up: {}", e.getMessage());
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP] Initialization failed, cleaning up: {}", e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Call an MCP tool. Failures complete the future with a classified
     * {@link ToolBackendException}.
     */
    public CompletableFuture<Map<String, Object>> callTool(String name, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()))
                .handle((result, error) -> {
                    if (error != null) {
                        throw toBackendException(name, error);
                    }
                    return parseToolCallResult(name, result);
                });
    }

    /**
     * Send a request and return a future of its result. The entry in the
     * pending map is removed before the returned future completes, including
     * when the request times out after {@code requestTimeout}.
     */
    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, future);
        CompletableFuture<JsonNode> tracked = future
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP] -> {}", json);
            synchronized (this) {
                if (writer == null) {
                    throw new IOException("MCP client is not started");
                }
                writer.write(json);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            future.completeExceptionally(e);
        }

        return tracked;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP] -> (notification) {}", json);
            synchronized (this) {
                writer.write(json);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            log.warn("[MCP] Failed to send notification: {}", e.getMessage());
        }
    }

    /**
     * Route one line read from the server to the pending request it answers.
     */
    void handleMessage(String line) {
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            if (idNode == null || !idNode.isInt()) {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP] Server notification: {}", method);
                return;
            }

            CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
            if (pending == null) {
                log.warn("[MCP] Received response for unknown id: {}", idNode.asInt());
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP] Failed to parse response: {}", e.getMessage());
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    log.debug("[MCP] <- {}", line);
                    handleMessage(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP] Reader thread error: {}", e.getMessage());
            }
        } finally {
            running = false;
            failPending(new IOException("MCP process closed"));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP] stderr: {}", line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP] Stderr drain ended: {}", e.getMessage());
            }
        }
    }

    List<ToolDescriptor> parseToolDescriptors(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDescriptor> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP] Failed to parse inputSchema for tool '{}': {}", name, e.getMessage());
                }
            }

            tools.add(ToolDescriptor.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    /**
     * Turn a tools/call result into the response payload. Structured content is
     * preferred; otherwise text content is parsed as JSON when possible.
     */
    Map<String, Object> parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            throw new ToolBackendException(ToolErrorKind.EXECUTION_FAILED, "No result from MCP tool: " + toolName);
        }

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);
        if (isError) {
            String message = output.isEmpty() ? "MCP tool error" : output.toString();
            throw new ToolBackendException(classify(0, message), message);
        }

        JsonNode structured = result.get("structuredContent");
        if (structured != null && structured.isObject()) {
            return objectMapper.convertValue(structured, MAP_TYPE_REF);
        }
        return parseTextPayload(output.toString());
    }

    private Map<String, Object> parseTextPayload(String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (text.isEmpty()) {
            return payload;
        }
        try {
            JsonNode parsed = objectMapper.readTree(text);
            if (parsed.isObject()) {
                return objectMapper.convertValue(parsed, MAP_TYPE_REF);
            }
            if (parsed.isArray()) {
                payload.put("items", objectMapper.convertValue(parsed, List.class));
                return payload;
            }
        } catch (JsonProcessingException e) {
            log.trace("[MCP] Tool output is plain text");
        }
        payload.put("text", text);
        return payload;
    }

    /**
     * Classify an MCP failure from its JSON-RPC code and message.
     */
    static ToolErrorKind classify(int code, String message) {
        if (code == INVALID_PARAMS) {
            return ToolErrorKind.INVALID_ARGUMENTS;
        }
        String lower = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (code == METHOD_NOT_FOUND || lower.contains("not found") || lower.contains("unknown tool")) {
            return ToolErrorKind.NOT_FOUND;
        }
        if (lower.contains("validation") || lower.contains("invalid") || lower.contains("must be")
                || lower.contains("required")) {
            return ToolErrorKind.INVALID_ARGUMENTS;
        }
        return ToolErrorKind.EXECUTION_FAILED;
    }

    private ToolBackendException toBackendException(String toolName, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ToolBackendException backendException) {
            return backendException;
        }
        if (cause instanceof TimeoutException) {
            return new ToolBackendException(ToolErrorKind.TIMEOUT,
                    "MCP tool call '" + toolName + "' timed out after " + requestTimeout, cause);
        }
        if (cause instanceof McpException mcpException) {
            return new ToolBackendException(classify(mcpException.getCode(), mcpException.getMessage()),
                    mcpException.getMessage(), mcpException);
        }
        return new ToolBackendException(ToolErrorKind.EXECUTION_FAILED,
                "MCP tool call '" + toolName + "' failed: " + cause.getMessage(), cause);
    }

    private void failPending(Throwable error) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(error);
        }
        pendingRequests.clear();
    }

    public List<ToolDescriptor> getTools() {
        return cachedTools;
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        log.info("[MCP] Closing client");
        running = false;
        failPending(new IOException("MCP client closing"));

        synchronized (this) {
            if (writer != null) {
                try {
                    writer.close();
                } catch (IOException e) {
                    log.debug("[MCP] Error closing writer: {}", e.getMessage());
                }
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
