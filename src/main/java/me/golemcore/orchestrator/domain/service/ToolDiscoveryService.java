package me.golemcore.orchestrator.domain.service;

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
import me.golemcore.orchestrator.domain.model.Dependency;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ToolBackendPort;
import me.golemcore.orchestrator.resilience.CircuitBreakerRegistry;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Populates the {@link ToolRegistry} once at startup.
 *
 * <p>
 * Tools are fetched from the tool backend through its circuit breaker. When
 * discovery fails or returns nothing, the built-in todo descriptors are
 * registered instead so the reasoning backend still sees the tool contracts.
 * Each descriptor is marked destructive per {@link ToolConfirmationPolicy}.
 */
@Service
@Slf4j
public class ToolDiscoveryService {

    private static final String TYPE = "type";
    private static final String STRING = "string";
    private static final String INTEGER = "integer";
    private static final String DESCRIPTION = "description";
    private static final String MAX_LENGTH = "maxLength";

    private final ToolBackendPort toolBackendPort;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ToolRegistry toolRegistry;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final Duration startupTimeout;

    public ToolDiscoveryService(ToolBackendPort toolBackendPort, CircuitBreakerRegistry circuitBreakers,
            ToolRegistry toolRegistry, ToolConfirmationPolicy confirmationPolicy,
            OrchestratorProperties properties) {
        this.toolBackendPort = toolBackendPort;
        this.circuitBreakers = circuitBreakers;
        this.toolRegistry = toolRegistry;
        this.confirmationPolicy = confirmationPolicy;
        this.startupTimeout = properties.getTools().getStartupTimeout();
    }

    public List<ToolDescriptor> discover() {
        List<ToolDescriptor> discovered;
        try {
            discovered = circuitBreakers.get(Dependency.TOOL_BACKEND)
                    .guard(() -> Mono.fromFuture(toolBackendPort::listTools).timeout(startupTimeout))
                    .block();
        } catch (RuntimeException e) { // NOSONAR - any discovery failure falls back to built-ins
            log.warn("[Tools] Tool discovery failed, using built-in descriptors: {}", e.getMessage());
            discovered = null;
        }
        if (discovered == null || discovered.isEmpty()) {
            discovered = builtinDescriptors();
        }

        List<ToolDescriptor> marked = new ArrayList<>();
        for (ToolDescriptor descriptor : discovered) {
            marked.add(ToolDescriptor.builder()
                    .name(descriptor.getName())
                    .description(descriptor.getDescription())
                    .inputSchema(descriptor.getInputSchema())
                    .destructive(descriptor.isDestructive()
                            || confirmationPolicy.isDestructive(descriptor.getName(), descriptor.getInputSchema()))
                    .build());
        }
        toolRegistry.initialize(marked);
        return toolRegistry.all();
    }

    /**
     * Descriptors of the todo operations the tool backend is expected to
     * expose.
     */
    public static List<ToolDescriptor> builtinDescriptors() {
        Map<String, Object> title = property(STRING, "Todo title");
        title.put(MAX_LENGTH, 200);
        Map<String, Object> description = property(STRING, "Optional details");
        description.put(MAX_LENGTH, 2000);
        Map<String, Object> status = property(STRING, "New status");
        status.put("enum", List.of("active", "completed", "archived"));

        Map<String, Object> createProps = new LinkedHashMap<>();
        createProps.put("title", title);
        createProps.put(DESCRIPTION, description);

        Map<String, Object> updateProps = new LinkedHashMap<>();
        updateProps.put("id", property(INTEGER, "Todo id"));
        updateProps.put("title", title);
        updateProps.put(DESCRIPTION, description);
        updateProps.put("status", status);

        Map<String, Object> deleteProps = new LinkedHashMap<>();
        deleteProps.put("id", property(INTEGER, "Todo id"));
        deleteProps.put("confirmation", property("boolean", "Must be true; set only after the user confirmed"));

        return List.of(
                descriptor("create", "Create a new todo", schema(createProps, List.of("title"))),
                descriptor("list", "List all todos, newest first", schema(new LinkedHashMap<>(), List.of())),
                descriptor("update", "Update title, description or status of a todo",
                        schema(updateProps, List.of("id"))),
                descriptor("delete", "Permanently delete a todo", schema(deleteProps, List.of("id", "confirmation"))));
    }

    private static ToolDescriptor descriptor(String name, String description, Map<String, Object> schema) {
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .inputSchema(schema)
                .build();
    }

    private static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "object");
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }

    private static Map<String, Object> property(String type, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put(TYPE, type);
        property.put(DESCRIPTION, description);
        return property;
    }
}
