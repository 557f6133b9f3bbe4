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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of tool descriptors. Populated exactly once at startup and
 * read-only afterwards; dispatch is a lookup in it.
 *
 * <p>
 * Each descriptor's input schema is compiled into a {@link JsonSchema}
 * (draft 2020-12) at initialization. A tool whose schema does not compile is
 * still registered, without local argument validation.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private volatile Map<String, ToolDescriptor> tools;
    private volatile Map<String, JsonSchema> schemas = Map.of();

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public synchronized void initialize(Collection<ToolDescriptor> descriptors) {
        if (tools != null) {
            throw new IllegalStateException("Tool registry is already initialized");
        }
        Map<String, ToolDescriptor> byName = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : descriptors) {
            if (descriptor.getName() == null || descriptor.getName().isBlank()) {
                log.warn("[Tools] Skipping tool without a name");
                continue;
            }
            if (byName.putIfAbsent(descriptor.getName(), descriptor) != null) {
                log.warn("[Tools] Duplicate tool '{}', keeping the first definition", descriptor.getName());
            }
        }
        Map<String, JsonSchema> compiled = new LinkedHashMap<>();
        byName.forEach((name, descriptor) -> compile(descriptor).ifPresent(schema -> compiled.put(name, schema)));
        schemas = Collections.unmodifiableMap(compiled);
        tools = Collections.unmodifiableMap(byName);
        log.info("[Tools] Registered {} tools: {}", byName.size(), byName.keySet());
    }

    public boolean isInitialized() {
        return tools != null;
    }

    public Optional<ToolDescriptor> find(String name) {
        Map<String, ToolDescriptor> snapshot = tools;
        if (snapshot == null || name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get(name));
    }

    /**
     * Compiled input schema of a registered tool, empty when the tool is
     * unknown or declares no usable schema.
     */
    public Optional<JsonSchema> schemaFor(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(name));
    }

    public List<ToolDescriptor> all() {
        Map<String, ToolDescriptor> snapshot = tools;
        return snapshot != null ? List.copyOf(snapshot.values()) : List.of();
    }

    public List<String> names() {
        Map<String, ToolDescriptor> snapshot = tools;
        return snapshot != null ? List.copyOf(snapshot.keySet()) : List.of();
    }

    private Optional<JsonSchema> compile(ToolDescriptor descriptor) {
        if (descriptor.getInputSchema() == null || descriptor.getInputSchema().isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode schemaNode = objectMapper.valueToTree(descriptor.getInputSchema());
            JsonSchema schema = schemaFactory.getSchema(schemaNode);
            schema.initializeValidators();
            return Optional.of(schema);
        } catch (JsonSchemaException | IllegalArgumentException e) {
            log.warn("[Tools] Input schema of '{}' does not compile, arguments are not validated locally: {}",
                    descriptor.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
