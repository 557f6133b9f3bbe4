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
import me.golemcore.orchestrator.domain.model.ToolCallIntent;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Policy deciding which tool calls are destructive and whether a call carries
 * the explicit confirmation they need. A tool is destructive when it is listed
 * in {@code orchestrator.tools.destructive} or its argument schema requires the
 * confirmation field. Confirmation is truthy only for boolean {@code true} or
 * the string {@code "true"}.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    private static final String UNKNOWN = "unknown";

    private final Set<String> destructiveTools;
    private final String confirmationField;

    public ToolConfirmationPolicy(OrchestratorProperties properties) {
        this.destructiveTools = Set.copyOf(properties.getTools().getDestructive());
        this.confirmationField = properties.getTools().getConfirmationField();
        log.info("ToolConfirmationPolicy destructive tools: {}, confirmation field: {}", destructiveTools,
                confirmationField);
    }

    /**
     * Check if a tool is destructive from its name and argument schema.
     */
    public boolean isDestructive(String toolName, Map<String, Object> inputSchema) {
        if (destructiveTools.contains(toolName)) {
            return true;
        }
        if (inputSchema == null) {
            return false;
        }
        Object required = inputSchema.get("required");
        return required instanceof List<?> list && list.contains(confirmationField);
    }

    /**
     * Check if a concrete call is destructive. The intent's own flag, the
     * registry descriptor and the configured list are all honored.
     */
    public boolean isDestructive(ToolCallIntent intent, ToolDescriptor descriptor) {
        if (intent.destructive() || destructiveTools.contains(intent.toolName())) {
            return true;
        }
        return descriptor != null && descriptor.isDestructive();
    }

    public boolean hasConfirmation(Map<String, Object> arguments) {
        if (arguments == null) {
            return false;
        }
        Object value = arguments.get(confirmationField);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value instanceof String text && "true".equalsIgnoreCase(text.trim());
    }

    public String getConfirmationField() {
        return confirmationField;
    }

    /**
     * Build a human-readable description of the action, used in rejection
     * messages fed back to the reasoning backend.
     */
    public String describeAction(ToolCallIntent intent) {
        Map<String, Object> args = intent.arguments();
        return switch (intent.toolName()) {
        case "delete", "delete_todo" -> "Delete todo #" + args.getOrDefault("id", UNKNOWN);
        case "update", "update_todo" -> "Update todo #" + args.getOrDefault("id", UNKNOWN);
        default -> intent.toolName() + ": " + args;
        };
    }
}
