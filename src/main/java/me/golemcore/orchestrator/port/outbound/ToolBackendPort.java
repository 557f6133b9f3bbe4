package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.ToolDescriptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the tool backend that executes named operations against durable
 * state. Implementations report classified failures by completing the future
 * with a {@link me.golemcore.orchestrator.domain.model.ToolBackendException}.
 */
public interface ToolBackendPort {

    /**
     * Fetch the tool descriptors exposed by the backend.
     */
    CompletableFuture<List<ToolDescriptor>> listTools();

    /**
     * Invoke a tool and return its structured response.
     */
    CompletableFuture<Map<String, Object>> invoke(String toolName, Map<String, Object> arguments);
}
