package me.golemcore.orchestrator.adapter.outbound.reasoning;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ReasoningFragment;
import me.golemcore.orchestrator.domain.model.ReasoningMessage;
import me.golemcore.orchestrator.domain.model.ReasoningRequest;
import me.golemcore.orchestrator.domain.model.ToolCallIntent;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ReasoningPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reasoning backend adapter using the langchain4j OpenAI-compatible chat
 * model. The default endpoint is Gemini's OpenAI-compatible API.
 *
 * <p>
 * Each reasoning turn is one chat completion with function calling. The
 * response is split into fragments: the assistant text first, then one
 * fragment per tool execution request, in the order the model produced them.
 * The client performs no retries; retry policy belongs to the caller.
 *
 * <p>
 * Configuration via {@code orchestrator.reasoning.*}.
 */
@Component
@Slf4j
public class Langchain4jReasoningAdapter implements ReasoningPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;

    @Autowired
    public Langchain4jReasoningAdapter(OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    Langchain4jReasoningAdapter(OrchestratorProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
    }

    @Override
    public String getModel() {
        return properties.getReasoning().getModel();
    }

    @Override
    public Flux<ReasoningFragment> stream(ReasoningRequest request) {
        return Mono.fromCallable(() -> chat(request))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(response -> Flux.fromIterable(toFragments(response)));
    }

    private ChatResponse chat(ReasoningRequest request) {
        ChatModel model = getChatModel();
        List<ChatMessage> messages = convertMessages(request);
        List<ToolSpecification> tools = convertTools(request.getTools());

        log.debug("[Reasoning] Calling {} with {} messages and {} tools for {}", getModel(), messages.size(),
                tools.size(), request.getRequestId());
        if (tools.isEmpty()) {
            return model.chat(ChatRequest.builder().messages(messages).build());
        }
        return model.chat(ChatRequest.builder()
                .messages(messages)
                .toolSpecifications(tools)
                .build());
    }

    private synchronized ChatModel getChatModel() {
        if (chatModel != null) {
            return chatModel;
        }
        OrchestratorProperties.ReasoningProperties config = properties.getReasoning();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Reasoning backend is not configured (orchestrator.reasoning.api-key)");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(properties.getBreakers().getReasoningBackend().getCallTimeout());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        chatModel = builder.build();
        log.info("[Reasoning] Initialized model {} at {}", config.getModel(), config.getBaseUrl());
        return chatModel;
    }

    List<ReasoningFragment> toFragments(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<ReasoningFragment> fragments = new ArrayList<>();
        if (aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            fragments.add(ReasoningFragment.text(aiMessage.text()));
        }
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                fragments.add(ReasoningFragment.toolCall(
                        ToolCallIntent.of(request.id(), request.name(), parseJsonArgs(request.arguments()))));
            }
            log.trace("[Reasoning] Parsed {} tool calls from response", aiMessage.toolExecutionRequests().size());
        }
        return fragments;
    }

    List<ChatMessage> convertMessages(ReasoningRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (ReasoningMessage msg : request.getMessages()) {
            switch (msg.getRole()) {
            case ReasoningMessage.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case ReasoningMessage.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.callId())
                                    .name(tc.toolName())
                                    .arguments(convertArgsToJson(tc.arguments()))
                                    .build())
                            .toList();
                    if (msg.getContent() != null && !msg.getContent().isBlank()) {
                        messages.add(AiMessage.from(msg.getContent(), toolRequests));
                    } else {
                        messages.add(AiMessage.from(toolRequests));
                    }
                } else if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case ReasoningMessage.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            default -> log.warn("[Reasoning] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDescriptor> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream()
                .map(this::convertToolDescriptor)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDescriptor(ToolDescriptor tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> schemaProperties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (schemaProperties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : schemaProperties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            return JsonIntegerSchema.builder().description(description).build();
        }
        case "number" -> {
            return JsonNumberSchema.builder().description(description).build();
        }
        case "boolean" -> {
            return JsonBooleanSchema.builder().description(description).build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            return JsonStringSchema.builder().description(description).build();
        }
        }
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) { // NOSONAR
            log.warn("[Reasoning] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) { // NOSONAR
            log.warn("[Reasoning] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
