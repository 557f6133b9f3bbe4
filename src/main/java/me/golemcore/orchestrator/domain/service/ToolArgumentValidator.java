package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.ValidationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Local check of tool arguments against the tool's compiled JSON schema.
 * Types are strict: {@code "7"} is not an integer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolArgumentValidator {

    private final ObjectMapper objectMapper;

    /**
     * Returns the schema violations joined into one message, or empty if the
     * arguments pass.
     */
    public Optional<String> validate(JsonSchema schema, Map<String, Object> arguments) {
        JsonNode node = objectMapper.valueToTree(arguments != null ? arguments : Map.of());
        Set<ValidationMessage> messages = schema.validate(node);
        if (messages.isEmpty()) {
            return Optional.empty();
        }
        String violation = messages.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .collect(Collectors.joining("; "));
        log.debug("[Tools] Argument validation failed: {}", violation);
        return Optional.of("Invalid arguments: " + violation);
    }
}
