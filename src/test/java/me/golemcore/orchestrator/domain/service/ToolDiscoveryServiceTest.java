package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ToolBackendException;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolErrorKind;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ToolBackendPort;
import me.golemcore.orchestrator.resilience.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolDiscoveryServiceTest {

    private OrchestratorProperties properties;
    private ToolBackendPort toolBackendPort;
    private ToolRegistry registry;
    private ToolDiscoveryService service;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getTools().setStartupTimeout(Duration.ofMillis(200));
        toolBackendPort = mock(ToolBackendPort.class);
        registry = new ToolRegistry(new ObjectMapper());
        service = new ToolDiscoveryService(toolBackendPort, new CircuitBreakerRegistry(properties, Clock.systemUTC()),
                registry, new ToolConfirmationPolicy(properties), properties);
    }

    @Test
    void shouldRegisterDiscoveredToolsAndMarkDestructive() {
        ToolDescriptor purge = ToolDescriptor.builder()
                .name("purge")
                .inputSchema(Map.of("type", "object", "required", List.of("confirmation")))
                .build();
        ToolDescriptor create = ToolDescriptor.builder().name("create").build();
        when(toolBackendPort.listTools()).thenReturn(CompletableFuture.completedFuture(List.of(create, purge)));

        List<ToolDescriptor> tools = service.discover();

        assertEquals(List.of("create", "purge"), registry.names());
        assertFalse(tools.get(0).isDestructive());
        assertTrue(tools.get(1).isDestructive());
    }

    @Test
    void shouldFallBackToBuiltinsWhenDiscoveryFails() {
        when(toolBackendPort.listTools()).thenReturn(CompletableFuture.failedFuture(
                new ToolBackendException(ToolErrorKind.EXECUTION_FAILED, "not configured")));

        service.discover();

        assertEquals(List.of("create", "list", "update", "delete"), registry.names());
        assertTrue(registry.find("delete").orElseThrow().isDestructive());
        assertFalse(registry.find("create").orElseThrow().isDestructive());
    }

    @Test
    void shouldFallBackToBuiltinsWhenDiscoveryTimesOut() {
        when(toolBackendPort.listTools()).thenReturn(new CompletableFuture<>());

        service.discover();

        assertEquals(4, registry.all().size());
    }

    @Test
    void shouldFallBackToBuiltinsWhenBackendHasNoTools() {
        when(toolBackendPort.listTools()).thenReturn(CompletableFuture.completedFuture(List.of()));

        service.discover();

        assertTrue(registry.find("create").isPresent());
    }

    @Test
    void shouldDescribeBuiltinContracts() {
        Map<String, Object> createSchema = ToolDiscoveryService.builtinDescriptors().get(0).getInputSchema();

        assertEquals(List.of("title"), createSchema.get("required"));
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> properties = (Map<String, Map<String, Object>>) createSchema
                .get("properties");
        assertEquals(200, properties.get("title").get("maxLength"));
        assertEquals(2000, properties.get("description").get("maxLength"));
    }
}
