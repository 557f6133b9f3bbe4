package me.golemcore.orchestrator.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ToolBackendException;
import me.golemcore.orchestrator.domain.model.ToolErrorKind;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpToolBackendAdapterTest {

    @Test
    void shouldFailCallsWhenBackendIsNotConfigured() {
        McpToolBackendAdapter adapter = new McpToolBackendAdapter(new OrchestratorProperties(), new ObjectMapper());

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> adapter.invoke("list", Map.of()).get(1, TimeUnit.SECONDS));

        ToolBackendException cause = assertInstanceOf(ToolBackendException.class, failure.getCause());
        assertEquals(ToolErrorKind.EXECUTION_FAILED, cause.getKind());
        assertTrue(cause.getMessage().contains("orchestrator.tools.mcp-command"));
    }

    @Test
    void shouldFailDiscoveryWhenBackendIsNotConfigured() {
        McpToolBackendAdapter adapter = new McpToolBackendAdapter(new OrchestratorProperties(), new ObjectMapper());

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> adapter.listTools().get(1, TimeUnit.SECONDS));

        assertInstanceOf(ToolBackendException.class, failure.getCause());
        adapter.shutdown();
    }
}
