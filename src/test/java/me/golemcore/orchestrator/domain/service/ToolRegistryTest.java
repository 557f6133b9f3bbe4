package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private static ToolDescriptor tool(String name, String description) {
        return ToolDescriptor.builder().name(name).description(description).build();
    }

    @Test
    void shouldBeEmptyBeforeInitialization() {
        ToolRegistry registry = new ToolRegistry(new ObjectMapper());

        assertFalse(registry.isInitialized());
        assertTrue(registry.all().isEmpty());
        assertTrue(registry.find("create").isEmpty());
    }

    @Test
    void shouldKeepOrderAndFirstDuplicate() {
        ToolRegistry registry = new ToolRegistry(new ObjectMapper());

        registry.initialize(List.of(tool("create", "first"), tool("list", "list"), tool("create", "second"),
                tool(" ", "blank")));

        assertEquals(List.of("create", "list"), registry.names());
        assertEquals("first", registry.find("create").orElseThrow().getDescription());
    }

    @Test
    void shouldInitializeOnlyOnce() {
        ToolRegistry registry = new ToolRegistry(new ObjectMapper());
        registry.initialize(List.of(tool("create", "c")));
        List<ToolDescriptor> replacement = List.of(tool("list", "l"));

        assertThrows(IllegalStateException.class, () -> registry.initialize(replacement));
        assertEquals(List.of("create"), registry.names());
    }
}
