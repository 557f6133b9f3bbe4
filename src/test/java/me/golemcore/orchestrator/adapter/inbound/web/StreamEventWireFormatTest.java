package me.golemcore.orchestrator.adapter.inbound.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.OrchestratorErrorKind;
import me.golemcore.orchestrator.domain.model.StreamEvent;
import me.golemcore.orchestrator.domain.model.StreamFrame;
import me.golemcore.orchestrator.domain.model.ToolCallIntent;
import me.golemcore.orchestrator.domain.model.ToolCallResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamEventWireFormatTest {

    private static final String REQUEST_ID = "req_k2x_0123456789abcdef";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StreamEventWireFormat wireFormat = new StreamEventWireFormat(objectMapper);

    @Test
    void shouldWriteEventNameAndSingleJsonDataField() {
        ServerSentEvent<String> sse = wireFormat.toServerSentEvent(
                StreamFrame.of(StreamEvent.thinking(REQUEST_ID, NOW, "Looking at your todos")));

        assertEquals("thinking", sse.event());
        assertEquals("{\"requestId\":\"" + REQUEST_ID + "\",\"content\":\"Looking at your todos\"}", sse.data());
        assertNull(sse.comment());
    }

    @Test
    void shouldPutRequestIdFirst() throws Exception {
        StreamEvent event = StreamEvent.done(REQUEST_ID, NOW, "Done.", List.of("create"));

        JsonNode data = objectMapper.readTree(wireFormat.toJson(event));

        Iterator<String> fields = data.fieldNames();
        assertEquals("requestId", fields.next());
        assertEquals("finalOutput", fields.next());
        assertEquals("create", data.get("toolsCalled").get(0).asText());
        assertTrue(data.get("success").asBoolean());
    }

    @Test
    void shouldUseToolCallNameForBothToolCallPhases() throws Exception {
        ToolCallIntent intent = ToolCallIntent.of("call_1", "create", Map.of("title", "buy eggs"));
        ToolCallResult result = ToolCallResult.success("call_1", "create", Map.of("id", 1));

        ServerSentEvent<String> started = wireFormat.toServerSentEvent(
                StreamFrame.of(StreamEvent.toolCallStarted(REQUEST_ID, NOW, intent)));
        ServerSentEvent<String> finished = wireFormat.toServerSentEvent(
                StreamFrame.of(StreamEvent.toolCallFinished(REQUEST_ID, NOW, intent, result)));

        assertEquals("tool_call", started.event());
        assertEquals("tool_call", finished.event());
        assertEquals("in_progress", objectMapper.readTree(started.data()).get("status").asText());
        assertEquals("success", objectMapper.readTree(finished.data()).get("status").asText());
    }

    @Test
    void shouldEncodeErrorPayload() throws Exception {
        ServerSentEvent<String> sse = wireFormat.toServerSentEvent(StreamFrame.of(StreamEvent.error(REQUEST_ID, NOW,
                OrchestratorErrorKind.DEPENDENCY_UNAVAILABLE, "Reasoning backend is unavailable")));

        JsonNode data = objectMapper.readTree(sse.data());
        assertEquals("error", sse.event());
        assertEquals("DependencyUnavailable", data.get("errorKind").asText());
        assertTrue(data.get("recoverable").asBoolean());
    }

    @Test
    void shouldEncodeKeepAliveAsComment() {
        ServerSentEvent<String> sse = wireFormat.toServerSentEvent(StreamFrame.keepAlive());

        assertEquals(StreamEventWireFormat.KEEP_ALIVE_COMMENT, sse.comment());
        assertNull(sse.event());
        assertNull(sse.data());
        assertFalse(StreamFrame.of(StreamEvent.thinking(REQUEST_ID, NOW, "x")).isKeepAlive());
    }
}
