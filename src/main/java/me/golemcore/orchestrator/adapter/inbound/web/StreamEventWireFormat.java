package me.golemcore.orchestrator.adapter.inbound.web;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.StreamEvent;
import me.golemcore.orchestrator.domain.model.StreamFrame;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-sent event encoding of stream frames.
 *
 * <p>
 * Each event is written as {@code event: <type>} followed by a single
 * {@code data:} line holding a JSON object whose first field is
 * {@code requestId}, followed by the event payload fields. Keep-alives are SSE
 * comments, which clients ignore.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamEventWireFormat {

    static final String KEEP_ALIVE_COMMENT = "keep-alive";

    private final ObjectMapper objectMapper;

    public ServerSentEvent<String> toServerSentEvent(StreamFrame frame) {
        if (frame.isKeepAlive()) {
            return ServerSentEvent.<String>builder()
                    .comment(KEEP_ALIVE_COMMENT)
                    .build();
        }
        StreamEvent event = frame.event();
        return ServerSentEvent.<String>builder()
                .event(event.type().getWireName())
                .data(toJson(event))
                .build();
    }

    String toJson(StreamEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requestId", event.requestId());
        data.putAll(event.payload());
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("[Stream] Failed to serialize {} event for {}", event.type(), event.requestId(), e);
            throw new IllegalStateException("Unserializable " + event.type() + " payload", e);
        }
    }
}
