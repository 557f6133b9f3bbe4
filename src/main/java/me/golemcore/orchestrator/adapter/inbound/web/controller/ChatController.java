package me.golemcore.orchestrator.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.StreamEventWireFormat;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ChatStreamRequest;
import me.golemcore.orchestrator.domain.model.AdmissionException;
import me.golemcore.orchestrator.domain.model.Request;
import me.golemcore.orchestrator.domain.model.RequestContext;
import me.golemcore.orchestrator.domain.service.Orchestrator;
import me.golemcore.orchestrator.domain.service.RequestAdmissionService;
import me.golemcore.orchestrator.domain.service.RequestCorrelator;
import me.golemcore.orchestrator.observability.OrchestratorMetrics;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Streaming chat endpoint.
 *
 * <p>
 * The message is admitted and tagged before the response starts, so an
 * admission failure is answered with a plain error status and no stream. An
 * admitted request is answered with {@code text/event-stream}; closing the
 * connection cancels the request.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final RequestAdmissionService admissionService;
    private final RequestCorrelator correlator;
    private final Orchestrator orchestrator;
    private final StreamEventWireFormat wireFormat;
    private final OrchestratorMetrics metrics;

    @PostMapping("/chat/stream")
    public Flux<ServerSentEvent<String>> stream(@RequestBody ChatStreamRequest body,
            @RequestHeader(value = HttpHeaders.CONTENT_LENGTH, required = false) Long contentLength) {
        metrics.requestReceived();
        Request request;
        try {
            request = admissionService.admit(body.getMessage(), contentLength != null ? contentLength : 0);
        } catch (AdmissionException e) {
            metrics.requestRejected();
            throw e;
        }
        RequestContext context = correlator.tag(request, body.getRequestId());
        log.info("[API] Streaming request {}", context.id());
        return orchestrator.stream(context)
                .map(wireFormat::toServerSentEvent);
    }
}
