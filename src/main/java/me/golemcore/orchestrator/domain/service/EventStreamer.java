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
import me.golemcore.orchestrator.domain.model.RequestContext;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Opens the outbound event channel of each request, sized and timed from
 * {@code orchestrator.stream.*}.
 */
@Service
@Slf4j
public class EventStreamer {

    private final int capacity;
    private final Duration heartbeatInterval;
    private final Duration emitTimeout;
    private final Scheduler heartbeatScheduler;

    @Autowired
    public EventStreamer(OrchestratorProperties properties) {
        this(properties, Schedulers.parallel());
    }

    public EventStreamer(OrchestratorProperties properties, Scheduler heartbeatScheduler) {
        OrchestratorProperties.StreamProperties stream = properties.getStream();
        if (stream.getBufferCapacity() < 1) {
            throw new IllegalArgumentException("orchestrator.stream.buffer-capacity must be >= 1");
        }
        if (stream.getHeartbeatInterval() == null || stream.getHeartbeatInterval().isNegative()
                || stream.getHeartbeatInterval().isZero()) {
            throw new IllegalArgumentException("orchestrator.stream.heartbeat-interval must be > 0");
        }
        this.capacity = stream.getBufferCapacity();
        this.heartbeatInterval = stream.getHeartbeatInterval();
        this.emitTimeout = stream.getEmitTimeout();
        this.heartbeatScheduler = heartbeatScheduler;
    }

    public EventSink open(RequestContext context) {
        log.debug("[Stream] Opening stream for {}", context.id());
        return new EventSink(context, capacity, heartbeatInterval, emitTimeout, heartbeatScheduler);
    }
}
