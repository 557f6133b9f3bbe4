package me.golemcore.orchestrator.domain.model;

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

import java.time.Instant;

/**
 * Admitted inbound request. Created by admission with the sanitized text and
 * stamped with its correlation id exactly once, before the run starts.
 */
public record Request(String id, String rawInput, String sanitizedInput, Instant receivedAt) {

    public Request withId(String requestId) {
        if (id != null) {
            throw new IllegalStateException("Request already carries id " + id);
        }
        return new Request(requestId, rawInput, sanitizedInput, receivedAt);
    }
}
