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
import me.golemcore.orchestrator.domain.model.CancellationToken;
import me.golemcore.orchestrator.domain.model.Request;
import me.golemcore.orchestrator.domain.model.RequestContext;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Issues the correlation id of each admitted request and builds its
 * {@link RequestContext}. Ids combine the current time (base 36 millis) with
 * 64 random bits, e.g. {@code req_lx3k9a2b_9f1c2d3e4a5b6c7d}.
 *
 * <p>
 * A client-supplied id is reused when it is well formed, so clients can
 * correlate their own logs; anything else is replaced by a generated id.
 */
@Component
@Slf4j
public class RequestCorrelator {

    private static final String PREFIX = "req_";
    private static final int RANDOM_BYTES = 8;
    private static final Pattern CLIENT_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RequestCorrelator(Clock clock) {
        this.clock = clock;
    }

    public RequestContext tag(Request request) {
        return tag(request, null);
    }

    public RequestContext tag(Request request, String clientRequestId) {
        String id;
        if (clientRequestId != null && CLIENT_ID_PATTERN.matcher(clientRequestId).matches()) {
            id = clientRequestId;
        } else {
            if (clientRequestId != null) {
                log.debug("[Correlation] Ignoring malformed client request id");
            }
            id = generateId();
        }
        return new RequestContext(id, request.withId(id), new CancellationToken());
    }

    String generateId() {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return PREFIX + Long.toString(clock.millis(), 36) + "_" + HexFormat.of().formatHex(bytes);
    }
}
