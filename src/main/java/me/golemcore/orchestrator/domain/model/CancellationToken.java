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

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal for a single request. Triggered when the outbound
 * channel closes; observed by the orchestrator to abandon in-flight work.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.Empty<Void> signal = Sinks.empty();

    /**
     * Trigger cancellation. Returns {@code true} only for the first caller.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        signal.tryEmitEmpty();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Completes when the token is cancelled. Usable with
     * {@code takeUntilOther}.
     */
    public Mono<Void> whenCancelled() {
        return signal.asMono();
    }
}
