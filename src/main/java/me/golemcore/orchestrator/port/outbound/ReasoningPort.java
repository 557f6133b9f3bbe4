package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.ReasoningFragment;
import me.golemcore.orchestrator.domain.model.ReasoningRequest;
import reactor.core.publisher.Flux;

/**
 * Port for the reasoning backend. Each call opens one reasoning turn whose
 * output is a finite, non-restartable sequence of text, thinking and tool-call
 * fragments. Cancelling the subscription abandons the turn.
 */
public interface ReasoningPort {

    /**
     * Returns the model identifier used for reasoning.
     */
    String getModel();

    Flux<ReasoningFragment> stream(ReasoningRequest request);
}
