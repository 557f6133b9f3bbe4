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

/**
 * Thrown when a call is rejected because the dependency's circuit breaker is
 * open (or half-open with its probe quota used up). The dependency was not
 * invoked.
 */
public class CircuitOpenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient CircuitBreakerSnapshot snapshot;

    public CircuitOpenException(CircuitBreakerSnapshot snapshot) {
        super("Circuit breaker for " + snapshot.dependency().getId() + " is " + snapshot.phase());
        this.snapshot = snapshot;
    }

    public Dependency getDependency() {
        return snapshot.dependency();
    }

    public CircuitBreakerSnapshot getSnapshot() {
        return snapshot;
    }
}
