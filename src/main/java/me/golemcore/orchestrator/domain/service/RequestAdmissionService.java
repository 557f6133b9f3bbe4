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
import me.golemcore.orchestrator.domain.model.AdmissionError;
import me.golemcore.orchestrator.domain.model.AdmissionException;
import me.golemcore.orchestrator.domain.model.Request;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.security.InputSanitizer;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Admission control for inbound requests: length ceiling, encoding check,
 * control-character stripping and emptiness check, in that order. Pure and
 * synchronous; a rejection is raised as {@link AdmissionException} before any
 * streaming starts.
 *
 * <p>
 * Length is measured in Unicode code points. The declared body size is
 * checked first so oversized bodies are rejected without inspecting the
 * message.
 */
@Service
@Slf4j
public class RequestAdmissionService {

    private final InputSanitizer inputSanitizer;
    private final Clock clock;
    private final int maxInputLength;
    private final long maxBodyBytes;

    public RequestAdmissionService(InputSanitizer inputSanitizer, OrchestratorProperties properties, Clock clock) {
        this.inputSanitizer = inputSanitizer;
        this.clock = clock;
        this.maxInputLength = properties.getAdmission().getMaxInputLength();
        this.maxBodyBytes = properties.getAdmission().getMaxBodyBytes();
        if (maxInputLength < 1) {
            throw new IllegalArgumentException("orchestrator.admission.max-input-length must be >= 1");
        }
        if (maxBodyBytes < maxInputLength) {
            throw new IllegalArgumentException(
                    "orchestrator.admission.max-body-bytes must be >= orchestrator.admission.max-input-length");
        }
    }

    /**
     * Admit input, rejecting early when the declared size of the request body
     * carrying it already exceeds the body ceiling. A declared length of 0 or
     * less means unknown.
     *
     * @param rawInput
     *            message text as decoded from the request
     * @param declaredLength
     *            {@code Content-Length} of the carrying body, in bytes
     */
    public Request admit(String rawInput, long declaredLength) {
        if (declaredLength > maxBodyBytes) {
            log.info("[Admission] Rejected request: error={}, bodyBytes={}, maxBodyBytes={}",
                    AdmissionError.TOO_LONG.getWireName(), declaredLength, maxBodyBytes);
            throw new AdmissionException(AdmissionError.TOO_LONG,
                    "Request body of " + declaredLength + " bytes exceeds maximum of " + maxBodyBytes + " bytes");
        }
        if (rawInput == null) {
            throw reject(AdmissionError.EMPTY, 0);
        }
        int length = rawInput.codePointCount(0, rawInput.length());
        if (length > maxInputLength) {
            throw reject(AdmissionError.TOO_LONG, length);
        }
        if (!inputSanitizer.isWellFormed(rawInput)) {
            throw reject(AdmissionError.INVALID_ENCODING, length);
        }

        String sanitized = inputSanitizer.sanitize(rawInput);
        if (sanitized.isBlank()) {
            throw reject(AdmissionError.EMPTY, length);
        }
        return new Request(null, rawInput, sanitized, clock.instant());
    }

    private AdmissionException reject(AdmissionError error, long length) {
        log.info("[Admission] Rejected request: error={}, length={}, max={}", error.getWireName(), length,
                maxInputLength);
        if (error == AdmissionError.TOO_LONG) {
            return new AdmissionException(error,
                    "Message length " + length + " exceeds maximum of " + maxInputLength + " characters");
        }
        return new AdmissionException(error);
    }
}
