package me.golemcore.orchestrator.security;

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
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Input sanitizer that removes control characters from inbound text.
 *
 * <p>
 * Newline, tab and carriage return are kept. C0 controls, DEL and C1 controls
 * are removed. Everything else, including zero-width and BiDi characters, is
 * preserved exactly as received: no Unicode normalization is applied.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InputSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");

    /**
     * Remove control characters except newline, tab and carriage return.
     */
    public String stripControlCharacters(String input) {
        if (input == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(input).replaceAll("");
    }

    /**
     * Check that the string is well-formed UTF-16, i.e. contains no unpaired
     * surrogate and therefore encodes losslessly to UTF-8.
     */
    public boolean isWellFormed(String input) {
        if (input == null) {
            return true;
        }
        int length = input.length();
        for (int i = 0; i < length; i++) {
            char c = input.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= length || !Character.isLowSurrogate(input.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Full sanitization pipeline.
     */
    public String sanitize(String input) {
        if (input == null) {
            return "";
        }

        log.trace("[Security] Sanitizing input: {} chars", input.length());
        int originalLength = input.length();
        String sanitized = stripControlCharacters(input);
        if (sanitized.length() != originalLength) {
            log.debug("[Security] Input sanitized: {} -> {} chars", originalLength, sanitized.length());
        }
        return sanitized;
    }
}
