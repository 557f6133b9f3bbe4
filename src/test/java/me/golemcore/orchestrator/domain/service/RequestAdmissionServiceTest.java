package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.AdmissionError;
import me.golemcore.orchestrator.domain.model.AdmissionException;
import me.golemcore.orchestrator.domain.model.Request;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.security.InputSanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RequestAdmissionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private RequestAdmissionService service;

    @BeforeEach
    void setUp() {
        service = new RequestAdmissionService(new InputSanitizer(), new OrchestratorProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AdmissionError rejectionOf(String input) {
        return assertThrows(AdmissionException.class, () -> service.admit(input, 0)).getError();
    }

    // ===== Accepted input =====

    @Test
    void shouldAdmitPlainText() {
        Request request = service.admit("create a todo: buy eggs", 0);

        assertNull(request.id());
        assertEquals("create a todo: buy eggs", request.rawInput());
        assertEquals("create a todo: buy eggs", request.sanitizedInput());
        assertEquals(NOW, request.receivedAt());
    }

    @Test
    void shouldAdmitInputAtExactLimit() {
        String input = "a".repeat(5000);

        assertEquals(5000, service.admit(input, 0).sanitizedInput().length());
    }

    @Test
    void shouldStripControlCharactersAndKeepEverythingElse() {
        String input = "buy\u0000 eggs\u0007\n\tand éclairs 🥚\u009F\r";

        Request request = service.admit(input, 0);

        assertEquals("buy eggs\n\tand éclairs 🥚\r", request.sanitizedInput());
        assertEquals(input, request.rawInput());
    }

    @Test
    void shouldCountLengthInCodePoints() {
        String emoji = "🥚";
        String input = emoji.repeat(5000);

        assertEquals(10000, input.length());
        assertEquals(input, service.admit(input, 0).sanitizedInput());
    }

    // ===== Rejections =====

    @Test
    void shouldRejectTooLongInput() {
        AdmissionException rejected = assertThrows(AdmissionException.class,
                () -> service.admit("x".repeat(6000), 6000));

        assertEquals(AdmissionError.TOO_LONG, rejected.getError());
        assertEquals("Message length 6000 exceeds maximum of 5000 characters", rejected.getMessage());
    }

    @Test
    void shouldRejectOnDeclaredBodySizeBeforeInspectingContent() {
        AdmissionException rejected = assertThrows(AdmissionException.class,
                () -> service.admit(null, 65537));

        assertEquals(AdmissionError.TOO_LONG, rejected.getError());
        assertEquals("Request body of 65537 bytes exceeds maximum of 65536 bytes", rejected.getMessage());
    }

    @Test
    void shouldAdmitMultibyteMessageWhoseBodyIsLargerThanCharacterLimit() {
        String input = "\uD83E\uDD5A".repeat(5000);

        assertEquals(input, service.admit(input, 20_030).sanitizedInput());
    }

    @Test
    void shouldRejectEmptyAndWhitespaceOnlyInput() {
        assertEquals(AdmissionError.EMPTY, rejectionOf(null));
        assertEquals(AdmissionError.EMPTY, rejectionOf(""));
        assertEquals(AdmissionError.EMPTY, rejectionOf("   \n\t "));
    }

    @Test
    void shouldRejectInputThatIsOnlyControlCharacters() {
        assertEquals(AdmissionError.EMPTY, rejectionOf("\u0000\u0001\u001B"));
    }

    @Test
    void shouldRejectUnpairedSurrogates() {
        assertEquals(AdmissionError.INVALID_ENCODING, rejectionOf("buy \uD83E eggs"));
        assertEquals(AdmissionError.INVALID_ENCODING, rejectionOf("\uDD5A"));
    }

    @Test
    void shouldPreferTooLongOverInvalidEncoding() {
        assertEquals(AdmissionError.TOO_LONG, rejectionOf("\uD83E" + "a".repeat(6000)));
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getAdmission().setMaxInputLength(0);
        Clock clock = Clock.systemUTC();
        InputSanitizer sanitizer = new InputSanitizer();

        assertThrows(IllegalArgumentException.class,
                () -> new RequestAdmissionService(sanitizer, properties, clock));
    }

    @Test
    void shouldRejectBodyCeilingBelowMessageLimit() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getAdmission().setMaxBodyBytes(100);
        Clock clock = Clock.systemUTC();
        InputSanitizer sanitizer = new InputSanitizer();

        assertThrows(IllegalArgumentException.class,
                () -> new RequestAdmissionService(sanitizer, properties, clock));
    }
}
