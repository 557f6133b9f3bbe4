package me.golemcore.orchestrator.domain.model;

/**
 * Reasons an inbound request is rejected before any work begins.
 */
public enum AdmissionError {

    /**
     * Input is empty or contains only whitespace/control characters.
     */
    EMPTY("Empty", "Message must not be empty"),

    /**
     * Input (declared or actual) is longer than the configured ceiling.
     */
    TOO_LONG("TooLong", "Message exceeds the maximum allowed length"),

    /**
     * Input is not well-formed text (unpaired surrogates or malformed UTF-8).
     */
    INVALID_ENCODING("InvalidEncoding", "Message is not valid UTF-8 text");

    private final String wireName;
    private final String defaultMessage;

    AdmissionError(String wireName, String defaultMessage) {
        this.wireName = wireName;
        this.defaultMessage = defaultMessage;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
