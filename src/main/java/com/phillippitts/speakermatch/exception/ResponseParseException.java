package com.phillippitts.speakermatch.exception;

/**
 * Thrown when no valid JSON object can be located in a model reply.
 */
public class ResponseParseException extends SpeakerMatchException {

    private final String rawPreview;

    public ResponseParseException(String message, String rawPreview) {
        super(message);
        this.rawPreview = rawPreview;
    }

    public ResponseParseException(String message, String rawPreview, Throwable cause) {
        super(message, cause);
        this.rawPreview = rawPreview;
    }

    /**
     * Returns a truncated preview of the reply that failed to parse (for logs only).
     */
    public String getRawPreview() {
        return rawPreview;
    }
}
