package com.phillippitts.speakermatch.exception;

/**
 * Thrown when caller input is malformed: blank or too-short query text, or a threshold
 * outside the 0-10 scale. Raised before any scoring work begins.
 */
public class ValidationException extends SpeakerMatchException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
