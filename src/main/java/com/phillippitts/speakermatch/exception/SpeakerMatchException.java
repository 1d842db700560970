package com.phillippitts.speakermatch.exception;

/**
 * Base exception for all speakermatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeakerMatchException extends RuntimeException {

    public SpeakerMatchException(String message) {
        super(message);
    }

    public SpeakerMatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakerMatchException(Throwable cause) {
        super(cause);
    }
}
