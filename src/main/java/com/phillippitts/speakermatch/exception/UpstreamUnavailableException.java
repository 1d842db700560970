package com.phillippitts.speakermatch.exception;

/**
 * Thrown when the speaker catalog failed to load or holds no entries.
 * This is request-fatal: there is nothing to score.
 */
public class UpstreamUnavailableException extends SpeakerMatchException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
