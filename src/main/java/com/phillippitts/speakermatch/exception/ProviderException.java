package com.phillippitts.speakermatch.exception;

/**
 * Thrown when a scoring provider call fails: network failure, authentication failure,
 * or provider-side rejection (rate limit, content policy).
 *
 * <p>Per-item occurrences are contained by the item scorer and never surface as request failures.
 */
public class ProviderException extends SpeakerMatchException {

    private final String providerName;

    public ProviderException(String message) {
        super(message);
        this.providerName = "unknown";
    }

    public ProviderException(String message, String providerName) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public ProviderException(String message, String providerName, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
