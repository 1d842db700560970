package com.phillippitts.speakermatch.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for request validation, prompting and batch deadlines.
 */
@Validated
@ConfigurationProperties(prefix = "matching")
public class MatchingProperties {

    /** Minimum trimmed length of the caller's business description. */
    @Min(1)
    private final int minQueryLength;

    /** Threshold applied when the caller does not send one. */
    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private final double defaultThreshold;

    /** Biography characters included in each scoring prompt. */
    @Positive
    private final int bioTruncationChars;

    /** Per-item deadline, measured from the moment a worker starts the item. */
    @Positive
    private final long itemTimeoutMs;

    /** Deadline for the whole batch, measured from submission. */
    @Positive
    private final long requestDeadlineMs;

    @ConstructorBinding
    public MatchingProperties(Integer minQueryLength,
                              Double defaultThreshold,
                              Integer bioTruncationChars,
                              Long itemTimeoutMs,
                              Long requestDeadlineMs) {
        this.minQueryLength = minQueryLength == null ? 10 : minQueryLength;
        this.defaultThreshold = defaultThreshold == null ? 6.0 : defaultThreshold;
        this.bioTruncationChars = bioTruncationChars == null ? 800 : bioTruncationChars;
        this.itemTimeoutMs = itemTimeoutMs == null ? 30_000L : itemTimeoutMs;
        this.requestDeadlineMs = requestDeadlineMs == null ? 120_000L : requestDeadlineMs;
    }

    /**
     * All defaults; used by tests.
     */
    public static MatchingProperties defaults() {
        return new MatchingProperties(null, null, null, null, null);
    }

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public int getBioTruncationChars() {
        return bioTruncationChars;
    }

    public long getItemTimeoutMs() {
        return itemTimeoutMs;
    }

    public long getRequestDeadlineMs() {
        return requestDeadlineMs;
    }
}
