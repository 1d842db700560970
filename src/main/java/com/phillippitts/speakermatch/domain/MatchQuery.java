package com.phillippitts.speakermatch.domain;

import com.phillippitts.speakermatch.exception.ValidationException;

/**
 * The caller's business description plus the minimum acceptable score.
 *
 * @param text      free-text business context, never blank
 * @param threshold minimum score (inclusive) on the 0-10 scale
 */
public record MatchQuery(String text, double threshold) {

    public static final double MIN_THRESHOLD = 0.0;
    public static final double MAX_THRESHOLD = 10.0;

    /**
     * @throws ValidationException if text is blank or threshold is outside [0, 10]
     */
    public MatchQuery {
        if (text == null || text.isBlank()) {
            throw new ValidationException("text", "Query text must not be empty");
        }
        if (Double.isNaN(threshold) || threshold < MIN_THRESHOLD || threshold > MAX_THRESHOLD) {
            throw new ValidationException("threshold",
                    "Threshold must be between " + MIN_THRESHOLD + " and " + MAX_THRESHOLD + ", got: " + threshold);
        }
    }
}
