package com.phillippitts.speakermatch.domain;

import java.util.Objects;

/**
 * Result of scoring one speaker against one query.
 *
 * <p>The score is expected in 0-10 but is not clamped: a malformed model reply may fall outside.
 * Failed items carry score 0 and a reasoning string that explains the failure.
 *
 * @param speaker   the scored catalog entry
 * @param score     relevance score reported by the model
 * @param reasoning model rationale, or the failure reason
 * @param failed    true when this match is a degraded stand-in for a failed scoring call
 */
public record ScoredMatch(
        SpeakerRecord speaker,
        double score,
        String reasoning,
        boolean failed
) {

    public ScoredMatch {
        Objects.requireNonNull(speaker, "speaker");
        reasoning = reasoning == null ? "" : reasoning;
    }

    /**
     * Creates a successful match.
     */
    public static ScoredMatch of(SpeakerRecord speaker, double score, String reasoning) {
        return new ScoredMatch(speaker, score, reasoning, false);
    }

    /**
     * Creates a zero-score match standing in for a failed scoring call.
     *
     * @param speaker the speaker whose scoring failed
     * @param reason  short failure description
     */
    public static ScoredMatch failure(SpeakerRecord speaker, String reason) {
        return new ScoredMatch(speaker, 0.0, "Error: " + reason, true);
    }

    public String name() {
        return speaker.name();
    }
}
