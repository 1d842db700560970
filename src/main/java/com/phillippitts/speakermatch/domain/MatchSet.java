package com.phillippitts.speakermatch.domain;

import java.util.List;

/**
 * Ranked, threshold-filtered matches for one request.
 *
 * @param matches     matches with score at or above the threshold, best first
 * @param scoredCount number of items scored before filtering (always the catalog size)
 */
public record MatchSet(List<ScoredMatch> matches, int scoredCount) {

    public MatchSet {
        matches = matches == null ? List.of() : List.copyOf(matches);
        if (scoredCount < matches.size()) {
            throw new IllegalArgumentException(
                    "scoredCount (" + scoredCount + ") must not be less than matches (" + matches.size() + ")");
        }
    }

    public int size() {
        return matches.size();
    }
}
