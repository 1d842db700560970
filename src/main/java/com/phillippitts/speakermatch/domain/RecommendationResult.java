package com.phillippitts.speakermatch.domain;

import java.util.List;

/**
 * Result handed to the request layer.
 *
 * @param matches      ranked matches above the threshold
 * @param totalCount   number of speakers in the catalog
 * @param matchedCount number of matches returned
 */
public record RecommendationResult(List<ScoredMatch> matches, int totalCount, int matchedCount) {

    public RecommendationResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public static RecommendationResult from(MatchSet set, int totalCount) {
        return new RecommendationResult(set.matches(), totalCount, set.size());
    }
}
