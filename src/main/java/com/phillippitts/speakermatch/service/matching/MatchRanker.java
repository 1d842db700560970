package com.phillippitts.speakermatch.service.matching;

import com.phillippitts.speakermatch.domain.MatchSet;
import com.phillippitts.speakermatch.domain.ScoredMatch;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Filters scored matches by threshold and orders them best first.
 *
 * <p>Pure and synchronous. Keeps {@code score >= threshold} (inclusive) and sorts descending by
 * score; the sort is stable, so equal scores keep their input (catalog) order. Can be applied
 * repeatedly to one scored batch with different thresholds.
 */
@Component
public class MatchRanker {

    private static final Comparator<ScoredMatch> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredMatch::score).reversed();

    /**
     * @param scored    every scored item, in catalog order
     * @param threshold inclusive minimum score
     * @return ranked, filtered match set
     */
    public MatchSet rank(List<ScoredMatch> scored, double threshold) {
        Objects.requireNonNull(scored, "scored");
        // Stream.sorted is stable for ordered streams
        List<ScoredMatch> ranked = scored.stream()
                .filter(m -> m.score() >= threshold)
                .sorted(BY_SCORE_DESC)
                .collect(Collectors.toList());
        return new MatchSet(ranked, scored.size());
    }
}
