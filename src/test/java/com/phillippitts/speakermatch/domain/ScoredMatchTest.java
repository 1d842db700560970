package com.phillippitts.speakermatch.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoredMatchTest {

    private static final SpeakerRecord ADA = new SpeakerRecord("Ada", "CTO", "Acme", "bio");

    @Test
    void failureHasZeroScoreAndErrorReasoning() {
        ScoredMatch m = ScoredMatch.failure(ADA, "timeout after 100 ms");

        assertThat(m.score()).isZero();
        assertThat(m.reasoning()).isEqualTo("Error: timeout after 100 ms");
        assertThat(m.failed()).isTrue();
        assertThat(m.name()).isEqualTo("Ada");
    }

    @Test
    void successKeepsScoreUnclamped() {
        ScoredMatch m = ScoredMatch.of(ADA, 11.5, null);

        assertThat(m.score()).isEqualTo(11.5);
        assertThat(m.reasoning()).isEmpty();
        assertThat(m.failed()).isFalse();
    }

    @Test
    void speakerRecordNormalizesNulls() {
        SpeakerRecord r = new SpeakerRecord("Bo", null, null, null);

        assertThat(r.title()).isEmpty();
        assertThat(r.organization()).isEmpty();
        assertThat(r.bio()).isEmpty();
    }

    @Test
    void matchSetRejectsScoredCountBelowMatches() {
        List<ScoredMatch> two = List.of(ScoredMatch.of(ADA, 7, "a"), ScoredMatch.of(ADA, 8, "b"));

        assertThatThrownBy(() -> new MatchSet(two, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recommendationResultCountsMatches() {
        MatchSet set = new MatchSet(List.of(ScoredMatch.of(ADA, 7, "a")), 4);

        RecommendationResult result = RecommendationResult.from(set, 4);

        assertThat(result.totalCount()).isEqualTo(4);
        assertThat(result.matchedCount()).isEqualTo(1);
        assertThat(result.matches()).extracting(ScoredMatch::name).containsExactly("Ada");
    }
}
