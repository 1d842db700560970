package com.phillippitts.speakermatch.service.recommend;

import com.phillippitts.speakermatch.config.properties.MatchingProperties;
import com.phillippitts.speakermatch.domain.MatchQuery;
import com.phillippitts.speakermatch.domain.MatchSet;
import com.phillippitts.speakermatch.domain.RecommendationResult;
import com.phillippitts.speakermatch.domain.ScoredMatch;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.UpstreamUnavailableException;
import com.phillippitts.speakermatch.exception.ValidationException;
import com.phillippitts.speakermatch.service.catalog.SpeakerCatalog;
import com.phillippitts.speakermatch.service.matching.SpeakerMatchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SpeakerRecommendationServiceTest {

    private static final SpeakerRecord ADA = new SpeakerRecord("Ada", "CTO", "Acme", "bio");
    private static final SpeakerRecord BO = new SpeakerRecord("Bo", "CMO", "Globex", "bio");

    private SpeakerCatalog catalog;
    private SpeakerMatchService matchService;
    private SpeakerRecommendationService service;

    @BeforeEach
    void setUp() {
        catalog = mock(SpeakerCatalog.class);
        matchService = mock(SpeakerMatchService.class);
        service = new SpeakerRecommendationService(catalog, matchService, MatchingProperties.defaults());
    }

    @Test
    void returnsRankedMatchesWithCounts() {
        when(catalog.getSpeakers()).thenReturn(List.of(ADA, BO));
        when(matchService.recommend(any(MatchQuery.class), eq(List.of(ADA, BO))))
                .thenReturn(new MatchSet(List.of(ScoredMatch.of(ADA, 8, "fit")), 2));

        RecommendationResult result = service.recommend("We build logistics software", 6.0);

        assertThat(result.totalCount()).isEqualTo(2);
        assertThat(result.matchedCount()).isEqualTo(1);
        assertThat(result.matches()).extracting(ScoredMatch::name).containsExactly("Ada");
        verify(matchService).recommend(new MatchQuery("We build logistics software", 6.0), List.of(ADA, BO));
    }

    @Test
    void shortQueryIsRejectedBeforeCatalogAccess() {
        assertThatThrownBy(() -> service.recommend("too short", 6.0))
                .isInstanceOf(ValidationException.class)
                .hasMessage("User bio must be at least 10 characters");

        verifyNoInteractions(catalog, matchService);
    }

    @Test
    void whitespaceDoesNotCountTowardMinimumLength() {
        assertThatThrownBy(() -> service.recommend("   abc      ", 6.0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void outOfRangeThresholdIsRejectedBeforeCatalogAccess() {
        assertThatThrownBy(() -> service.recommend("We build logistics software", 11))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("threshold");

        verifyNoInteractions(catalog, matchService);
    }

    @Test
    void unavailableCatalogPropagates() {
        when(catalog.getSpeakers()).thenThrow(new UpstreamUnavailableException("Speaker catalog is empty"));

        assertThatThrownBy(() -> service.recommend("We build logistics software", 6.0))
                .isInstanceOf(UpstreamUnavailableException.class);
        verify(matchService, never()).recommend(any(), anyList());
    }

    @Test
    void exposesDefaultThreshold() {
        assertThat(service.defaultThreshold()).isEqualTo(6.0);
    }
}
