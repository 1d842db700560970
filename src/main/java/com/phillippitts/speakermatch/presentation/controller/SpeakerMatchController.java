package com.phillippitts.speakermatch.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakermatch.domain.RecommendationResult;
import com.phillippitts.speakermatch.domain.ScoredMatch;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.service.catalog.SpeakerCatalog;
import com.phillippitts.speakermatch.service.recommend.SpeakerRecommendationService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP surface for speaker recommendations.
 *
 * <p>Field names on the wire are snake_case. Errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
class SpeakerMatchController {

    private static final Logger LOG = LogManager.getLogger(SpeakerMatchController.class);

    private final SpeakerRecommendationService recommendationService;
    private final SpeakerCatalog catalog;

    SpeakerMatchController(SpeakerRecommendationService recommendationService, SpeakerCatalog catalog) {
        this.recommendationService = recommendationService;
        this.catalog = catalog;
    }

    @GetMapping("/")
    ResponseEntity<StatusResponse> root() {
        return ResponseEntity.ok(new StatusResponse("Speaker Recommendation API", catalog.size()));
    }

    @GetMapping("/speakers")
    ResponseEntity<SpeakersResponse> speakers() {
        List<SpeakerRecord> speakers = catalog.getSpeakers();
        return ResponseEntity.ok(new SpeakersResponse(speakers, speakers.size()));
    }

    @PostMapping("/match")
    ResponseEntity<MatchResponse> match(@RequestBody MatchRequest request) {
        double threshold = request.threshold() == null
                ? recommendationService.defaultThreshold()
                : request.threshold();
        RecommendationResult result = recommendationService.recommend(request.userBio(), threshold);
        LOG.info("Returning {} of {} speakers", result.matchedCount(), result.totalCount());
        List<MatchView> views = result.matches().stream().map(MatchView::from).toList();
        return ResponseEntity.ok(new MatchResponse(views, result.totalCount(), result.matchedCount()));
    }

    record MatchRequest(@JsonProperty("user_bio") String userBio, Double threshold) {}

    record StatusResponse(String message, @JsonProperty("speakers_loaded") int speakersLoaded) {}

    record SpeakersResponse(List<SpeakerRecord> speakers, int count) {}

    record MatchView(String name, String title, String organization, String bio, double score, String reasoning) {
        static MatchView from(ScoredMatch m) {
            SpeakerRecord s = m.speaker();
            return new MatchView(s.name(), s.title(), s.organization(), s.bio(), m.score(), m.reasoning());
        }
    }

    record MatchResponse(
            List<MatchView> matches,
            @JsonProperty("total_speakers") int totalSpeakers,
            @JsonProperty("matches_found") int matchesFound
    ) {}
}
