package com.phillippitts.speakermatch.service.recommend;

import com.phillippitts.speakermatch.config.properties.MatchingProperties;
import com.phillippitts.speakermatch.domain.MatchQuery;
import com.phillippitts.speakermatch.domain.MatchSet;
import com.phillippitts.speakermatch.domain.RecommendationResult;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.UpstreamUnavailableException;
import com.phillippitts.speakermatch.exception.ValidationException;
import com.phillippitts.speakermatch.service.catalog.SpeakerCatalog;
import com.phillippitts.speakermatch.service.matching.SpeakerMatchService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for a single recommendation request.
 *
 * <p>Order of work: validate the query, read the catalog, then score and rank. Invalid input never
 * touches the catalog or the provider.
 */
@Service
public class SpeakerRecommendationService {

    private static final Logger LOG = LogManager.getLogger(SpeakerRecommendationService.class);

    private final SpeakerCatalog catalog;
    private final SpeakerMatchService matchService;
    private final MatchingProperties properties;

    public SpeakerRecommendationService(SpeakerCatalog catalog,
                                        SpeakerMatchService matchService,
                                        MatchingProperties properties) {
        this.catalog = catalog;
        this.matchService = matchService;
        this.properties = properties;
    }

    /**
     * @param queryText free-text description of the user's business and goals
     * @param threshold inclusive minimum score in [0, 10]
     * @throws ValidationException          if the text is too short or the threshold is out of range
     * @throws UpstreamUnavailableException if the catalog is unavailable or empty
     */
    public RecommendationResult recommend(String queryText, double threshold) {
        int minLength = properties.getMinQueryLength();
        if (queryText == null || queryText.strip().length() < minLength) {
            throw new ValidationException("user_bio",
                    "User bio must be at least " + minLength + " characters");
        }
        MatchQuery query = new MatchQuery(queryText.strip(), threshold);

        List<SpeakerRecord> speakers = catalog.getSpeakers();
        LOG.info("Recommendation request: {} chars, threshold={}, catalog={}",
                query.text().length(), threshold, speakers.size());

        MatchSet set = matchService.recommend(query, speakers);
        return RecommendationResult.from(set, speakers.size());
    }

    /**
     * @return default threshold applied when a request omits one
     */
    public double defaultThreshold() {
        return properties.getDefaultThreshold();
    }
}
