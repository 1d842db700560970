package com.phillippitts.speakermatch.service.matching;

import com.phillippitts.speakermatch.domain.MatchQuery;
import com.phillippitts.speakermatch.domain.MatchSet;
import com.phillippitts.speakermatch.domain.ScoredMatch;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.UpstreamUnavailableException;

import java.util.List;

/**
 * Scores a whole catalog against one query concurrently and ranks the outcome.
 * Implementations must be hermetic-test friendly.
 */
public interface SpeakerMatchService {

    /**
     * Scores every catalog entry and waits for all of them.
     *
     * @return exactly one result per catalog entry, in catalog order
     * @throws UpstreamUnavailableException if the catalog is empty
     */
    List<ScoredMatch> scoreAll(MatchQuery query, List<SpeakerRecord> catalog);

    /**
     * Scores the catalog, then filters by the query threshold and ranks best first.
     *
     * @throws UpstreamUnavailableException if the catalog is empty
     */
    MatchSet recommend(MatchQuery query, List<SpeakerRecord> catalog);
}
