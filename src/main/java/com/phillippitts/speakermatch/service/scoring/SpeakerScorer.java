package com.phillippitts.speakermatch.service.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.speakermatch.domain.MatchQuery;
import com.phillippitts.speakermatch.domain.ScoredMatch;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.ProviderException;
import com.phillippitts.speakermatch.exception.ResponseParseException;
import com.phillippitts.speakermatch.service.metrics.ScoringMetrics;
import com.phillippitts.speakermatch.service.scoring.parse.JsonResponseParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Scores one speaker against one query.
 *
 * <p><b>Failure containment:</b> {@link #score(MatchQuery, SpeakerRecord)} never throws for a
 * scoring failure. Provider errors, unparsable replies and unexpected runtime errors all become a
 * {@link ScoredMatch#failure(SpeakerRecord, String) zero-score match} whose reasoning names the cause,
 * so one bad item cannot abort a batch.
 *
 * <p>Missing keys are not failures: an absent or non-numeric {@code score} reads as 0 and an
 * absent {@code reasoning} as the empty string.
 *
 * <p>Thread-safe: stateless apart from immutable collaborators.
 */
@Component
public class SpeakerScorer {

    private static final Logger LOG = LogManager.getLogger(SpeakerScorer.class);

    private final ScoringClient client;
    private final ScoringPromptBuilder promptBuilder;
    private final ScoringMetrics metrics;

    public SpeakerScorer(ScoringClient client, ScoringPromptBuilder promptBuilder, ScoringMetrics metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Scores a speaker. Never throws for provider, parse or runtime failures.
     *
     * @param query   validated query
     * @param speaker catalog entry
     * @return scored match, or a zero-score failure match
     */
    public ScoredMatch score(MatchQuery query, SpeakerRecord speaker) {
        String provider = client.getProviderName();
        long t0 = System.nanoTime();
        try {
            String prompt = promptBuilder.build(query, speaker);
            String reply = client.complete(prompt);
            ObjectNode json = JsonResponseParser.extractJson(reply);

            ScoredMatch match = ScoredMatch.of(speaker, readScore(json), readReasoning(json));
            metrics.recordLatency(provider, System.nanoTime() - t0);
            metrics.incrementSuccess(provider);
            LOG.debug("Scored {}: {}", speaker.name(), match.score());
            return match;
        } catch (ProviderException pe) {
            LOG.warn("Error scoring {}: {}", speaker.name(), pe.getMessage());
            metrics.incrementFailure(provider, "provider");
            return ScoredMatch.failure(speaker, pe.getMessage());
        } catch (ResponseParseException rpe) {
            LOG.warn("Error scoring {}: {} (reply: {})", speaker.name(), rpe.getMessage(), rpe.getRawPreview());
            metrics.incrementFailure(provider, "parse");
            return ScoredMatch.failure(speaker, rpe.getMessage());
        } catch (RuntimeException re) {
            LOG.error("Unexpected error scoring {}", speaker.name(), re);
            metrics.incrementFailure(provider, "unexpected");
            return ScoredMatch.failure(speaker, re.getClass().getSimpleName() + ": " + re.getMessage());
        }
    }

    static double readScore(ObjectNode json) {
        JsonNode node = json.get("score");
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                double parsed = Double.parseDouble(node.textValue().trim());
                return Double.isNaN(parsed) ? 0.0 : parsed;
            } catch (NumberFormatException e) {
                LOG.debug("Non-numeric score '{}' read as 0", node.textValue());
                return 0.0;
            }
        }
        return 0.0;
    }

    static String readReasoning(ObjectNode json) {
        JsonNode node = json.get("reasoning");
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }
}
