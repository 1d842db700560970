package com.phillippitts.speakermatch.service.matching;

import com.phillippitts.speakermatch.config.properties.MatchingProperties;
import com.phillippitts.speakermatch.domain.MatchQuery;
import com.phillippitts.speakermatch.domain.MatchSet;
import com.phillippitts.speakermatch.domain.ScoredMatch;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.UpstreamUnavailableException;
import com.phillippitts.speakermatch.service.metrics.ScoringMetrics;
import com.phillippitts.speakermatch.service.scoring.SpeakerScorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default fan-out orchestrator: one scoring task per catalog entry on a bounded executor,
 * joined with a full barrier.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Bounded concurrency:</b> tasks run on {@code scoringExecutor}, whose pool size caps
 *       concurrent provider calls; the rest queue</li>
 *   <li><b>Per-item timeout:</b> starts when a worker picks the item up; an item that overruns
 *       resolves to a zero-score failure and its late reply is discarded</li>
 *   <li><b>Request deadline:</b> measured from submission of the first task; when the whole batch
 *       overruns, every unresolved item resolves to a zero-score failure and queued items that have
 *       not started are skipped without a provider call</li>
 *   <li><b>No caller-run work:</b> the request thread only submits and waits; a task the executor
 *       refuses (pool and queue full) resolves to a zero-score failure</li>
 *   <li><b>Graceful degradation:</b> per-item failures are data, never exceptions, so the batch
 *       always yields exactly N results for N entries</li>
 * </ul>
 *
 * <p><b>Ordering:</b> results are collected by catalog index, never by completion order, and the
 * ranker sorts stably. The final order depends only on scores and catalog order.
 *
 * <p>In-flight provider calls cannot be interrupted through {@link CompletableFuture}; a call that
 * outlives its deadline keeps its worker until the provider's own HTTP timeout fires.
 *
 * @see SpeakerScorer
 * @see MatchRanker
 */
@Service
public class DefaultSpeakerMatchService implements SpeakerMatchService {

    private static final Logger LOG = LogManager.getLogger(DefaultSpeakerMatchService.class);

    private final SpeakerScorer scorer;
    private final MatchRanker ranker;
    private final Executor executor;
    private final ScoringMetrics metrics;
    private final long itemTimeoutMs;
    private final long requestDeadlineMs;

    /**
     * @param scorer     item scorer (never throws for per-item failures)
     * @param ranker     threshold filter and sorter
     * @param executor   bounded pool for scoring tasks (qualified as "scoringExecutor")
     * @param properties source of the per-item timeout and request deadline
     * @param metrics    batch latency metrics
     */
    @Autowired
    public DefaultSpeakerMatchService(SpeakerScorer scorer,
                                      MatchRanker ranker,
                                      @Qualifier("scoringExecutor") Executor executor,
                                      MatchingProperties properties,
                                      ScoringMetrics metrics) {
        this(scorer, ranker, executor, metrics, properties.getItemTimeoutMs(), properties.getRequestDeadlineMs());
    }

    public DefaultSpeakerMatchService(SpeakerScorer scorer,
                                      MatchRanker ranker,
                                      Executor executor,
                                      ScoringMetrics metrics,
                                      long itemTimeoutMs,
                                      long requestDeadlineMs) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.itemTimeoutMs = itemTimeoutMs <= 0 ? 30_000L : itemTimeoutMs;
        this.requestDeadlineMs = requestDeadlineMs <= 0 ? 120_000L : requestDeadlineMs;
    }

    @Override
    public MatchSet recommend(MatchQuery query, List<SpeakerRecord> catalog) {
        List<ScoredMatch> scored = scoreAll(query, catalog);
        MatchSet set = ranker.rank(scored, query.threshold());
        LOG.info("Found {} matches above threshold {}", set.size(), query.threshold());
        return set;
    }

    @Override
    public List<ScoredMatch> scoreAll(MatchQuery query, List<SpeakerRecord> catalog) {
        Objects.requireNonNull(query, "query");
        if (catalog == null || catalog.isEmpty()) {
            throw new UpstreamUnavailableException("Speaker catalog is empty");
        }

        long t0 = System.nanoTime();
        long deadline = t0 + TimeUnit.MILLISECONDS.toNanos(requestDeadlineMs);
        LOG.info("Scoring {} speakers in parallel", catalog.size());

        List<CompletableFuture<ScoredMatch>> futures = new ArrayList<>(catalog.size());
        for (SpeakerRecord speaker : catalog) {
            futures.add(submit(query, speaker));
        }

        awaitAll(futures, catalog, deadline);

        List<ScoredMatch> results = new ArrayList<>(catalog.size());
        int failed = 0;
        for (CompletableFuture<ScoredMatch> f : futures) {
            ScoredMatch m = f.join();
            if (m.failed()) {
                failed++;
            }
            results.add(m);
        }

        long elapsed = System.nanoTime() - t0;
        metrics.recordBatch(elapsed);
        LOG.info("Scored {} speakers in {} ms ({} failed)",
                results.size(), TimeUnit.NANOSECONDS.toMillis(elapsed), failed);
        return results;
    }

    private CompletableFuture<ScoredMatch> submit(MatchQuery query, SpeakerRecord speaker) {
        CompletableFuture<ScoredMatch> result = new CompletableFuture<>();
        Runnable task = () -> {
            if (result.isDone()) {
                return; // resolved by the request deadline before a worker got to it
            }
            result.completeOnTimeout(
                    ScoredMatch.failure(speaker, "timeout after " + itemTimeoutMs + " ms"),
                    itemTimeoutMs,
                    TimeUnit.MILLISECONDS
            );
            try {
                result.complete(scorer.score(query, speaker));
            } catch (RuntimeException re) {
                LOG.error("Scorer escaped its failure boundary for {}", speaker.name(), re);
                result.complete(ScoredMatch.failure(speaker, re.getClass().getSimpleName() + ": " + re.getMessage()));
            }
        };
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ree) {
            LOG.warn("Scoring task rejected for {}: {}", speaker.name(), ree.getMessage());
            result.complete(ScoredMatch.failure(speaker, "scoring task rejected"));
        }
        return result;
    }

    private void awaitAll(List<CompletableFuture<ScoredMatch>> futures,
                          List<SpeakerRecord> catalog,
                          long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            int resolved = resolveUnfinished(futures, catalog, "request deadline exceeded");
            LOG.warn("Scoring batch exceeded request deadline of {} ms; {} speakers scored as failures",
                    requestDeadlineMs, resolved);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            int resolved = resolveUnfinished(futures, catalog, "interrupted");
            LOG.warn("Scoring batch interrupted; {} speakers scored as failures", resolved);
        } catch (ExecutionException ee) {
            // Futures only complete normally; kept for the checked signature of get()
            LOG.error("Unexpected scoring batch failure", ee.getCause());
            resolveUnfinished(futures, catalog, "unexpected batch failure");
        }
    }

    private static int resolveUnfinished(List<CompletableFuture<ScoredMatch>> futures,
                                         List<SpeakerRecord> catalog,
                                         String reason) {
        int resolved = 0;
        for (int i = 0; i < futures.size(); i++) {
            if (futures.get(i).complete(ScoredMatch.failure(catalog.get(i), reason))) {
                resolved++;
            }
        }
        return resolved;
    }
}
