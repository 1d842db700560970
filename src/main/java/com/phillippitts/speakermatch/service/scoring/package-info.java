/**
 * Per-speaker scoring: provider clients, prompt rendering and the scorer that turns a model
 * reply into a {@link com.phillippitts.speakermatch.domain.ScoredMatch}.
 *
 * <p>Architecture:
 * <ul>
 *   <li>{@link com.phillippitts.speakermatch.service.scoring.ScoringClient} - one prompt in, raw text out</li>
 *   <li>{@link com.phillippitts.speakermatch.service.scoring.AbstractScoringClient} - error normalization</li>
 *   <li>{@code openai} / {@code anthropic} - LangChain4j-backed implementations</li>
 *   <li>{@code parse} - JSON extraction from free-text replies</li>
 * </ul>
 *
 * <p>The scorer is the failure boundary: provider and parse errors end there and become
 * zero-score matches.
 *
 * @since 1.0
 */
package com.phillippitts.speakermatch.service.scoring;
