/**
 * Domain models for speaker matching.
 *
 * <p>All domain models are immutable records that validate or normalize in their constructors.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.speakermatch.domain.SpeakerRecord} - one catalog entry</li>
 *   <li>{@link com.phillippitts.speakermatch.domain.MatchQuery} - business context and threshold</li>
 *   <li>{@link com.phillippitts.speakermatch.domain.ScoredMatch} - one speaker's score and rationale</li>
 *   <li>{@link com.phillippitts.speakermatch.domain.MatchSet} - ranked, filtered matches</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakermatch.domain;
