/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakermatch.exception.SpeakerMatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.speakermatch.exception.ValidationException} - Caller input rejected
 *       before scoring starts (HTTP 400)</li>
 *   <li>{@link com.phillippitts.speakermatch.exception.ProviderException} - A scoring provider call
 *       failed; contained per item</li>
 *   <li>{@link com.phillippitts.speakermatch.exception.ResponseParseException} - A model reply held no
 *       parseable JSON object; contained per item</li>
 *   <li>{@link com.phillippitts.speakermatch.exception.UpstreamUnavailableException} - The speaker
 *       catalog is missing or empty (HTTP 503)</li>
 * </ul>
 *
 * <p>Only validation and catalog failures reach the caller. Provider and parse failures are converted
 * to zero-score matches by {@link com.phillippitts.speakermatch.service.scoring.SpeakerScorer}.
 *
 * @see com.phillippitts.speakermatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.speakermatch.exception;
