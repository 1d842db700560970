/**
 * Maps domain exceptions to HTTP status codes and a uniform {@code ApiError} body.
 *
 * <ul>
 *   <li>{@code ValidationException} - 400</li>
 *   <li>{@code UpstreamUnavailableException} - 503</li>
 *   <li>anything else - 500</li>
 * </ul>
 */
package com.phillippitts.speakermatch.presentation.exception;
