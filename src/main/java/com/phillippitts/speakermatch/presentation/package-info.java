/**
 * Presentation layer: REST controllers and the API error boundary.
 *
 * <p>Controllers stay thin. They translate wire DTOs to service calls and never catch domain
 * exceptions themselves.
 *
 * @see com.phillippitts.speakermatch.presentation.controller
 * @see com.phillippitts.speakermatch.presentation.exception
 */
package com.phillippitts.speakermatch.presentation;
