/**
 * Logging infrastructure: request-scoped MDC values for Log4j2.
 */
package com.phillippitts.speakermatch.config.logging;
