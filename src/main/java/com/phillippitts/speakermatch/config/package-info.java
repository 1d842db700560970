/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.speakermatch.config.ThreadPoolConfig} - bounded executor for
 *       per-speaker scoring tasks</li>
 *   <li>{@link com.phillippitts.speakermatch.config.WebConfig} - CORS origins</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.scoring} - provider client selection</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakermatch.config;
