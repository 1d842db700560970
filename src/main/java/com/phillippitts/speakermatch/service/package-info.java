/**
 * Service layer containing the scoring and ranking logic.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.scoring} - provider clients, prompt building, reply parsing and the
 *       per-speaker scorer</li>
 *   <li>{@code service.matching} - concurrent fan-out over the catalog and threshold ranking</li>
 *   <li>{@code service.catalog} - speaker catalog loading</li>
 *   <li>{@code service.recommend} - request-level facade (validate, load, match)</li>
 *   <li>{@code service.metrics} / {@code service.health} - Micrometer meters and actuator health</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans ({@code @Component}, {@code @Service})</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Per-speaker failures are values, not exceptions</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @see com.phillippitts.speakermatch.service.matching
 * @see com.phillippitts.speakermatch.service.scoring
 * @since 1.0
 */
package com.phillippitts.speakermatch.service;
