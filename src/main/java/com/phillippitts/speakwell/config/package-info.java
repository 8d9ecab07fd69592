/**
 * Application-wide configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.analysis} - wiring of the aligner, scorer, rubric resolver and analyzer</li>
 *   <li>{@code config.properties} - typed {@code speakwell.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.config;
