/**
 * Immutable value types exchanged by the pronunciation engine.
 *
 * <p>All models are Java records validated in their compact constructors:
 * <ul>
 *   <li>{@link com.phillippitts.speakwell.domain.TranscriptWord} and
 *       {@link com.phillippitts.speakwell.domain.Transcription} - transcriber output</li>
 *   <li>{@link com.phillippitts.speakwell.domain.WordResult} and
 *       {@link com.phillippitts.speakwell.domain.ErrorType} - per-word classification</li>
 *   <li>{@link com.phillippitts.speakwell.domain.RubricWeights} - scoring penalties</li>
 *   <li>{@link com.phillippitts.speakwell.domain.AnalysisResult} - terminal output</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.domain;
