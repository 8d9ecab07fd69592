/**
 * Pronunciation analysis orchestration.
 *
 * <p>{@link com.phillippitts.speakwell.service.analysis.PronunciationAnalyzer} runs the
 * tokenize, align and score pipeline; completed analyses are announced with
 * {@link com.phillippitts.speakwell.service.analysis.event.PronunciationAnalyzedEvent}.
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.service.analysis;
