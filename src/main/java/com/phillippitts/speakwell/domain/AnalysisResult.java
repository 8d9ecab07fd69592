package com.phillippitts.speakwell.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a pronunciation analysis: overall score, per-word classification and the
 * transcribed text it was computed from.
 *
 * @param overallScore    aggregate score in [0, 100]
 * @param words           target-word results in sentence order followed by insertions in
 *                        transcript order (immutable)
 * @param transcribedText the transcriber's text (never null)
 */
public record AnalysisResult(
        int overallScore,
        List<WordResult> words,
        String transcribedText
) {

    public AnalysisResult {
        if (overallScore < 0 || overallScore > 100) {
            throw new IllegalArgumentException("overallScore must be between 0 and 100, got: " + overallScore);
        }
        Objects.requireNonNull(words, "words must not be null");
        words = List.copyOf(words);
        transcribedText = transcribedText == null ? "" : transcribedText;
    }

    /**
     * Counts the results carrying the given classification.
     *
     * @param type classification to count
     * @return number of matching results
     */
    public long count(ErrorType type) {
        return words.stream().filter(w -> w.error() == type).count();
    }
}
