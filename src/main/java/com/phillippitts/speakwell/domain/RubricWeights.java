package com.phillippitts.speakwell.domain;

import com.phillippitts.speakwell.exception.InvalidRubricException;

/**
 * Penalty weights controlling how alignment errors map to the overall score.
 *
 * <p>Weights are penalty severities in [0, 100]: a higher weight lowers the score
 * contribution of that error type. A mispronunciation weight of 100 scores the word like a
 * miss; 0 scores it as if correct. The insertion weight is a flat deduction per inserted
 * word. The threshold bounds how many character edits still count as a mispronunciation.
 *
 * @param mispronunciationWeight    penalty for a mispronounced word (0-100)
 * @param omissionWeight            penalty for an omitted word (0-100)
 * @param insertionWeight           flat deduction per inserted word (0-100)
 * @param mispronunciationThreshold maximum Levenshtein distance for a mispronunciation (>= 0)
 */
public record RubricWeights(
        int mispronunciationWeight,
        int omissionWeight,
        int insertionWeight,
        int mispronunciationThreshold
) {

    public static final int MAX_WEIGHT = 100;

    /** Rubric used when no custom rubric is available. */
    public static final RubricWeights DEFAULT = new RubricWeights(50, 70, 30, 3);

    /**
     * @throws InvalidRubricException if a weight is outside [0,100] or the threshold is negative
     */
    public RubricWeights {
        requireWeight("mispronunciationWeight", mispronunciationWeight);
        requireWeight("omissionWeight", omissionWeight);
        requireWeight("insertionWeight", insertionWeight);
        if (mispronunciationThreshold < 0) {
            throw new InvalidRubricException("mispronunciationThreshold", mispronunciationThreshold, "must be >= 0");
        }
    }

    private static void requireWeight(String field, int value) {
        if (value < 0 || value > MAX_WEIGHT) {
            throw new InvalidRubricException(field, value, "must be between 0 and " + MAX_WEIGHT);
        }
    }
}
