package com.phillippitts.speakwell.service.rubric;

import com.phillippitts.speakwell.domain.RubricWeights;

/**
 * A stored rubric override. Any field left null keeps the value of the rubric it is
 * applied to, so a doctor may override a single weight.
 *
 * @param mispronunciationWeight    override for the mispronunciation penalty, or null
 * @param omissionWeight            override for the omission penalty, or null
 * @param insertionWeight           override for the insertion deduction, or null
 * @param mispronunciationThreshold override for the edit-distance threshold, or null
 */
public record RubricSettings(
        Integer mispronunciationWeight,
        Integer omissionWeight,
        Integer insertionWeight,
        Integer mispronunciationThreshold
) {

    /**
     * Captures a full rubric as settings with every field set.
     */
    public static RubricSettings of(RubricWeights weights) {
        return new RubricSettings(weights.mispronunciationWeight(), weights.omissionWeight(),
                weights.insertionWeight(), weights.mispronunciationThreshold());
    }

    /**
     * Overlays these settings on a base rubric.
     *
     * @param base rubric supplying values for null fields
     * @return merged, validated weights
     * @throws com.phillippitts.speakwell.exception.InvalidRubricException if the merge is out of range
     */
    public RubricWeights applyTo(RubricWeights base) {
        return new RubricWeights(
                mispronunciationWeight == null ? base.mispronunciationWeight() : mispronunciationWeight,
                omissionWeight == null ? base.omissionWeight() : omissionWeight,
                insertionWeight == null ? base.insertionWeight() : insertionWeight,
                mispronunciationThreshold == null ? base.mispronunciationThreshold() : mispronunciationThreshold
        );
    }
}
