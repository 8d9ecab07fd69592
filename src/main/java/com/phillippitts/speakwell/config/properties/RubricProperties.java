package com.phillippitts.speakwell.config.properties;

import com.phillippitts.speakwell.domain.RubricWeights;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Default rubric applied when no doctor or patient specific rubric is stored.
 */
@Validated
@ConfigurationProperties(prefix = "speakwell.rubric")
public class RubricProperties {

    /** Penalty for a mispronounced word (0..100). */
    @Min(0)
    @Max(100)
    private final int mispronunciationWeight;

    /** Penalty for an omitted word (0..100). */
    @Min(0)
    @Max(100)
    private final int omissionWeight;

    /** Flat deduction per inserted word (0..100). */
    @Min(0)
    @Max(100)
    private final int insertionWeight;

    /** Maximum Levenshtein distance still counted as a mispronunciation. */
    @Min(0)
    private final int mispronunciationThreshold;

    @ConstructorBinding
    public RubricProperties(Integer mispronunciationWeight, Integer omissionWeight,
                            Integer insertionWeight, Integer mispronunciationThreshold) {
        RubricWeights d = RubricWeights.DEFAULT;
        this.mispronunciationWeight = mispronunciationWeight == null
                ? d.mispronunciationWeight() : mispronunciationWeight;
        this.omissionWeight = omissionWeight == null ? d.omissionWeight() : omissionWeight;
        this.insertionWeight = insertionWeight == null ? d.insertionWeight() : insertionWeight;
        this.mispronunciationThreshold = mispronunciationThreshold == null
                ? d.mispronunciationThreshold() : mispronunciationThreshold;
    }

    /**
     * Properties carrying the built-in defaults (50/70/30, threshold 3).
     */
    public static RubricProperties defaults() {
        return new RubricProperties(null, null, null, null);
    }

    public int getMispronunciationWeight() {
        return mispronunciationWeight;
    }

    public int getOmissionWeight() {
        return omissionWeight;
    }

    public int getInsertionWeight() {
        return insertionWeight;
    }

    public int getMispronunciationThreshold() {
        return mispronunciationThreshold;
    }

    /**
     * @return the configured defaults as validated weights
     * @throws com.phillippitts.speakwell.exception.InvalidRubricException if a value is out of range
     */
    public RubricWeights toWeights() {
        return new RubricWeights(mispronunciationWeight, omissionWeight, insertionWeight,
                mispronunciationThreshold);
    }
}
