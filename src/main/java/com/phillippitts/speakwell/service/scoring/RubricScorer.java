package com.phillippitts.speakwell.service.scoring;

import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.domain.WordResult;

import java.util.List;

/**
 * Converts classified words and rubric weights into a single 0-100 score.
 *
 * <p>Each target word is worth {@value #POINTS_PER_WORD} possible points:
 * <ul>
 *   <li>correct: full points</li>
 *   <li>mispronunciation: {@code 100 * (100 - mispronunciationWeight) / 100}</li>
 *   <li>omission: {@code 100 * (100 - omissionWeight) / 100}</li>
 * </ul>
 * An insertion has no slot of its own; it deducts {@code insertionWeight} from the earned
 * points only. The ratio of earned to possible points is clamped to [0, 100] and rounded.
 * With no target words the score is 0.
 *
 * <p>Stateless and thread-safe.
 */
public final class RubricScorer {

    static final int POINTS_PER_WORD = 100;

    /**
     * Scores the given alignment.
     *
     * @param results classified words (null treated as empty)
     * @param weights rubric weights (null means {@link RubricWeights#DEFAULT})
     * @return score in [0, 100]
     */
    public int score(List<WordResult> results, RubricWeights weights) {
        if (results == null || results.isEmpty()) {
            return 0;
        }
        RubricWeights w = weights == null ? RubricWeights.DEFAULT : weights;

        double totalPossible = 0;
        double actual = 0;
        for (WordResult result : results) {
            if (result.error().isTargetSlot()) {
                totalPossible += POINTS_PER_WORD;
            }
            actual += contribution(result, w);
        }

        if (totalPossible == 0) {
            return 0;
        }
        double ratio = actual / totalPossible * 100;
        return (int) Math.round(Math.max(0, Math.min(100, ratio)));
    }

    private static double contribution(WordResult result, RubricWeights w) {
        return switch (result.error()) {
            case NONE -> POINTS_PER_WORD;
            case MISPRONUNCIATION -> POINTS_PER_WORD * (100.0 - w.mispronunciationWeight()) / 100.0;
            case OMISSION -> POINTS_PER_WORD * (100.0 - w.omissionWeight()) / 100.0;
            case INSERTION -> -w.insertionWeight();
        };
    }
}
