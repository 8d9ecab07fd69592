package com.phillippitts.speakwell.service.rubric;

import com.phillippitts.speakwell.domain.RubricWeights;

import java.util.Objects;

/**
 * Effective rubric plus the level it was resolved from.
 */
public record ResolvedRubric(RubricWeights weights, RubricSource source) {

    public ResolvedRubric {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(source, "source");
    }
}
