package com.phillippitts.speakwell.service.align;

import com.phillippitts.speakwell.domain.TranscriptWord;
import com.phillippitts.speakwell.domain.WordResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for word aligners implementing the degenerate cases once.
 *
 * <p>{@link #align} treats null lists as empty and short-circuits:
 * <ul>
 *   <li>no target words and no transcript words: empty result</li>
 *   <li>no target words: every transcript word is an insertion</li>
 *   <li>no transcript words: every target word is an omission</li>
 *   <li>otherwise: {@link #doAlign} with both lists non-empty</li>
 * </ul>
 *
 * @since 1.0
 */
public abstract class AbstractWordAligner implements WordAligner {

    @Override
    public final List<WordResult> align(List<String> targetWords, List<TranscriptWord> transcriptWords,
                                        int threshold) {
        List<String> targets = targetWords == null ? List.of() : targetWords;
        List<TranscriptWord> transcript = transcriptWords == null ? List.of() : transcriptWords;

        if (targets.isEmpty()) {
            return allInserted(transcript);
        }
        if (transcript.isEmpty()) {
            return allOmitted(targets);
        }
        return List.copyOf(doAlign(targets, transcript, threshold));
    }

    /**
     * Aligns two non-empty lists.
     *
     * @param targetWords     target tokens (never empty)
     * @param transcriptWords transcript words (never empty)
     * @param threshold       edit-distance threshold; below 1 no fuzzy match is possible
     * @return classified words
     */
    protected abstract List<WordResult> doAlign(List<String> targetWords, List<TranscriptWord> transcriptWords,
                                                int threshold);

    protected final List<WordResult> allInserted(List<TranscriptWord> transcriptWords) {
        List<WordResult> results = new ArrayList<>(transcriptWords.size());
        for (TranscriptWord w : transcriptWords) {
            results.add(WordResult.inserted(w.text()));
        }
        return List.copyOf(results);
    }

    protected final List<WordResult> allOmitted(List<String> targetWords) {
        List<WordResult> results = new ArrayList<>(targetWords.size());
        for (String target : targetWords) {
            results.add(WordResult.omitted(target));
        }
        return List.copyOf(results);
    }
}
