package com.phillippitts.speakwell.service.align;

import com.phillippitts.speakwell.domain.TranscriptWord;
import com.phillippitts.speakwell.domain.WordResult;

import java.util.List;

/**
 * Strategy interface for aligning target words against transcribed words.
 *
 * <p>Implementations classify every target word as correct, mispronounced or omitted, and
 * every transcript word left unmatched as an insertion.
 *
 * <p><b>Result Contract:</b>
 * <ul>
 *   <li>Exactly one non-insertion result per target word, in sentence order</li>
 *   <li>Exactly one insertion result per unmatched transcript word, in transcript order,
 *       after all target-word results</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations should be stateless; any bookkeeping lives in the
 * scope of a single {@link #align} call.
 *
 * @see com.phillippitts.speakwell.service.align.impl.GreedyWordAligner
 * @since 1.0
 */
public interface WordAligner {

    /**
     * Aligns target words with transcript words.
     *
     * @param targetWords     lowercase target tokens in sentence order (may be empty)
     * @param transcriptWords recognized words in transcript order (may be empty)
     * @param threshold       maximum edit distance that still counts as a mispronunciation;
     *                        a negative value disables the fuzzy phase
     * @return classified words, never null
     */
    List<WordResult> align(List<String> targetWords, List<TranscriptWord> transcriptWords, int threshold);
}
