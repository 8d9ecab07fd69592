package com.phillippitts.speakwell.service.align.impl;

import com.phillippitts.speakwell.domain.TranscriptWord;
import com.phillippitts.speakwell.domain.WordResult;
import com.phillippitts.speakwell.service.align.AbstractWordAligner;
import com.phillippitts.speakwell.service.align.LevenshteinDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Two-phase greedy aligner: exact match first, then closest fuzzy match.
 *
 * <p>Target words are processed in sentence order. For each one:
 * <ol>
 *   <li><b>Exact phase</b> - the first unconsumed transcript word (in transcript order) with
 *       identical lowercased text marks the target correct and is consumed.</li>
 *   <li><b>Fuzzy phase</b> - otherwise the unconsumed transcript word with the smallest
 *       Levenshtein distance {@code d}, {@code 0 < d <= threshold}, marks the target
 *       mispronounced and is consumed. Ties keep the first candidate seen.</li>
 *   <li>Otherwise the target is omitted and nothing is consumed.</li>
 * </ol>
 * Transcript words never consumed become insertions, appended in transcript order.
 *
 * <p>Not an optimal sequence alignment: transcript order only breaks ties.
 */
public final class GreedyWordAligner extends AbstractWordAligner {

    private static final Logger LOG = LogManager.getLogger(GreedyWordAligner.class);

    /**
     * Aligns two non-empty lists. Empty inputs are handled by {@link AbstractWordAligner}.
     */
    @Override
    protected List<WordResult> doAlign(List<String> targetWords, List<TranscriptWord> transcriptWords,
                                       int threshold) {
        List<String> transcript = lowercase(transcriptWords);
        boolean[] consumed = new boolean[transcript.size()];
        List<WordResult> results = new ArrayList<>(targetWords.size() + transcript.size());

        for (String targetWord : targetWords) {
            String target = targetWord.toLowerCase(Locale.ROOT);

            int exact = findExact(target, transcript, consumed);
            if (exact >= 0) {
                consumed[exact] = true;
                results.add(WordResult.correct(targetWord));
                LOG.debug("Exact match: target='{}' -> transcript[{}]", targetWord, exact);
                continue;
            }

            int fuzzy = findClosest(target, transcript, consumed, threshold);
            if (fuzzy >= 0) {
                consumed[fuzzy] = true;
                String heard = transcriptWords.get(fuzzy).text();
                results.add(WordResult.mispronounced(targetWord, heard));
                LOG.debug("Mispronunciation: target='{}' -> transcript[{}]='{}'", targetWord, fuzzy, heard);
            } else {
                results.add(WordResult.omitted(targetWord));
                LOG.debug("Omission: no candidate for target='{}' within threshold {}", targetWord, threshold);
            }
        }

        for (int i = 0; i < consumed.length; i++) {
            if (!consumed[i]) {
                String text = transcriptWords.get(i).text();
                results.add(WordResult.inserted(text));
                LOG.debug("Insertion: transcript[{}]='{}'", i, text);
            }
        }
        return results;
    }

    private static int findExact(String target, List<String> transcript, boolean[] consumed) {
        for (int i = 0; i < transcript.size(); i++) {
            if (!consumed[i] && transcript.get(i).equals(target)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds the unconsumed transcript index with the smallest positive distance within the
     * threshold. Strict less-than keeps the earliest index on ties.
     *
     * @return matching index, or -1 if no candidate qualifies
     */
    private static int findClosest(String target, List<String> transcript, boolean[] consumed, int threshold) {
        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < transcript.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            int distance = LevenshteinDistance.distance(target, transcript.get(i));
            if (distance > 0 && distance <= threshold && distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    private static List<String> lowercase(List<TranscriptWord> words) {
        List<String> lower = new ArrayList<>(words.size());
        for (TranscriptWord w : words) {
            lower.add(w.text().toLowerCase(Locale.ROOT));
        }
        return lower;
    }
}
