package com.phillippitts.speakwell.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Classification of one word produced by alignment.
 *
 * <p>One result is produced per target word ({@link ErrorType#NONE},
 * {@link ErrorType#MISPRONUNCIATION} or {@link ErrorType#OMISSION}) and one per
 * unmatched transcript word ({@link ErrorType#INSERTION}).
 *
 * @param word          the target word, or the transcript text for insertions
 * @param error         the classification
 * @param transcribedAs the transcript word a mispronunciation was matched against;
 *                      null for every other classification
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WordResult(
        String word,
        ErrorType error,
        String transcribedAs
) {

    public WordResult {
        Objects.requireNonNull(word, "word must not be null");
        Objects.requireNonNull(error, "error must not be null");
        if (error == ErrorType.MISPRONUNCIATION) {
            Objects.requireNonNull(transcribedAs, "transcribedAs is required for a mispronunciation");
        } else if (transcribedAs != null) {
            throw new IllegalArgumentException("transcribedAs is only allowed for a mispronunciation, got: " + error);
        }
    }

    public static WordResult correct(String word) {
        return new WordResult(word, ErrorType.NONE, null);
    }

    public static WordResult mispronounced(String word, String transcribedAs) {
        return new WordResult(word, ErrorType.MISPRONUNCIATION, transcribedAs);
    }

    public static WordResult omitted(String word) {
        return new WordResult(word, ErrorType.OMISSION, null);
    }

    public static WordResult inserted(String transcriptText) {
        return new WordResult(transcriptText, ErrorType.INSERTION, null);
    }
}
