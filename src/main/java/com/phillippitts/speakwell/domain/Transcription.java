package com.phillippitts.speakwell.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Full transcriber output: the flat transcribed text plus the ordered word list.
 *
 * @param text  the transcribed text as reported by the transcriber (never null)
 * @param words recognized words in time order (never null, immutable)
 */
public record Transcription(
        String text,
        List<TranscriptWord> words
) {

    private static final Transcription EMPTY = new Transcription("", List.of());

    public Transcription {
        text = text == null ? "" : text;
        words = words == null ? List.of() : List.copyOf(words);
    }

    /**
     * Builds a transcription whose text is the word texts joined by single spaces.
     *
     * @param words recognized words
     * @return a new Transcription
     */
    public static Transcription ofWords(List<TranscriptWord> words) {
        List<TranscriptWord> safe = words == null ? List.of() : words;
        String text = safe.stream().map(TranscriptWord::text).collect(Collectors.joining(" "));
        return new Transcription(text, safe);
    }

    /**
     * Returns a transcription with no words, used when the transcriber heard nothing.
     *
     * @return the empty transcription
     */
    public static Transcription empty() {
        return EMPTY;
    }
}
