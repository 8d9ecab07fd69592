package com.phillippitts.speakwell.domain;

import java.util.Objects;

/**
 * A single word recognized by the speech-to-text transcriber, with its timing.
 *
 * <p>Timestamps are carried through as produced by the transcriber; monotonicity is not
 * checked.
 *
 * @param text      the recognized word (must not be null)
 * @param startTime start of the word in seconds
 * @param endTime   end of the word in seconds
 */
public record TranscriptWord(
        String text,
        double startTime,
        double endTime
) {

    public TranscriptWord {
        Objects.requireNonNull(text, "Transcript word text must not be null");
    }

    /**
     * Creates a transcript word without timing information (both timestamps zero).
     *
     * @param text the recognized word
     * @return a new TranscriptWord
     */
    public static TranscriptWord of(String text) {
        return new TranscriptWord(text, 0.0, 0.0);
    }
}
