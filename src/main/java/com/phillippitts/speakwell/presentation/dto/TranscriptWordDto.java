package com.phillippitts.speakwell.presentation.dto;

import com.phillippitts.speakwell.domain.TranscriptWord;
import jakarta.validation.constraints.NotNull;

/**
 * JSON form of a transcribed word.
 */
public record TranscriptWordDto(
        @NotNull String text,
        double startTime,
        double endTime
) {

    public TranscriptWord toDomain() {
        return new TranscriptWord(text, startTime, endTime);
    }
}
