package com.phillippitts.speakwell.presentation.dto;

import com.phillippitts.speakwell.domain.TranscriptWord;
import com.phillippitts.speakwell.domain.Transcription;
import com.phillippitts.speakwell.service.rubric.RubricSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Analysis request carrying an already transcribed word list.
 *
 * @param targetSentence  sentence the patient was asked to say
 * @param transcribedText transcriber's flat text; derived from the words when absent
 * @param words           recognized words in transcript order (may be empty)
 * @param rubric          optional rubric override, layered over the default rubric
 * @param doctorId        optional doctor id (falls back to the X-Doctor-ID header)
 * @param patientId       optional patient id (falls back to the X-Patient-ID header)
 */
public record AnalysisRequest(
        @NotNull String targetSentence,
        String transcribedText,
        List<@Valid @NotNull TranscriptWordDto> words,
        RubricSettings rubric,
        String doctorId,
        String patientId
) {

    public Transcription toTranscription() {
        List<TranscriptWord> domainWords = words == null
                ? List.of()
                : words.stream().map(TranscriptWordDto::toDomain).toList();
        if (transcribedText == null) {
            return Transcription.ofWords(domainWords);
        }
        return new Transcription(transcribedText, domainWords);
    }
}
