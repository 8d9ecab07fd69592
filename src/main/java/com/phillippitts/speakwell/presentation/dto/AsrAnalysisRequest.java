package com.phillippitts.speakwell.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Analysis request carrying raw word-level ASR output as produced in the browser.
 *
 * @param targetSentence sentence the patient was asked to say
 * @param asrOutput      transformers.js output JSON ({@code text} plus word {@code chunks})
 * @param doctorId       optional doctor id
 * @param patientId      optional patient id
 */
public record AsrAnalysisRequest(
        @NotNull String targetSentence,
        @NotBlank String asrOutput,
        String doctorId,
        String patientId
) {}
