package com.phillippitts.speakwell.service.analysis.event;

import com.phillippitts.speakwell.domain.AnalysisResult;

import java.time.Instant;

/**
 * Emitted when an analysis completes, for consumers that keep practice history.
 *
 * @param doctorId       doctor the analysis was run for (may be null)
 * @param patientId      patient the analysis was run for (may be null)
 * @param targetSentence the sentence the patient practiced
 * @param result         the analysis outcome
 * @param timestamp      when the analysis completed
 */
public record PronunciationAnalyzedEvent(
        String doctorId,
        String patientId,
        String targetSentence,
        AnalysisResult result,
        Instant timestamp
) {}
