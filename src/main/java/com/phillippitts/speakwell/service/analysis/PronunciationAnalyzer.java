package com.phillippitts.speakwell.service.analysis;

import com.phillippitts.speakwell.domain.AnalysisResult;
import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.domain.Transcription;

/**
 * Entry point for pronunciation analysis: tokenizes the target sentence, aligns it with
 * the transcript and scores the alignment.
 *
 * <p>Implementations are thread-safe. Each call owns its inputs and returns a fresh,
 * immutable {@link AnalysisResult}.
 *
 * @since 1.0
 */
public interface PronunciationAnalyzer {

    /**
     * Analyzes a transcript against a target sentence with an explicit rubric.
     *
     * @param targetSentence raw sentence the speaker was asked to say (must not be null)
     * @param transcription  transcriber output (null treated as empty)
     * @param weights        rubric to score with (null means the configured default rubric)
     * @return analysis result
     */
    AnalysisResult analyze(String targetSentence, Transcription transcription, RubricWeights weights);

    /**
     * Analyzes a transcript for a doctor/patient pair, using their stored rubric unless an
     * override is given.
     *
     * @param doctorId       doctor identifier (may be null)
     * @param patientId      patient identifier (may be null)
     * @param targetSentence raw target sentence (must not be null)
     * @param transcription  transcriber output (null treated as empty)
     * @param override       rubric that takes precedence over stored rubrics, or null
     * @return analysis result
     * @throws com.phillippitts.speakwell.exception.InvalidRubricException if a stored rubric is out of range
     */
    AnalysisResult analyzeFor(String doctorId, String patientId, String targetSentence,
                              Transcription transcription, RubricWeights override);

    /**
     * Same as {@link #analyzeFor(String, String, String, Transcription, RubricWeights)} without
     * an override.
     */
    default AnalysisResult analyzeFor(String doctorId, String patientId, String targetSentence,
                                      Transcription transcription) {
        return analyzeFor(doctorId, patientId, targetSentence, transcription, null);
    }
}
