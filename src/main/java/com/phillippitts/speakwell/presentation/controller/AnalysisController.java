package com.phillippitts.speakwell.presentation.controller;

import com.phillippitts.speakwell.config.logging.MdcFilter;
import com.phillippitts.speakwell.domain.AnalysisResult;
import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.domain.Transcription;
import com.phillippitts.speakwell.exception.TranscriptionException;
import com.phillippitts.speakwell.presentation.dto.AnalysisRequest;
import com.phillippitts.speakwell.presentation.dto.AsrAnalysisRequest;
import com.phillippitts.speakwell.service.analysis.PronunciationAnalyzer;
import com.phillippitts.speakwell.service.metrics.AnalysisMetrics;
import com.phillippitts.speakwell.service.rubric.RubricResolver;
import com.phillippitts.speakwell.service.transcript.WhisperChunkParser;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pronunciation analysis endpoints. The transcript is produced by the caller's transcriber
 * and posted either as a word list or as raw ASR output.
 */
@RestController
@RequestMapping("/api/analysis")
class AnalysisController {

    private static final Logger LOG = LogManager.getLogger(AnalysisController.class);

    private final PronunciationAnalyzer analyzer;
    private final RubricResolver rubricResolver;
    private final AnalysisMetrics metrics;

    AnalysisController(PronunciationAnalyzer analyzer, RubricResolver rubricResolver, AnalysisMetrics metrics) {
        this.analyzer = analyzer;
        this.rubricResolver = rubricResolver;
        this.metrics = metrics;
    }

    @PostMapping
    ResponseEntity<AnalysisResult> analyze(
            @Valid @RequestBody AnalysisRequest request,
            @RequestHeader(value = MdcFilter.DOCTOR_ID_HEADER, required = false) String doctorHeader,
            @RequestHeader(value = MdcFilter.PATIENT_ID_HEADER, required = false) String patientHeader) {
        RubricWeights override = request.rubric() == null
                ? null
                : request.rubric().applyTo(rubricResolver.defaults());
        Transcription transcription = request.toTranscription();
        LOG.debug("Analysis requested: transcriptWords={}, rubricOverride={}",
                transcription.words().size(), override != null);

        AnalysisResult result = analyzer.analyzeFor(
                firstNonBlank(request.doctorId(), doctorHeader),
                firstNonBlank(request.patientId(), patientHeader),
                request.targetSentence(), transcription, override);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/asr")
    ResponseEntity<AnalysisResult> analyzeAsrOutput(
            @Valid @RequestBody AsrAnalysisRequest request,
            @RequestHeader(value = MdcFilter.DOCTOR_ID_HEADER, required = false) String doctorHeader,
            @RequestHeader(value = MdcFilter.PATIENT_ID_HEADER, required = false) String patientHeader) {
        Transcription transcription;
        try {
            transcription = WhisperChunkParser.parse(request.asrOutput());
        } catch (TranscriptionException e) {
            metrics.incrementFailure("transcription_error");
            throw e;
        }
        LOG.debug("ASR analysis requested: transcriptWords={}", transcription.words().size());

        AnalysisResult result = analyzer.analyzeFor(
                firstNonBlank(request.doctorId(), doctorHeader),
                firstNonBlank(request.patientId(), patientHeader),
                request.targetSentence(), transcription);
        return ResponseEntity.ok(result);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
