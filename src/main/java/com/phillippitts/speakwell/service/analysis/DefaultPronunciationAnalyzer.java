package com.phillippitts.speakwell.service.analysis;

import com.phillippitts.speakwell.config.properties.AnalysisProperties;
import com.phillippitts.speakwell.domain.AnalysisResult;
import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.domain.Transcription;
import com.phillippitts.speakwell.domain.WordResult;
import com.phillippitts.speakwell.exception.InvalidRubricException;
import com.phillippitts.speakwell.service.align.WordAligner;
import com.phillippitts.speakwell.service.analysis.event.PronunciationAnalyzedEvent;
import com.phillippitts.speakwell.service.metrics.AnalysisMetrics;
import com.phillippitts.speakwell.service.rubric.RubricResolver;
import com.phillippitts.speakwell.service.scoring.RubricScorer;
import com.phillippitts.speakwell.util.LogSanitizer;
import com.phillippitts.speakwell.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of {@link PronunciationAnalyzer}.
 *
 * <p>Pipeline per call: tokenize target sentence, align with the transcript words using the
 * rubric's threshold, score with the rubric's weights, then record metrics and publish a
 * {@link PronunciationAnalyzedEvent}.
 *
 * <p><b>Degenerate input:</b> a target sentence without words is not an error. Every
 * transcript word becomes an insertion and the score is 0.
 *
 * <p><b>Error Handling:</b> an out-of-range stored rubric is counted as a failure and the
 * {@link InvalidRubricException} propagates to the caller; nothing is published.
 *
 * @since 1.0
 */
public class DefaultPronunciationAnalyzer implements PronunciationAnalyzer {

    private static final Logger LOG = LogManager.getLogger(DefaultPronunciationAnalyzer.class);

    private final AnalysisProperties props;
    private final ApplicationEventPublisher publisher;
    private final WordAligner aligner;
    private final RubricScorer scorer;
    private final RubricResolver rubricResolver;
    private final AnalysisMetrics metrics;

    /**
     * Constructs a DefaultPronunciationAnalyzer.
     *
     * @param props analysis configuration (log preview length, event publishing)
     * @param publisher Spring event publisher for completed analyses
     * @param aligner word aligner
     * @param scorer rubric scorer
     * @param rubricResolver resolver for stored and default rubrics
     * @param metrics metrics recorder
     * @throws NullPointerException if any parameter is null
     */
    public DefaultPronunciationAnalyzer(AnalysisProperties props,
                                        ApplicationEventPublisher publisher,
                                        WordAligner aligner,
                                        RubricScorer scorer,
                                        RubricResolver rubricResolver,
                                        AnalysisMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.aligner = Objects.requireNonNull(aligner, "aligner must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.rubricResolver = Objects.requireNonNull(rubricResolver, "rubricResolver must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public AnalysisResult analyze(String targetSentence, Transcription transcription, RubricWeights weights) {
        RubricWeights rubric = weights == null ? rubricResolver.defaults() : weights;
        return run(null, null, targetSentence, transcription, rubric);
    }

    @Override
    public AnalysisResult analyzeFor(String doctorId, String patientId, String targetSentence,
                                     Transcription transcription, RubricWeights override) {
        RubricWeights rubric;
        if (override != null) {
            rubric = override;
        } else {
            try {
                rubric = rubricResolver.resolve(doctorId, patientId).weights();
            } catch (InvalidRubricException e) {
                metrics.incrementFailure("invalid_rubric");
                LOG.warn("Stored rubric rejected for doctor {}: {}", doctorId, e.getMessage());
                throw e;
            }
        }
        return run(doctorId, patientId, targetSentence, transcription, rubric);
    }

    private AnalysisResult run(String doctorId, String patientId, String targetSentence,
                               Transcription transcription, RubricWeights rubric) {
        Objects.requireNonNull(targetSentence, "targetSentence must not be null");
        Transcription heard = transcription == null ? Transcription.empty() : transcription;
        long startTime = System.nanoTime();

        List<String> targetWords = SentenceTokenizer.tokenize(targetSentence);
        if (targetWords.isEmpty()) {
            LOG.warn("Target sentence has no words; all {} transcript words count as insertions",
                    heard.words().size());
        }

        List<WordResult> words = aligner.align(targetWords, heard.words(), rubric.mispronunciationThreshold());
        int score = scorer.score(words, rubric);
        AnalysisResult result = new AnalysisResult(score, words, heard.text());

        long duration = TimeUtils.elapsedNanos(startTime);
        metrics.recordAnalysis(result, duration);
        LOG.info("Analysis complete: score={}, targetWords={}, transcriptWords={}, target='{}', durationMs={}",
                score, targetWords.size(), heard.words().size(),
                LogSanitizer.preview(targetSentence, props.getLogPreviewChars()),
                TimeUtils.nanosToMillis(duration));

        if (props.isPublishEvents()) {
            publisher.publishEvent(new PronunciationAnalyzedEvent(
                    doctorId, patientId, targetSentence, result, Instant.now()));
        }
        return result;
    }
}
