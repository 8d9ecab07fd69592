package com.phillippitts.speakwell.service.analysis;

import com.phillippitts.speakwell.config.properties.AnalysisProperties;
import com.phillippitts.speakwell.domain.AnalysisResult;
import com.phillippitts.speakwell.domain.ErrorType;
import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.domain.Transcription;
import com.phillippitts.speakwell.domain.WordResult;
import com.phillippitts.speakwell.exception.InvalidRubricException;
import com.phillippitts.speakwell.service.align.impl.GreedyWordAligner;
import com.phillippitts.speakwell.service.analysis.event.PronunciationAnalyzedEvent;
import com.phillippitts.speakwell.service.metrics.AnalysisMetrics;
import com.phillippitts.speakwell.service.rubric.RubricResolver;
import com.phillippitts.speakwell.service.rubric.RubricSettings;
import com.phillippitts.speakwell.service.rubric.RubricSettingsStore;
import com.phillippitts.speakwell.service.scoring.RubricScorer;
import com.phillippitts.speakwell.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.phillippitts.speakwell.testutil.Transcripts.transcription;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultPronunciationAnalyzerTest {

    private EventCapturingPublisher publisher;
    private MeterRegistry registry;
    private RubricSettingsStore store;
    private DefaultPronunciationAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        store = mock(RubricSettingsStore.class);
        when(store.findForDoctor(any())).thenReturn(Optional.empty());
        when(store.findForPatient(any(), any())).thenReturn(Optional.empty());
        analyzer = newAnalyzer(AnalysisProperties.defaults());
    }

    private DefaultPronunciationAnalyzer newAnalyzer(AnalysisProperties props) {
        AnalysisMetrics metrics = new AnalysisMetrics(registry);
        RubricResolver resolver = new RubricResolver(store, RubricWeights.DEFAULT, metrics);
        return new DefaultPronunciationAnalyzer(props, publisher, new GreedyWordAligner(), new RubricScorer(),
                resolver, metrics);
    }

    @Test
    void perfectReadingScoresHundred() {
        AnalysisResult result = analyzer.analyze("The cat sat", transcription("the", "cat", "sat"), null);

        assertThat(result.overallScore()).isEqualTo(100);
        assertThat(result.words()).extracting(WordResult::error).containsOnly(ErrorType.NONE);
        assertThat(result.transcribedText()).isEqualTo("the cat sat");
    }

    @Test
    void mispronouncedWordScoresEightyThree() {
        AnalysisResult result = analyzer.analyze("the cat sat", transcription("the", "kat", "sat"), null);

        assertThat(result.words()).containsExactly(
                WordResult.correct("the"), WordResult.mispronounced("cat", "kat"), WordResult.correct("sat"));
        assertThat(result.overallScore()).isEqualTo(83);
    }

    @Test
    void omittedWordWithoutCandidateScoresSeventySeven() {
        RubricWeights noFuzzy = new RubricWeights(50, 70, 30, 0);

        AnalysisResult result = analyzer.analyze("the cat sat", transcription("the", "sat"), noFuzzy);

        assertThat(result.words()).containsExactly(
                WordResult.correct("the"), WordResult.omitted("cat"), WordResult.correct("sat"));
        assertThat(result.overallScore()).isEqualTo(77);
    }

    @Test
    void greedyFuzzyMatchAppliesWithDefaultThreshold() {
        // "cat" takes "sat" as a close match before "sat" is looked up
        AnalysisResult result = analyzer.analyze("the cat sat", transcription("the", "sat"), null);

        assertThat(result.words()).containsExactly(
                WordResult.correct("the"), WordResult.mispronounced("cat", "sat"), WordResult.omitted("sat"));
        // (100 + 50 + 30) / 300 = 60
        assertThat(result.overallScore()).isEqualTo(60);
    }

    @Test
    void insertedWordScoresEightyFive() {
        AnalysisResult result = analyzer.analyze("the cat", transcription("the", "cat", "now"), null);

        assertThat(result.words()).containsExactly(
                WordResult.correct("the"), WordResult.correct("cat"), WordResult.inserted("now"));
        assertThat(result.overallScore()).isEqualTo(85);
    }

    @Test
    void emptyTranscriptScoresThirty() {
        AnalysisResult result = analyzer.analyze("the cat sat", Transcription.empty(), null);

        assertThat(result.words()).extracting(WordResult::error).containsOnly(ErrorType.OMISSION);
        assertThat(result.overallScore()).isEqualTo(30);
        assertThat(result.transcribedText()).isEmpty();
    }

    @Test
    void nullTranscriptionIsTreatedAsEmpty() {
        AnalysisResult result = analyzer.analyze("the cat", null, null);

        assertThat(result.count(ErrorType.OMISSION)).isEqualTo(2);
    }

    @Test
    void blankTargetSentenceYieldsInsertionsAndZeroScore() {
        AnalysisResult result = analyzer.analyze("   ", transcription("hello", "there"), null);

        assertThat(result.overallScore()).isZero();
        assertThat(result.words()).containsExactly(WordResult.inserted("hello"), WordResult.inserted("there"));
    }

    @Test
    void rejectsNullTargetSentence() {
        assertThatThrownBy(() -> analyzer.analyze(null, transcription("hi"), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("targetSentence");
    }

    @Test
    void explicitWeightsOverrideDefaults() {
        RubricWeights lenient = new RubricWeights(0, 70, 30, 3);

        AnalysisResult result = analyzer.analyze("the cat sat", transcription("the", "kat", "sat"), lenient);

        assertThat(result.overallScore()).isEqualTo(100);
    }

    @Test
    void analyzeForUsesStoredPatientRubric() {
        when(store.findForPatient("dr-1", "pt-1")).thenReturn(Optional.of(new RubricSettings(100, null, null, null)));

        AnalysisResult result = analyzer.analyzeFor("dr-1", "pt-1", "the cat sat", transcription("the", "kat", "sat"));

        // (100 + 0 + 100) / 300 = 66.7
        assertThat(result.overallScore()).isEqualTo(67);
    }

    @Test
    void analyzeForPrefersOverrideOverStoredRubric() {
        when(store.findForDoctor("dr-1")).thenReturn(Optional.of(new RubricSettings(100, null, null, null)));

        AnalysisResult result = analyzer.analyzeFor("dr-1", null, "the cat sat",
                transcription("the", "kat", "sat"), RubricWeights.DEFAULT);

        assertThat(result.overallScore()).isEqualTo(83);
    }

    @Test
    void analyzeForCountsInvalidStoredRubricAsFailure() {
        when(store.findForDoctor("dr-1")).thenReturn(Optional.of(new RubricSettings(150, null, null, null)));

        assertThatThrownBy(() -> analyzer.analyzeFor("dr-1", null, "the cat", transcription("the", "cat")))
                .isInstanceOf(InvalidRubricException.class);

        assertThat(registry.find("speakwell.analysis.failure").tag("reason", "invalid_rubric").counter())
                .isNotNull()
                .satisfies(c -> assertThat(c.count()).isEqualTo(1.0));
        assertThat(publisher.analyzedEvents()).isEmpty();
    }

    @Test
    void publishesAnalyzedEventWithCallerIds() {
        AnalysisResult result = analyzer.analyzeFor("dr-1", "pt-9", "the cat", transcription("the", "cat"));

        assertThat(publisher.analyzedEvents()).hasSize(1);
        PronunciationAnalyzedEvent event = publisher.analyzedEvents().get(0);
        assertThat(event.doctorId()).isEqualTo("dr-1");
        assertThat(event.patientId()).isEqualTo("pt-9");
        assertThat(event.targetSentence()).isEqualTo("the cat");
        assertThat(event.result()).isEqualTo(result);
        assertThat(event.timestamp()).isNotNull();
    }

    @Test
    void doesNotPublishWhenEventsDisabled() {
        DefaultPronunciationAnalyzer quiet = newAnalyzer(new AnalysisProperties(40, false));

        quiet.analyze("the cat", transcription("the", "cat"), null);

        assertThat(publisher.size()).isZero();
    }

    @Test
    void recordsMetricsForEachAnalysis() {
        analyzer.analyze("the cat sat", transcription("the", "kat", "sat", "uh"), null);

        assertThat(registry.find("speakwell.analysis.latency").timer()).isNotNull()
                .satisfies(t -> assertThat(t.count()).isEqualTo(1));
        assertThat(registry.find("speakwell.analysis.words").tag("error", "none").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("speakwell.analysis.words").tag("error", "mispronunciation").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("speakwell.analysis.words").tag("error", "insertion").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void analysisIsIdempotent() {
        Transcription heard = transcription("peter", "piper", "pick", "a", "peck");

        AnalysisResult first = analyzer.analyze("Peter Piper picked a peck", heard, null);
        AnalysisResult second = analyzer.analyze("Peter Piper picked a peck", heard, null);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void constructorRejectsNulls() {
        AnalysisMetrics metrics = new AnalysisMetrics(registry);
        RubricResolver resolver = new RubricResolver(store, RubricWeights.DEFAULT, metrics);

        assertThatThrownBy(() -> new DefaultPronunciationAnalyzer(null, publisher, new GreedyWordAligner(),
                new RubricScorer(), resolver, metrics))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("props");
        assertThatThrownBy(() -> new DefaultPronunciationAnalyzer(AnalysisProperties.defaults(), publisher, null,
                new RubricScorer(), resolver, metrics))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("aligner");
    }
}
