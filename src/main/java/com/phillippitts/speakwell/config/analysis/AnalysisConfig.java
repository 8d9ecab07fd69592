package com.phillippitts.speakwell.config.analysis;

import com.phillippitts.speakwell.config.properties.AnalysisProperties;
import com.phillippitts.speakwell.config.properties.RubricProperties;
import com.phillippitts.speakwell.service.align.WordAligner;
import com.phillippitts.speakwell.service.align.impl.GreedyWordAligner;
import com.phillippitts.speakwell.service.analysis.DefaultPronunciationAnalyzer;
import com.phillippitts.speakwell.service.analysis.PronunciationAnalyzer;
import com.phillippitts.speakwell.service.exercise.PracticeSentenceCatalog;
import com.phillippitts.speakwell.service.metrics.AnalysisMetrics;
import com.phillippitts.speakwell.service.rubric.InMemoryRubricSettingsStore;
import com.phillippitts.speakwell.service.rubric.RubricResolver;
import com.phillippitts.speakwell.service.rubric.RubricSettingsStore;
import com.phillippitts.speakwell.service.scoring.RubricScorer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the alignment and scoring engine and the services around it.
 */
@Configuration
public class AnalysisConfig {

    @Bean
    public WordAligner wordAligner() {
        return new GreedyWordAligner();
    }

    @Bean
    public RubricScorer rubricScorer() {
        return new RubricScorer();
    }

    @Bean
    public AnalysisMetrics analysisMetrics(MeterRegistry registry) {
        return new AnalysisMetrics(registry);
    }

    /**
     * Process-local rubric store, replaced when a document-store backed bean is present.
     */
    @Bean
    @ConditionalOnMissingBean(RubricSettingsStore.class)
    public RubricSettingsStore rubricSettingsStore() {
        return new InMemoryRubricSettingsStore();
    }

    @Bean
    public RubricResolver rubricResolver(RubricSettingsStore store, RubricProperties rubricProperties,
                                         AnalysisMetrics metrics) {
        return new RubricResolver(store, rubricProperties.toWeights(), metrics);
    }

    @Bean
    public PronunciationAnalyzer pronunciationAnalyzer(AnalysisProperties props,
                                                       ApplicationEventPublisher publisher,
                                                       WordAligner aligner,
                                                       RubricScorer scorer,
                                                       RubricResolver rubricResolver,
                                                       AnalysisMetrics metrics) {
        return new DefaultPronunciationAnalyzer(props, publisher, aligner, scorer, rubricResolver, metrics);
    }

    @Bean
    public PracticeSentenceCatalog practiceSentenceCatalog() {
        return new PracticeSentenceCatalog();
    }
}
