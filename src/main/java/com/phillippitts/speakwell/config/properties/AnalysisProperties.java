package com.phillippitts.speakwell.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the analysis pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "speakwell.analysis")
public class AnalysisProperties {

    /** Characters of the target sentence shown in log lines. 0 hides the sentence. */
    @Min(0)
    private final int logPreviewChars;

    /** Publish a PronunciationAnalyzedEvent after each analysis. */
    private final boolean publishEvents;

    @ConstructorBinding
    public AnalysisProperties(Integer logPreviewChars, Boolean publishEvents) {
        int chars = logPreviewChars == null ? 40 : logPreviewChars;
        if (chars < 0) {
            throw new IllegalArgumentException("speakwell.analysis.log-preview-chars must be >= 0");
        }
        this.logPreviewChars = chars;
        this.publishEvents = publishEvents == null ? true : publishEvents;
    }

    public static AnalysisProperties defaults() {
        return new AnalysisProperties(null, null);
    }

    public int getLogPreviewChars() {
        return logPreviewChars;
    }

    public boolean isPublishEvents() {
        return publishEvents;
    }
}
