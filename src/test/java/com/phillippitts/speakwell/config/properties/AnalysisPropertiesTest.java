package com.phillippitts.speakwell.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisPropertiesTest {

    @Test
    void defaults() {
        AnalysisProperties props = AnalysisProperties.defaults();

        assertThat(props.getLogPreviewChars()).isEqualTo(40);
        assertThat(props.isPublishEvents()).isTrue();
    }

    @Test
    void acceptsExplicitValues() {
        AnalysisProperties props = new AnalysisProperties(0, false);

        assertThat(props.getLogPreviewChars()).isZero();
        assertThat(props.isPublishEvents()).isFalse();
    }

    @Test
    void rejectsNegativePreviewLength() {
        assertThatThrownBy(() -> new AnalysisProperties(-1, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("log-preview-chars");
    }
}
