package com.phillippitts.speakwell.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisResultTest {

    @Test
    void rejectsScoreOutsideRange() {
        assertThatThrownBy(() -> new AnalysisResult(101, List.of(), ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("101");
        assertThatThrownBy(() -> new AnalysisResult(-1, List.of(), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void countsResultsByType() {
        AnalysisResult r = new AnalysisResult(60, List.of(
                WordResult.correct("the"),
                WordResult.mispronounced("cat", "sat"),
                WordResult.omitted("sat"),
                WordResult.inserted("um"),
                WordResult.inserted("uh")), "the sat um uh");

        assertThat(r.count(ErrorType.NONE)).isEqualTo(1);
        assertThat(r.count(ErrorType.MISPRONUNCIATION)).isEqualTo(1);
        assertThat(r.count(ErrorType.OMISSION)).isEqualTo(1);
        assertThat(r.count(ErrorType.INSERTION)).isEqualTo(2);
    }

    @Test
    void nullTranscribedTextBecomesEmpty() {
        assertThat(new AnalysisResult(0, List.of(), null).transcribedText()).isEmpty();
    }
}
