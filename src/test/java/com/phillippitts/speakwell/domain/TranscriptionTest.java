package com.phillippitts.speakwell.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionTest {

    @Test
    void nullFieldsBecomeEmpty() {
        Transcription t = new Transcription(null, null);

        assertThat(t.text()).isEmpty();
        assertThat(t.words()).isEmpty();
    }

    @Test
    void ofWordsJoinsTextWithSingleSpaces() {
        Transcription t = Transcription.ofWords(List.of(
                new TranscriptWord("she", 0.0, 0.3), new TranscriptWord("sells", 0.4, 0.8)));

        assertThat(t.text()).isEqualTo("she sells");
        assertThat(t.words()).hasSize(2);
    }

    @Test
    void wordsAreDefensivelyCopied() {
        List<TranscriptWord> source = new ArrayList<>(List.of(TranscriptWord.of("hi")));
        Transcription t = new Transcription("hi", source);

        source.add(TranscriptWord.of("there"));

        assertThat(t.words()).hasSize(1);
        assertThatThrownBy(() -> t.words().add(TranscriptWord.of("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyHasNoWords() {
        assertThat(Transcription.empty().words()).isEmpty();
        assertThat(Transcription.empty().text()).isEmpty();
    }

    @Test
    void transcriptWordRequiresText() {
        assertThatThrownBy(() -> new TranscriptWord(null, 0, 0))
                .isInstanceOf(NullPointerException.class);
        assertThat(TranscriptWord.of("cat").startTime()).isZero();
    }
}
