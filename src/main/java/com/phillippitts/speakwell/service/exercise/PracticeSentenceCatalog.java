package com.phillippitts.speakwell.service.exercise;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in practice sentences: a default set for patients without assigned exercises and
 * sentence sets per exercise type.
 */
public final class PracticeSentenceCatalog {

    private static final List<String> DEFAULT_SENTENCES = List.of(
            "The quick brown fox jumps over the lazy dog.",
            "She sells seashells by the seashore.",
            "Peter Piper picked a peck of pickled peppers.",
            "How much wood would a woodchuck chuck if a woodchuck could chuck wood?",
            "Betty Botter bought some butter but she said the butter's bitter."
    );

    private static final Map<String, List<String>> EXERCISE_SENTENCES = exercises();

    private static Map<String, List<String>> exercises() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("R-sound practice", List.of(
                "Rahul runs really fast.",
                "The red car raced around the track.",
                "A roaring fire warmed the room.",
                "The brave knight rescued the princess.",
                "Remember to read your book."));
        m.put("S-sound practice", List.of(
                "She sells shiny shoes.",
                "The sun shines brightly in the sky.",
                "Sally sings sweet songs.",
                "Seven sleepy sheep slept soundly.",
                "The snake slithered silently through the grass."));
        m.put("Fluency reading", List.of(
                "In the quiet forest, a tiny squirrel gathered nuts for the winter.",
                "The old wizard cast a powerful spell, and the ancient castle began to glow.",
                "Children laughed and played in the park, enjoying the warm afternoon sunshine.",
                "The vast ocean stretched endlessly, its waves crashing gently against the sandy shore.",
                "Learning new things can be challenging, but it is always rewarding in the end."));
        return Collections.unmodifiableMap(m);
    }

    public List<String> defaultSentences() {
        return DEFAULT_SENTENCES;
    }

    /**
     * @return exercise type names in display order
     */
    public Set<String> exerciseTypes() {
        return EXERCISE_SENTENCES.keySet();
    }

    /**
     * @param exerciseType exercise type name, matched exactly
     * @return sentences for the type, or an empty list for an unknown type
     */
    public List<String> sentencesFor(String exerciseType) {
        if (exerciseType == null) {
            return List.of();
        }
        return EXERCISE_SENTENCES.getOrDefault(exerciseType, List.of());
    }

    /**
     * @return every exercise type with its sentences, in display order
     */
    public Map<String, List<String>> allExercises() {
        return EXERCISE_SENTENCES;
    }
}
