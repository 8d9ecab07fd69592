package com.phillippitts.speakwell.presentation.controller;

import com.phillippitts.speakwell.service.exercise.PracticeSentenceCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Practice sentences for the patient view.
 */
@RestController
@RequestMapping("/api/exercises")
class ExerciseController {

    private final PracticeSentenceCatalog catalog;

    ExerciseController(PracticeSentenceCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> catalog() {
        return ResponseEntity.ok(Map.of(
                "defaults", catalog.defaultSentences(),
                "exercises", catalog.allExercises()
        ));
    }

    @GetMapping("/{exerciseType}")
    ResponseEntity<List<String>> sentences(@PathVariable String exerciseType) {
        List<String> sentences = catalog.sentencesFor(exerciseType);
        if (sentences.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sentences);
    }
}
