package com.phillippitts.speakwell.presentation.controller;

import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.service.rubric.RubricResolver;
import com.phillippitts.speakwell.service.rubric.RubricSettings;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reads and updates doctor-level and per-patient rubrics. Responses are the effective
 * rubric after defaults are applied.
 */
@RestController
@RequestMapping("/api/rubrics")
class RubricController {

    private final RubricResolver rubricResolver;

    RubricController(RubricResolver rubricResolver) {
        this.rubricResolver = rubricResolver;
    }

    @GetMapping("/{doctorId}")
    ResponseEntity<RubricWeights> doctorRubric(@PathVariable String doctorId) {
        return ResponseEntity.ok(rubricResolver.resolve(doctorId, null).weights());
    }

    @GetMapping("/{doctorId}/patients/{patientId}")
    ResponseEntity<RubricWeights> patientRubric(@PathVariable String doctorId, @PathVariable String patientId) {
        return ResponseEntity.ok(rubricResolver.resolve(doctorId, patientId).weights());
    }

    @PutMapping("/{doctorId}")
    ResponseEntity<RubricWeights> saveDoctorRubric(@PathVariable String doctorId,
                                                   @RequestBody RubricSettings settings) {
        return ResponseEntity.ok(rubricResolver.save(doctorId, null, settings));
    }

    @PutMapping("/{doctorId}/patients/{patientId}")
    ResponseEntity<RubricWeights> savePatientRubric(@PathVariable String doctorId,
                                                    @PathVariable String patientId,
                                                    @RequestBody RubricSettings settings) {
        return ResponseEntity.ok(rubricResolver.save(doctorId, patientId, settings));
    }
}
