package com.phillippitts.speakwell.service.rubric;

import java.util.Optional;

/**
 * Storage seam for custom rubrics, keyed by doctor and optionally by patient.
 *
 * <p>Production deployments back this with the document store that also keeps practice
 * history; {@link InMemoryRubricSettingsStore} is used otherwise. Implementations may throw
 * unchecked exceptions on storage failure; {@link RubricResolver} falls back to defaults.
 */
public interface RubricSettingsStore {

    Optional<RubricSettings> findForDoctor(String doctorId);

    Optional<RubricSettings> findForPatient(String doctorId, String patientId);

    void saveForDoctor(String doctorId, RubricSettings settings);

    void saveForPatient(String doctorId, String patientId, RubricSettings settings);
}
