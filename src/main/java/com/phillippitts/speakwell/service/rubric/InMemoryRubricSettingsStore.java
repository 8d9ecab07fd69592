package com.phillippitts.speakwell.service.rubric;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, process-local {@link RubricSettingsStore}. Contents are lost on restart.
 */
public class InMemoryRubricSettingsStore implements RubricSettingsStore {

    private final Map<String, RubricSettings> doctorRubrics = new ConcurrentHashMap<>();
    private final Map<PatientKey, RubricSettings> patientRubrics = new ConcurrentHashMap<>();

    @Override
    public Optional<RubricSettings> findForDoctor(String doctorId) {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        return Optional.ofNullable(doctorRubrics.get(doctorId));
    }

    @Override
    public Optional<RubricSettings> findForPatient(String doctorId, String patientId) {
        return Optional.ofNullable(patientRubrics.get(new PatientKey(doctorId, patientId)));
    }

    @Override
    public void saveForDoctor(String doctorId, RubricSettings settings) {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        doctorRubrics.put(doctorId, Objects.requireNonNull(settings, "settings must not be null"));
    }

    @Override
    public void saveForPatient(String doctorId, String patientId, RubricSettings settings) {
        patientRubrics.put(new PatientKey(doctorId, patientId),
                Objects.requireNonNull(settings, "settings must not be null"));
    }

    private record PatientKey(String doctorId, String patientId) {
        PatientKey {
            Objects.requireNonNull(doctorId, "doctorId must not be null");
            Objects.requireNonNull(patientId, "patientId must not be null");
        }
    }
}
