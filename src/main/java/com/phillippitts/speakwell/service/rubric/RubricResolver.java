package com.phillippitts.speakwell.service.rubric;

import com.phillippitts.speakwell.domain.RubricWeights;
import com.phillippitts.speakwell.service.metrics.AnalysisMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the rubric for a doctor/patient pair.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>per-patient rubric stored under the doctor</li>
 *   <li>the doctor's own rubric</li>
 *   <li>configured defaults</li>
 * </ol>
 * Stored settings are partial overrides merged over the defaults. A storage failure is
 * logged and the defaults are used; the analysis itself never fails on rubric lookup.
 */
public class RubricResolver {

    private static final Logger LOG = LogManager.getLogger(RubricResolver.class);

    private final RubricSettingsStore store;
    private final RubricWeights defaults;
    private final AnalysisMetrics metrics;

    public RubricResolver(RubricSettingsStore store, RubricWeights defaults, AnalysisMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public RubricWeights defaults() {
        return defaults;
    }

    /**
     * Resolves the effective rubric.
     *
     * @param doctorId  doctor identifier (may be null or blank)
     * @param patientId patient identifier (may be null or blank)
     * @return resolved weights and their source
     * @throws com.phillippitts.speakwell.exception.InvalidRubricException if a stored rubric is out of range
     */
    public ResolvedRubric resolve(String doctorId, String patientId) {
        ResolvedRubric resolved = lookup(doctorId, patientId);
        metrics.recordRubricResolution(resolved.source().tag());
        LOG.debug("Resolved rubric from {}: {}", resolved.source(), resolved.weights());
        return resolved;
    }

    private ResolvedRubric lookup(String doctorId, String patientId) {
        if (isBlank(doctorId)) {
            LOG.warn("No doctor id provided, using default rubric");
            return new ResolvedRubric(defaults, RubricSource.DEFAULT);
        }

        Optional<RubricSettings> patientRubric;
        Optional<RubricSettings> doctorRubric;
        try {
            patientRubric = isBlank(patientId) ? Optional.empty() : store.findForPatient(doctorId, patientId);
            doctorRubric = patientRubric.isPresent() ? Optional.empty() : store.findForDoctor(doctorId);
        } catch (RuntimeException e) {
            LOG.warn("Rubric lookup failed for doctor {}, using default rubric", doctorId, e);
            return new ResolvedRubric(defaults, RubricSource.FALLBACK);
        }

        if (patientRubric.isPresent()) {
            return new ResolvedRubric(patientRubric.get().applyTo(defaults), RubricSource.PATIENT);
        }
        if (doctorRubric.isPresent()) {
            return new ResolvedRubric(doctorRubric.get().applyTo(defaults), RubricSource.DOCTOR);
        }
        LOG.warn("No rubric found for doctor {}, using default rubric", doctorId);
        return new ResolvedRubric(defaults, RubricSource.DEFAULT);
    }

    /**
     * Validates and stores a rubric override.
     *
     * @param doctorId  doctor identifier (required)
     * @param patientId patient identifier, or null for the doctor-level rubric
     * @param settings  partial override
     * @return the effective rubric after the save
     * @throws com.phillippitts.speakwell.exception.InvalidRubricException if the merged rubric is out of range
     */
    public RubricWeights save(String doctorId, String patientId, RubricSettings settings) {
        if (isBlank(doctorId)) {
            throw new IllegalArgumentException("doctorId must not be blank");
        }
        Objects.requireNonNull(settings, "settings must not be null");
        RubricWeights effective = settings.applyTo(defaults);
        if (isBlank(patientId)) {
            store.saveForDoctor(doctorId, settings);
            LOG.info("Rubric saved for doctor {}", doctorId);
        } else {
            store.saveForPatient(doctorId, patientId, settings);
            LOG.info("Rubric saved for doctor {} and patient {}", doctorId, patientId);
        }
        return effective;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
