package com.phillippitts.speakwell.service.rubric;

import java.util.Locale;

/**
 * Where a resolved rubric came from. Used for logging and metrics tags.
 */
public enum RubricSource {
    PATIENT,
    DOCTOR,
    DEFAULT,
    FALLBACK;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
