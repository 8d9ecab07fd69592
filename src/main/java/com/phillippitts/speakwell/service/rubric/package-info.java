/**
 * Rubric lookup and storage: per-patient and per-doctor overrides layered over the
 * configured default rubric.
 *
 * @see com.phillippitts.speakwell.service.rubric.RubricResolver
 * @since 1.0
 */
package com.phillippitts.speakwell.service.rubric;
