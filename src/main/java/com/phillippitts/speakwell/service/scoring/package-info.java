/**
 * Rubric-based scoring of aligned words.
 *
 * @see com.phillippitts.speakwell.service.scoring.RubricScorer
 * @since 1.0
 */
package com.phillippitts.speakwell.service.scoring;
