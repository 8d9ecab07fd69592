/**
 * Word alignment between a target sentence and a transcript.
 *
 * <p>{@link com.phillippitts.speakwell.service.align.WordAligner} is the strategy seam,
 * {@link com.phillippitts.speakwell.service.align.AbstractWordAligner} handles empty inputs,
 * and {@link com.phillippitts.speakwell.service.align.impl.GreedyWordAligner} is the greedy
 * exact-then-fuzzy matcher used for scoring.
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.service.align;
