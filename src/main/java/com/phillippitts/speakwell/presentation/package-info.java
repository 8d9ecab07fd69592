/**
 * Presentation layer: the JSON REST adapter around the pronunciation engine.
 *
 * <p>Controllers translate requests into engine calls; domain exceptions are mapped to HTTP
 * responses by {@link com.phillippitts.speakwell.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.presentation;
