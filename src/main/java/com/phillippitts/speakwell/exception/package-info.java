/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakwell.exception.SpeakWellException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.speakwell.exception.InvalidRubricException} - Thrown when
 *       rubric weights are outside their documented ranges</li>
 *   <li>{@link com.phillippitts.speakwell.exception.TranscriptionException} - Thrown when
 *       transcriber output is missing or malformed</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining and map to HTTP status codes
 * via {@code GlobalExceptionHandler}. The alignment and scoring engine itself never throws on
 * well-typed input.
 *
 * @see com.phillippitts.speakwell.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.speakwell.exception;
