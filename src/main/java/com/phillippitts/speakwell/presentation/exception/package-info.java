/**
 * Mapping of domain exceptions to HTTP responses.
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.presentation.exception;
