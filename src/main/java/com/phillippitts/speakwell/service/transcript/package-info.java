/**
 * Adapters turning external transcriber output into
 * {@link com.phillippitts.speakwell.domain.Transcription} values.
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.service.transcript;
