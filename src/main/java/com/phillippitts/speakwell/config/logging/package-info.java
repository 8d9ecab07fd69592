/**
 * Logging infrastructure: request-scoped MDC population for Log4j2.
 *
 * @see com.phillippitts.speakwell.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.speakwell.config.logging;
