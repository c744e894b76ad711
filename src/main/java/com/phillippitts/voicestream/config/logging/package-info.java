/**
 * Request correlation for Log4j2 structured logging.
 */
package com.phillippitts.voicestream.config.logging;
