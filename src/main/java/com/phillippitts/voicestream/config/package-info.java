/**
 * Spring configuration: synthesis wiring, thread pools, metrics and request logging.
 */
package com.phillippitts.voicestream.config;
