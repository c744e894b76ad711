/**
 * Domain value types shared by the synthesis pipeline: requests, output formats and worker states.
 *
 * @since 1.0
 */
package com.phillippitts.voicestream.domain;
