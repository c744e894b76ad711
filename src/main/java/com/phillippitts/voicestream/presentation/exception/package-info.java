/**
 * Maps domain exceptions to HTTP error responses.
 */
package com.phillippitts.voicestream.presentation.exception;
