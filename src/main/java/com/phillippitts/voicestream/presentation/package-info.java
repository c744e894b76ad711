/**
 * HTTP boundary of the application.
 */
package com.phillippitts.voicestream.presentation;
