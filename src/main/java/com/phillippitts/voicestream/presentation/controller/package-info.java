/**
 * REST controllers.
 */
package com.phillippitts.voicestream.presentation.controller;
