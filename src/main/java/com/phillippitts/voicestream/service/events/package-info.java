/**
 * Application events raised by the worker pool and their logging listener.
 */
package com.phillippitts.voicestream.service.events;
