/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.talkback.exception.TalkBackException} - base for all application errors</li>
 *   <li>{@link com.phillippitts.talkback.exception.AudioSourceUnavailableException} - the microphone
 *       could not be opened; escapes listen calls</li>
 *   <li>{@link com.phillippitts.talkback.exception.TranscriptionServiceUnavailableException} - a
 *       recognizer call failed; absorbed by the capture pipeline</li>
 *   <li>{@link com.phillippitts.talkback.exception.SelfSpeechCatalogException} - the self-speech
 *       catalog resource is missing at startup</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support chaining via a {@code cause} parameter.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.exception;
