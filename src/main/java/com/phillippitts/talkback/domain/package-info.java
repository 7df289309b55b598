/**
 * Domain model for the voice front end.
 *
 * <p>All types here are immutable records or enums except {@link com.phillippitts.talkback.domain.UtteranceBuffer},
 * which is owned by a single capture task and frozen before it is handed to the assembler.
 *
 * <ul>
 *   <li>{@link com.phillippitts.talkback.domain.AudioSegment} - one chunk of PCM audio</li>
 *   <li>{@link com.phillippitts.talkback.domain.TranscriptFragment} - text recognized from a retained chunk</li>
 *   <li>{@link com.phillippitts.talkback.domain.EnvironmentProfile} - host tuning resolved once at startup</li>
 *   <li>{@link com.phillippitts.talkback.domain.ConversationSession} - the single active conversation</li>
 *   <li>{@link com.phillippitts.talkback.domain.TranscriptionResult} - output of one recognizer call</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.talkback.domain;
