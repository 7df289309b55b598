/**
 * Audio format constants, PCM energy measurement and WAV serialization.
 *
 * <p>Microphone access lives in {@link com.phillippitts.talkback.service.audio.source}.
 */
package com.phillippitts.talkback.service.audio;
