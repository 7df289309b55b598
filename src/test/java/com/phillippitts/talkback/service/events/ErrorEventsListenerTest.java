package com.phillippitts.talkback.service.events;

import com.phillippitts.talkback.service.audio.source.CaptureErrorEvent;
import com.phillippitts.talkback.service.interrupt.PlaybackInterruptedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThat(l.shouldLog("capture-MIC_UNAVAILABLE")).isTrue();
        assertThat(l.shouldLog("capture-MIC_UNAVAILABLE")).isFalse();
        assertThat(l.shouldLog("capture-INTERRUPT_MIC_UNAVAILABLE")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onCaptureError(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
            l.onCaptureError(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
            l.onPlaybackInterrupted(new PlaybackInterruptedEvent("stop", Instant.now()));
        }).doesNotThrowAnyException();
    }
}
