package com.phillippitts.talkback.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void talkBackExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        TalkBackException ex = new TalkBackException("wrapper error", cause);

        assertThat(ex).isInstanceOf(RuntimeException.class);
        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void audioSourceUnavailableShouldNameDevice() {
        AudioSourceUnavailableException ex = new AudioSourceUnavailableException("Microphone unavailable", "default");

        assertThat(ex).isInstanceOf(TalkBackException.class);
        assertThat(ex.getMessage()).isEqualTo("Microphone unavailable (device: default)");
        assertThat(ex.getDevice()).isEqualTo("default");
    }

    @Test
    void transcriptionFailureShouldNameRecognizer() {
        TranscriptionServiceUnavailableException ex =
                new TranscriptionServiceUnavailableException("Timeout", "whisper");
        TranscriptionServiceUnavailableException anonymous =
                new TranscriptionServiceUnavailableException("Timeout");

        assertThat(ex.getMessage()).isEqualTo("Timeout (recognizer: whisper)");
        assertThat(ex.getRecognizerName()).isEqualTo("whisper");
        assertThat(anonymous.getRecognizerName()).isEqualTo("unknown");
    }

    @Test
    void catalogExceptionShouldIncludeLocation() {
        SelfSpeechCatalogException ex = new SelfSpeechCatalogException("classpath:self-speech/missing.txt");

        assertThat(ex.getMessage()).contains("classpath:self-speech/missing.txt");
        assertThat(ex.getLocation()).isEqualTo("classpath:self-speech/missing.txt");
    }
}
