package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.stt.WhisperProperties;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.stt.SpeechRecognizer;
import com.phillippitts.talkback.service.stt.whisper.WhisperProcessRunner;
import com.phillippitts.talkback.service.stt.whisper.WhisperSpeechRecognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the whisper.cpp recognizer as the default {@link SpeechRecognizer}.
 */
@Configuration
public class SpeechRecognizerConfig {

    private static final Logger LOG = LogManager.getLogger(SpeechRecognizerConfig.class);

    @Bean
    public WhisperProcessRunner whisperProcessRunner() {
        return new WhisperProcessRunner();
    }

    @Bean
    @ConditionalOnMissingBean(SpeechRecognizer.class)
    public SpeechRecognizer whisperSpeechRecognizer(WhisperProperties props,
                                                    WhisperProcessRunner runner,
                                                    VoiceMetrics metrics) {
        WhisperSpeechRecognizer recognizer = new WhisperSpeechRecognizer(props, runner, metrics, props.maxConcurrent());
        if (!recognizer.isHealthy()) {
            LOG.warn("Whisper binary or model not found (binary={}, model={}); transcription will fail until installed",
                    props.binaryPath(), props.modelPath());
        }
        return recognizer;
    }
}
