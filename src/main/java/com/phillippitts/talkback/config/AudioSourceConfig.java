package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.properties.AudioCaptureProperties;
import com.phillippitts.talkback.service.audio.source.AudioFrameSource;
import com.phillippitts.talkback.service.audio.source.JavaSoundAudioFrameSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the Java Sound microphone unless another {@link AudioFrameSource} is provided.
 */
@Configuration
public class AudioSourceConfig {

    @Bean
    @ConditionalOnMissingBean(AudioFrameSource.class)
    public AudioFrameSource audioFrameSource(AudioCaptureProperties props) {
        return new JavaSoundAudioFrameSource(props);
    }
}
