package com.phillippitts.talkback.config;

import com.phillippitts.talkback.service.playback.LoggingPlaybackController;
import com.phillippitts.talkback.service.playback.PlaybackController;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlaybackConfig {

    @Bean
    @ConditionalOnMissingBean(PlaybackController.class)
    public PlaybackController playbackController() {
        return new LoggingPlaybackController();
    }
}
