package com.phillippitts.talkback;

import com.phillippitts.talkback.config.properties.AssemblerProperties;
import com.phillippitts.talkback.config.properties.AudioCaptureProperties;
import com.phillippitts.talkback.config.properties.EnvironmentProperties;
import com.phillippitts.talkback.config.properties.FilterProperties;
import com.phillippitts.talkback.config.properties.InterruptProperties;
import com.phillippitts.talkback.config.properties.ListenProperties;
import com.phillippitts.talkback.config.properties.SessionProperties;
import com.phillippitts.talkback.config.properties.ThreadPoolProperties;
import com.phillippitts.talkback.config.stt.WhisperProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperProperties.class,
        AudioCaptureProperties.class,
        EnvironmentProperties.class,
        ListenProperties.class,
        FilterProperties.class,
        AssemblerProperties.class,
        SessionProperties.class,
        InterruptProperties.class,
        ThreadPoolProperties.class
})
public class TalkBackApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalkBackApplication.class, args);
    }

}
