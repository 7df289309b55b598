package com.phillippitts.talkback.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Interrupt monitoring while the assistant is speaking.
 */
@Validated
@ConfigurationProperties(prefix = "interrupt")
public class InterruptProperties {

    private final boolean enabled;

    /** Phrases that stop playback, matched on word boundaries. */
    private final List<String> phrases;

    /** Audio captured per check. */
    private final Duration checkDuration;

    @ConstructorBinding
    public InterruptProperties(Boolean enabled, List<String> phrases, Duration checkDuration) {
        this.enabled = enabled == null ? true : enabled;
        this.phrases = phrases == null || phrases.isEmpty()
                ? List.of("stop", "cancel", "be quiet", "wait", "hold on", "pause", "shut up")
                : List.copyOf(phrases);
        this.checkDuration = checkDuration == null ? Duration.ofMillis(200) : checkDuration;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getPhrases() {
        return phrases;
    }

    public Duration getCheckDuration() {
        return checkDuration;
    }
}
