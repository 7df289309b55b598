package com.phillippitts.talkback.config.properties;

import com.phillippitts.talkback.domain.ListenMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Capture loop settings.
 *
 * <p>Chunk durations default to {@link ListenMode#defaultChunkDuration()} when a mode is not
 * listed under {@code listen.chunk-durations}.
 */
@Validated
@ConfigurationProperties(prefix = "listen")
public class ListenProperties {

    private Map<ListenMode, Duration> chunkDurations = new EnumMap<>(ListenMode.class);
    private boolean calibrate = true;
    private String locale = "en";
    private Map<String, List<String>> incompleteOpeners = new LinkedHashMap<>();
    @Valid
    private Loop loop = new Loop();

    public Duration chunkDurationFor(ListenMode mode) {
        Duration configured = chunkDurations.get(mode);
        return configured != null ? configured : mode.defaultChunkDuration();
    }

    /**
     * Openers for the configured locale, falling back to the language subtag ("en" for "en-GB").
     */
    public List<String> openersForLocale() {
        String key = locale.toLowerCase(Locale.ROOT);
        List<String> openers = incompleteOpeners.get(key);
        if (openers == null && key.contains("-")) {
            openers = incompleteOpeners.get(key.substring(0, key.indexOf('-')));
        }
        return openers != null ? openers : List.of();
    }

    @AssertTrue(message = "listen.chunk-durations must all be positive")
    public boolean isChunkDurationsPositive() {
        return chunkDurations.values().stream().allMatch(ListenProperties::isPositive);
    }

    static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }

    public Map<ListenMode, Duration> getChunkDurations() {
        return chunkDurations;
    }

    public void setChunkDurations(Map<ListenMode, Duration> chunkDurations) {
        this.chunkDurations = chunkDurations;
    }

    public boolean isCalibrate() {
        return calibrate;
    }

    public void setCalibrate(boolean calibrate) {
        this.calibrate = calibrate;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public Map<String, List<String>> getIncompleteOpeners() {
        return incompleteOpeners;
    }

    public void setIncompleteOpeners(Map<String, List<String>> incompleteOpeners) {
        this.incompleteOpeners = incompleteOpeners;
    }

    public Loop getLoop() {
        return loop;
    }

    public void setLoop(Loop loop) {
        this.loop = loop;
    }

    /**
     * Continuous listening loop, off unless {@code listen.loop.enabled=true}.
     */
    public static class Loop {
        private boolean enabled = false;
        private ListenMode mode = ListenMode.NORMAL;
        private Duration timeout = Duration.ofSeconds(15);
        private Duration silenceThreshold = Duration.ofSeconds(1);
        private Duration maxTotalTime = Duration.ofSeconds(30);
        private Duration errorBackoff = Duration.ofSeconds(5);

        @AssertTrue(message = "listen.loop timeout, silence-threshold and max-total-time must be positive")
        public boolean isDurationsPositive() {
            return isPositive(timeout) && isPositive(silenceThreshold) && isPositive(maxTotalTime);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public ListenMode getMode() {
            return mode;
        }

        public void setMode(ListenMode mode) {
            this.mode = mode;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getSilenceThreshold() {
            return silenceThreshold;
        }

        public void setSilenceThreshold(Duration silenceThreshold) {
            this.silenceThreshold = silenceThreshold;
        }

        public Duration getMaxTotalTime() {
            return maxTotalTime;
        }

        public void setMaxTotalTime(Duration maxTotalTime) {
            this.maxTotalTime = maxTotalTime;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }
    }
}
