package com.phillippitts.talkback.service.health;

import com.phillippitts.talkback.service.stt.SpeechRecognizer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the speech recognizer can currently transcribe.
 *
 * <p>Exposed via /actuator/health when actuator endpoints are enabled.
 */
@Component
public class SpeechRecognizerHealthIndicator implements HealthIndicator {

    private final SpeechRecognizer recognizer;

    public SpeechRecognizerHealthIndicator(SpeechRecognizer recognizer) {
        this.recognizer = recognizer;
    }

    @Override
    public Health health() {
        boolean healthy = recognizer.isHealthy();
        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
                .withDetail("recognizer", recognizer.getName())
                .withDetail("status", healthy ? "ready" : "unhealthy")
                .build();
    }
}
