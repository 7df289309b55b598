package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation session settings: trigger phrases per identity, end phrases and timeout.
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** What to do when another identity's trigger phrase is heard during an active session. */
    public enum CollisionPolicy { IGNORE, SWITCH }

    @NotNull
    private final Duration timeout;

    @NotNull
    private final CollisionPolicy collisionPolicy;

    private final Map<String, List<String>> triggers;

    private final List<String> endPhrases;

    @ConstructorBinding
    public SessionProperties(Duration timeout, CollisionPolicy collisionPolicy,
                             Map<String, List<String>> triggers, List<String> endPhrases) {
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        if (this.timeout.isNegative() || this.timeout.isZero()) {
            throw new IllegalArgumentException("session.timeout must be positive");
        }
        this.collisionPolicy = collisionPolicy == null ? CollisionPolicy.IGNORE : collisionPolicy;
        this.triggers = triggers == null ? Map.of() : new LinkedHashMap<>(triggers);
        this.endPhrases = endPhrases == null ? List.of() : List.copyOf(endPhrases);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public CollisionPolicy getCollisionPolicy() {
        return collisionPolicy;
    }

    public Map<String, List<String>> getTriggers() {
        return triggers;
    }

    public List<String> getEndPhrases() {
        return endPhrases;
    }
}
