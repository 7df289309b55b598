package com.phillippitts.talkback.config.properties;

import com.phillippitts.talkback.domain.ListenMode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ListenPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void shouldAcceptDefaults() {
        assertThat(validator.validate(new ListenProperties())).isEmpty();
    }

    @Test
    void shouldRejectZeroChunkDuration() {
        // Arrange
        ListenProperties props = new ListenProperties();
        Map<ListenMode, Duration> chunks = new EnumMap<>(ListenMode.class);
        chunks.put(ListenMode.NORMAL, Duration.ZERO);
        props.setChunkDurations(chunks);

        // Act
        Set<ConstraintViolation<ListenProperties>> violations = validator.validate(props);

        // Assert
        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("listen.chunk-durations must all be positive");
    }

    @Test
    void shouldRejectNonPositiveLoopDurations() {
        ListenProperties props = new ListenProperties();
        props.getLoop().setSilenceThreshold(Duration.ofMillis(-1));

        assertThat(validator.validate(props)).hasSize(1);
    }

    @Test
    void shouldFallBackToModeDefaultsAndLanguageSubtag() {
        ListenProperties props = new ListenProperties();
        props.setLocale("en-GB");
        props.setIncompleteOpeners(Map.of("en", List.of("what is the")));

        assertThat(props.chunkDurationFor(ListenMode.WORD_GAME)).isEqualTo(Duration.ofMillis(300));
        assertThat(props.openersForLocale()).containsExactly("what is the");
    }
}
