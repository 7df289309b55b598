package com.phillippitts.talkback.service.assembly;

import com.phillippitts.talkback.config.properties.AssemblerProperties;
import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.testutil.FakeSpeechRecognizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static com.phillippitts.talkback.testutil.TestAudio.loud;
import static org.assertj.core.api.Assertions.assertThat;

class UtteranceAssemblerTest {

    private static final Duration CHUNK = Duration.ofMillis(600);

    private FakeSpeechRecognizer recognizer;
    private SimpleMeterRegistry registry;
    private UtteranceAssembler assembler;

    @BeforeEach
    void setUp() {
        recognizer = new FakeSpeechRecognizer();
        registry = new SimpleMeterRegistry();
        LexicalRepairTable repairs = new LexicalRepairTable(List.of(
                new AssemblerProperties.Repair("philipino", "filipino"),
                new AssemblerProperties.Repair("ready ready", "ready")));
        assembler = new UtteranceAssembler(recognizer, new AssemblerProperties(3, Duration.ZERO, null, null, null),
                repairs, new VoiceMetrics(registry));
    }

    private static List<AudioSegment> chunks(int n) {
        return IntStream.range(0, n).mapToObj(i -> loud(CHUNK)).toList();
    }

    @Test
    void shouldTranscribeConcatenatedAudioOnceWithFirstHint() {
        // Arrange
        recognizer.respond("What Is   A Volcano");

        // Act
        String text = assembler.assemble(chunks(3));

        // Assert
        assertThat(text).isEqualTo("what is a volcano");
        assertThat(recognizer.calls()).singleElement().satisfies(call -> {
            assertThat(call.languageHint()).isEqualTo("en-US");
            assertThat(call.audio().duration()).isEqualTo(Duration.ofMillis(1800));
        });
        assertThat(registry.counter("talkback.assembly", "strategy", "primary").count()).isEqualTo(1.0);
    }

    @Test
    void shouldWalkHintsInOrderUntilOneProducesText() {
        recognizer.respond("", "hello there");

        assertThat(assembler.assemble(chunks(2))).isEqualTo("hello there");
        assertThat(recognizer.hints()).containsExactly("en-US", "en-GB");
    }

    @Test
    void shouldRetryAllHintsUpToMaxAttempts() {
        // first attempt: 3 empty hints, second attempt: first hint fails, second succeeds
        recognizer.respond("", "", "").fail(1).respond("second try");

        assertThat(assembler.assemble(chunks(2))).isEqualTo("second try");
        assertThat(recognizer.hints()).containsExactly("en-US", "en-GB", "en-AU", "en-US", "en-GB");
    }

    @Test
    void shouldUseIntlHintsForIntlGameMode() {
        recognizer.respond("", "good morning");

        assertThat(assembler.assemble(chunks(1), ListenMode.INTL_GAME)).isEqualTo("good morning");
        assertThat(recognizer.hints()).containsExactly("fil-PH", "en-US");
    }

    @Test
    void shouldFallBackToPerChunkTranscriptionAndApplyRepairs() {
        // Arrange: 3 attempts x 3 hints produce nothing, then one call per chunk
        for (int i = 0; i < 9; i++) {
            recognizer.respond("");
        }
        recognizer.respond("I speak", "", "Philipino  ready ready");

        // Act
        String text = assembler.assemble(chunks(3));

        // Assert
        assertThat(text).isEqualTo("i speak filipino ready");
        assertThat(recognizer.callCount()).isEqualTo(12);
        assertThat(recognizer.hints().subList(9, 12)).containsOnly("en-US");
        assertThat(registry.counter("talkback.assembly", "strategy", "fallback").count()).isEqualTo(1.0);
    }

    @Test
    void shouldReturnNullWhenBothStrategiesFail() {
        recognizer.fail(100);

        assertThat(assembler.assemble(chunks(2))).isNull();
        assertThat(registry.counter("talkback.assembly", "strategy", "none").count()).isEqualTo(1.0);
    }

    @Test
    void shouldReturnNullForNoSegments() {
        assertThat(assembler.assemble(List.of())).isNull();
        assertThat(assembler.assemble(null)).isNull();
        assertThat(recognizer.callCount()).isZero();
    }

    @Test
    void shouldApplyRepairsToPrimaryResult() {
        recognizer.respond("I am ready ready");

        assertThat(assembler.assemble(chunks(1))).isEqualTo("i am ready");
    }
}
