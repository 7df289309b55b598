package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.SessionProperties.CollisionPolicy;
import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;
import com.phillippitts.talkback.service.audio.source.CaptureErrorEvent;
import com.phillippitts.talkback.service.orchestration.event.UtteranceRecognizedEvent;
import com.phillippitts.talkback.testutil.PipelineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.phillippitts.talkback.testutil.TestAudio.loud;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceInteractionOrchestratorTest {

    private static final Duration CHUNK = Duration.ofMillis(600);

    private PipelineFixture fx;
    private VoiceInteractionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        fx = new PipelineFixture();
        orchestrator = new VoiceInteractionOrchestrator(fx.engine, fx.sessionManager(CollisionPolicy.IGNORE),
                fx.state, fx.publisher);
    }

    private Optional<String> listen() {
        return orchestrator.listenOnce(Duration.ofSeconds(2), Duration.ofSeconds(1), Duration.ofSeconds(10),
                ListenMode.NORMAL);
    }

    @Test
    void shouldPublishUtteranceThatStartsSession() {
        // Arrange
        fx.source.enqueue(loud(CHUNK), loud(CHUNK));
        fx.recognizer.respond("hey miley", "what is lava", "hey miley what is lava");

        // Act
        Optional<String> identity = listen();

        // Assert
        assertThat(identity).contains("sophia");
        assertThat(fx.publisher.eventsOfType(UtteranceRecognizedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.text()).isEqualTo("hey miley what is lava");
                    assertThat(e.identity()).isEqualTo("sophia");
                    assertThat(e.mode()).isEqualTo(ListenMode.NORMAL);
                });
    }

    @Test
    void shouldDropUtteranceOutsideSession() {
        fx.source.enqueue(loud(CHUNK));
        fx.recognizer.respond("what is lava", "what is lava");

        assertThat(listen()).isEmpty();
        assertThat(fx.publisher.eventsOfType(UtteranceRecognizedEvent.class)).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenNothingWasHeard() {
        assertThat(listen()).isEmpty();
        assertThat(fx.publisher.all()).isEmpty();
    }

    @Test
    void shouldPublishCaptureErrorAndRethrowWhenMicrophoneFails() {
        fx.source.failOnOpen();

        assertThatThrownBy(this::listen).isInstanceOf(AudioSourceUnavailableException.class);
        assertThat(fx.publisher.eventsOfType(CaptureErrorEvent.class))
                .singleElement()
                .extracting(CaptureErrorEvent::reason)
                .isEqualTo("MIC_UNAVAILABLE");
    }
}
