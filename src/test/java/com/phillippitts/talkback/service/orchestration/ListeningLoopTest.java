package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.ListenProperties;
import com.phillippitts.talkback.config.properties.SessionProperties.CollisionPolicy;
import com.phillippitts.talkback.service.audio.source.CaptureErrorEvent;
import com.phillippitts.talkback.testutil.PipelineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class ListeningLoopTest {

    private PipelineFixture fx;
    private List<Runnable> submitted;
    private ListeningLoop loop;

    @BeforeEach
    void setUp() {
        fx = new PipelineFixture();
        ListenProperties.Loop settings = fx.listenProperties.getLoop();
        settings.setTimeout(Duration.ofMillis(600));
        settings.setErrorBackoff(Duration.ZERO);
        submitted = new ArrayList<>();
        Executor capturing = submitted::add;
        VoiceInteractionOrchestrator orchestrator = new VoiceInteractionOrchestrator(fx.engine,
                fx.sessionManager(CollisionPolicy.IGNORE), fx.state, fx.publisher);
        loop = new ListeningLoop(orchestrator, fx.state, fx.listenProperties, capturing);
    }

    @Test
    void shouldNotStartWhenDisabled() {
        loop.start();

        assertThat(loop.isRunning()).isFalse();
        assertThat(submitted).isEmpty();
    }

    @Test
    void shouldSubmitLoopWhenEnabledAndStopOnRequest() {
        fx.listenProperties.getLoop().setEnabled(true);

        loop.start();
        loop.start();

        assertThat(loop.isRunning()).isTrue();
        assertThat(submitted).hasSize(1);

        loop.stop();
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void shouldIdleWithoutListeningWhileAssistantIsSpeaking() {
        fx.state.beginSpeaking("hello");

        assertThat(loop.iterate()).isTrue();
        assertThat(fx.source.openCount()).isZero();
    }

    @Test
    void shouldListenOncePerIteration() {
        assertThat(loop.iterate()).isTrue();

        assertThat(fx.source.openCount()).isEqualTo(1);
    }

    @Test
    void shouldBackOffAndContinueAfterMicrophoneFailure() {
        fx.source.failOnOpen();

        assertThat(loop.iterate()).isTrue();
        assertThat(fx.publisher.eventsOfType(CaptureErrorEvent.class)).hasSize(1);
    }
}
