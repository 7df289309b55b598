package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.config.properties.AssemblerProperties;
import com.phillippitts.talkback.config.properties.EnvironmentProperties;
import com.phillippitts.talkback.config.properties.FilterProperties;
import com.phillippitts.talkback.config.properties.ListenProperties;
import com.phillippitts.talkback.config.properties.SessionProperties;
import com.phillippitts.talkback.domain.EnvironmentCategory;
import com.phillippitts.talkback.service.assembly.LexicalRepairTable;
import com.phillippitts.talkback.service.assembly.UtteranceAssembler;
import com.phillippitts.talkback.service.capture.ChunkClassifier;
import com.phillippitts.talkback.service.capture.IncompleteUtteranceDetector;
import com.phillippitts.talkback.service.capture.SegmentCaptureEngine;
import com.phillippitts.talkback.service.filter.SelfSpeechCatalog;
import com.phillippitts.talkback.service.filter.SelfSpeechFilter;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.profile.EnvironmentProbe;
import com.phillippitts.talkback.service.profile.EnvironmentProfileResolver;
import com.phillippitts.talkback.service.session.ConversationSessionManager;
import com.phillippitts.talkback.service.session.TriggerPhraseTable;
import com.phillippitts.talkback.service.state.InteractionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires the real capture pipeline around fakes for the microphone, recognizer, clock and
 * event bus.
 *
 * <p>Defaults: {@link EnvironmentCategory#GENERIC} profile (normal gate 250, no chunk or
 * silence scaling), calibration off, no retry pause, a small self-speech catalog and the
 * English incomplete-sentence openers.
 */
public final class PipelineFixture {

    public static final List<String> OPENERS = List.of(
            "what is the", "how do you", "where is the", "when did the", "why do", "who is",
            "which one", "how far is", "what are the", "tell me about", "what about", "how about",
            "what if", "can you", "could you", "would you", "will you");

    public final FakeAudioFrameSource source = new FakeAudioFrameSource();
    public final FakeSpeechRecognizer recognizer = new FakeSpeechRecognizer();
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final MutableClock clock = new MutableClock();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final VoiceMetrics metrics = new VoiceMetrics(registry);
    public final InteractionState state = new InteractionState(publisher, clock);
    public final ListenProperties listenProperties = new ListenProperties();
    public final EnvironmentProfileResolver profiles;
    public final SelfSpeechFilter filter;
    public final ChunkClassifier classifier;
    public final UtteranceAssembler assembler;
    public final SegmentCaptureEngine engine;

    public PipelineFixture() {
        this(EnvironmentCategory.GENERIC);
    }

    public PipelineFixture(EnvironmentCategory category) {
        listenProperties.setCalibrate(false);
        profiles = new EnvironmentProfileResolver(new UnknownHost(), new EnvironmentProperties(category, null));
        filter = new SelfSpeechFilter(
                new SelfSpeechCatalog("test", List.of("i'm listening", "great job", "let me think")),
                new FilterProperties(null, null, null, null), state, metrics);
        classifier = new ChunkClassifier(recognizer, filter, metrics);
        assembler = new UtteranceAssembler(recognizer, assemblerProperties(),
                new LexicalRepairTable(List.of(new AssemblerProperties.Repair("colour", "color"))), metrics);
        engine = new SegmentCaptureEngine(source, profiles, classifier, filter, assembler,
                new IncompleteUtteranceDetector(OPENERS), state, listenProperties, metrics);
    }

    public static AssemblerProperties assemblerProperties() {
        return new AssemblerProperties(3, Duration.ZERO, null, null, null);
    }

    public ConversationSessionManager sessionManager(SessionProperties.CollisionPolicy policy) {
        Map<String, List<String>> triggers = new LinkedHashMap<>();
        triggers.put("sophia", List.of("miley", "hey miley", "mily"));
        triggers.put("eladriel", List.of("dino", "hey dino"));
        SessionProperties props = new SessionProperties(Duration.ofSeconds(30), policy,
                triggers, List.of("goodbye", "see you later"));
        return new ConversationSessionManager(state, new TriggerPhraseTable(props.getTriggers()), props,
                publisher, metrics);
    }

    /** Probe that knows nothing about the host. */
    static final class UnknownHost implements EnvironmentProbe {
        @Override
        public String osName() {
            return "";
        }

        @Override
        public String osArch() {
            return "";
        }

        @Override
        public Optional<String> boardModel() {
            return Optional.empty();
        }
    }
}
