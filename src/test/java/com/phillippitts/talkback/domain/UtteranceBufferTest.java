package com.phillippitts.talkback.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtteranceBufferTest {

    private static TranscriptFragment fragment(String text, long offsetMillis) {
        AudioSegment audio = AudioSegment.of(new byte[3200], 16_000, 1);
        return new TranscriptFragment(text, audio, Duration.ofMillis(offsetMillis));
    }

    @Test
    void shouldKeepFragmentsInArrivalOrder() {
        UtteranceBuffer buffer = new UtteranceBuffer();
        buffer.append(fragment("what is", 0));
        buffer.append(fragment("the weather", 600));

        assertThat(buffer.size()).isEqualTo(2);
        assertThat(buffer.lastFragment()).map(TranscriptFragment::text).contains("the weather");
        assertThat(buffer.fragments()).extracting(TranscriptFragment::text).containsExactly("what is", "the weather");
    }

    @Test
    void shouldRejectAppendAfterFreeze() {
        UtteranceBuffer buffer = new UtteranceBuffer();
        buffer.append(fragment("hello", 0));
        buffer.freeze();

        assertThat(buffer.isFrozen()).isTrue();
        assertThatThrownBy(() -> buffer.append(fragment("again", 600)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldConsumeExactlyOnceAfterFreeze() {
        UtteranceBuffer buffer = new UtteranceBuffer();
        TranscriptFragment first = fragment("hello", 0);
        buffer.append(first);

        assertThatThrownBy(buffer::consume).isInstanceOf(IllegalStateException.class);
        buffer.freeze();
        assertThat(buffer.consume()).containsExactly(first.source());
        assertThatThrownBy(buffer::consume).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectBlankFragmentText() {
        AudioSegment audio = AudioSegment.of(new byte[320], 16_000, 1);

        assertThatThrownBy(() -> new TranscriptFragment("  ", audio, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new UtteranceBuffer().lastFragment()).isEmpty();
    }
}
