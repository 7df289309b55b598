package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.testutil.TestAudio;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AudioLevelsTest {

    @Test
    void shouldComputeRmsOfSquareWave() {
        assertThat(AudioLevels.rms(TestAudio.tone(Duration.ofMillis(100), 1000))).isCloseTo(1000.0, within(1e-6));
        assertThat(AudioLevels.rms(TestAudio.silent(Duration.ofMillis(100)))).isZero();
    }

    @Test
    void shouldDecodeNegativeSamplesAsSigned() {
        // -32768 little-endian
        byte[] pcm = {0x00, (byte) 0x80};

        assertThat(AudioLevels.rms(pcm, 0, pcm.length)).isEqualTo(32768.0);
        assertThat(AudioLevels.rms(new byte[0], 0, 0)).isZero();
    }

    @Test
    void shouldConcatenateInOrderAndSumDurations() {
        AudioSegment a = TestAudio.loud(Duration.ofMillis(600));
        AudioSegment b = TestAudio.silent(Duration.ofMillis(300));

        AudioSegment joined = AudioLevels.concat(List.of(a, b));

        assertThat(joined.pcm()).hasSize(a.pcm().length + b.pcm().length);
        assertThat(joined.duration()).isEqualTo(Duration.ofMillis(900));
        assertThat(joined.pcm()[0]).isEqualTo(a.pcm()[0]);
        assertThat(joined.pcm()[a.pcm().length]).isZero();
    }

    @Test
    void shouldRejectMismatchedOrEmptyInput() {
        AudioSegment mono = TestAudio.loud(Duration.ofMillis(100));
        AudioSegment other = AudioSegment.of(new byte[1600], 8_000, 1);

        assertThatThrownBy(() -> AudioLevels.concat(List.of(mono, other))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AudioLevels.concat(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThat(AudioLevels.concat(List.of(mono))).isSameAs(mono);
    }
}
