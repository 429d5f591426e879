package com.umitunal.cronrelay.time;

import com.umitunal.cronrelay.exception.DurationException;
import com.umitunal.cronrelay.exception.FormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class DurationCodecTest {

    @ParameterizedTest
    @CsvSource({
            "2h, 2, 0, 0",
            "3m, 0, 3, 0",
            "4s, 0, 0, 4",
            "2h3m4s, 2, 3, 4",
            "1h30m, 1, 30, 0",
            "45m59s, 0, 45, 59",
            "8760h, 8760, 0, 0",
            "05m, 0, 5, 0"
    })
    @DisplayName("Should parse each component into milliseconds")
    void testParseDuration(String text, long hours, long minutes, long seconds) {
        // When
        long millis = DurationCodec.parseDuration(text);

        // Then - the components can be recovered from the result
        long totalSeconds = millis / 1000;
        assertThat(millis % 1000).isZero();
        assertThat(totalSeconds / 3600).isEqualTo(hours);
        assertThat((totalSeconds % 3600) / 60).isEqualTo(minutes);
        assertThat(totalSeconds % 60).isEqualTo(seconds);
    }

    @Test
    @DisplayName("Should reject empty input")
    void testRejectsEmpty() {
        assertThatThrownBy(() -> DurationCodec.parseDuration(""))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("non-empty");
    }

    @Test
    @DisplayName("Should reject a zero duration")
    void testRejectsZero() {
        assertThatThrownBy(() -> DurationCodec.parseDuration("0s"))
                .isInstanceOf(DurationException.class)
                .hasMessageContaining("cannot be zero");
        assertThatThrownBy(() -> DurationCodec.parseDuration("0h0m0s"))
                .isInstanceOf(DurationException.class);
    }

    @Test
    @DisplayName("Should reject minutes above 59")
    void testRejectsMinutesOutOfRange() {
        assertThatThrownBy(() -> DurationCodec.parseDuration("90m"))
                .isInstanceOf(FormatException.class)
                .isNotInstanceOf(DurationException.class)
                .hasMessageContaining("minutes")
                .hasMessageContaining("59");
    }

    @ParameterizedTest
    @ValueSource(strings = {"60s", "8761h", "1h60m", "99999999999h"})
    @DisplayName("Should reject out of range components")
    void testRejectsOutOfRange(String text) {
        assertThatThrownBy(() -> DurationCodec.parseDuration(text))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("Must be between");
    }

    @ParameterizedTest
    @ValueSource(strings = {"h", "5", "5d", "3s2m", "1h 2m", "-5m", "m5"})
    @DisplayName("Should reject notation that does not follow [Nh][Nm][Ns]")
    void testRejectsBadNotation(String text) {
        assertThatThrownBy(() -> DurationCodec.parseDuration(text))
                .isInstanceOf(FormatException.class);
    }

    @Test
    @DisplayName("Should add the duration to now")
    void testFutureFromDuration() {
        assertThat(DurationCodec.futureFromDuration("1m30s", 1_000_000L)).isEqualTo(1_090_000L);
    }

    @Test
    @DisplayName("Should format milliseconds in the same notation")
    void testFormatDuration() {
        assertThat(DurationCodec.formatDuration(0)).isEqualTo("0s");
        assertThat(DurationCodec.formatDuration(4_000)).isEqualTo("4s");
        assertThat(DurationCodec.formatDuration(7_384_000)).isEqualTo("2h3m4s");
        assertThat(DurationCodec.formatDuration(3_600_999)).isEqualTo("1h");
        assertThatThrownBy(() -> DurationCodec.formatDuration(-1))
                .isInstanceOf(DurationException.class);
    }

    @Test
    @DisplayName("Should check the notation shape only")
    void testIsDurationFormat() {
        assertThat(DurationCodec.isDurationFormat("2h3m")).isTrue();
        assertThat(DurationCodec.isDurationFormat("90m")).isTrue();
        assertThat(DurationCodec.isDurationFormat("")).isFalse();
        assertThat(DurationCodec.isDurationFormat("20251104153000")).isFalse();
        assertThat(DurationCodec.isDurationFormat(null)).isFalse();
    }
}
