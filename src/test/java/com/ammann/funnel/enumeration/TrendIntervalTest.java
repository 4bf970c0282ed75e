/* (C)2026 */
package com.ammann.funnel.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TrendIntervalTest {

    @ParameterizedTest
    @CsvSource({
            "HOUR, 2021-05-05T13:47:12Z, 2021-05-05T13:00:00Z",
            "DAY, 2021-05-05T13:47:12Z, 2021-05-05T00:00:00Z",
            "WEEK, 2021-05-05T13:47:12Z, 2021-05-02T00:00:00Z",
            "WEEK, 2021-05-02T00:00:00Z, 2021-05-02T00:00:00Z",
            "WEEK, 2021-05-01T23:59:59Z, 2021-04-25T00:00:00Z",
            "MONTH, 2021-05-31T23:00:00Z, 2021-05-01T00:00:00Z"
    })
    void truncatesToPeriodStartInUtc(TrendInterval interval, String instant, String expected) {
        assertThat(interval.truncate(Instant.parse(instant), ZoneOffset.UTC)).isEqualTo(Instant.parse(expected));
    }

    @ParameterizedTest
    @CsvSource({
            "HOUR, 2021-05-01T23:00:00Z, 2021-05-02T00:00:00Z",
            "DAY, 2021-05-31T00:00:00Z, 2021-06-01T00:00:00Z",
            "WEEK, 2021-04-25T00:00:00Z, 2021-05-02T00:00:00Z",
            "MONTH, 2021-01-01T00:00:00Z, 2021-02-01T00:00:00Z",
            "MONTH, 2021-02-01T00:00:00Z, 2021-03-01T00:00:00Z"
    })
    void advancesToNextPeriod(TrendInterval interval, String start, String expected) {
        assertThat(interval.next(Instant.parse(start), ZoneOffset.UTC)).isEqualTo(Instant.parse(expected));
    }

    @Test
    void dayAcrossDaylightSavingChangeIsTwentyThreeHours() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        Instant dayStart = TrendInterval.DAY.truncate(Instant.parse("2021-03-28T12:00:00Z"), berlin);

        assertThat(dayStart).isEqualTo(Instant.parse("2021-03-27T23:00:00Z"));
        assertThat(TrendInterval.DAY.next(dayStart, berlin)).isEqualTo(Instant.parse("2021-03-28T22:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"day", "DAY", "Day"})
    void fromStringIsCaseInsensitive(String value) {
        assertThat(TrendInterval.fromString(value)).isEqualTo(TrendInterval.DAY);
    }

    @Test
    void fromStringRejectsUnknownAndNull() {
        assertThatThrownBy(() -> TrendInterval.fromString("fortnight"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fortnight");
        assertThatThrownBy(() -> TrendInterval.fromString(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
