/* (C)2026 */
package com.ammann.funnel.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class WindowUnitTest {

    @ParameterizedTest
    @CsvSource({
            "SECOND, 90, PT1M30S",
            "MINUTE, 90, PT1H30M",
            "HOUR, 36, PT36H",
            "DAY, 14, PT336H",
            "WEEK, 2, PT336H",
            "MONTH, 1, PT720H"
    })
    void convertsAmountsToFixedDurations(WindowUnit unit, long amount, String expected) {
        assertThat(unit.toDuration(amount)).isEqualTo(Duration.parse(expected));
    }

    @Test
    void monthIsAlwaysThirtyDays() {
        assertThat(WindowUnit.MONTH.getUnitDuration()).isEqualTo(Duration.ofDays(30));
    }
}
