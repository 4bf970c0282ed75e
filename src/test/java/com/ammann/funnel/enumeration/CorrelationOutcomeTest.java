/* (C)2026 */
package com.ammann.funnel.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CorrelationOutcomeTest {

    @ParameterizedTest
    @CsvSource({
            "11.0, SUCCESS",
            "1.0000001, SUCCESS",
            "1.0, FAILURE",
            "0.0909, FAILURE"
    })
    void classifiesOddsRatio(double oddsRatio, CorrelationOutcome expected) {
        assertThat(CorrelationOutcome.fromOddsRatio(oddsRatio)).isEqualTo(expected);
    }
}
