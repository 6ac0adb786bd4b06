package com.ammann.telemetry.detection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReportFormatTest
{

    @ParameterizedTest(name = "{0} rounds to {1}")
    @CsvSource({
            "1.005,   1.0",
            "2.675,   2.67",
            "1.125,   1.13",
            "-1.125,  -1.13",
            "102.6666666, 102.67",
            "75.0,    75.0"
    })
    void roundsExactBinaryValue(double value, double expected)
    {
        assertThat(ReportFormat.round2(value)).isEqualTo(expected);
    }

    @Test
    void nonFiniteValuesPassThrough()
    {
        assertThat(ReportFormat.round2(Double.NaN)).isNaN();
        assertThat(ReportFormat.round2(Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void formatsWholeLimitsWithoutFraction()
    {
        assertThat(ReportFormat.limit(1500.0)).isEqualTo("1500");
        assertThat(ReportFormat.limit(-0.5)).isEqualTo("-0.5");
    }
}
