package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.RedlineDirection;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.RedlineViolation;
import com.ammann.telemetry.support.TestDataFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RedlineDetector}.
 */
class RedlineDetectorTest
{

    private final RedlineDetector detector = new RedlineDetector();

    @ParameterizedTest(name = "{0} against [100, 1500] is {2} at {1}%")
    @CsvSource({
            "1575, 5.0,   CAUTION",
            "1576, 5.07,  WARNING",
            "1650, 10.0,  WARNING",
            "1700, 13.33, CRITICAL",
            "90,   10.0,  WARNING",
            "80,   20.0,  CRITICAL"
    })
    @DisplayName("Severity boundaries are strict")
    void classifiesByPercentOver(double value, double expectedPercent, Severity expectedSeverity)
    {
        RedlineViolation violation = single(TestDataFactory.profile("p", 100, 1500), value);

        assertThat(violation.percentOver()).isEqualTo(expectedPercent);
        assertThat(violation.severity()).isEqualTo(expectedSeverity);
    }

    @Test
    void reportsHighViolation()
    {
        RedlineViolation violation = single(TestDataFactory.profile("p", 100, 1500), 1575);

        assertThat(violation.direction()).isEqualTo(RedlineDirection.HIGH);
        assertThat(violation.redlineLimit()).isEqualTo(1500.0);
        assertThat(violation.exceedance()).isEqualTo(75.0);
        assertThat(violation.description()).isEqualTo("Test Parameter HIGH redline: 1575.0 u (limit 1500 u, 5.0% over)");
    }

    @Test
    void reportsLowViolation()
    {
        RedlineViolation violation = single(TestDataFactory.profile("p", 100, 1500), 90);

        assertThat(violation.direction()).isEqualTo(RedlineDirection.LOW);
        assertThat(violation.redlineLimit()).isEqualTo(100.0);
        assertThat(violation.exceedance()).isEqualTo(10.0);
    }

    @Test
    void zeroBoundDividesByOne()
    {
        RedlineViolation violation = single(TestDataFactory.profile("p", 0, 10), -3);

        assertThat(violation.percentOver()).isEqualTo(300.0);
        assertThat(violation.severity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void valuesOnTheBoundAreNotViolations()
    {
        MissionProfile profile = TestDataFactory.profile("p", 100, 1500);
        List<ObservationRecord> data = TestDataFactory.series("p", 100, 1500, 800);

        assertThat(detector.detect(context(profile, data))).isEmpty();
    }

    @Test
    void constantSeriesAboveRedlineIsFlaggedEverywhere()
    {
        List<ObservationRecord> data = TestDataFactory.series("velocity_ms", TestDataFactory.constant(30, 9000.0));

        List<Anomaly> anomalies = detector.detect(context(MissionProfile.crs16(), data));

        assertThat(anomalies).hasSize(30)
                .allSatisfy(a -> {
                    assertThat(a.severity()).isEqualTo(Severity.WARNING);
                    assertThat(((RedlineViolation) a).percentOver()).isEqualTo(9.76);
                });
    }

    @Test
    void skipsNonFiniteValues()
    {
        MissionProfile profile = TestDataFactory.profile("p", 0, 10);
        List<ObservationRecord> data = List.of(
                TestDataFactory.record(0.0, "p", Double.NaN),
                TestDataFactory.record(1.0, "p", Double.POSITIVE_INFINITY),
                TestDataFactory.record(2.0, "p", null));

        assertThat(detector.detect(context(profile, data))).isEmpty();
    }

    private RedlineViolation single(MissionProfile profile, double value)
    {
        List<Anomaly> anomalies = detector.detect(context(profile, TestDataFactory.series("p", value)));
        assertThat(anomalies).hasSize(1);
        return (RedlineViolation) anomalies.get(0);
    }

    private static DetectionContext context(MissionProfile profile, List<ObservationRecord> data)
    {
        return new DetectionContext(data, Map.of(), profile, DetectionSettings.defaults());
    }
}
