package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.support.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyFilterTest
{

    private final List<Anomaly> anomalies = List.of(
            TestDataFactory.outlier(1.0, Severity.CRITICAL, "velocity_ms"),
            TestDataFactory.outlier(2.0, Severity.CAUTION, "velocity_ms"),
            TestDataFactory.outlier(3.0, Severity.CRITICAL, "altitude_km")
    );

    @Test
    void emptyFilterKeepsEverything()
    {
        assertThat(AnomalyFilter.none().apply(anomalies)).isEqualTo(anomalies);
    }

    @Test
    void combinesCriteria()
    {
        AnomalyFilter filter = new AnomalyFilter(Severity.CRITICAL, null, "velocity_ms");

        assertThat(filter.apply(anomalies))
                .singleElement()
                .extracting(Anomaly::missionTime)
                .isEqualTo(1.0);
    }

    @Test
    void typeMismatchExcludesAll()
    {
        AnomalyFilter filter = new AnomalyFilter(null, AnomalyType.REDLINE_VIOLATION, null);

        assertThat(filter.apply(anomalies)).isEmpty();
    }

    @Test
    void filteringLeavesSourceUntouched()
    {
        new AnomalyFilter(Severity.CAUTION, null, null).apply(anomalies);

        assertThat(anomalies).hasSize(3);
    }
}
