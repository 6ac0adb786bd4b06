package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.AnomalySummary;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.support.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SummaryBuilderTest
{

    private final SummaryBuilder builder = new SummaryBuilder();

    @Test
    void countsBySeverityTypeAndParameter()
    {
        List<Anomaly> anomalies = List.of(
                TestDataFactory.outlier(1.0, Severity.CRITICAL, "a"),
                TestDataFactory.outlier(2.0, Severity.CRITICAL, "a"),
                TestDataFactory.outlier(3.0, Severity.CAUTION, "b"));

        AnomalySummary summary = builder.build(
                anomalies, new EventClusterer(10.0).cluster(anomalies), MissionProfile.crs16());

        assertThat(summary.totalAnomalies()).isEqualTo(3);
        assertThat(summary.totalEvents()).isEqualTo(1);
        assertThat(summary.bySeverity()).containsExactly(
                entry(Severity.CRITICAL, 2),
                entry(Severity.WARNING, 0),
                entry(Severity.CAUTION, 1));
        assertThat(summary.byType()).containsExactly(entry("Z-Score Outlier", 3));
        assertThat(summary.byParameter()).containsExactly(entry("A", 2), entry("B", 1));
    }

    @Test
    void emptyRunStillListsEveryTier()
    {
        AnomalySummary summary = builder.build(List.of(), List.of(), MissionProfile.crs16());

        assertThat(summary.totalAnomalies()).isZero();
        assertThat(summary.bySeverity()).containsOnlyKeys(Severity.CRITICAL, Severity.WARNING, Severity.CAUTION)
                .allSatisfy((severity, count) -> assertThat(count).isZero());
        assertThat(summary.byType()).isEmpty();
        assertThat(summary.events()).isEmpty();
    }

    @Test
    void carriesStaticMissionTables()
    {
        MissionProfile profile = MissionProfile.crs16();

        AnomalySummary summary = builder.build(List.of(), List.of(), profile);

        assertThat(summary.redlineLimits()).hasSize(13).isEqualTo(profile.redlines());
        assertThat(summary.missionEvents()).containsEntry("maxq", 54.0);
    }
}
