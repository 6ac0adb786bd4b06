package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.ColumnInfoDTO;
import com.ammann.telemetry.dto.ParameterStatisticsDTO;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.TelemetryDataset;
import com.ammann.telemetry.support.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetryStatisticsServiceTest
{

    private final TelemetryStatisticsService service = new TelemetryStatisticsService();

    @Test
    void calculatesDescriptiveStatistics()
    {
        List<ObservationRecord> records = TestDataFactory.series("p", 10, 9, 8, 7, 6, 5, 4, 3, 2, 1);

        ParameterStatisticsDTO stats = service.calculateStatistics(records, "p").orElseThrow();

        assertThat(stats.count()).isEqualTo(10);
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(10.0);
        assertThat(stats.mean()).isEqualTo(5.5);
        assertThat(stats.std()).isEqualTo(2.8723);
        assertThat(stats.median()).isEqualTo(6.0);
        assertThat(stats.q1()).isEqualTo(3.0);
        assertThat(stats.q3()).isEqualTo(8.0);
        assertThat(stats.iqr()).isEqualTo(5.0);
    }

    @Test
    void columnWithoutSamplesHasNoStatistics()
    {
        assertThat(service.calculateStatistics(TestDataFactory.series("p", 1, 2), "q")).isEmpty();
    }

    @Test
    void downsamplesWithFixedStride()
    {
        List<ObservationRecord> records = TestDataFactory.series("p", 0, 1, 2, 3, 4, 5, 6, 7, 8, 9);

        List<ObservationRecord> sampled = service.downsample(records, 3);

        assertThat(sampled).extracting(ObservationRecord::missionTime).containsExactly(0.0, 4.0, 8.0);
    }

    @Test
    void smallSeriesIsNotDownsampled()
    {
        List<ObservationRecord> records = TestDataFactory.series("p", 1, 2, 3);

        assertThat(service.downsample(records, 1000)).isSameAs(records);
    }

    @Test
    void rowAlwaysKeepsTimeAndPhase()
    {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("velocity_ms", 7.0);
        values.put("altitude_km", 1.0);
        ObservationRecord record = new ObservationRecord(3.0, "ascent", values, Map.of("note", "x"));
        List<String> columns = List.of("mission_time_s", "flight_phase", "velocity_ms", "altitude_km", "note");

        Map<String, Object> selectedRow = service.toRow(record, columns, List.of("altitude_km"));
        Map<String, Object> fullRow = service.toRow(record, columns, null);

        assertThat(selectedRow).containsOnlyKeys("mission_time_s", "flight_phase", "altitude_km");
        assertThat(selectedRow.get("flight_phase")).isEqualTo("ascent");
        assertThat(fullRow).containsKeys("velocity_ms", "note");
    }

    @Test
    void describesColumns()
    {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("velocity_ms", 100.0);
        values.put("engine_temp_k", 300.0);
        TelemetryDataset dataset = new TelemetryDataset(
                "t.csv",
                List.of("mission_time_s", "flight_phase", "velocity_ms", "engine_temp_k"),
                List.of(new ObservationRecord(0.0, "ascent", values, null)));

        List<ColumnInfoDTO> columns = service.columnInfo(dataset, MissionProfile.crs16());

        assertThat(columns).extracting(ColumnInfoDTO::label)
                .containsExactly("Mission Time S", "Flight Phase", "Velocity", "Engine Temp K");
        assertThat(columns).extracting(ColumnInfoDTO::numeric)
                .containsExactly(true, false, true, true);
        assertThat(columns).extracting(ColumnInfoDTO::hasRedline)
                .containsExactly(false, false, true, false);
        assertThat(columns.get(2).unit()).isEqualTo("m/s");
        assertThat(service.numericColumns(dataset)).containsExactly("velocity_ms", "engine_temp_k");
    }

    @Test
    void titleCasesColumnNames()
    {
        assertThat(TelemetryStatisticsService.titleCase("dynamic_pressure_pa")).isEqualTo("Dynamic Pressure Pa");
    }
}
