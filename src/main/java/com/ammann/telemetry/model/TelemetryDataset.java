package com.ammann.telemetry.model;

import java.util.List;

/**
 * A fully materialised telemetry sequence as handed over by ingestion.
 *
 * @param filename name of the source the records came from
 * @param columns  column names in source order, including the time and phase columns
 * @param records  records in source order
 */
public record TelemetryDataset(String filename, List<String> columns, List<ObservationRecord> records) {

    public TelemetryDataset {
        columns = List.copyOf(columns);
        records = List.copyOf(records);
    }
}
