/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.TelemetryDataset;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Reads telemetry CSV files with a header row into {@link ObservationRecord}s.
 *
 * <p>Cells that parse as numbers become numeric readings, anything else is kept as a text
 * attribute and empty cells are dropped. The {@code mission_time_s} column supplies the
 * mission time and {@code flight_phase} the phase label.
 */
@ApplicationScoped
public class TelemetryCsvParser {

    private static final Logger LOG = Logger.getLogger(TelemetryCsvParser.class);

    public static final String MISSION_TIME_COLUMN = "mission_time_s";
    public static final String PHASE_COLUMN = "flight_phase";

    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    /**
     * Parses CSV text.
     *
     * @param filename name reported for the dataset
     * @param content CSV text including the header row
     * @return the parsed dataset
     * @throws ValidationException if the text is not readable CSV
     */
    public TelemetryDataset parse(String filename, String content) {
        return parse(filename, new StringReader(content));
    }

    /**
     * Parses a CSV file from disk.
     *
     * @param file path to the CSV file
     * @return the parsed dataset, named after the file
     * @throws ValidationException if the file cannot be read or is not valid CSV
     */
    public TelemetryDataset parseFile(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(file.getFileName().toString(), reader);
        } catch (IOException e) {
            throw new ValidationException("Unable to read telemetry file " + file, e);
        }
    }

    TelemetryDataset parse(String filename, Reader reader) {
        List<String> columns = new ArrayList<>();
        List<ObservationRecord> records = new ArrayList<>();

        try (MappingIterator<Map<String, String>> rows =
                mapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                if (columns.isEmpty()) {
                    columns.addAll(row.keySet());
                }
                records.add(toRecord(row));
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new ValidationException("Malformed telemetry CSV: " + e.getMessage(), e);
        }

        LOG.infof("Parsed %d telemetry records with %d columns from %s",
                records.size(), columns.size(), filename);

        return new TelemetryDataset(filename, columns, records);
    }

    private static ObservationRecord toRecord(Map<String, String> row) {
        Double missionTime = null;
        String phase = null;
        Map<String, Double> values = new LinkedHashMap<>();
        Map<String, String> attributes = new LinkedHashMap<>();

        for (Map.Entry<String, String> cell : row.entrySet()) {
            String column = cell.getKey();
            String raw = cell.getValue() == null ? "" : cell.getValue().trim();
            if (raw.isEmpty()) {
                continue;
            }
            Double number = parseNumber(raw);

            if (MISSION_TIME_COLUMN.equals(column)) {
                missionTime = number;
            } else if (PHASE_COLUMN.equals(column)) {
                phase = raw;
            } else if (number != null) {
                values.put(column, number);
            } else {
                attributes.put(column, raw);
            }
        }

        return new ObservationRecord(missionTime, phase, values, attributes);
    }

    private static Double parseNumber(String raw) {
        try {
            return Double.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
