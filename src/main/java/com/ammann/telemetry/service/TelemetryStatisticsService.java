package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.ColumnInfoDTO;
import com.ammann.telemetry.dto.ParameterStatisticsDTO;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.RedlineLimit;
import com.ammann.telemetry.model.TelemetryDataset;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Descriptive statistics and presentation helpers over a loaded telemetry dataset.
 *
 * <p>Unlike the detection baselines, these statistics cover every numeric column of the
 * dataset, not only the monitored ones, and include quartiles.
 */
@ApplicationScoped
public class TelemetryStatisticsService
{
    private static final Logger LOG = Logger.getLogger(TelemetryStatisticsService.class);

    /**
     * Numeric columns of a dataset, judged by the first record, excluding the time column.
     *
     * @param dataset loaded dataset
     * @return numeric column names in source order
     */
    public List<String> numericColumns(TelemetryDataset dataset)
    {
        if (dataset.records().isEmpty()) {
            return List.of();
        }
        ObservationRecord first = dataset.records().get(0);
        return dataset.columns().stream()
                .filter(column -> first.values().containsKey(column))
                .toList();
    }

    /**
     * Computes statistics for every numeric column.
     *
     * @param dataset loaded dataset
     * @return statistics keyed by column, columns without numeric samples omitted
     */
    public Map<String, ParameterStatisticsDTO> statisticsFor(TelemetryDataset dataset)
    {
        Map<String, ParameterStatisticsDTO> statistics = new LinkedHashMap<>();
        for (String column : numericColumns(dataset)) {
            calculateStatistics(dataset.records(), column).ifPresent(s -> statistics.put(column, s));
        }
        LOG.debugf("Computed statistics for %d columns of %s", statistics.size(), dataset.filename());
        return statistics;
    }

    /**
     * Computes count, range, mean, population standard deviation and quartiles of one column.
     *
     * @param records records to read from
     * @param parameter column name
     * @return the statistics, or empty when the column has no finite samples
     */
    public Optional<ParameterStatisticsDTO> calculateStatistics(List<ObservationRecord> records, String parameter)
    {
        double[] values = records.stream()
                .filter(r -> r.hasFiniteValue(parameter))
                .mapToDouble(r -> r.value(parameter))
                .sorted()
                .toArray();
        if (values.length == 0) {
            return Optional.empty();
        }

        int n = values.length;
        double mean = Arrays.stream(values).sum() / n;
        double variance = Arrays.stream(values).map(v -> Math.pow(v - mean, 2)).sum() / n;
        double q1 = values[(int) Math.floor(n * 0.25)];
        double q3 = values[(int) Math.floor(n * 0.75)];

        return Optional.of(new ParameterStatisticsDTO(
                parameter,
                n,
                values[0],
                values[n - 1],
                round4(mean),
                round4(Math.sqrt(variance)),
                values[n / 2],
                q1,
                q3,
                q3 - q1
        ));
    }

    /**
     * Keeps every {@code step}-th record where {@code step = ceil(size / maxPoints)}.
     *
     * @param records records to thin out
     * @param maxPoints target upper bound
     * @return the records unchanged when already small enough, otherwise the strided subset
     */
    public List<ObservationRecord> downsample(List<ObservationRecord> records, int maxPoints)
    {
        if (records.size() <= maxPoints) {
            return records;
        }
        int step = (int) Math.ceil((double) records.size() / maxPoints);
        return IntStream.range(0, records.size())
                .filter(i -> i % step == 0)
                .mapToObj(records::get)
                .toList();
    }

    /**
     * Flattens a record into a column-ordered row for JSON output.
     *
     * @param record record to flatten
     * @param columns dataset columns in source order
     * @param selected columns to keep besides time and phase, {@code null} for all
     * @return row keyed by column name
     */
    public Map<String, Object> toRow(ObservationRecord record, List<String> columns, List<String> selected)
    {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(TelemetryCsvParser.MISSION_TIME_COLUMN, record.missionTime());
        row.put(TelemetryCsvParser.PHASE_COLUMN, record.phase());

        List<String> keep = selected != null ? selected : columns;
        for (String column : keep) {
            if (record.values().containsKey(column)) {
                row.put(column, record.values().get(column));
            } else if (record.attributes().containsKey(column)) {
                row.put(column, record.attributes().get(column));
            }
        }
        return row;
    }

    /**
     * Describes every column of the dataset.
     *
     * @param dataset loaded dataset
     * @param profile mission profile supplying labels and units
     * @return one entry per column in source order
     */
    public List<ColumnInfoDTO> columnInfo(TelemetryDataset dataset, MissionProfile profile)
    {
        ObservationRecord first = dataset.records().isEmpty() ? null : dataset.records().get(0);
        List<ColumnInfoDTO> info = new ArrayList<>();
        for (String column : dataset.columns()) {
            RedlineLimit limit = profile.redlines().get(column);
            boolean numeric = first != null
                    && (first.values().containsKey(column)
                        || (TelemetryCsvParser.MISSION_TIME_COLUMN.equals(column) && first.missionTime() != null));
            info.add(new ColumnInfoDTO(
                    column,
                    limit != null ? limit.label() : titleCase(column),
                    limit != null ? limit.unit() : "",
                    numeric,
                    limit != null));
        }
        return info;
    }

    /** {@code dynamic_pressure_pa} becomes {@code Dynamic Pressure Pa}. */
    static String titleCase(String column)
    {
        String[] words = column.replace('_', ' ').split(" ", -1);
        StringBuilder label = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                label.append(' ');
            }
            String word = words[i];
            if (!word.isEmpty()) {
                label.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
            }
        }
        return label.toString();
    }

    private static double round4(double value)
    {
        return new BigDecimal(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
