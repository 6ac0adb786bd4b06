package com.ammann.telemetry.detection;

import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.ParameterBaseline;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Computes per-parameter baselines (mean, population standard deviation, min, max)
 * over the finite samples of the working set.
 *
 * <p>Parameters without a single finite sample are left out of the result rather than
 * reported as an error.
 */
public class StatisticsAggregator
{
    private static final Logger LOG = Logger.getLogger(StatisticsAggregator.class);

    /**
     * Computes baselines for the monitored parameters.
     *
     * @param workingSet records with a valid mission time
     * @param parameters monitored parameter names
     * @return baselines keyed by parameter, in the iteration order of {@code parameters}
     */
    public Map<String, ParameterBaseline> compute(List<ObservationRecord> workingSet, Collection<String> parameters)
    {
        Map<String, ParameterBaseline> baselines = new LinkedHashMap<>();

        for (String parameter : parameters) {
            double[] values = finiteValues(workingSet, parameter);
            if (values.length == 0) {
                LOG.debugf("No finite samples for %s, baseline skipped", parameter);
                continue;
            }
            baselines.put(parameter, baselineOf(parameter, values));
        }

        return baselines;
    }

    /** Population statistics; variance divides by n, not n - 1. */
    static ParameterBaseline baselineOf(String parameter, double[] values)
    {
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        double mean = sum / values.length;
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(squares / values.length);

        return new ParameterBaseline(parameter, values.length, mean, std, min, max);
    }

    private static double[] finiteValues(List<ObservationRecord> workingSet, String parameter)
    {
        return workingSet.stream()
                .filter(r -> r.hasFiniteValue(parameter))
                .mapToDouble(r -> r.value(parameter))
                .toArray();
    }
}
