package org.carball.dbbench.stats;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive statistics of one metric over the measured iterations.
 */
public record BenchmarkStats(
        @JsonProperty("iterations") int iterations,
        @JsonProperty("warmup_runs") int warmupRuns,
        @JsonProperty("average") double mean,
        @JsonProperty("median") double median,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("std_deviation") double stdDeviation,
        @JsonProperty("std_deviation_percent") double stdDeviationPercent,
        @JsonProperty("p95") double p95,
        @JsonProperty("p99") double p99,
        @JsonProperty("values") List<Double> values
) {

    public static final double DEFAULT_STABILITY_THRESHOLD = 10;

    public BenchmarkStats {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static BenchmarkStats empty(int warmupRuns) {
        return new BenchmarkStats(0, warmupRuns, 0, 0, 0, 0, 0, 0, 0, 0, List.of());
    }

    public static BenchmarkStats fromValues(List<? extends Number> values, int warmupRuns) {
        if (values == null || values.isEmpty()) {
            return empty(warmupRuns);
        }

        List<Double> raw = new ArrayList<>(values.size());
        for (Number value : values) {
            raw.add(value == null ? 0.0 : value.doubleValue());
        }

        List<Double> sorted = new ArrayList<>(raw);
        Collections.sort(sorted);

        int n = sorted.size();
        double sum = 0;
        for (double value : sorted) {
            sum += value;
        }
        double mean = sum / n;

        double median = n % 2 == 0
                ? (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2
                : sorted.get(n / 2);

        double stdDeviation = 0;
        if (n >= 2) {
            double squares = 0;
            for (double value : sorted) {
                squares += (value - mean) * (value - mean);
            }
            stdDeviation = Math.sqrt(squares / (n - 1));
        }
        double stdDeviationPercent = mean != 0 ? stdDeviation / mean * 100 : 0;

        return new BenchmarkStats(
                n,
                warmupRuns,
                mean,
                median,
                sorted.get(0),
                sorted.get(n - 1),
                stdDeviation,
                stdDeviationPercent,
                percentile(sorted, 95),
                percentile(sorted, 99),
                raw
        );
    }

    /**
     * Linear interpolation between the closest ranks of an ascending list.
     */
    static double percentile(List<Double> sorted, double percentile) {
        if (sorted.isEmpty()) {
            return 0;
        }
        double index = percentile / 100 * (sorted.size() - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted.get(lower);
        }
        double fraction = index - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
    }

    @JsonIgnore
    public boolean isStable() {
        return isStable(DEFAULT_STABILITY_THRESHOLD);
    }

    public boolean isStable(double thresholdPercent) {
        return stdDeviationPercent <= thresholdPercent;
    }

    public String stabilityLabel() {
        if (stdDeviationPercent <= 5) {
            return "Very Stable";
        } else if (stdDeviationPercent <= 10) {
            return "Stable";
        } else if (stdDeviationPercent <= 20) {
            return "Moderate Variance";
        }
        return "High Variance";
    }
}
