package org.carball.dbbench.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.dbbench.baseline.BaselineResult;
import org.carball.dbbench.baseline.GitInfo;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Statistics of every metric over a series of iterations.
 */
public record IterationResult(
        @JsonProperty("execution_time") BenchmarkStats executionTime,
        @JsonProperty("memory_used") BenchmarkStats memoryUsed,
        @JsonProperty("peak_memory") BenchmarkStats peakMemory,
        @JsonProperty("query_count") BenchmarkStats queryCount,
        @JsonProperty("db_time") BenchmarkStats dbTime,
        @JsonProperty("performance_score") BenchmarkStats performanceScore,
        @JsonProperty("raw_iterations") List<IterationSample> rawIterations
) {

    public IterationResult {
        rawIterations = rawIterations == null ? List.of() : List.copyOf(rawIterations);
    }

    public static IterationResult fromIterations(List<IterationSample> samples, int warmupRuns) {
        List<IterationSample> iterations = samples == null ? List.of() : samples;
        return new IterationResult(
                stats(iterations, IterationSample::executionTime, warmupRuns),
                stats(iterations, IterationSample::memoryUsed, warmupRuns),
                stats(iterations, IterationSample::peakMemory, warmupRuns),
                stats(iterations, IterationSample::queryCount, warmupRuns),
                stats(iterations, IterationSample::dbTime, warmupRuns),
                stats(iterations, IterationSample::performanceScore, warmupRuns),
                iterations
        );
    }

    private static BenchmarkStats stats(List<IterationSample> samples,
                                        ToDoubleFunction<IterationSample> metric,
                                        int warmupRuns) {
        List<Double> values = samples.stream()
                .map(sample -> metric.applyAsDouble(sample))
                .collect(Collectors.toList());
        return BenchmarkStats.fromValues(values, warmupRuns);
    }

    /**
     * Median execution time in seconds.
     */
    public double primaryResult() {
        return executionTime.median();
    }

    /**
     * Baseline built from the medians of every metric, carrying these statistics.
     */
    public BaselineResult toBaseline(String benchmarkName,
                                     String benchmarkClass,
                                     Map<String, Object> options,
                                     GitInfo gitInfo) {
        return BaselineResult.builder()
                .benchmarkName(benchmarkName)
                .benchmarkClass(benchmarkClass)
                .executionTime(executionTime.median())
                .memoryUsed((long) memoryUsed.median())
                .peakMemory((long) peakMemory.median())
                .totalQueries((int) queryCount.median())
                .totalDbTime(dbTime.median())
                .performanceScore((int) performanceScore.median())
                .options(options)
                .createdAt(Instant.now())
                .gitBranch(gitInfo == null ? null : gitInfo.branch())
                .gitCommit(gitInfo == null ? null : gitInfo.commit())
                .iterations(executionTime.iterations())
                .stats(this)
                .build();
    }
}
