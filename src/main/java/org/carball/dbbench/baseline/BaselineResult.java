package org.carball.dbbench.baseline;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.carball.dbbench.stats.IterationResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saved measurements of one benchmark. With more than one iteration the scalar
 * fields hold medians and {@code stats} the full statistics.
 *
 * @param executionTime seconds
 * @param memoryUsed bytes
 * @param peakMemory bytes
 * @param totalDbTime milliseconds
 */
@Builder(toBuilder = true)
public record BaselineResult(
        @JsonProperty("benchmark_name") String benchmarkName,
        @JsonProperty("benchmark_class") String benchmarkClass,
        @JsonProperty("execution_time") double executionTime,
        @JsonProperty("memory_used") long memoryUsed,
        @JsonProperty("peak_memory") long peakMemory,
        @JsonProperty("total_queries") int totalQueries,
        @JsonProperty("total_db_time") double totalDbTime,
        @JsonProperty("performance_score") int performanceScore,
        @JsonProperty("options") Map<String, Object> options,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("git_branch") String gitBranch,
        @JsonProperty("git_commit") String gitCommit,
        @JsonProperty("iterations") int iterations,
        @JsonProperty("stats") IterationResult stats
) {

    public BaselineResult {
        options = options == null ? Map.of() : canonicalOptions(options);
        iterations = Math.max(1, iterations);
    }

    /**
     * Integral numbers become {@code Long} and floating-point numbers {@code Double}, the types
     * option values have after a JSON round trip.
     */
    private static Map<String, Object> canonicalOptions(Map<String, Object> options) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        options.forEach((key, value) -> canonical.put(key, canonicalValue(value)));
        return Collections.unmodifiableMap(canonical);
    }

    private static Object canonicalValue(Object value) {
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, item) -> nested.put(String.valueOf(key), canonicalValue(item)));
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            ((List<?>) value).forEach(item -> items.add(canonicalValue(item)));
            return Collections.unmodifiableList(items);
        }
        return value;
    }

    /**
     * Baseline of a single iteration.
     */
    public static BaselineResult fromSingleRun(String benchmarkName,
                                               String benchmarkClass,
                                               double executionTimeSeconds,
                                               long memoryUsed,
                                               long peakMemory,
                                               int totalQueries,
                                               double totalDbTime,
                                               int performanceScore,
                                               Map<String, Object> options,
                                               GitInfo gitInfo) {
        GitInfo git = gitInfo == null ? GitInfo.none() : gitInfo;
        return BaselineResult.builder()
                .benchmarkName(benchmarkName)
                .benchmarkClass(benchmarkClass)
                .executionTime(executionTimeSeconds)
                .memoryUsed(memoryUsed)
                .peakMemory(peakMemory)
                .totalQueries(totalQueries)
                .totalDbTime(totalDbTime)
                .performanceScore(performanceScore)
                .options(options)
                .createdAt(Instant.now())
                .gitBranch(git.branch())
                .gitCommit(git.commit())
                .iterations(1)
                .build();
    }

    public boolean hasMultipleIterations() {
        return iterations > 1;
    }
}
