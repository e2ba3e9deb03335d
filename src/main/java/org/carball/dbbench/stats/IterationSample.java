package org.carball.dbbench.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Measurements of one benchmark iteration.
 *
 * @param executionTime seconds
 * @param memoryUsed heap growth in bytes
 * @param peakMemory peak heap in bytes
 * @param dbTime milliseconds
 */
public record IterationSample(
        @JsonProperty("execution_time") double executionTime,
        @JsonProperty("memory_used") long memoryUsed,
        @JsonProperty("peak_memory") long peakMemory,
        @JsonProperty("query_count") int queryCount,
        @JsonProperty("db_time") double dbTime,
        @JsonProperty("performance_score") int performanceScore
) {
}
