package org.carball.dbbench.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class BenchmarkConfig {

    public static final String DEFAULT_BASELINE_PATH = "benchmarks/baselines";

    @Builder.Default
    private AdvisorConfig advisor = AdvisorConfig.defaults();

    @Builder.Default
    private RegressionThresholds regression = RegressionThresholds.defaults();

    // Iterations
    @Builder.Default
    private int defaultIterations = 5;

    @Builder.Default
    private int minIterations = 1;

    @Builder.Default
    private int maxIterations = 100;

    @Builder.Default
    private int warmupIterations = 0;

    @Builder.Default
    private String baselinePath = DEFAULT_BASELINE_PATH;

    public static BenchmarkConfig defaults() {
        return BenchmarkConfig.builder().build();
    }

    /**
     * Clamps a requested iteration count into [minIterations, maxIterations].
     */
    public int clampIterations(int requested) {
        int lower = Math.max(1, minIterations);
        int upper = Math.max(lower, maxIterations);
        return Math.max(lower, Math.min(upper, requested));
    }

    /**
     * Logs warnings for inconsistent values. Never throws.
     */
    public void validate() {
        if (minIterations < 1) {
            log.warn("Minimum iterations ({}) should be at least 1", minIterations);
        }

        if (maxIterations < minIterations) {
            log.warn("Maximum iterations ({}) should not be below minimum iterations ({})",
                    maxIterations, minIterations);
        }

        if (defaultIterations < minIterations || defaultIterations > maxIterations) {
            log.warn("Default iterations ({}) is outside [{}, {}] and will be clamped",
                    defaultIterations, minIterations, maxIterations);
        }

        if (warmupIterations < 0) {
            log.warn("Warmup iterations ({}) should not be negative", warmupIterations);
        }

        if (baselinePath == null || baselinePath.isBlank()) {
            log.warn("Baseline path is empty, using {}", DEFAULT_BASELINE_PATH);
            baselinePath = DEFAULT_BASELINE_PATH;
        }

        regression.validate();

        log.debug("Using iterations - Default: {}, Min: {}, Max: {}, Warmup: {}",
                defaultIterations, minIterations, maxIterations, warmupIterations);
    }

    public String getConfigurationSummary() {
        return String.format("Advisor: %s | Iterations: %d (warmup %d) | Baselines: %s",
                advisor.isEnabled() ? "enabled" : "disabled",
                defaultIterations, warmupIterations, baselinePath);
    }
}
