package org.carball.dbbench.config;

import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Warning and critical percentages per compared metric. Metrics or levels that are not
 * configured fall back to the defaults.
 */
@Slf4j
@EqualsAndHashCode
public class RegressionThresholds {

    public static final String EXECUTION_TIME = "execution_time";
    public static final String MEMORY = "memory";
    public static final String QUERIES = "queries";
    public static final String SCORE = "score";

    private static final Map<String, Level> DEFAULTS = Map.of(
            EXECUTION_TIME, new Level(10, 25),
            MEMORY, new Level(15, 30),
            QUERIES, new Level(20, 50),
            SCORE, new Level(10, 20));

    private static final Level FALLBACK = new Level(10, 25);

    public record Level(double warning, double critical) {
    }

    private final Map<String, Level> levels = new LinkedHashMap<>();

    public static RegressionThresholds defaults() {
        return new RegressionThresholds();
    }

    public RegressionThresholds warning(String metric, double percent) {
        levels.put(metric, new Level(percent, critical(metric)));
        return this;
    }

    public RegressionThresholds critical(String metric, double percent) {
        levels.put(metric, new Level(warning(metric), percent));
        return this;
    }

    public double warning(String metric) {
        Level level = levels.get(metric);
        return level != null ? level.warning() : DEFAULTS.getOrDefault(metric, FALLBACK).warning();
    }

    public double critical(String metric) {
        Level level = levels.get(metric);
        return level != null ? level.critical() : DEFAULTS.getOrDefault(metric, FALLBACK).critical();
    }

    public Map<String, Level> overrides() {
        return Collections.unmodifiableMap(levels);
    }

    public void validate() {
        for (String metric : new String[]{EXECUTION_TIME, MEMORY, QUERIES, SCORE}) {
            if (warning(metric) > critical(metric)) {
                log.warn("Warning threshold for {} ({}%) is above its critical threshold ({}%)",
                        metric, warning(metric), critical(metric));
            }
            if (warning(metric) <= 0) {
                log.warn("Warning threshold for {} ({}%) should be positive", metric, warning(metric));
            }
        }
    }
}
