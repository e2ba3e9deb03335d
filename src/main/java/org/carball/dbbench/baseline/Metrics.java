package org.carball.dbbench.baseline;

/**
 * Names of the compared metrics.
 */
public final class Metrics {

    public static final String EXECUTION_TIME = "execution_time";
    public static final String PEAK_MEMORY = "peak_memory";
    public static final String TOTAL_QUERIES = "total_queries";
    public static final String PERFORMANCE_SCORE = "performance_score";

    private Metrics() {
        // Utility class - prevent instantiation
    }

    public static String label(String metric) {
        switch (metric) {
            case EXECUTION_TIME:
                return "Execution Time";
            case PEAK_MEMORY:
                return "Peak Memory";
            case TOTAL_QUERIES:
                return "Query Count";
            case PERFORMANCE_SCORE:
                return "Performance Score";
            default:
                return metric;
        }
    }
}
