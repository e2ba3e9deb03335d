package org.carball.dbbench.harness;

import org.carball.dbbench.collector.QueryCollector;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Handed to a running benchmark to time and record its database calls.
 */
public class BenchmarkContext {

    public static final String DEFAULT_CONNECTION = "default";

    private final QueryCollector collector;
    private final Map<String, Object> options;
    private final int iteration;

    public BenchmarkContext(QueryCollector collector, Map<String, Object> options, int iteration) {
        this.collector = collector;
        this.options = options == null ? Map.of() : options;
        this.iteration = iteration;
    }

    /**
     * Runs one database call, timing it and recording it against the caller's location.
     * The call is recorded even when it throws.
     */
    public <T> T query(String sql, List<Object> bindings, Callable<T> execution) throws Exception {
        return query(DEFAULT_CONNECTION, sql, bindings, execution);
    }

    public <T> T query(String connection, String sql, List<Object> bindings, Callable<T> execution) throws Exception {
        long start = System.nanoTime();
        try {
            return execution.call();
        } finally {
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            collector.record(sql, bindings, elapsedMs, connection);
        }
    }

    /**
     * Records a call the workload timed itself.
     */
    public void record(String sql, List<Object> bindings, double timeMs) {
        collector.record(sql, bindings, timeMs, DEFAULT_CONNECTION);
    }

    public QueryCollector getCollector() {
        return collector;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * Zero-based index of the current iteration; negative during warmup.
     */
    public int getIteration() {
        return iteration;
    }
}
