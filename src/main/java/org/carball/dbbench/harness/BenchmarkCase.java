package org.carball.dbbench.harness;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of a measured workload. Subclasses implement {@link #benchmark(BenchmarkContext)}
 * and report their queries through the context.
 */
public abstract class BenchmarkCase {

    private final Map<String, Object> configuredOptions = new LinkedHashMap<>();
    private boolean configured = false;

    public String getName() {
        return getClass().getSimpleName();
    }

    public String getDescription() {
        return "No description provided";
    }

    /**
     * Options this benchmark understands, with their default values.
     */
    public Map<String, Object> getDefaultOptions() {
        return Map.of();
    }

    /**
     * Overlays the given values on the defaults.
     */
    public BenchmarkCase configure(Map<String, Object> options) {
        configuredOptions.clear();
        configuredOptions.putAll(getDefaultOptions());
        if (options != null) {
            configuredOptions.putAll(options);
        }
        configured = true;
        applyOptions(Collections.unmodifiableMap(configuredOptions));
        return this;
    }

    public Map<String, Object> getOptions() {
        if (!configured) {
            configure(null);
        }
        return Collections.unmodifiableMap(configuredOptions);
    }

    /**
     * @throws ClassCastException when the configured value is not of the given type
     */
    protected <T> T option(String name, Class<T> type, T defaultValue) {
        Object value = getOptions().get(name);
        return value == null ? defaultValue : type.cast(value);
    }

    /**
     * Hook for subclasses that derive state from their options.
     */
    protected void applyOptions(Map<String, Object> options) {
    }

    /**
     * Runs before every iteration, outside the measurement.
     */
    public void setUp() throws Exception {
    }

    /**
     * Runs after every iteration, outside the measurement, even when the iteration failed.
     */
    public void tearDown() throws Exception {
    }

    public abstract void benchmark(BenchmarkContext context) throws Exception;
}
