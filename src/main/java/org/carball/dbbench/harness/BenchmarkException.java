package org.carball.dbbench.harness;

/**
 * A benchmark's setup, workload or teardown failed.
 */
public class BenchmarkException extends Exception {

    public BenchmarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
