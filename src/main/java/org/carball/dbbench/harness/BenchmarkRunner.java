package org.carball.dbbench.harness;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.analyzer.Advisor;
import org.carball.dbbench.analyzer.PerformanceScore;
import org.carball.dbbench.baseline.BaselineResult;
import org.carball.dbbench.baseline.GitInfo;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.BenchmarkConfig;
import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.stats.IterationResult;
import org.carball.dbbench.stats.IterationSample;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs a benchmark for warmup and measured iterations, analyzing each measured one.
 */
@Slf4j
public class BenchmarkRunner {

    private final BenchmarkConfig config;
    private final Supplier<GitInfo> gitInfo;

    public BenchmarkRunner() {
        this(BenchmarkConfig.defaults());
    }

    public BenchmarkRunner(BenchmarkConfig config) {
        this(config, GitInfo::detect);
    }

    public BenchmarkRunner(BenchmarkConfig config, Supplier<GitInfo> gitInfo) {
        this.config = config;
        this.gitInfo = gitInfo;
    }

    public BenchmarkRun run(BenchmarkCase benchmark) throws BenchmarkException {
        return run(benchmark, config.getDefaultIterations());
    }

    /**
     * @throws IllegalArgumentException when fewer than one iteration is requested
     */
    public BenchmarkRun run(BenchmarkCase benchmark, int requestedIterations) throws BenchmarkException {
        if (requestedIterations < 1) {
            throw new IllegalArgumentException("Iterations must be at least 1, got " + requestedIterations);
        }
        int iterations = config.clampIterations(requestedIterations);
        if (iterations != requestedIterations) {
            log.warn("Iterations {} outside [{}, {}], using {}", requestedIterations,
                    config.getMinIterations(), config.getMaxIterations(), iterations);
        }
        int warmup = Math.max(0, config.getWarmupIterations());

        QueryCollector collector = new QueryCollector();
        Advisor advisor = new Advisor(collector, config.getAdvisor());

        log.info("Running benchmark {} ({} iterations, {} warmup)", benchmark.getName(), iterations, warmup);

        for (int i = 0; i < warmup; i++) {
            runIteration(benchmark, advisor, -1 - i);
        }

        List<IterationSample> samples = new ArrayList<>();
        AdvisorReport lastReport = null;
        PerformanceScore lastScore = null;

        for (int i = 0; i < iterations; i++) {
            IterationOutcome outcome = runIteration(benchmark, advisor, i);
            samples.add(outcome.sample());
            lastReport = outcome.report();
            lastScore = outcome.score();
            log.debug("Iteration {}/{}: {}s, {} queries", i + 1, iterations,
                    outcome.sample().executionTime(), outcome.sample().queryCount());
        }

        IterationResult result = IterationResult.fromIterations(samples, warmup);
        BaselineResult baseline = toBaseline(benchmark, result, samples);

        log.info("Benchmark {} finished: median {}s, score {}", benchmark.getName(),
                result.primaryResult(), baseline.performanceScore());
        return new BenchmarkRun(benchmark.getName(), result, lastReport, lastScore, baseline);
    }

    private IterationOutcome runIteration(BenchmarkCase benchmark, Advisor advisor, int iteration)
            throws BenchmarkException {
        advisor.reset();
        try {
            benchmark.setUp();
        } catch (Exception e) {
            throw new BenchmarkException("Setup of " + benchmark.getName() + " failed", e);
        }

        BenchmarkContext context = new BenchmarkContext(advisor.getCollector(), benchmark.getOptions(), iteration);
        long memoryBefore;
        long startNanos;
        double executionTime;
        long memoryUsed;
        long peakMemory;
        Optional<AdvisorReport> report;

        try {
            resetPeakUsage();
            memoryBefore = usedHeap();
            startNanos = System.nanoTime();

            advisor.start();
            try {
                benchmark.benchmark(context);
            } finally {
                report = advisor.stop();
            }

            executionTime = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            memoryUsed = Math.max(0, usedHeap() - memoryBefore);
            peakMemory = peakHeap();
        } catch (Exception e) {
            throw new BenchmarkException("Benchmark " + benchmark.getName() + " failed", e);
        } finally {
            try {
                benchmark.tearDown();
            } catch (Exception e) {
                log.warn("Teardown of {} failed: {}", benchmark.getName(), e.getMessage());
            }
        }

        double seconds = executionTime;
        PerformanceScore score = report
                .map(r -> new PerformanceScore(r, seconds, config.getAdvisor().nPlusOneSavingsRatio()))
                .orElse(null);

        IterationSample sample = new IterationSample(
                seconds,
                memoryUsed,
                peakMemory,
                report.map(AdvisorReport::getTotalQueries).orElse(advisor.getCollector().getQueryCount()),
                report.map(AdvisorReport::getTotalDbTime).orElse(advisor.getCollector().getTotalTime()),
                score == null ? 0 : score.getScore());

        return new IterationOutcome(sample, report.orElse(null), score);
    }

    private BaselineResult toBaseline(BenchmarkCase benchmark, IterationResult result, List<IterationSample> samples) {
        GitInfo git = gitInfo.get();
        if (samples.size() > 1) {
            return result.toBaseline(benchmark.getName(), benchmark.getClass().getName(), benchmark.getOptions(), git);
        }
        IterationSample only = samples.get(0);
        return BaselineResult.fromSingleRun(
                benchmark.getName(),
                benchmark.getClass().getName(),
                only.executionTime(),
                only.memoryUsed(),
                only.peakMemory(),
                only.queryCount(),
                only.dbTime(),
                only.performanceScore(),
                benchmark.getOptions(),
                git);
    }

    private static long usedHeap() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    private static void resetPeakUsage() {
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP && pool.isValid()) {
                pool.resetPeakUsage();
            }
        }
    }

    private static long peakHeap() {
        long peak = 0;
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP && pool.isValid() && pool.getPeakUsage() != null) {
                peak += pool.getPeakUsage().getUsed();
            }
        }
        return peak > 0 ? peak : usedHeap();
    }

    private record IterationOutcome(IterationSample sample, AdvisorReport report, PerformanceScore score) {
    }
}
