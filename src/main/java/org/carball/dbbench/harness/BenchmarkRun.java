package org.carball.dbbench.harness;

import org.carball.dbbench.analyzer.PerformanceScore;
import org.carball.dbbench.baseline.BaselineResult;
import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.stats.IterationResult;

import java.util.Optional;

/**
 * Everything one benchmark execution produced. The report and score are those of the last
 * measured iteration and are null when the advisor was disabled.
 */
public record BenchmarkRun(
        String benchmarkName,
        IterationResult result,
        AdvisorReport lastReport,
        PerformanceScore lastScore,
        BaselineResult baseline
) {

    public Optional<AdvisorReport> advisorReport() {
        return Optional.ofNullable(lastReport);
    }

    public Optional<PerformanceScore> performanceScore() {
        return Optional.ofNullable(lastScore);
    }

    public int iterations() {
        return result.executionTime().iterations();
    }
}
