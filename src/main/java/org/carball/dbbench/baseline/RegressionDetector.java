package org.carball.dbbench.baseline;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.config.RegressionThresholds;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.output.Formats;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.DoubleFunction;

/**
 * Compares a run against its baseline metric by metric.
 */
@Slf4j
public class RegressionDetector {

    static final double IMPROVEMENT_PERCENT = 10;
    static final double SCORE_IMPROVEMENT_PERCENT = 5;

    private final RegressionThresholds thresholds;

    public RegressionDetector() {
        this(RegressionThresholds.defaults());
    }

    public RegressionDetector(RegressionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ComparisonResult compare(BaselineResult baseline, BaselineResult current) {
        List<RegressionItem> regressions = new ArrayList<>();
        List<ImprovementItem> improvements = new ArrayList<>();

        // Higher is worse
        compareIncreasing(Metrics.EXECUTION_TIME, RegressionThresholds.EXECUTION_TIME,
                baseline.executionTime(), current.executionTime(), Formats::seconds, regressions, improvements);
        compareIncreasing(Metrics.PEAK_MEMORY, RegressionThresholds.MEMORY,
                baseline.peakMemory(), current.peakMemory(), Formats::memory, regressions, improvements);
        compareIncreasing(Metrics.TOTAL_QUERIES, RegressionThresholds.QUERIES,
                baseline.totalQueries(), current.totalQueries(), value -> String.format(Locale.ROOT, "%,d", (long) value),
                regressions, improvements);

        // Lower is worse
        double scoreBase = baseline.performanceScore();
        double scoreCurrent = current.performanceScore();
        double scoreDrop = scoreBase > 0 ? (scoreBase - scoreCurrent) / scoreBase * 100 : 0;
        DoubleFunction<String> scoreFormat = value -> (int) value + "/100";

        if (scoreDrop > 0) {
            severity(scoreDrop, RegressionThresholds.SCORE).ifPresent(severity -> regressions.add(new RegressionItem(
                    Metrics.PERFORMANCE_SCORE, scoreBase, scoreCurrent, scoreDrop, severity,
                    scoreFormat.apply(scoreBase), scoreFormat.apply(scoreCurrent))));
        } else if (scoreDrop < -SCORE_IMPROVEMENT_PERCENT) {
            improvements.add(new ImprovementItem(
                    Metrics.PERFORMANCE_SCORE, scoreBase, scoreCurrent, Math.abs(scoreDrop),
                    scoreFormat.apply(scoreBase), scoreFormat.apply(scoreCurrent)));
        }

        ComparisonResult result = new ComparisonResult(baseline, current, regressions, improvements);
        log.debug("Compared {} against baseline: {} regressions, {} improvements",
                current.benchmarkName(), regressions.size(), improvements.size());
        return result;
    }

    private void compareIncreasing(String metric,
                                   String thresholdKey,
                                   double base,
                                   double current,
                                   DoubleFunction<String> format,
                                   List<RegressionItem> regressions,
                                   List<ImprovementItem> improvements) {
        double diff = percentageDiff(base, current);

        if (diff > 0) {
            severity(diff, thresholdKey).ifPresent(severity -> regressions.add(new RegressionItem(
                    metric, base, current, diff, severity, format.apply(base), format.apply(current))));
        } else if (diff < -IMPROVEMENT_PERCENT) {
            improvements.add(new ImprovementItem(
                    metric, base, current, Math.abs(diff), format.apply(base), format.apply(current)));
        }
    }

    /**
     * Relative change from base to current in percent. A zero base counts as a full
     * 100% increase when current is positive.
     */
    static double percentageDiff(double base, double current) {
        if (base == 0) {
            return current > 0 ? 100 : 0;
        }
        return (current - base) / base * 100;
    }

    private Optional<Severity> severity(double diffPercent, String thresholdKey) {
        if (diffPercent >= thresholds.critical(thresholdKey)) {
            return Optional.of(Severity.CRITICAL);
        }
        if (diffPercent >= thresholds.warning(thresholdKey)) {
            return Optional.of(Severity.WARNING);
        }
        return Optional.empty();
    }
}
