package org.carball.dbbench.output;

import org.carball.dbbench.baseline.BaselineResult;
import org.carball.dbbench.baseline.ComparisonResult;
import org.carball.dbbench.baseline.ImprovementItem;
import org.carball.dbbench.baseline.RegressionItem;

import java.util.Locale;

/**
 * Plain-text rendering of a baseline comparison.
 */
public class ComparisonReportRenderer {

    private static final String ROW_FORMAT = "  %-20s %14s %14s %10s%n";

    public String render(ComparisonResult comparison) {
        BaselineResult baseline = comparison.baseline();
        BaselineResult current = comparison.current();
        StringBuilder out = new StringBuilder();

        out.append('\n');
        out.append("╔════════════════════════════════════════════════════════════╗\n");
        out.append("║                 BASELINE COMPARISON                        ║\n");
        out.append("╚════════════════════════════════════════════════════════════╝\n\n");

        out.append("  ").append(comparison.getStatus().getEmoji()).append(' ')
                .append(comparison.getStatus().getLabel()).append("\n\n");

        out.append("Metrics Comparison:\n");
        out.append(String.format(Locale.ROOT, ROW_FORMAT, "Metric", "Baseline", "Current", "Change"));
        out.append(String.format(Locale.ROOT, ROW_FORMAT, "Execution Time",
                Formats.seconds(baseline.executionTime()), Formats.seconds(current.executionTime()),
                change(baseline.executionTime(), current.executionTime())));
        out.append(String.format(Locale.ROOT, ROW_FORMAT, "Peak Memory",
                Formats.memory(baseline.peakMemory()), Formats.memory(current.peakMemory()),
                change(baseline.peakMemory(), current.peakMemory())));
        out.append(String.format(Locale.ROOT, ROW_FORMAT, "Query Count",
                String.format(Locale.ROOT, "%,d", baseline.totalQueries()),
                String.format(Locale.ROOT, "%,d", current.totalQueries()),
                change(baseline.totalQueries(), current.totalQueries())));
        out.append(String.format(Locale.ROOT, ROW_FORMAT, "Performance Score",
                baseline.performanceScore() + "/100", current.performanceScore() + "/100",
                scoreChange(baseline.performanceScore(), current.performanceScore())));

        if (comparison.hasRegressions()) {
            out.append("\nRegressions Detected:\n");
            for (RegressionItem regression : comparison.regressions()) {
                out.append(String.format(Locale.ROOT, "  %s %s: %s → %s (+%.1f%%)%n",
                        regression.severity().getIcon(),
                        regression.metricLabel(),
                        regression.formattedBaseline(),
                        regression.formattedCurrent(),
                        regression.diffPercent()));
            }
        }

        if (comparison.hasImprovements()) {
            out.append("\nImprovements:\n");
            for (ImprovementItem improvement : comparison.improvements()) {
                out.append(String.format(Locale.ROOT, "  🚀 %s: %s → %s (-%.1f%%)%n",
                        improvement.metricLabel(),
                        improvement.formattedBaseline(),
                        improvement.formattedCurrent(),
                        improvement.improvementPercent()));
            }
        }

        out.append('\n');
        out.append("Baseline: ").append(gitLabel(baseline)).append('\n');
        out.append("Current:  ").append(gitLabel(current)).append('\n');
        return out.toString();
    }

    static String change(double baseline, double current) {
        if (baseline == 0) {
            return "N/A";
        }
        double diff = (current - baseline) / baseline * 100;
        if (Math.abs(diff) < 1) {
            return "~";
        }
        return Formats.percent(diff);
    }

    static String scoreChange(int baseline, int current) {
        int diff = current - baseline;
        if (diff == 0) {
            return "~";
        }
        return String.format(Locale.ROOT, "%+d", diff);
    }

    private static String gitLabel(BaselineResult result) {
        return (result.gitBranch() == null ? "unknown" : result.gitBranch())
                + "@" + (result.gitCommit() == null ? "unknown" : result.gitCommit());
    }
}
