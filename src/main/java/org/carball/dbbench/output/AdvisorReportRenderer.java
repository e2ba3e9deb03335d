package org.carball.dbbench.output;

import org.carball.dbbench.analyzer.PerformanceScore;
import org.carball.dbbench.analyzer.ScoreAdjustment;
import org.carball.dbbench.analyzer.ScoreGrade;
import org.carball.dbbench.config.DisplaySettings;
import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of an advisor report for the console.
 */
public class AdvisorReportRenderer {

    private static final int SQL_PREVIEW_LENGTH = 100;
    private static final int TOP_LOCATIONS = 5;
    private static final String RULE = "────────────────────────────────────────────────────────────────";

    private final DisplaySettings display;

    public AdvisorReportRenderer() {
        this(DisplaySettings.defaults());
    }

    public AdvisorReportRenderer(DisplaySettings display) {
        this.display = display;
    }

    public String render(AdvisorReport report, double executionTimeSeconds) {
        return render(report, executionTimeSeconds, null);
    }

    /**
     * Renders the report, followed by the score section when a score is given.
     */
    public String render(AdvisorReport report, double executionTimeSeconds, PerformanceScore score) {
        StringBuilder out = new StringBuilder();

        out.append('\n');
        out.append("╔════════════════════════════════════════════════════════════════╗\n");
        out.append("║                    📊 ADVISOR REPORT                           ║\n");
        out.append("╚════════════════════════════════════════════════════════════════╝\n");

        appendSummary(out, report, executionTimeSeconds);
        appendSuggestions(out, report);
        appendHotspots(out, report);
        if (score != null) {
            appendScore(out, score);
        }

        out.append("Analysis completed in ").append(Formats.time(report.getAnalysisTime())).append('\n');
        return out.toString();
    }

    private void appendSummary(StringBuilder out, AdvisorReport report, double executionTimeSeconds) {
        out.append("\nDatabase Statistics:\n");
        out.append(row("Total Queries", String.format(Locale.ROOT, "%,d", report.getTotalQueries())));
        out.append(row("Unique Queries", String.format(Locale.ROOT, "%,d", report.getUniqueQueries())));
        out.append(row("Total DB Time", Formats.time(report.getTotalDbTime())));
        out.append(row("DB Time %", String.format(Locale.ROOT, "%.1f%%",
                report.getDbTimePercentage(executionTimeSeconds * 1000))));

        int critical = report.getCriticalCount();
        int warnings = report.getWarningCount();
        int info = report.getInfoCount();

        if (critical == 0 && warnings == 0 && info == 0) {
            out.append("  ✅ No issues detected!\n");
            return;
        }

        out.append("Issues Found:\n ");
        if (critical > 0) {
            out.append(" 🔴 ").append(critical).append(" critical");
        }
        if (warnings > 0) {
            out.append(" ⚠️  ").append(warnings).append(" warnings");
        }
        if (info > 0) {
            out.append(" ℹ️  ").append(info).append(" info");
        }
        out.append('\n');
    }

    private void appendSuggestions(StringBuilder out, AdvisorReport report) {
        if (!report.hasSuggestions()) {
            return;
        }

        out.append("\nOptimization Suggestions:\n\n");

        Map<String, List<AdvisorSuggestion>> byType = report.getSuggestions().stream()
                .collect(Collectors.groupingBy(AdvisorSuggestion::getType, LinkedHashMap::new, Collectors.toList()));

        int displayed = 0;
        Map<String, Integer> hidden = new LinkedHashMap<>();

        for (Map.Entry<String, List<AdvisorSuggestion>> entry : byType.entrySet()) {
            List<AdvisorSuggestion> suggestions = entry.getValue();
            int shown = 0;
            for (AdvisorSuggestion suggestion : suggestions) {
                if (shown >= display.getMaxPerType() || displayed >= display.getMaxTotal()) {
                    break;
                }
                appendSuggestion(out, suggestion);
                shown++;
                displayed++;
            }
            if (suggestions.size() > shown) {
                hidden.merge(entry.getKey(), suggestions.size() - shown, Integer::sum);
            }
        }

        if (!hidden.isEmpty()) {
            out.append(RULE).append('\n');
            out.append("Additional issues not shown:\n");
            hidden.forEach((type, count) ->
                    out.append("  • ").append(count).append(" more [").append(type).append("] issues\n"));
            out.append('\n');
        }
    }

    private void appendSuggestion(StringBuilder out, AdvisorSuggestion suggestion) {
        out.append(suggestion.getSeverity().getIcon())
                .append(" [").append(suggestion.getType()).append("] ")
                .append(suggestion.getTitle()).append('\n');
        out.append("   ").append(suggestion.getDescription()).append('\n');

        if (suggestion.getLocation() != null) {
            out.append("   📍 ").append(suggestion.getLocation()).append('\n');
        }

        if (suggestion.getSuggestion() != null) {
            for (String line : suggestion.getSuggestion().split("\n")) {
                out.append("   💡 ").append(line).append('\n');
            }
        }

        Object sql = suggestion.getMetadata().containsKey("sql")
                ? suggestion.getMetadata().get("sql")
                : suggestion.getMetadata().get("sample_sql");
        if (sql != null) {
            String text = sql.toString();
            if (text.length() > SQL_PREVIEW_LENGTH) {
                text = text.substring(0, SQL_PREVIEW_LENGTH) + "...";
            }
            out.append("   SQL: ").append(text).append('\n');
        }
        out.append('\n');
    }

    private void appendHotspots(StringBuilder out, AdvisorReport report) {
        Map<String, Integer> top = report.getTopLocationsByQueryCount(TOP_LOCATIONS);
        if (top.isEmpty()) {
            return;
        }

        out.append("\nTop ").append(TOP_LOCATIONS).append(" Locations by Query Count:\n");
        out.append(String.format(Locale.ROOT, "  %-60s %10s %12s%n", "Location", "Queries", "Time"));
        for (Map.Entry<String, Integer> entry : top.entrySet()) {
            double time = report.getTimeByLocation().getOrDefault(entry.getKey(), 0.0);
            out.append(String.format(Locale.ROOT, "  %-60s %,10d %12s%n",
                    entry.getKey(), entry.getValue(), Formats.time(time)));
        }
        out.append('\n');
    }

    private void appendScore(StringBuilder out, PerformanceScore score) {
        ScoreGrade grade = score.getGrade();
        out.append("Performance Score: ").append(score.getScore()).append("/100 ")
                .append(grade.getEmoji()).append(' ')
                .append(grade.name()).append(" (").append(grade.getLabel()).append(")\n");

        for (ScoreAdjustment penalty : score.getBreakdown()) {
            out.append(String.format(Locale.ROOT, "  %+4d  %s%n", penalty.points(), penalty.reason()));
        }
        for (ScoreAdjustment bonus : score.getBonuses()) {
            out.append(String.format(Locale.ROOT, "  %+4d  %s%n", bonus.points(), bonus.reason()));
        }

        if (score.getPotentialScore() > score.getScore()) {
            out.append("Potential score if all issues are fixed: ").append(score.getPotentialScore()).append("/100\n");
        }
        double savings = score.getEstimatedTimeSavings();
        if (savings > 0) {
            out.append("Estimated time savings: ").append(Formats.time(savings)).append('\n');
        }
        out.append('\n');
    }

    private static String row(String label, String value) {
        return String.format(Locale.ROOT, "  %-16s %s%n", label, value);
    }
}
