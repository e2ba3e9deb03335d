package org.carball.dbbench.analyzer;

import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 0-100 score of one advisor report, with the penalties and bonuses that produced it.
 */
public class PerformanceScore {

    private static final int BASE_SCORE = 100;
    private static final int MAX_PENALTY_PER_TYPE = 30;
    private static final int UNKNOWN_TYPE_PENALTY = 5;

    private static final int NO_CRITICAL_BONUS = 5;
    private static final int NO_ISSUES_BONUS = 10;
    private static final int LOW_QUERY_COUNT_BONUS = 5;
    private static final int LOW_QUERY_COUNT = 50;

    public static final double DEFAULT_N_PLUS_ONE_SAVINGS_RATIO = 0.8;

    private static final Map<String, Map<Severity, Integer>> PENALTIES = Map.of(
            SuggestionType.N_PLUS_ONE, Map.of(Severity.CRITICAL, 15, Severity.WARNING, 8, Severity.INFO, 2),
            SuggestionType.SLOW_QUERY, Map.of(Severity.CRITICAL, 20, Severity.WARNING, 10, Severity.INFO, 3),
            SuggestionType.HOTSPOT, Map.of(Severity.CRITICAL, 10, Severity.WARNING, 5, Severity.INFO, 1),
            SuggestionType.DUPLICATE_QUERY, Map.of(Severity.CRITICAL, 5, Severity.WARNING, 3, Severity.INFO, 1)
    );

    private final AdvisorReport report;
    private final double executionTimeSeconds;
    private final double nPlusOneSavingsRatio;

    private final List<ScoreAdjustment> breakdown = new ArrayList<>();
    private final List<ScoreAdjustment> bonuses = new ArrayList<>();
    private int score;

    public PerformanceScore(AdvisorReport report, double executionTimeSeconds) {
        this(report, executionTimeSeconds, DEFAULT_N_PLUS_ONE_SAVINGS_RATIO);
    }

    public PerformanceScore(AdvisorReport report, double executionTimeSeconds, double nPlusOneSavingsRatio) {
        this.report = report;
        this.executionTimeSeconds = executionTimeSeconds;
        this.nPlusOneSavingsRatio = nPlusOneSavingsRatio;
        calculate();
    }

    private void calculate() {
        score = BASE_SCORE;

        applyIssuePenalties();

        int dbTimePenalty = dbTimePenalty();
        if (dbTimePenalty > 0) {
            score -= dbTimePenalty;
            breakdown.add(new ScoreAdjustment(
                    String.format(Locale.ROOT, "High DB time (%.1f%%)", dbTimePercent()), -dbTimePenalty));
        }

        int uniquenessPenalty = uniquenessPenalty();
        if (uniquenessPenalty > 0) {
            score -= uniquenessPenalty;
            breakdown.add(new ScoreAdjustment(
                    String.format(Locale.ROOT, "Low query uniqueness (%.1f%%)", uniquenessPercent()), -uniquenessPenalty));
        }

        applyBonuses();

        score = clamp(score);
    }

    private void applyIssuePenalties() {
        Map<String, Integer> penaltiesByType = new LinkedHashMap<>();
        for (AdvisorSuggestion suggestion : report.getSuggestions()) {
            int penalty = PENALTIES.getOrDefault(suggestion.getType(), Map.of())
                    .getOrDefault(suggestion.getSeverity(), UNKNOWN_TYPE_PENALTY);
            penaltiesByType.merge(suggestion.getType(), penalty, Integer::sum);
        }

        for (Map.Entry<String, Integer> entry : penaltiesByType.entrySet()) {
            int capped = Math.min(MAX_PENALTY_PER_TYPE, entry.getValue());
            score -= capped;
            breakdown.add(new ScoreAdjustment(SuggestionType.label(entry.getKey()), -capped));
        }
    }

    private void applyBonuses() {
        if (report.getCriticalCount() == 0) {
            score += NO_CRITICAL_BONUS;
            bonuses.add(new ScoreAdjustment("No critical issues", NO_CRITICAL_BONUS));
        }

        if (!report.hasSuggestions()) {
            score += NO_ISSUES_BONUS;
            bonuses.add(new ScoreAdjustment("No issues detected", NO_ISSUES_BONUS));
        }

        if (report.getTotalQueries() < LOW_QUERY_COUNT) {
            score += LOW_QUERY_COUNT_BONUS;
            bonuses.add(new ScoreAdjustment("Low query count", LOW_QUERY_COUNT_BONUS));
        }
    }

    private double dbTimePercent() {
        return report.getDbTimePercentage(executionTimeSeconds * 1000);
    }

    private int dbTimePenalty() {
        double percent = dbTimePercent();
        if (percent > 85) {
            return 15;
        } else if (percent > 70) {
            return 10;
        } else if (percent > 50) {
            return 5;
        }
        return 0;
    }

    private double uniquenessPercent() {
        return (double) report.getUniqueQueries() / report.getTotalQueries() * 100;
    }

    private int uniquenessPenalty() {
        if (report.getTotalQueries() == 0) {
            return 0;
        }
        double percent = uniquenessPercent();
        if (percent < 5) {
            return 15;
        } else if (percent < 20) {
            return 10;
        } else if (percent < 50) {
            return 5;
        }
        return 0;
    }

    public int getScore() {
        return score;
    }

    public List<ScoreAdjustment> getBreakdown() {
        return Collections.unmodifiableList(breakdown);
    }

    public List<ScoreAdjustment> getBonuses() {
        return Collections.unmodifiableList(bonuses);
    }

    public ScoreGrade getGrade() {
        return ScoreGrade.fromScore(score);
    }

    /**
     * Score the same run would get with every suggestion fixed: the DB-time and uniqueness
     * penalties still apply, and both issue bonuses are granted.
     */
    public int getPotentialScore() {
        int potential = BASE_SCORE - dbTimePenalty() - uniquenessPenalty() + NO_CRITICAL_BONUS + NO_ISSUES_BONUS;
        return clamp(potential);
    }

    /**
     * Milliseconds the suggestions could save.
     */
    public double getEstimatedTimeSavings() {
        double savings = 0;
        for (AdvisorSuggestion suggestion : report.getSuggestions()) {
            if (suggestion.metadataDouble("potential_savings_ms").isPresent()) {
                savings += suggestion.metadataDouble("potential_savings_ms").get();
                continue;
            }
            if (suggestion.metadataDouble("total_time_ms").isEmpty()) {
                continue;
            }
            double totalTime = suggestion.metadataDouble("total_time_ms").get();
            if (SuggestionType.N_PLUS_ONE.equals(suggestion.getType())) {
                savings += totalTime * nPlusOneSavingsRatio;
            } else if (SuggestionType.DUPLICATE_QUERY.equals(suggestion.getType())) {
                int count = Math.max(1, suggestion.metadataInt("count").orElse(2));
                savings += totalTime / count * (count - 1);
            }
        }
        return savings;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(BASE_SCORE, value));
    }
}
