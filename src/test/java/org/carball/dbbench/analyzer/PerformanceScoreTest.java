package org.carball.dbbench.analyzer;

import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PerformanceScoreTest {

    @Test
    void shouldGrantAllBonusesToCleanRun() {
        // Given
        AdvisorReport report = report(10, 10, 100, List.of());

        // When
        PerformanceScore score = new PerformanceScore(report, 1.0);

        // Then
        assertThat(score.getScore()).isEqualTo(100);
        assertThat(score.getBreakdown()).isEmpty();
        assertThat(score.getBonuses()).extracting(ScoreAdjustment::points).containsExactly(5, 10, 5);
        assertThat(score.getGrade()).isEqualTo(ScoreGrade.A);
    }

    @Test
    void shouldCapPenaltyPerType() {
        // Given
        AdvisorReport report = report(100, 100, 0, List.of(
                suggestion(SuggestionType.SLOW_QUERY, Severity.CRITICAL),
                suggestion(SuggestionType.SLOW_QUERY, Severity.CRITICAL),
                suggestion(SuggestionType.SLOW_QUERY, Severity.CRITICAL)));

        // When
        PerformanceScore score = new PerformanceScore(report, 1.0);

        // Then
        assertThat(score.getScore()).isEqualTo(70);
        assertThat(score.getBreakdown()).containsExactly(new ScoreAdjustment("Slow queries", -30));
        assertThat(score.getBonuses()).isEmpty();
        assertThat(score.getGrade()).isEqualTo(ScoreGrade.C);
    }

    @Test
    void shouldCompoundPenaltiesAcrossTypes() {
        // Given
        AdvisorReport report = report(100, 100, 0, List.of(
                suggestion(SuggestionType.N_PLUS_ONE, Severity.WARNING),
                suggestion(SuggestionType.HOTSPOT, Severity.WARNING),
                suggestion(SuggestionType.DUPLICATE_QUERY, Severity.INFO),
                suggestion("custom_rule", Severity.WARNING)));

        // When
        PerformanceScore score = new PerformanceScore(report, 1.0);

        // Then
        assertThat(score.getBreakdown()).extracting(ScoreAdjustment::points).containsExactly(-8, -5, -1, -5);
        assertThat(score.getScore()).isEqualTo(100 - 8 - 5 - 1 - 5 + 5);
    }

    @Test
    void shouldPenalizeDbTimeShareAndLowUniqueness() {
        // Given
        AdvisorReport report = report(100, 3, 900, List.of());

        // When
        PerformanceScore score = new PerformanceScore(report, 1.0);

        // Then
        assertThat(score.getBreakdown()).containsExactly(
                new ScoreAdjustment("High DB time (90.0%)", -15),
                new ScoreAdjustment("Low query uniqueness (3.0%)", -15));
        assertThat(score.getScore()).isEqualTo(85);
    }

    @Test
    void shouldApplyGradedDbTimePenalties() {
        // Then
        assertThat(new PerformanceScore(report(100, 100, 710, List.of()), 1.0).getBreakdown())
                .extracting(ScoreAdjustment::points).containsExactly(-10);
        assertThat(new PerformanceScore(report(100, 100, 510, List.of()), 1.0).getBreakdown())
                .extracting(ScoreAdjustment::points).containsExactly(-5);
        assertThat(new PerformanceScore(report(100, 100, 500, List.of()), 1.0).getBreakdown()).isEmpty();
    }

    @Test
    void shouldSkipDbTimePenaltyWhenExecutionTimeUnknown() {
        // Given
        AdvisorReport report = report(100, 100, 5000, List.of());

        // When
        PerformanceScore score = new PerformanceScore(report, 0);

        // Then
        assertThat(score.getBreakdown()).isEmpty();
    }

    @Test
    void shouldSkipUniquenessPenaltyWithoutQueries() {
        // Given
        AdvisorReport report = report(0, 0, 0, List.of());

        // When
        PerformanceScore score = new PerformanceScore(report, 1.0);

        // Then
        assertThat(score.getBreakdown()).isEmpty();
        assertThat(score.getScore()).isEqualTo(100);
    }

    @Test
    void shouldNeverIncreaseAsCriticalSuggestionsAreAdded() {
        // Given
        String[] types = {SuggestionType.N_PLUS_ONE, SuggestionType.SLOW_QUERY, SuggestionType.HOTSPOT,
                SuggestionType.DUPLICATE_QUERY, "custom_rule", "other_rule"};
        List<AdvisorSuggestion> suggestions = new ArrayList<>();
        int previous = new PerformanceScore(report(200, 4, 950, suggestions), 1.0).getScore();

        // When / Then
        for (int i = 0; i < 40; i++) {
            suggestions.add(suggestion(types[i % types.length], Severity.CRITICAL));
            int current = new PerformanceScore(report(200, 4, 950, suggestions), 1.0).getScore();
            assertThat(current).isLessThanOrEqualTo(previous).isBetween(0, 100);
            previous = current;
        }
        assertThat(previous).isZero();
    }

    @Test
    void shouldComputePotentialScoreWithoutIssuePenalties() {
        // Given
        AdvisorReport report = report(100, 3, 900, List.of(
                suggestion(SuggestionType.N_PLUS_ONE, Severity.CRITICAL)));

        // When
        PerformanceScore score = new PerformanceScore(report, 1.0);

        // Then
        assertThat(score.getScore()).isEqualTo(100 - 15 - 15 - 15);
        assertThat(score.getPotentialScore()).isEqualTo(100 - 15 - 15 + 15);
    }

    @Test
    void shouldEstimateTimeSavings() {
        // Given
        AdvisorReport report = report(100, 100, 0, List.of(
                AdvisorSuggestion.builder().type(SuggestionType.N_PLUS_ONE).severity(Severity.WARNING)
                        .meta("potential_savings_ms", 14.0).meta("total_time_ms", 24.0).build(),
                AdvisorSuggestion.builder().type(SuggestionType.N_PLUS_ONE).severity(Severity.WARNING)
                        .meta("total_time_ms", 100.0).build(),
                AdvisorSuggestion.builder().type(SuggestionType.DUPLICATE_QUERY).severity(Severity.INFO)
                        .meta("total_time_ms", 8.0).meta("count", 4).build(),
                AdvisorSuggestion.builder().type(SuggestionType.SLOW_QUERY).severity(Severity.WARNING)
                        .meta("time_ms", 500.0).build()));

        // Then
        assertThat(new PerformanceScore(report, 1.0).getEstimatedTimeSavings()).isCloseTo(14 + 80 + 6, within(0.001));
        assertThat(new PerformanceScore(report, 1.0, 0.5).getEstimatedTimeSavings()).isCloseTo(14 + 50 + 6, within(0.001));
    }

    @Test
    void shouldSelectGradeByFirstThresholdReached() {
        // Then
        assertThat(ScoreGrade.fromScore(100)).isEqualTo(ScoreGrade.A);
        assertThat(ScoreGrade.fromScore(90)).isEqualTo(ScoreGrade.A);
        assertThat(ScoreGrade.fromScore(89)).isEqualTo(ScoreGrade.B);
        assertThat(ScoreGrade.fromScore(60).getLabel()).isEqualTo("Needs Work");
        assertThat(ScoreGrade.fromScore(50)).isEqualTo(ScoreGrade.E);
        assertThat(ScoreGrade.fromScore(49)).isEqualTo(ScoreGrade.F);
        assertThat(ScoreGrade.fromScore(0).getLabel()).isEqualTo("Critical");
    }

    static AdvisorReport report(int totalQueries, int uniqueQueries, double dbTimeMs, List<AdvisorSuggestion> suggestions) {
        return AdvisorReport.builder()
                .totalQueries(totalQueries)
                .uniqueQueries(uniqueQueries)
                .totalDbTime(dbTimeMs)
                .suggestions(suggestions)
                .build();
    }

    static AdvisorSuggestion suggestion(String type, Severity severity) {
        return AdvisorSuggestion.builder()
                .type(type)
                .severity(severity)
                .title(type)
                .description(type)
                .build();
    }
}
