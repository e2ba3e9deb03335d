package org.carball.dbbench.analyzer.rules;

import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.config.RuleSettings;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;
import org.carball.dbbench.model.query.QueryEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.carball.dbbench.TestQueries.collect;
import static org.carball.dbbench.TestQueries.event;

public class NPlusOneRuleTest {

    private final NPlusOneRule rule = new NPlusOneRule();

    @Test
    void shouldReportGroupAtThreshold() {
        // Given
        QueryCollector collector = collect(lookups(12, 2.0));

        // When
        List<AdvisorSuggestion> suggestions = rule.analyze(collector, AdvisorConfig.defaults());

        // Then
        assertThat(suggestions).hasSize(1);
        AdvisorSuggestion suggestion = suggestions.get(0);
        assertThat(suggestion.getType()).isEqualTo(SuggestionType.N_PLUS_ONE);
        assertThat(suggestion.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(suggestion.metadataInt("count")).contains(12);
        assertThat(suggestion.metadataDouble("total_time_ms")).contains(24.0);
        assertThat(suggestion.metadataDouble("potential_savings_ms").get()).isCloseTo(14.0, within(0.001));
        assertThat(suggestion.getMetadata().get("normalized_sql"))
                .isEqualTo("SELECT * FROM comments WHERE post_id = ?");
        assertThat(suggestion.getLocation()).isEqualTo("com.acme.shop.OrderService::listOrders()");
        assertThat(suggestion.getDescription()).isEqualTo("12 identical queries (total: 24.00ms, avg: 2.00ms)");
    }

    @Test
    void shouldIgnoreGroupBelowThreshold() {
        // Given
        QueryCollector collector = collect(lookups(9, 2.0));

        // When
        List<AdvisorSuggestion> suggestions = rule.analyze(collector, AdvisorConfig.defaults());

        // Then
        assertThat(suggestions).isEmpty();
    }

    @Test
    void shouldBeCriticalByCountEvenWhenTotalTimeIsLow() {
        // Given
        QueryCollector collector = collect(lookups(100, 1.0));

        // When
        List<AdvisorSuggestion> suggestions = rule.analyze(collector, AdvisorConfig.defaults());

        // Then
        assertThat(suggestions).hasSize(1);
        assertThat(suggestions.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(suggestions.get(0).metadataDouble("total_time_ms").get()).isCloseTo(100.0, within(0.001));
    }

    @Test
    void shouldBeCriticalByTotalTime() {
        // Given
        QueryCollector collector = collect(lookups(20, 60.0));

        // When
        List<AdvisorSuggestion> suggestions = rule.analyze(collector, AdvisorConfig.defaults());

        // Then
        assertThat(suggestions.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void shouldInferRelationForRemediation() {
        // Given
        QueryCollector collector = collect(lookups(10, 1.0));

        // When
        AdvisorSuggestion suggestion = rule.analyze(collector, AdvisorConfig.defaults()).get(0);

        // Then
        assertThat(suggestion.getMetadata().get("detected_table")).isEqualTo("comments");
        assertThat(suggestion.getMetadata().get("detected_relation")).isEqualTo("comment");
        assertThat(suggestion.getSuggestion())
                .contains("'comment' association")
                .contains("SELECT ... FROM comments WHERE post_id IN (...)")
                .endsWith("This could reduce queries from N to 1");
    }

    @Test
    void shouldStillSuggestWhenNoRelationCanBeInferred() {
        // Given
        List<QueryEvent> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(event("UPDATE counters SET hits = hits + 1 WHERE id = " + i, 1.0));
        }

        // When
        AdvisorSuggestion suggestion = rule.analyze(collect(events), AdvisorConfig.defaults()).get(0);

        // Then
        assertThat(suggestion.getMetadata()).containsEntry("detected_relation", null);
        assertThat(suggestion.getSuggestion()).contains("SELECT ... WHERE id IN (...)");
    }

    @Test
    void shouldHonorConfiguredThresholds() {
        // Given
        AdvisorConfig config = AdvisorConfig.builder()
                .rule(NPlusOneRule.NAME, RuleSettings.of(Map.of("threshold", "5", "critical_count", 6)))
                .build();
        QueryCollector collector = collect(lookups(6, 1.0));

        // When
        List<AdvisorSuggestion> suggestions = rule.analyze(collector, config);

        // Then
        assertThat(suggestions).hasSize(1);
        assertThat(suggestions.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void shouldNotProduceNegativeSavings() {
        // Given
        AdvisorConfig config = AdvisorConfig.builder()
                .rule(NPlusOneRule.NAME, RuleSettings.of(Map.of("bulk_cost_multiplier", 50)))
                .build();

        // When
        AdvisorSuggestion suggestion = rule.analyze(collect(lookups(10, 1.0)), config).get(0);

        // Then
        assertThat(suggestion.metadataDouble("potential_savings_ms")).contains(0.0);
    }

    static List<QueryEvent> lookups(int count, double timeMs) {
        List<QueryEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(event("SELECT * FROM comments WHERE post_id = " + (i + 1), timeMs));
        }
        return events;
    }
}
