package org.carball.dbbench.analyzer.rules;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.config.RuleSettings;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;
import org.carball.dbbench.model.query.CollectedQuery;
import org.carball.dbbench.output.Formats;
import org.carball.dbbench.parser.SqlInspector;
import org.carball.dbbench.parser.SqlInspector.RelationHint;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Flags the same normalized statement executed many times, the signature of an association
 * loaded row by row.
 */
@Slf4j
public class NPlusOneRule implements AdvisorRule {

    public static final String NAME = "n_plus_one";

    static final int DEFAULT_THRESHOLD = 10;
    static final int DEFAULT_CRITICAL_COUNT = 100;
    static final double DEFAULT_CRITICAL_TIME_MS = 1000;

    // One batched query is assumed to cost about this many single lookups
    static final double DEFAULT_BULK_COST_MULTIPLIER = 5;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AdvisorSuggestion> analyze(QueryCollector collector, AdvisorConfig config) {
        RuleSettings settings = config.rule(NAME);
        int threshold = settings.getInt("threshold", DEFAULT_THRESHOLD);
        int criticalCount = settings.getInt("critical_count", DEFAULT_CRITICAL_COUNT);
        double criticalTime = settings.getDouble("critical_time_ms", DEFAULT_CRITICAL_TIME_MS);
        double bulkCost = settings.getDouble("bulk_cost_multiplier", DEFAULT_BULK_COST_MULTIPLIER);

        List<AdvisorSuggestion> suggestions = new ArrayList<>();

        for (Map.Entry<String, List<CollectedQuery>> group : collector.groupByNormalizedSql().entrySet()) {
            List<CollectedQuery> queries = group.getValue();
            int count = queries.size();
            if (count < threshold) {
                continue;
            }

            CollectedQuery first = queries.get(0);
            List<String> locations = queries.stream()
                    .map(CollectedQuery::locationString)
                    .distinct()
                    .collect(Collectors.toList());

            double totalTime = queries.stream().mapToDouble(CollectedQuery::timeMs).sum();
            double avgTime = totalTime / count;
            double potentialSavings = Math.max(0, totalTime - avgTime * bulkCost);

            Severity severity = count >= criticalCount || totalTime >= criticalTime
                    ? Severity.CRITICAL
                    : Severity.WARNING;

            Optional<RelationHint> hint = SqlInspector.inferRelation(first.sql());

            log.debug("N+1 candidate: {} executions of '{}' from {}", count, group.getKey(), locations.get(0));

            suggestions.add(AdvisorSuggestion.builder()
                    .type(SuggestionType.N_PLUS_ONE)
                    .severity(severity)
                    .title("Possible N+1 Query")
                    .description(String.format(Locale.ROOT, "%d identical queries (total: %s, avg: %.2fms)",
                            count, Formats.time(totalTime), avgTime))
                    .location(locations.get(0))
                    .suggestion(remediation(hint))
                    .meta("count", count)
                    .meta("total_time_ms", totalTime)
                    .meta("avg_time_ms", avgTime)
                    .meta("potential_savings_ms", potentialSavings)
                    .meta("potential_savings_formatted", Formats.time(potentialSavings))
                    .meta("normalized_sql", group.getKey())
                    .meta("sample_sql", first.sql())
                    .meta("locations", locations)
                    .meta("detected_table", hint.map(RelationHint::table).orElse(null))
                    .meta("detected_relation", hint.map(RelationHint::relation).orElse(null))
                    .build());
        }

        return suggestions;
    }

    private static String remediation(Optional<RelationHint> hint) {
        List<String> lines = new ArrayList<>();
        if (hint.isPresent()) {
            RelationHint relation = hint.get();
            lines.add("→ Fetch the '" + relation.relation() + "' association eagerly (JOIN FETCH or an entity graph)");
            lines.add("→ Or load it for all parents at once: SELECT ... FROM " + relation.table()
                    + " WHERE " + relation.column() + " IN (...)");
        } else {
            lines.add("→ Fetch the association eagerly (JOIN FETCH or an entity graph)");
            lines.add("→ Or batch the lookups: SELECT ... WHERE id IN (...)");
        }
        lines.add("→ This could reduce queries from N to 1");
        return String.join("\n", lines);
    }
}
