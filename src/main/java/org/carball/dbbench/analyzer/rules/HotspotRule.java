package org.carball.dbbench.analyzer.rules;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.config.RuleSettings;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;
import org.carball.dbbench.model.query.CollectedQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags code locations that issue most of the queries or spend most of the database time.
 */
@Slf4j
public class HotspotRule implements AdvisorRule {

    public static final String NAME = "hotspot";

    static final double DEFAULT_THRESHOLD_PERCENT = 50;
    static final int DEFAULT_MIN_QUERIES = 10;
    static final double DEFAULT_CRITICAL_PERCENT = 80;

    private static final double DOMINANT_SHARE_PERCENT = 50;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AdvisorSuggestion> analyze(QueryCollector collector, AdvisorConfig config) {
        RuleSettings settings = config.rule(NAME);
        double thresholdPercent = settings.getDouble("threshold_percent", DEFAULT_THRESHOLD_PERCENT);
        int minQueries = settings.getInt("min_queries", DEFAULT_MIN_QUERIES);
        double criticalPercent = settings.getDouble("critical_percent", DEFAULT_CRITICAL_PERCENT);

        List<AdvisorSuggestion> suggestions = new ArrayList<>();

        int totalQueries = collector.getQueryCount();
        double totalTime = collector.getTotalTime();

        if (totalQueries < minQueries) {
            log.debug("Skipping hotspot analysis: {} queries below minimum of {}", totalQueries, minQueries);
            return suggestions;
        }

        for (Map.Entry<String, List<CollectedQuery>> group : collector.groupByLocation().entrySet()) {
            List<CollectedQuery> queries = group.getValue();
            int queryCount = queries.size();
            double locationTime = queries.stream().mapToDouble(CollectedQuery::timeMs).sum();

            double queryPercent = (double) queryCount / totalQueries * 100;
            double timePercent = totalTime > 0 ? locationTime / totalTime * 100 : 0;

            if (queryPercent < thresholdPercent && timePercent < thresholdPercent) {
                continue;
            }

            Severity severity = queryPercent >= criticalPercent || timePercent >= criticalPercent
                    ? Severity.CRITICAL
                    : Severity.WARNING;

            CollectedQuery first = queries.get(0);

            suggestions.add(AdvisorSuggestion.builder()
                    .type(SuggestionType.HOTSPOT)
                    .severity(severity)
                    .title("Database Hotspot")
                    .description(String.format(Locale.ROOT, "%d queries (%.1f%% of total), %.2fms (%.1f%% of DB time)",
                            queryCount, queryPercent, locationTime, timePercent))
                    .location(group.getKey())
                    .suggestion(remediation(queryPercent, timePercent))
                    .meta("query_count", queryCount)
                    .meta("query_percent", queryPercent)
                    .meta("time_ms", locationTime)
                    .meta("time_percent", timePercent)
                    .meta("file", first.origin().file())
                    .meta("line", first.origin().line())
                    .build());
        }

        return suggestions;
    }

    private static String remediation(double queryPercent, double timePercent) {
        List<String> lines = new ArrayList<>();

        if (queryPercent >= DOMINANT_SHARE_PERCENT) {
            lines.add("This location generates a large number of queries");
            lines.add("Consider batching operations or using bulk queries");
        }

        if (timePercent >= DOMINANT_SHARE_PERCENT) {
            lines.add("This location consumes most of the DB time");
            lines.add("Review queries for optimization opportunities");
        }

        lines.add("Consider caching results if data changes infrequently");
        lines.add("Review if all queries are necessary");
        return String.join("\n", lines);
    }
}
