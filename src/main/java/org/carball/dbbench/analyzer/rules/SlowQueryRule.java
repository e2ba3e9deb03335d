package org.carball.dbbench.analyzer.rules;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.config.RuleSettings;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;
import org.carball.dbbench.model.query.CollectedQuery;
import org.carball.dbbench.parser.SqlInspector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
public class SlowQueryRule implements AdvisorRule {

    public static final String NAME = "slow_query";

    static final double DEFAULT_THRESHOLD_MS = 100;
    static final double DEFAULT_CRITICAL_MS = 1000;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AdvisorSuggestion> analyze(QueryCollector collector, AdvisorConfig config) {
        RuleSettings settings = config.rule(NAME);
        double thresholdMs = settings.getDouble("threshold_ms", DEFAULT_THRESHOLD_MS);
        double criticalMs = settings.getDouble("critical_ms", DEFAULT_CRITICAL_MS);

        List<AdvisorSuggestion> suggestions = new ArrayList<>();

        for (CollectedQuery query : collector.getSlowQueries(thresholdMs)) {
            Severity severity = query.timeMs() >= criticalMs ? Severity.CRITICAL : Severity.WARNING;

            suggestions.add(AdvisorSuggestion.builder()
                    .type(SuggestionType.SLOW_QUERY)
                    .severity(severity)
                    .title("Slow Query Detected")
                    .description(String.format(Locale.ROOT, "Query took %.2fms (threshold: %.0fms)",
                            query.timeMs(), thresholdMs))
                    .location(query.locationString())
                    .suggestion(String.join("\n", hints(query)))
                    .meta("time_ms", query.timeMs())
                    .meta("sql", query.sql())
                    .meta("file", query.origin().file())
                    .meta("line", query.origin().line())
                    .build());
        }

        log.debug("{} queries above {}ms", suggestions.size(), thresholdMs);
        return suggestions;
    }

    static List<String> hints(CollectedQuery query) {
        String sql = query.sql();
        List<String> hints = new ArrayList<>();

        if (SqlInspector.isSelect(sql) && !SqlInspector.hasWhere(sql) && !SqlInspector.hasLimit(sql)) {
            hints.add("Query has no WHERE clause - consider adding filters");
        }

        Optional<String> column = SqlInspector.equalityFilterColumn(sql);
        column.ifPresent(name -> hints.add("Consider adding an index on column '" + name + "'"));

        if (SqlInspector.hasOrderBy(sql)) {
            hints.add("Ensure columns in ORDER BY clause are indexed");
        }

        if (SqlInspector.hasLeadingWildcard(sql, query.bindings())) {
            hints.add("LIKE with leading wildcard (%) cannot use indexes - consider full-text search");
        }

        if (SqlInspector.selectsAllColumns(sql)) {
            hints.add("Avoid SELECT * - select only needed columns");
        }

        if (hints.isEmpty()) {
            hints.add("Review query execution plan with EXPLAIN");
            hints.add("Consider adding appropriate indexes");
        }
        return hints;
    }
}
