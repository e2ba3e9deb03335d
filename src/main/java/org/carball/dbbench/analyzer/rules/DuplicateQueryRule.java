package org.carball.dbbench.analyzer.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.config.RuleSettings;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.advisor.Severity;
import org.carball.dbbench.model.advisor.SuggestionType;
import org.carball.dbbench.model.query.CollectedQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags the exact same statement executed repeatedly with the same bound values.
 */
@Slf4j
public class DuplicateQueryRule implements AdvisorRule {

    public static final String NAME = "duplicate";

    static final int DEFAULT_THRESHOLD = 2;
    static final int DEFAULT_WARNING_COUNT = 5;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AdvisorSuggestion> analyze(QueryCollector collector, AdvisorConfig config) {
        RuleSettings settings = config.rule(NAME);
        int threshold = settings.getInt("threshold", DEFAULT_THRESHOLD);
        int warningCount = settings.getInt("warning_count", DEFAULT_WARNING_COUNT);

        List<AdvisorSuggestion> suggestions = new ArrayList<>();

        Map<String, List<CollectedQuery>> grouped = collector.getQueries().stream()
                .collect(Collectors.groupingBy(this::fingerprint, LinkedHashMap::new, Collectors.toList()));

        for (List<CollectedQuery> queries : grouped.values()) {
            int count = queries.size();
            if (count < threshold) {
                continue;
            }

            List<String> locations = queries.stream()
                    .map(CollectedQuery::locationString)
                    .distinct()
                    .collect(Collectors.toList());

            double totalTime = queries.stream().mapToDouble(CollectedQuery::timeMs).sum();
            double wastedTime = totalTime - totalTime / count;

            suggestions.add(AdvisorSuggestion.builder()
                    .type(SuggestionType.DUPLICATE_QUERY)
                    .severity(count >= warningCount ? Severity.WARNING : Severity.INFO)
                    .title("Duplicate Query")
                    .description(String.format(Locale.ROOT, "Exact same query executed %d times (wasted: %.2fms)",
                            count, wastedTime))
                    .location(locations.get(0))
                    .suggestion(remediation(locations))
                    .meta("count", count)
                    .meta("total_time_ms", totalTime)
                    .meta("wasted_time_ms", wastedTime)
                    .meta("sql", queries.get(0).sql())
                    .meta("locations", locations)
                    .build());
        }

        return suggestions;
    }

    /**
     * SHA-256 over the exact SQL and its JSON-serialized bindings.
     */
    String fingerprint(CollectedQuery query) {
        String bindings;
        try {
            bindings = objectMapper.writeValueAsString(query.bindings());
        } catch (JsonProcessingException e) {
            log.debug("Bindings not serializable as JSON, using their string form: {}", e.getMessage());
            bindings = String.valueOf(query.bindings());
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(query.sql().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(bindings.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String remediation(List<String> locations) {
        List<String> lines = new ArrayList<>();
        lines.add("This exact query is executed multiple times with the same data");
        if (locations.size() > 1) {
            lines.add("Query is called from multiple locations - consider centralizing");
        }
        lines.add("Consider caching the result or storing it in a variable");
        lines.add("If in a loop, move the query outside the loop");
        return String.join("\n", lines);
    }
}
