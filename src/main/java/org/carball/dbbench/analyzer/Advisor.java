package org.carball.dbbench.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.analyzer.rules.AdvisorRule;
import org.carball.dbbench.analyzer.rules.DuplicateQueryRule;
import org.carball.dbbench.analyzer.rules.HotspotRule;
import org.carball.dbbench.analyzer.rules.NPlusOneRule;
import org.carball.dbbench.analyzer.rules.SlowQueryRule;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;
import org.carball.dbbench.model.query.CollectedQuery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the advisor rules over one collection window and assembles the report.
 */
@Slf4j
public class Advisor {

    private final QueryCollector collector;
    private final List<AdvisorRule> rules;
    private AdvisorConfig config;
    private boolean enabled = true;

    public Advisor() {
        this(new QueryCollector(), AdvisorConfig.defaults());
    }

    public Advisor(QueryCollector collector, AdvisorConfig config) {
        this(collector, config, defaultRules());
    }

    public Advisor(QueryCollector collector, AdvisorConfig config, List<AdvisorRule> rules) {
        this.collector = collector;
        this.config = config;
        this.rules = new ArrayList<>(rules);
    }

    public static List<AdvisorRule> defaultRules() {
        return List.of(
                new NPlusOneRule(),
                new SlowQueryRule(),
                new HotspotRule(),
                new DuplicateQueryRule()
        );
    }

    public Advisor addRule(AdvisorRule rule) {
        rules.add(rule);
        return this;
    }

    public List<AdvisorRule> getRules() {
        return List.copyOf(rules);
    }

    public Advisor setConfig(AdvisorConfig config) {
        this.config = config;
        return this;
    }

    public AdvisorConfig getConfig() {
        return config;
    }

    public Advisor setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public boolean isEnabled() {
        return enabled && config.isEnabled();
    }

    public QueryCollector getCollector() {
        return collector;
    }

    public void start() {
        if (!isEnabled()) {
            return;
        }
        collector.start();
    }

    /**
     * Closes the collection window and analyzes it. Empty when the advisor is disabled.
     */
    public Optional<AdvisorReport> stop() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        collector.stop();
        return Optional.of(analyze());
    }

    public AdvisorReport analyze() {
        long startNanos = System.nanoTime();

        List<AdvisorSuggestion> suggestions = new ArrayList<>();
        for (AdvisorRule rule : rules) {
            if (!rule.isEnabled(config)) {
                log.debug("Rule {} disabled", rule.getName());
                continue;
            }
            try {
                suggestions.addAll(rule.analyze(collector, config));
            } catch (RuntimeException e) {
                log.warn("Rule {} failed and was skipped: {}", rule.getName(), e.getMessage());
                log.debug("Rule failure details", e);
            }
        }

        // List.sort is stable, so rule order is kept within a severity
        suggestions.sort(Comparator.comparing(AdvisorSuggestion::getSeverity));

        Map<String, Integer> queriesByLocation = new LinkedHashMap<>();
        Map<String, Double> timeByLocation = new LinkedHashMap<>();
        for (Map.Entry<String, List<CollectedQuery>> group : collector.groupByLocation().entrySet()) {
            queriesByLocation.put(group.getKey(), group.getValue().size());
            timeByLocation.put(group.getKey(), group.getValue().stream().mapToDouble(CollectedQuery::timeMs).sum());
        }

        AdvisorReport report = AdvisorReport.builder()
                .totalQueries(collector.getQueryCount())
                .totalDbTime(collector.getTotalTime())
                .uniqueQueries(collector.getUniqueQueryCount())
                .suggestions(suggestions)
                .queriesByLocation(sortDescending(queriesByLocation))
                .timeByLocation(sortDescending(timeByLocation))
                .analysisTime((System.nanoTime() - startNanos) / 1_000_000.0)
                .build();

        log.debug("Advisor found {} suggestions across {} queries", suggestions.size(), report.getTotalQueries());
        return report;
    }

    public void reset() {
        collector.reset();
    }

    private static <V extends Comparable<V>> Map<String, V> sortDescending(Map<String, V> source) {
        Map<String, V> sorted = new LinkedHashMap<>();
        source.entrySet().stream()
                .sorted(Map.Entry.<String, V>comparingByValue().reversed())
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }
}
