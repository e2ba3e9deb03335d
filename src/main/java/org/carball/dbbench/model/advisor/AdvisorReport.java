package org.carball.dbbench.model.advisor;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of one advisor analysis: query totals, suggestions sorted by severity and
 * per-location statistics sorted in descending order.
 */
@Value
public class AdvisorReport {

    int totalQueries;

    /**
     * Milliseconds spent in the database.
     */
    double totalDbTime;

    int uniqueQueries;
    List<AdvisorSuggestion> suggestions;
    Map<String, Integer> queriesByLocation;
    Map<String, Double> timeByLocation;

    /**
     * Milliseconds the analysis itself took.
     */
    double analysisTime;

    @Builder
    public AdvisorReport(int totalQueries,
                         double totalDbTime,
                         int uniqueQueries,
                         List<AdvisorSuggestion> suggestions,
                         Map<String, Integer> queriesByLocation,
                         Map<String, Double> timeByLocation,
                         double analysisTime) {
        this.totalQueries = totalQueries;
        this.totalDbTime = totalDbTime;
        this.uniqueQueries = uniqueQueries;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.queriesByLocation = queriesByLocation == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queriesByLocation));
        this.timeByLocation = timeByLocation == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(timeByLocation));
        this.analysisTime = analysisTime;
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }

    public List<AdvisorSuggestion> getSuggestionsBySeverity(Severity severity) {
        return suggestions.stream()
                .filter(s -> s.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    public int getCriticalCount() {
        return getSuggestionsBySeverity(Severity.CRITICAL).size();
    }

    public int getWarningCount() {
        return getSuggestionsBySeverity(Severity.WARNING).size();
    }

    public int getInfoCount() {
        return getSuggestionsBySeverity(Severity.INFO).size();
    }

    public Map<String, Integer> getTopLocationsByQueryCount(int limit) {
        return topEntries(queriesByLocation, limit);
    }

    public Map<String, Double> getTopLocationsByTime(int limit) {
        return topEntries(timeByLocation, limit);
    }

    /**
     * Share of the total execution time spent in the database, as a percentage.
     */
    public double getDbTimePercentage(double totalExecutionTimeMs) {
        if (totalExecutionTimeMs <= 0) {
            return 0;
        }
        return (totalDbTime / totalExecutionTimeMs) * 100;
    }

    /**
     * Flattened form for JSON export.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_queries", totalQueries);
        map.put("total_db_time_ms", round(totalDbTime));
        map.put("unique_queries", uniqueQueries);

        List<Map<String, Object>> suggestionMaps = new ArrayList<>();
        for (AdvisorSuggestion suggestion : suggestions) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", suggestion.getType());
            entry.put("severity", suggestion.getSeverity().getCode());
            entry.put("title", suggestion.getTitle());
            entry.put("description", suggestion.getDescription());
            entry.put("location", suggestion.getLocation());
            entry.put("suggestion", suggestion.getSuggestion());
            suggestionMaps.add(entry);
        }
        map.put("suggestions", suggestionMaps);
        map.put("queries_by_location", queriesByLocation);
        map.put("time_by_location", timeByLocation);
        map.put("analysis_time_ms", round(analysisTime));
        return map;
    }

    private static <V extends Comparable<V>> Map<String, V> topEntries(Map<String, V> source, int limit) {
        Map<String, V> top = new LinkedHashMap<>();
        source.entrySet().stream()
                .sorted(Map.Entry.<String, V>comparingByValue().reversed())
                .limit(Math.max(0, limit))
                .forEach(entry -> top.put(entry.getKey(), entry.getValue()));
        return top;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
