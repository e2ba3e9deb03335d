package org.carball.dbbench.model.advisor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * An optimization suggestion produced by one advisor rule.
 */
@Value
@Builder
public class AdvisorSuggestion {

    String type;
    Severity severity;
    String title;
    String description;
    String location;

    /**
     * Remediation text, one hint per line.
     */
    String suggestion;

    @Singular("meta")
    Map<String, Object> metadata;

    public Optional<Double> metadataDouble(String key) {
        Object value = metadata.get(key);
        return value instanceof Number ? Optional.of(((Number) value).doubleValue()) : Optional.empty();
    }

    public Optional<Integer> metadataInt(String key) {
        Object value = metadata.get(key);
        return value instanceof Number ? Optional.of(((Number) value).intValue()) : Optional.empty();
    }
}
