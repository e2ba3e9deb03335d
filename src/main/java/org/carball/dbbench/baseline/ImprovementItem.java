package org.carball.dbbench.baseline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A metric that got better. {@code improvementPercent} is a positive magnitude.
 */
public record ImprovementItem(
        @JsonProperty("metric") String metric,
        @JsonProperty("baseline_value") double baselineValue,
        @JsonProperty("current_value") double currentValue,
        @JsonProperty("improvement_percent") double improvementPercent,
        @JsonProperty("formatted_baseline") String formattedBaseline,
        @JsonProperty("formatted_current") String formattedCurrent
) {

    public String metricLabel() {
        return Metrics.label(metric);
    }
}
