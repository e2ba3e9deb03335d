package org.carball.dbbench.baseline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.dbbench.model.advisor.Severity;

/**
 * A metric that got worse by at least its warning threshold.
 */
public record RegressionItem(
        @JsonProperty("metric") String metric,
        @JsonProperty("baseline_value") double baselineValue,
        @JsonProperty("current_value") double currentValue,
        @JsonProperty("diff_percent") double diffPercent,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("formatted_baseline") String formattedBaseline,
        @JsonProperty("formatted_current") String formattedCurrent
) {

    @JsonIgnore
    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    public String metricLabel() {
        return Metrics.label(metric);
    }
}
