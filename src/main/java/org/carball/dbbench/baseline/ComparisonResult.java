package org.carball.dbbench.baseline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of comparing a run against its baseline.
 */
public record ComparisonResult(
        BaselineResult baseline,
        BaselineResult current,
        List<RegressionItem> regressions,
        List<ImprovementItem> improvements
) {

    public ComparisonResult {
        regressions = regressions == null ? List.of() : List.copyOf(regressions);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }

    public boolean hasCritical() {
        return regressions.stream().anyMatch(RegressionItem::isCritical);
    }

    public boolean hasWarning() {
        return regressions.stream().anyMatch(item -> !item.isCritical());
    }

    public boolean hasRegressions() {
        return !regressions.isEmpty();
    }

    public boolean hasImprovements() {
        return !improvements.isEmpty();
    }

    public ComparisonStatus getStatus() {
        if (hasCritical()) {
            return ComparisonStatus.CRITICAL;
        }
        if (hasWarning()) {
            return ComparisonStatus.WARNING;
        }
        if (hasImprovements()) {
            return ComparisonStatus.IMPROVED;
        }
        return ComparisonStatus.STABLE;
    }

    public boolean shouldFailCI() {
        return hasCritical();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", getStatus().getCode());
        map.put("has_regressions", hasRegressions());
        map.put("has_improvements", hasImprovements());
        map.put("baseline", baseline);
        map.put("current", current);
        map.put("regressions", regressions);
        map.put("improvements", improvements);
        return map;
    }
}
