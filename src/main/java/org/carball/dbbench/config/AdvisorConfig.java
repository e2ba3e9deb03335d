package org.carball.dbbench.config;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisor switches, per-rule settings and display limits.
 */
@Data
@Builder(toBuilder = true)
public class AdvisorConfig {

    @Builder.Default
    private boolean enabled = true;

    @Singular("rule")
    private Map<String, RuleSettings> rules;

    @Builder.Default
    private DisplaySettings display = DisplaySettings.defaults();

    public static AdvisorConfig defaults() {
        return AdvisorConfig.builder().build();
    }

    /**
     * Settings of the named rule; empty settings when the rule is not configured.
     */
    public RuleSettings rule(String name) {
        RuleSettings settings = rules.get(name);
        return settings == null ? RuleSettings.empty() : settings;
    }

    public boolean isRuleEnabled(String name) {
        return rule(name).isEnabled();
    }

    /**
     * Share of an N+1 group's time assumed recoverable when no explicit savings are reported.
     */
    public double nPlusOneSavingsRatio() {
        return rule("n_plus_one").getDouble("savings_ratio", 0.8);
    }

    public void setRuleOption(String rule, String key, Object value) {
        Map<String, RuleSettings> updated = new LinkedHashMap<>(rules);
        updated.put(rule, rule(rule).with(key, value));
        rules = updated;
    }
}
