package org.carball.dbbench.analyzer.rules;

import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.AdvisorConfig;
import org.carball.dbbench.model.advisor.AdvisorSuggestion;

import java.util.List;

/**
 * A check over the queries of one collection window.
 */
public interface AdvisorRule {

    /**
     * Key of this rule's settings under {@code advisor.rules}.
     */
    String getName();

    default boolean isEnabled(AdvisorConfig config) {
        return config.isRuleEnabled(getName());
    }

    /**
     * Inspects the collected queries without modifying them.
     */
    List<AdvisorSuggestion> analyze(QueryCollector collector, AdvisorConfig config);
}
