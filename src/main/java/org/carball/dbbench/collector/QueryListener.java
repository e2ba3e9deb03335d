package org.carball.dbbench.collector;

import org.carball.dbbench.model.query.QueryEvent;

/**
 * Receives query executions from an instrumented workload.
 */
@FunctionalInterface
public interface QueryListener {

    void onQuery(QueryEvent event);
}
