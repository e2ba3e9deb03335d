package org.carball.dbbench.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.model.query.CallSite;
import org.carball.dbbench.model.query.CollectedQuery;
import org.carball.dbbench.model.query.QueryEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Collects query executions during a measurement window.
 * <p>
 * Appends are safe for concurrent writers. {@link #start()}, {@link #stop()} and {@link #reset()}
 * must only be called while no workload is running. Events arriving while the collector is
 * inactive are dropped.
 */
@Slf4j
public class QueryCollector implements QueryListener {

    private final ConcurrentLinkedQueue<CollectedQuery> queries = new ConcurrentLinkedQueue<>();
    private final CallSiteResolver callSiteResolver;
    private volatile boolean active = false;

    public QueryCollector() {
        this(new CallSiteResolver());
    }

    public QueryCollector(CallSiteResolver callSiteResolver) {
        this.callSiteResolver = callSiteResolver;
    }

    /**
     * Opens a new collection window. Does nothing if one is already open.
     */
    public void start() {
        if (active) {
            return;
        }
        queries.clear();
        active = true;
        log.debug("Query collection started");
    }

    public void stop() {
        if (!active) {
            return;
        }
        active = false;
        log.debug("Query collection stopped with {} queries", queries.size());
    }

    public void reset() {
        queries.clear();
    }

    public boolean isActive() {
        return active;
    }

    public void record(QueryEvent event) {
        if (!active || event == null) {
            return;
        }
        CallSite origin = callSiteResolver.resolve(event.frames());
        queries.add(CollectedQuery.from(event, origin));
    }

    /**
     * Records a query attributed to the caller of this method.
     */
    public void record(String sql, List<Object> bindings, double timeMs, String connection) {
        if (!active) {
            return;
        }
        QueryEvent event = new QueryEvent(sql, bindings, timeMs, connection, null);
        queries.add(CollectedQuery.from(event, callSiteResolver.resolveCurrentThread()));
    }

    @Override
    public void onQuery(QueryEvent event) {
        record(event);
    }

    public List<CollectedQuery> getQueries() {
        return List.copyOf(queries);
    }

    public int getQueryCount() {
        return queries.size();
    }

    /**
     * Total time spent in the database, in milliseconds.
     */
    public double getTotalTime() {
        return queries.stream().mapToDouble(CollectedQuery::timeMs).sum();
    }

    public int getUniqueQueryCount() {
        return (int) queries.stream()
                .map(CollectedQuery::normalizedSql)
                .distinct()
                .count();
    }

    public Map<String, List<CollectedQuery>> groupByNormalizedSql() {
        return queries.stream()
                .collect(Collectors.groupingBy(CollectedQuery::normalizedSql, LinkedHashMap::new, Collectors.toList()));
    }

    public Map<String, List<CollectedQuery>> groupByLocation() {
        return queries.stream()
                .collect(Collectors.groupingBy(CollectedQuery::locationString, LinkedHashMap::new, Collectors.toList()));
    }

    /**
     * Queries that took strictly longer than the threshold.
     */
    public List<CollectedQuery> getSlowQueries(double thresholdMs) {
        List<CollectedQuery> slow = new ArrayList<>();
        for (CollectedQuery query : queries) {
            if (query.timeMs() > thresholdMs) {
                slow.add(query);
            }
        }
        return slow;
    }
}
