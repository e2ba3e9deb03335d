package org.carball.dbbench.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A query execution reported by the measured workload, before call-site attribution.
 */
public record QueryEvent(
        @JsonProperty("sql") String sql,
        @JsonProperty("bindings") List<Object> bindings,
        @JsonProperty("time_ms") double timeMs,
        @JsonProperty("connection") String connection,
        @JsonProperty("frames") List<StackFrame> frames
) {

    public QueryEvent {
        sql = sql == null ? "" : sql;
        bindings = bindings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
        connection = connection == null ? "default" : connection;
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    public static QueryEvent of(String sql, List<Object> bindings, double timeMs) {
        return new QueryEvent(sql, bindings, timeMs, null, null);
    }
}
