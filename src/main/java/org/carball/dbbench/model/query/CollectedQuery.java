package org.carball.dbbench.model.query;

import org.carball.dbbench.parser.SqlNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A query observed during a collection window, with the application location that issued it.
 */
public record CollectedQuery(
        String sql,
        List<Object> bindings,
        double timeMs,
        String connection,
        CallSite origin,
        String normalizedSql,
        Instant capturedAt
) {

    public CollectedQuery {
        bindings = bindings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
        origin = origin == null ? CallSite.unknown() : origin;
    }

    public static CollectedQuery from(QueryEvent event, CallSite origin) {
        return new CollectedQuery(
                event.sql(),
                event.bindings(),
                event.timeMs(),
                event.connection(),
                origin,
                SqlNormalizer.normalize(event.sql()),
                Instant.now()
        );
    }

    public String locationString() {
        return origin.locationString();
    }

    public String fullLocation() {
        return origin.fullLocation();
    }
}
