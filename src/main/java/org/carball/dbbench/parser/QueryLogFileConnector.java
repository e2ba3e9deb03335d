package org.carball.dbbench.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.model.query.QueryEvent;
import org.carball.dbbench.output.JsonMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Reads query events recorded to a JSON file so they can be analyzed offline.
 * <pre>
 * { "benchmark": "checkout", "execution_time": 1.25,
 *   "queries": [ {"sql": "...", "bindings": [1], "time_ms": 0.8, "connection": "main",
 *                 "frames": [{"file": "...", "line": 42, "class": "...", "method": "..."}]} ] }
 * </pre>
 * {@code benchmark} and {@code execution_time} (seconds) are optional.
 */
@Slf4j
public class QueryLogFileConnector {

    private final ObjectMapper objectMapper = JsonMappers.create();
    private final JsonNode logData;
    private final Path path;

    public QueryLogFileConnector(String filePath) throws IOException {
        this(Paths.get(filePath));
    }

    public QueryLogFileConnector(Path path) throws IOException {
        this.path = path;
        if (!Files.exists(path)) {
            throw new IOException("Query log file not found: " + path);
        }

        String content = Files.readString(path);
        logData = objectMapper.readTree(content);

        validateFormat();
    }

    /**
     * Every query event of the log, in file order. Malformed entries are skipped.
     */
    public List<QueryEvent> getAllQueries() {
        List<QueryEvent> results = new ArrayList<>();
        JsonNode queries = logData.get("queries");

        if (queries != null && queries.isArray()) {
            int index = 0;
            for (JsonNode queryNode : queries) {
                try {
                    results.add(objectMapper.treeToValue(queryNode, QueryEvent.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed query #{} in {}: {}", index, path, e.getOriginalMessage());
                }
                index++;
            }
        }

        return results;
    }

    /**
     * Replays the log into an active collection window of the collector.
     *
     * @return number of events replayed
     */
    public int replayInto(QueryCollector collector) {
        boolean wasActive = collector.isActive();
        if (!wasActive) {
            collector.start();
        }

        List<QueryEvent> events = getAllQueries();
        events.forEach(collector::record);

        if (!wasActive) {
            collector.stop();
        }
        log.debug("Replayed {} queries from {}", events.size(), path);
        return events.size();
    }

    public String getBenchmarkName() {
        JsonNode name = logData.get("benchmark");
        if (name != null && name.isTextual()) {
            return name.asText();
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Wall-clock duration of the recorded workload in seconds, when the log carries it.
     */
    public OptionalDouble getExecutionTime() {
        JsonNode time = logData.get("execution_time");
        if (time != null && time.isNumber()) {
            return OptionalDouble.of(time.doubleValue());
        }
        return OptionalDouble.empty();
    }

    private void validateFormat() throws IOException {
        if (logData == null || !logData.isObject()) {
            throw new IOException("Invalid query log format: expected a JSON object in " + path);
        }
        JsonNode queries = logData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IOException("Invalid query log format: missing 'queries' array in " + path);
        }
    }
}
