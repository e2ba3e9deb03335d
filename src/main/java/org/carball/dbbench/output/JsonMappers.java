package org.carball.dbbench.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class JsonMappers {

    private JsonMappers() {
        // Utility class - prevent instantiation
    }

    /**
     * Mapper for reports, baselines and query logs: ISO-8601 dates, indented output,
     * null fields omitted, unknown fields ignored on read.
     */
    public static ObjectMapper create() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    /**
     * Mapper for baseline files. Untyped integers read back as {@code Long} so option values
     * compare equal after a round trip.
     */
    public static ObjectMapper createForBaselines() {
        ObjectMapper objectMapper = create();
        objectMapper.enable(DeserializationFeature.USE_LONG_FOR_INTS);
        return objectMapper;
    }
}
