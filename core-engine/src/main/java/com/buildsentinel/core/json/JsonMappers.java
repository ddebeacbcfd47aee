package com.buildsentinel.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the Jackson mappers used across the project.
 *
 * <p>
 * Instants are written as ISO-8601 strings. The strict mapper rejects unknown
 * properties and is used at the ingestion boundary; the lenient one reads
 * persisted state written by older or newer versions.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonMappers {

    private JsonMappers() {
        // not instantiable
    }

    /**
     * @return mapper that fails on unknown properties
     */
    public static ObjectMapper strict() {
        return base().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    /**
     * @return mapper that ignores unknown properties
     */
    public static ObjectMapper lenient() {
        return base().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static ObjectMapper base() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
