package io.bdrc.catalogsync.common;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ObjectMapperFactory {
    // Bulk responses for a 5000-record batch can be large
    private static final int MAX_STRING_LENGTH = 100 * 1024 * 1024;

    /**
     * Returns a mapper that tolerates unknown properties, since store documents carry fields this
     * code does not model.
     */
    public static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
        mapper.getFactory()
            .setStreamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(MAX_STRING_LENGTH)
                .build());
        return mapper;
    }

    private ObjectMapperFactory() {
        // Prevent instantiation
    }
}
