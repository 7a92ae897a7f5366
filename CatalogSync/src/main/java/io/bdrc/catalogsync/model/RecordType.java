package io.bdrc.catalogsync.model;

import java.util.Arrays;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The kind of catalog entity, fixed by the first character of its identifier.
 */
@Getter
@AllArgsConstructor
public enum RecordType {
    WORK("work", "W"),
    PERSON("person", "P"),
    UNKNOWN("unknown", null);

    private final String value;
    private final String idPrefix;

    public static RecordType fromId(String id) {
        if (id == null || id.isEmpty()) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(t -> t.idPrefix != null && id.startsWith(t.idPrefix))
            .findFirst()
            .orElse(UNKNOWN);
    }

    public static RecordType fromValue(String value) {
        return Arrays.stream(values())
            .filter(t -> t.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown record type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
