package io.bdrc.catalogsync.model;

import java.util.Arrays;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A git repository of source records.  Each holds exactly one record type and tracks its own
 * watermark.
 */
@Getter
@AllArgsConstructor
public enum SourceRepository {
    WORKS(RecordType.WORK, "works-20220922", "work_import_record"),
    PERSONS(RecordType.PERSON, "persons-20220922", "person_import_record");

    private final RecordType recordType;
    private final String repositoryName;
    private final String watermarkId;

    public String getLockId() {
        return recordType.getValue() + "_sync_lock";
    }

    public static SourceRepository forType(RecordType type) {
        return Arrays.stream(values())
            .filter(r -> r.recordType == type)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No source repository holds " + type + " records"));
    }
}
