package io.bdrc.catalogsync.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A released record queued for the guarded bulk upsert.
 */
@Value
@Builder
public class ImportRecord {
    @NonNull
    String id;
    @NonNull
    RecordType type;
    String preferredLabel;
    List<String> alternateLabels;
    List<String> authors;
    Double dbScore;

    public static ImportRecord from(ParsedRecord parsed, Double dbScore) {
        return ImportRecord.builder()
            .id(parsed.getId())
            .type(parsed.getType())
            .preferredLabel(parsed.getPreferredLabel())
            .alternateLabels(parsed.getAlternateLabels())
            .authors(parsed.getAuthors())
            .dbScore(dbScore)
            .build();
    }
}
