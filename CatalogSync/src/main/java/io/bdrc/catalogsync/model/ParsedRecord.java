package io.bdrc.catalogsync.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One source record, decoded and normalized.  Labels are already in Tibetan script.
 */
@Value
@Builder
public class ParsedRecord {
    @NonNull
    String id;
    @NonNull
    RecordType type;
    boolean released;
    String replacementId;
    String preferredLabel;
    @Singular
    List<String> alternateLabels;
    @Singular
    List<String> authors;
}
