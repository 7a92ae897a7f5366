package io.bdrc.catalogsync.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum RecordStatus {
    ACTIVE("active"),
    DUPLICATE("duplicate"),
    WITHDRAWN("withdrawn");

    private final String value;
}
