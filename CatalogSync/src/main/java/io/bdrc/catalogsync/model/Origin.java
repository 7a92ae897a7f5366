package io.bdrc.catalogsync.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Where a catalog record was first created.  Set once, never changed afterwards.
 */
@Getter
@AllArgsConstructor
public enum Origin {
    IMPORTED("imported"),
    LOCAL("local");

    private final String value;
}
