package io.bdrc.catalogsync.records;

import io.bdrc.catalogsync.common.CatalogSyncException;

public class RecordConflictException extends CatalogSyncException {
    public RecordConflictException(String message) {
        super(message);
    }
}
