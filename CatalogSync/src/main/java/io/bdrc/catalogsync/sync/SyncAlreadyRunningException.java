package io.bdrc.catalogsync.sync;

import io.bdrc.catalogsync.common.CatalogSyncException;
import io.bdrc.catalogsync.model.RecordType;

import lombok.Getter;

public class SyncAlreadyRunningException extends CatalogSyncException {
    @Getter
    private final RecordType recordType;

    public SyncAlreadyRunningException(RecordType recordType) {
        super("A " + recordType + " sync is already running");
        this.recordType = recordType;
    }
}
