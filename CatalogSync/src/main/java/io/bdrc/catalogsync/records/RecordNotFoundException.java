package io.bdrc.catalogsync.records;

import io.bdrc.catalogsync.common.CatalogSyncException;

import lombok.Getter;

@Getter
public class RecordNotFoundException extends CatalogSyncException {
    private final String resource;
    private final String id;

    public RecordNotFoundException(String resource, String id) {
        super(resource + " '" + id + "' not found");
        this.resource = resource;
        this.id = id;
    }
}
