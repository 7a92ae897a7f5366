package io.bdrc.catalogsync.parsing;

import io.bdrc.catalogsync.common.CatalogSyncException;

import lombok.Getter;

public class RecordParseException extends CatalogSyncException {
    @Getter
    private final String source;

    public RecordParseException(String source, Throwable cause) {
        super("Unable to parse record from " + source, cause);
        this.source = source;
    }
}
