package io.bdrc.catalogsync.common;

public class CatalogSyncException extends RuntimeException {
    public CatalogSyncException(String message) {
        super(message);
    }

    public CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
