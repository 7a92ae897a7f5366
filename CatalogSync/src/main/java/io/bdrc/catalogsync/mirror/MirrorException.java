package io.bdrc.catalogsync.mirror;

import io.bdrc.catalogsync.common.CatalogSyncException;

public class MirrorException extends CatalogSyncException {
    public MirrorException(String message) {
        super(message);
    }

    public MirrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
