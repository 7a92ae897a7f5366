package io.bdrc.catalogsync.scores;

import io.bdrc.catalogsync.common.CatalogSyncException;

public class ScoreLoadException extends CatalogSyncException {
    public ScoreLoadException(String message) {
        super(message);
    }

    public ScoreLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
