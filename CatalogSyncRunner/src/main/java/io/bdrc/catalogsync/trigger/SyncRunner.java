package io.bdrc.catalogsync.trigger;

import java.util.List;

import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.model.SyncCounts;
import io.bdrc.catalogsync.sync.SyncOptions;

@FunctionalInterface
public interface SyncRunner {
    SyncCounts run(List<RecordType> types, SyncOptions options);
}
