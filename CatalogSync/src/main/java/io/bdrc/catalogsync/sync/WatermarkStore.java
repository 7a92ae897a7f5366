package io.bdrc.catalogsync.sync;

import java.time.Clock;
import java.util.Optional;

import io.bdrc.catalogsync.common.CatalogSyncException;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.model.SourceRepository;
import io.bdrc.catalogsync.model.SyncWatermark;
import io.bdrc.catalogsync.store.CatalogStore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists the last fully imported revision of each source repository as a document of the catalog
 * index.
 */
@Slf4j
public class WatermarkStore {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private final CatalogStore store;
    private final Clock clock;

    public WatermarkStore(CatalogStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Optional<SyncWatermark> load(RecordType type) {
        var id = SourceRepository.forType(type).getWatermarkId();
        return store.get(id).map(doc -> {
            try {
                return OBJECT_MAPPER.treeToValue(doc, SyncWatermark.class);
            } catch (JsonProcessingException e) {
                throw new CatalogSyncException("Unreadable watermark " + id, e);
            }
        });
    }

    public void save(RecordType type, String revision) {
        var id = SourceRepository.forType(type).getWatermarkId();
        var watermark = new SyncWatermark(revision, clock.instant().toString());
        ObjectNode doc = OBJECT_MAPPER.valueToTree(watermark);
        store.index(id, doc);
        log.atInfo().setMessage("Updated watermark {} -> revision {}").addArgument(id).addArgument(revision).log();
    }
}
