package io.bdrc.catalogsync.records;

import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.CatalogFields;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.store.CatalogStore;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Record counts per type, from a terms aggregation over the whole catalog index.
 */
public class CatalogStatsService {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();
    static final String AGGREGATION_NAME = "by_type";

    private final CatalogStore store;

    public CatalogStatsService(CatalogStore store) {
        this.store = store;
    }

    public CatalogStats getStats() {
        var query = OBJECT_MAPPER.createObjectNode();
        query.putObject("aggs").putObject(AGGREGATION_NAME).putObject("terms").put("field", CatalogFields.TYPE);
        var response = store.search(query, 0);

        long works = 0;
        long persons = 0;
        for (var bucket : response.path("aggregations").path(AGGREGATION_NAME).path("buckets")) {
            var key = bucket.path("key").asText();
            var count = bucket.path("doc_count").asLong();
            if (RecordType.WORK.getValue().equals(key)) {
                works = count;
            } else if (RecordType.PERSON.getValue().equals(key)) {
                persons = count;
            }
        }
        return new CatalogStats(works, persons);
    }
}
