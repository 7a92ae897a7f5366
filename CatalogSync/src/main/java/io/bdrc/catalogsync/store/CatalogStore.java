package io.bdrc.catalogsync.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Document store holding catalog records, sync watermarks and run locks.
 */
public interface CatalogStore {
    String ID_FIELD = "id";

    enum StatusChange {
        APPLIED,
        /** The document already had the requested status. */
        UNCHANGED,
        MISSING
    }

    Optional<ObjectNode> get(String id);

    /** Writes the whole document and makes it visible to searches before returning. */
    void index(String id, ObjectNode document);

    /** Merges {@code partial} into an existing document and makes it visible to searches before returning. */
    void update(String id, ObjectNode partial);

    /**
     * Applies every upsert as one conditional write per document.  Item failures are reported in the
     * returned list; only a failure of the request as a whole is thrown.
     */
    List<BulkItemResult> bulkUpsert(List<GuardedUpsert> upserts);

    /**
     * Sets {@code record_status}, and {@code canonical_id} when one is given, and bumps
     * {@code curation.edit_version} in the same conditional write.  A document that already carries both
     * values is left exactly as it is.
     */
    StatusChange changeStatus(String id, String status, String canonicalId, String actor, String now);

    ObjectNode search(ObjectNode query, int size);

    void refresh();

    /**
     * @return true if {@code holder} now owns the lease, either freshly or by renewing its own
     */
    boolean acquireLease(String leaseId, String holder, Duration duration);

    void releaseLease(String leaseId, String holder);

    /**
     * Flattens the hits of a search response into their sources, each with its document id under
     * {@value #ID_FIELD}.
     */
    static List<ObjectNode> extractHits(ObjectNode searchResponse) {
        var results = new ArrayList<ObjectNode>();
        for (var hit : searchResponse.path("hits").path("hits")) {
            var source = hit.path("_source");
            var doc = source.isObject() ? ((ObjectNode) source).deepCopy() : searchResponse.objectNode();
            doc.put(ID_FIELD, hit.path("_id").asText());
            results.add(doc);
        }
        return results;
    }
}
