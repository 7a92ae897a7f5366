package io.bdrc.catalogsync.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.common.http.HttpResponse;
import io.bdrc.catalogsync.model.CatalogFields;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

/**
 * {@link CatalogStore} kept in memory, applying {@link GuardedUpsert}s with the same rules as the
 * painless scripts of {@link OpenSearchCatalogStore}.  Searches understand only {@code term} filters and
 * {@code multi_match} substring matching.
 */
public class InMemoryCatalogStore implements CatalogStore {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private final Map<String, ObjectNode> documents = new LinkedHashMap<>();
    private final Map<String, Instant> leaseExpirations = new HashMap<>();
    private final Map<String, String> leaseHolders = new HashMap<>();
    private final Set<String> failingIds = new HashSet<>();
    private final Clock clock;
    private boolean failBulkRequests;

    @Getter
    private int writeCount;
    @Getter
    private int refreshCount;
    @Getter
    private int bulkRequestCount;

    public InMemoryCatalogStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCatalogStore(Clock clock) {
        this.clock = clock;
    }

    /** Writes to this id fail: single updates throw, bulk items report an error. */
    public void failWritesTo(String id) {
        failingIds.add(id);
    }

    public void failBulkRequests() {
        failBulkRequests = true;
    }

    public Map<String, ObjectNode> documents() {
        return documents;
    }

    public void put(String id, String json) {
        try {
            documents.put(id, (ObjectNode) OBJECT_MAPPER.readTree(json));
        } catch (Exception e) {
            throw new IllegalArgumentException(json, e);
        }
    }

    @Override
    public synchronized Optional<ObjectNode> get(String id) {
        return Optional.ofNullable(documents.get(id)).map(ObjectNode::deepCopy);
    }

    @Override
    public synchronized void index(String id, ObjectNode document) {
        writeCount++;
        documents.put(id, document.deepCopy());
    }

    @Override
    public synchronized void update(String id, ObjectNode partial) {
        writeCount++;
        var existing = documents.get(id);
        if (existing == null || failingIds.contains(id)) {
            throw new OpenSearchCatalogStore.OperationFailed("Could not update document " + id,
                new HttpResponse(existing == null ? 404 : 500, "", Map.of(), "{}"));
        }
        deepMerge(existing, partial);
    }

    @Override
    public synchronized StatusChange changeStatus(String id, String status, String canonicalId, String actor,
                                                  String now) {
        var existing = documents.get(id);
        if (existing == null) {
            return StatusChange.MISSING;
        }
        if (failingIds.contains(id)) {
            throw new OpenSearchCatalogStore.OperationFailed("Could not change the status of " + id,
                new HttpResponse(500, "", Map.of(), "{}"));
        }
        if (status.equals(existing.path(CatalogFields.RECORD_STATUS).asText(null))
            && (canonicalId == null || canonicalId.equals(existing.path(CatalogFields.CANONICAL_ID).asText(null)))) {
            return StatusChange.UNCHANGED;
        }
        writeCount++;
        existing.put(CatalogFields.RECORD_STATUS, status);
        if (canonicalId != null) {
            existing.put(CatalogFields.CANONICAL_ID, canonicalId);
        }
        var curation = existing.path(CatalogFields.CURATION).isObject()
            ? (ObjectNode) existing.get(CatalogFields.CURATION)
            : existing.putObject(CatalogFields.CURATION);
        curation.put(CatalogFields.CURATION_EDIT_VERSION, curation.path(CatalogFields.CURATION_EDIT_VERSION).asInt(0) + 1)
            .put(CatalogFields.CURATION_MODIFIED_BY, actor)
            .put(CatalogFields.CURATION_MODIFIED_AT, now);
        return StatusChange.APPLIED;
    }

    private static void deepMerge(ObjectNode target, ObjectNode partial) {
        partial.fields().forEachRemaining(e -> {
            var current = target.get(e.getKey());
            if (current != null && current.isObject() && e.getValue().isObject()) {
                deepMerge((ObjectNode) current, (ObjectNode) e.getValue());
            } else {
                target.set(e.getKey(), e.getValue().deepCopy());
            }
        });
    }

    @Override
    public synchronized List<BulkItemResult> bulkUpsert(List<GuardedUpsert> upserts) {
        bulkRequestCount++;
        if (failBulkRequests) {
            throw new OpenSearchCatalogStore.OperationFailed("Bulk request failed",
                new HttpResponse(503, "Service Unavailable", Map.of(), "{}"));
        }
        var results = new ArrayList<BulkItemResult>();
        for (var upsert : upserts) {
            if (failingIds.contains(upsert.getId())) {
                results.add(BulkItemResult.error(upsert.getId(), "mapper_parsing_exception", "failed to parse"));
                continue;
            }
            writeCount++;
            var existing = documents.get(upsert.getId());
            var created = existing == null;
            var doc = created ? upsert.getUpsertDocument().deepCopy() : existing;
            apply(doc, upsert);
            documents.put(upsert.getId(), doc);
            results.add(BulkItemResult.builder()
                .id(upsert.getId())
                .outcome(created ? BulkItemResult.Outcome.CREATED : BulkItemResult.Outcome.UPDATED)
                .status(created ? 201 : 200)
                .build());
        }
        return results;
    }

    static void apply(ObjectNode doc, GuardedUpsert upsert) {
        upsert.getAlwaysFields().forEach((path, value) -> setPath(doc, path, value));
        var guard = getPath(doc, upsert.getGuardField());
        var guarded = guard != null && guard.isBoolean() && guard.booleanValue();
        if (!guarded) {
            upsert.getGuardedFields().forEach((path, value) -> {
                if (GuardedUpsert.isPresent(value)) {
                    setPath(doc, path, value);
                }
            });
        }
        setPath(doc, upsert.getOutcomeField(), doc.textNode(guarded
            ? upsert.getOutcomeWhenGuarded()
            : upsert.getOutcomeWhenApplied()));
        upsert.getDefaultFields().forEach((field, value) -> {
            if (!GuardedUpsert.isPresent(doc.get(field))) {
                doc.set(field, value.deepCopy());
            }
        });
    }

    private static void setPath(ObjectNode root, String path, JsonNode value) {
        var parts = path.split("\\.");
        var current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            var next = current.get(parts[i]);
            if (next == null || next.isNull()) {
                next = current.putObject(parts[i]);
            }
            current = (ObjectNode) next;
        }
        current.set(parts[parts.length - 1], value == null ? root.nullNode() : value.deepCopy());
    }

    private static JsonNode getPath(ObjectNode root, String path) {
        JsonNode current = root;
        for (var part : path.split("\\.")) {
            current = current.get(part);
            if (current == null || current.isNull()) {
                return null;
            }
        }
        return current;
    }

    @Override
    public synchronized ObjectNode search(ObjectNode query, int size) {
        var bool = query.path("query").path("bool");
        var response = OBJECT_MAPPER.createObjectNode();
        var hits = response.putObject("hits").putArray("hits");
        documents.entrySet().stream()
            .filter(e -> matchesFilters(e.getValue(), bool.path("filter")))
            .filter(e -> matchesText(e.getValue(), bool.path("must")))
            .limit(size)
            .forEach(e -> {
                var hit = hits.addObject();
                hit.put("_id", e.getKey());
                hit.set("_source", e.getValue().deepCopy());
            });
        return response;
    }

    private static boolean matchesFilters(ObjectNode doc, JsonNode filters) {
        for (var filter : filters) {
            var term = filter.path("term");
            var it = term.fields();
            while (it.hasNext()) {
                var e = it.next();
                if (!e.getValue().asText().equals(doc.path(e.getKey()).asText(null))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean matchesText(ObjectNode doc, JsonNode musts) {
        for (var must : musts) {
            var multiMatch = must.path("multi_match");
            var text = multiMatch.path("query").asText();
            var found = false;
            for (var field : multiMatch.path("fields")) {
                var value = doc.path(field.asText());
                if (value.isArray()) {
                    for (var v : value) {
                        found |= v.asText().contains(text);
                    }
                } else {
                    found |= value.asText().contains(text);
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    @Override
    public synchronized void refresh() {
        refreshCount++;
    }

    @Override
    public synchronized boolean acquireLease(String leaseId, String holder, Duration duration) {
        var now = clock.instant();
        var currentHolder = leaseHolders.get(leaseId);
        var expiration = leaseExpirations.getOrDefault(leaseId, Instant.EPOCH);
        if (currentHolder == null || currentHolder.equals(holder) || expiration.isBefore(now)) {
            leaseHolders.put(leaseId, holder);
            leaseExpirations.put(leaseId, now.plus(duration));
            return true;
        }
        return false;
    }

    @Override
    public synchronized void releaseLease(String leaseId, String holder) {
        if (holder.equals(leaseHolders.get(leaseId))) {
            leaseHolders.remove(leaseId);
            leaseExpirations.remove(leaseId);
        }
    }

    public synchronized Optional<String> leaseHolder(String leaseId) {
        return Optional.ofNullable(leaseHolders.get(leaseId));
    }
}
