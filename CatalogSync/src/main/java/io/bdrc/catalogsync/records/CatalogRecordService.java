package io.bdrc.catalogsync.records;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import io.bdrc.catalogsync.audit.AuditEvent;
import io.bdrc.catalogsync.audit.AuditSink;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.CatalogFields;
import io.bdrc.catalogsync.model.Origin;
import io.bdrc.catalogsync.model.RecordStatus;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.store.CatalogStore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Curator operations on catalog records.  Every change marks the record as modified so that later
 * imports leave its content alone, and every change is audited under the curator's name.
 * <p>
 * Validation happens before any write; a rejected call changes nothing.
 */
@Slf4j
public class CatalogRecordService {
    public static final int DEFAULT_SEARCH_SIZE = 20;
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private final CatalogStore store;
    private final AuditSink audit;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public CatalogRecordService(CatalogStore store, AuditSink audit) {
        this(store, audit, new IdGenerator(), Clock.systemUTC());
    }

    public CatalogRecordService(CatalogStore store, AuditSink audit, IdGenerator idGenerator, Clock clock) {
        this.store = store;
        this.audit = audit;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public ObjectNode create(RecordType type, RecordInput input) {
        var id = idGenerator.newId(type);
        var body = input.toFields();
        body.put(CatalogFields.TYPE, type.getValue());
        body.put(CatalogFields.ORIGIN, Origin.LOCAL.getValue());
        body.put(CatalogFields.RECORD_STATUS, RecordStatus.ACTIVE.getValue());
        body.set(CatalogFields.CURATION, curation(input.getModifiedBy(), 1));
        store.index(id, body);
        audit.emit(id, type, AuditSink.ACTION_CREATE, input.getModifiedBy());
        log.atInfo().setMessage("Created {} {}").addArgument(type).addArgument(id).log();
        return withId(body, id);
    }

    public ObjectNode update(RecordType type, String id, RecordInput input) {
        var existing = store.get(id).orElseThrow(() -> new RecordNotFoundException(label(type), id));
        var partial = input.toFields();
        partial.set(CatalogFields.CURATION, curation(input.getModifiedBy(), editVersion(existing) + 1));
        store.update(id, partial);
        audit.emit(id, type, AuditSink.ACTION_EDIT, input.getModifiedBy(), partial, null);
        return withId(merged(existing, partial), id);
    }

    public ObjectNode merge(RecordType type, String id, String canonicalId, String modifiedBy) {
        var label = label(type);
        if (id.equals(canonicalId)) {
            throw new RecordConflictException("Cannot merge " + label + " '" + id + "' into itself");
        }
        var existing = store.get(id).orElseThrow(() -> new RecordNotFoundException(label, id));
        if (RecordStatus.DUPLICATE.getValue().equals(existing.path(CatalogFields.RECORD_STATUS).asText())) {
            throw new RecordConflictException(label + " '" + id + "' is already marked as duplicate");
        }
        var canonical = store.get(canonicalId)
            .orElseThrow(() -> new RecordNotFoundException(label + " (canonical target)", canonicalId));
        if (!type.getValue().equals(canonical.path(CatalogFields.TYPE).asText())) {
            throw new RecordConflictException("Canonical target '" + canonicalId + "' is not a " + type);
        }

        var partial = OBJECT_MAPPER.createObjectNode();
        partial.put(CatalogFields.RECORD_STATUS, RecordStatus.DUPLICATE.getValue());
        partial.put(CatalogFields.CANONICAL_ID, canonicalId);
        partial.set(CatalogFields.CURATION, curation(modifiedBy, editVersion(existing) + 1));
        store.update(id, partial);
        audit.emit(id, type, AuditSink.ACTION_MERGE, modifiedBy,
            OBJECT_MAPPER.createObjectNode().put(CatalogFields.CANONICAL_ID, canonicalId), null);
        log.atInfo().setMessage("{} merged {} {} into {}").addArgument(modifiedBy).addArgument(type)
            .addArgument(id).addArgument(canonicalId).log();
        return withId(merged(existing, partial), id);
    }

    public Optional<ObjectNode> get(String id) {
        return store.get(id).map(doc -> withId(doc, id));
    }

    public List<ObjectNode> search(RecordType type, String text) {
        return search(type, text, DEFAULT_SEARCH_SIZE);
    }

    /**
     * Active records of one type, optionally matching {@code text} in their preferred or alternate
     * labels.
     */
    public List<ObjectNode> search(RecordType type, String text, int size) {
        var query = OBJECT_MAPPER.createObjectNode();
        var bool = query.putObject("query").putObject("bool");
        var filter = bool.putArray("filter");
        filter.addObject().putObject("term").put(CatalogFields.TYPE, type.getValue());
        filter.addObject().putObject("term").put(CatalogFields.RECORD_STATUS, RecordStatus.ACTIVE.getValue());
        if (text != null && !text.isBlank()) {
            var multiMatch = bool.putArray("must").addObject().putObject("multi_match");
            multiMatch.put("query", text);
            multiMatch.putArray("fields").add(CatalogFields.PREF_LABEL).add(CatalogFields.ALT_LABELS);
        }
        return CatalogStore.extractHits(store.search(query, size));
    }

    public List<AuditEvent> history(String id) {
        return audit.getHistory(id);
    }

    private ObjectNode curation(String modifiedBy, int editVersion) {
        var curation = OBJECT_MAPPER.createObjectNode();
        curation.put(CatalogFields.CURATION_MODIFIED, true);
        curation.put(CatalogFields.CURATION_MODIFIED_AT, clock.instant().toString());
        curation.put(CatalogFields.CURATION_MODIFIED_BY, modifiedBy);
        curation.put(CatalogFields.CURATION_EDIT_VERSION, editVersion);
        return curation;
    }

    private static int editVersion(ObjectNode doc) {
        return doc.path(CatalogFields.CURATION).path(CatalogFields.CURATION_EDIT_VERSION).asInt(0);
    }

    private static ObjectNode merged(ObjectNode existing, ObjectNode partial) {
        var result = existing.deepCopy();
        result.setAll(partial);
        return result;
    }

    private static ObjectNode withId(ObjectNode doc, String id) {
        var result = doc.deepCopy();
        result.put(CatalogStore.ID_FIELD, id);
        return result;
    }

    private static String label(RecordType type) {
        var value = type.getValue();
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
