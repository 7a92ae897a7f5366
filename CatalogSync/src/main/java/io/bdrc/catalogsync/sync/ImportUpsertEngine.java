package io.bdrc.catalogsync.sync;

import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

import io.bdrc.catalogsync.audit.AuditSink;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.CatalogFields;
import io.bdrc.catalogsync.model.ImportRecord;
import io.bdrc.catalogsync.model.Origin;
import io.bdrc.catalogsync.model.RecordStatus;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.model.SyncCounts;
import io.bdrc.catalogsync.store.BulkItemResult;
import io.bdrc.catalogsync.store.CatalogStore;
import io.bdrc.catalogsync.store.GuardedUpsert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes released records into the catalog without ever overwriting what a curator changed.  Content
 * fields are replaced only while {@code curation.modified} is not true; bookkeeping fields are always
 * advanced.
 */
@Slf4j
public class ImportUpsertEngine {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();
    static final String GUARD_FIELD = CatalogFields.CURATION + "." + CatalogFields.CURATION_MODIFIED;
    static final String OUTCOME_FIELD = CatalogFields.IMPORT_META + "." + CatalogFields.LAST_RESULT;

    private final CatalogStore store;
    private final AuditSink audit;

    public ImportUpsertEngine(CatalogStore store, AuditSink audit) {
        this.store = store;
        this.audit = audit;
    }

    public static String correlationId(String now) {
        return "import-" + now;
    }

    /**
     * @param now run timestamp, also the audit correlation id suffix
     * @return upserted and skipped counts of this flush
     */
    public SyncCounts upsert(List<ImportRecord> records, String now) {
        var counts = SyncCounts.zero();
        if (records.isEmpty()) {
            return counts;
        }
        var typeById = new HashMap<String, RecordType>();
        records.forEach(r -> typeById.put(r.getId(), r.getType()));

        var results = store.bulkUpsert(records.stream()
            .map(r -> toGuardedUpsert(r, now))
            .collect(Collectors.toList()));

        int created = 0;
        int updated = 0;
        for (var result : results) {
            var type = typeById.getOrDefault(result.getId(), RecordType.UNKNOWN);
            switch (result.getOutcome()) {
                case CREATED:
                    created++;
                    audit.emit(result.getId(), type, AuditSink.ACTION_IMPORT_CREATE, CatalogFields.IMPORTER_ACTOR,
                        null, correlationId(now));
                    break;
                case UPDATED:
                    updated++;
                    audit.emit(result.getId(), type, AuditSink.ACTION_IMPORT_UPDATE, CatalogFields.IMPORTER_ACTOR,
                        null, correlationId(now));
                    break;
                case NOOP:
                    counts.incrementSkipped();
                    break;
                default:
                    logItemError(result);
                    counts.incrementSkipped();
                    break;
            }
        }
        if (results.size() < records.size()) {
            log.atWarn().setMessage("Bulk response reported {} of {} items; counting the rest as skipped")
                .addArgument(results::size).addArgument(records::size).log();
            counts.addSkipped(records.size() - results.size());
        }
        counts.addUpserted(created + updated);

        log.atInfo().setMessage("Bulk upsert complete: {} created, {} updated, {} skipped")
            .addArgument(created).addArgument(updated).addArgument(counts::getSkipped).log();
        return counts;
    }

    private static void logItemError(BulkItemResult result) {
        log.atError().setMessage("Bulk upsert error for {} (status {}): {} {}")
            .addArgument(result::getId)
            .addArgument(result::getStatus)
            .addArgument(result::getErrorType)
            .addArgument(result::getErrorReason)
            .log();
    }

    GuardedUpsert toGuardedUpsert(ImportRecord record, String now) {
        var content = contentFields(record);

        var doc = OBJECT_MAPPER.createObjectNode();
        doc.put(CatalogFields.TYPE, record.getType().getValue());
        doc.put(CatalogFields.ORIGIN, Origin.IMPORTED.getValue());
        doc.putObject(CatalogFields.SOURCE_META).put(CatalogFields.UPDATED_AT, now);
        doc.set(CatalogFields.CURATION, zeroCuration());
        content.fields().forEachRemaining(e -> {
            if (GuardedUpsert.isPresent(e.getValue()) || !CatalogFields.DB_SCORE.equals(e.getKey())) {
                doc.set(e.getKey(), e.getValue());
            }
        });
        doc.put(CatalogFields.RECORD_STATUS, RecordStatus.ACTIVE.getValue());
        doc.putNull(CatalogFields.CANONICAL_ID);

        var builder = GuardedUpsert.builder()
            .id(record.getId())
            .upsertDocument(doc)
            .alwaysField(CatalogFields.SOURCE_META + "." + CatalogFields.UPDATED_AT, text(now))
            .alwaysField(CatalogFields.IMPORT_META + "." + CatalogFields.LAST_RUN_AT, text(now))
            .guardField(GUARD_FIELD)
            .outcomeField(OUTCOME_FIELD)
            .outcomeWhenApplied(CatalogFields.LAST_RESULT_APPLIED)
            .outcomeWhenGuarded(CatalogFields.LAST_RESULT_SKIPPED_MODIFIED)
            .defaultField(CatalogFields.CURATION, zeroCuration());
        content.fields().forEachRemaining(e -> builder.guardedField(e.getKey(), e.getValue()));
        return builder.build();
    }

    private static ObjectNode contentFields(ImportRecord record) {
        var content = OBJECT_MAPPER.createObjectNode();
        content.set(CatalogFields.PREF_LABEL, OBJECT_MAPPER.valueToTree(record.getPreferredLabel()));
        content.set(CatalogFields.ALT_LABELS, OBJECT_MAPPER.valueToTree(record.getAlternateLabels()));
        content.set(CatalogFields.AUTHORS, OBJECT_MAPPER.valueToTree(record.getAuthors()));
        content.set(CatalogFields.DB_SCORE, OBJECT_MAPPER.valueToTree(record.getDbScore()));
        return content;
    }

    static ObjectNode zeroCuration() {
        var curation = OBJECT_MAPPER.createObjectNode();
        curation.put(CatalogFields.CURATION_MODIFIED, false);
        curation.putNull(CatalogFields.CURATION_MODIFIED_AT);
        curation.putNull(CatalogFields.CURATION_MODIFIED_BY);
        curation.put(CatalogFields.CURATION_EDIT_VERSION, 0);
        return curation;
    }

    private static JsonNode text(String value) {
        return OBJECT_MAPPER.getNodeFactory().textNode(value);
    }
}
