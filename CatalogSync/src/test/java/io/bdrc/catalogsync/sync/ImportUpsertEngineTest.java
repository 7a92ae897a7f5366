package io.bdrc.catalogsync.sync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.bdrc.catalogsync.audit.RecordingAuditSink;
import io.bdrc.catalogsync.model.ImportRecord;
import io.bdrc.catalogsync.model.ParsedRecord;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.model.SyncCounts;
import io.bdrc.catalogsync.scores.EntityScores;
import io.bdrc.catalogsync.store.BulkItemResult;
import io.bdrc.catalogsync.store.CatalogStore;
import io.bdrc.catalogsync.store.InMemoryCatalogStore;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ImportUpsertEngineTest {
    private static final String NOW = "2024-03-01T10:00:00Z";
    private static final String LATER = "2024-03-02T10:00:00Z";

    private InMemoryCatalogStore store;
    private RecordingAuditSink audit;
    private ImportUpsertEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        audit = new RecordingAuditSink();
        engine = new ImportUpsertEngine(store, audit);
    }

    @Test
    void newRecordIsCreatedWithFreshCuration() {
        var counts = engine.upsert(List.of(work("W000001", "བཀྲ་ཤིས", 4.5)), NOW);

        assertThat(counts.getUpserted(), equalTo(1));
        assertThat(counts.getSkipped(), equalTo(0));

        var doc = store.documents().get("W000001");
        assertThat(doc.path("type").asText(), equalTo("work"));
        assertThat(doc.path("origin").asText(), equalTo("imported"));
        assertThat(doc.path("record_status").asText(), equalTo("active"));
        assertThat(doc.path("canonical_id").isNull(), is(true));
        assertThat(doc.path("pref_label_bo").asText(), equalTo("བཀྲ་ཤིས"));
        assertThat(doc.path("alt_label_bo").get(0).asText(), equalTo("ཆོས"));
        assertThat(doc.path("authors").get(0).asText(), equalTo("P000001"));
        assertThat(doc.path("db_score").asDouble(), equalTo(4.5));
        assertThat(doc.path("curation").path("modified").asBoolean(), is(false));
        assertThat(doc.path("curation").path("edit_version").asInt(), equalTo(0));
        assertThat(doc.path("source_meta").path("updated_at").asText(), equalTo(NOW));
        assertThat(doc.path("import_meta").path("last_run_at").asText(), equalTo(NOW));
        assertThat(doc.path("import_meta").path("last_result").asText(), equalTo("updated_or_created"));

        var event = audit.getEvents().get(0);
        assertThat(event.getAction(), equalTo("import_create"));
        assertThat(event.getActor(), equalTo("importer"));
        assertThat(event.getType(), equalTo("work"));
        assertThat(event.getCorrelationId(), equalTo("import-" + NOW));
    }

    @Test
    void missingScoreIsLeftOut() {
        engine.upsert(List.of(work("W000001", "ཀ", null)), NOW);

        assertThat(store.documents().get("W000001").has("db_score"), is(false));
    }

    @Test
    void uncuratedRecordIsOverwritten() {
        engine.upsert(List.of(work("W000001", "ཀ", null)), NOW);

        var counts = engine.upsert(List.of(work("W000001", "ཁ", null)), LATER);

        assertThat(counts.getUpserted(), equalTo(1));
        var doc = store.documents().get("W000001");
        assertThat(doc.path("pref_label_bo").asText(), equalTo("ཁ"));
        assertThat(doc.path("source_meta").path("updated_at").asText(), equalTo(LATER));
        assertThat(audit.actionsFor("W000001"), contains("import_create", "import_update"));
    }

    @Test
    void curatedRecordKeepsItsContent() {
        store.put("W000001", "{\"type\":\"work\",\"origin\":\"imported\",\"record_status\":\"active\","
            + "\"pref_label_bo\":\"curated\",\"alt_label_bo\":[\"kept\"],"
            + "\"curation\":{\"modified\":true,\"modified_by\":\"curator@bdrc.io\",\"edit_version\":3},"
            + "\"import_meta\":{\"last_run_at\":\"" + NOW + "\",\"last_result\":\"updated_or_created\"}}");

        engine.upsert(List.of(work("W000001", "from source", 9.0)), LATER);

        var doc = store.documents().get("W000001");
        assertThat(doc.path("pref_label_bo").asText(), equalTo("curated"));
        assertThat(doc.path("alt_label_bo").get(0).asText(), equalTo("kept"));
        assertThat(doc.has("db_score"), is(false));
        assertThat(doc.path("curation").path("edit_version").asInt(), equalTo(3));
        assertThat(doc.path("import_meta").path("last_result").asText(), equalTo("skipped_modified"));
        assertThat(doc.path("import_meta").path("last_run_at").asText(), equalTo(LATER));
        assertThat(doc.path("source_meta").path("updated_at").asText(), equalTo(LATER));
    }

    @Test
    void existingDocumentWithoutCurationGetsTheZeroBlock() {
        store.put("W000001", "{\"type\":\"work\",\"origin\":\"imported\",\"record_status\":\"active\","
            + "\"pref_label_bo\":\"old\"}");

        var counts = engine.upsert(List.of(work("W000001", "ཀ", null)), NOW);

        assertThat(counts.getUpserted(), equalTo(1));
        var doc = store.documents().get("W000001");
        assertThat(doc.path("curation"), equalTo(ImportUpsertEngine.zeroCuration()));
        assertThat(doc.path("pref_label_bo").asText(), equalTo("ཀ"));
        assertThat(doc.path("import_meta").path("last_result").asText(), equalTo("updated_or_created"));
    }

    @Test
    void repeatingTheSameBatchLeavesTheCatalogUnchanged() {
        store.put("W000002", "{\"type\":\"work\",\"record_status\":\"active\","
            + "\"curation\":{\"modified\":false,\"edit_version\":0}}");
        store.put("W000003", "{\"type\":\"work\",\"record_status\":\"active\","
            + "\"curation\":{\"modified\":true,\"modified_by\":\"curator@bdrc.io\",\"edit_version\":5}}");
        var classifier = new RecordClassifier(store, audit, new EntityScores(Map.of("W000001", 2.0)));
        var batch = List.of(
            parsed("W000001", true, null),
            parsed("W000002", false, null),
            parsed("W000003", false, "W000001"),
            parsed("W000004", false, null));

        runBatch(classifier, batch);
        var afterFirstRun = new HashMap<String, ObjectNode>();
        store.documents().forEach((id, doc) -> afterFirstRun.put(id, doc.deepCopy()));
        var auditAfterFirstRun = audit.getEvents().size();

        var counts = runBatch(classifier, batch);

        assertThat(store.documents(), equalTo(afterFirstRun));
        assertThat(counts.getWithdrawn(), equalTo(1));
        assertThat(counts.getMerged(), equalTo(1));
        assertThat(counts.getSkipped(), equalTo(1));
        assertThat(audit.getEvents().size() - auditAfterFirstRun, equalTo(1));
        assertThat(audit.actionsFor("W000002"), contains("withdraw"));
        assertThat(audit.actionsFor("W000003"), contains("merge"));
    }

    private SyncCounts runBatch(RecordClassifier classifier, List<ParsedRecord> batch) {
        var counts = SyncCounts.zero();
        var released = new ArrayList<ImportRecord>();
        batch.forEach(r -> classifier.classify(r, NOW, counts).ifPresent(released::add));
        counts.add(engine.upsert(released, NOW));
        return counts;
    }

    @Test
    void absentLabelDoesNotEraseExistingOne() {
        engine.upsert(List.of(work("P000001", "ཀ", null)), NOW);

        engine.upsert(List.of(ImportRecord.builder().id("P000001").type(RecordType.PERSON).build()), LATER);

        assertThat(store.documents().get("P000001").path("pref_label_bo").asText(), equalTo("ཀ"));
    }

    @Test
    void itemErrorsAreSkipped() {
        store.failWritesTo("W000002");

        var counts = engine.upsert(List.of(work("W000001", "ཀ", null), work("W000002", "ཁ", null)), NOW);

        assertThat(counts.getUpserted(), equalTo(1));
        assertThat(counts.getSkipped(), equalTo(1));
        assertThat(store.documents().containsKey("W000002"), is(false));
        assertThat(audit.actionsFor("W000002"), empty());
    }

    @Test
    void noopAndUnreportedItemsAreSkipped() {
        var bulkStore = mock(CatalogStore.class);
        when(bulkStore.bulkUpsert(any())).thenReturn(List.of(
            BulkItemResult.builder().id("W000001").outcome(BulkItemResult.Outcome.NOOP).status(200).build()));
        var mockedEngine = new ImportUpsertEngine(bulkStore, audit);

        var counts = mockedEngine.upsert(List.of(
            work("W000001", "ཀ", null), work("W000002", "ཁ", null), work("W000003", "ག", null)), NOW);

        assertThat(counts.getUpserted(), equalTo(0));
        assertThat(counts.getSkipped(), equalTo(3));
        assertThat(audit.getEvents(), empty());
    }

    @Test
    void emptyBatchSendsNothing() {
        var counts = engine.upsert(List.of(), NOW);

        assertThat(counts.getUpserted(), equalTo(0));
        assertThat(store.getBulkRequestCount(), equalTo(0));
    }

    @Test
    void guardedUpsertProtectsContentOnly() {
        var upsert = engine.toGuardedUpsert(work("W000001", "ཀ", 1.0), NOW);

        assertThat(upsert.getGuardField(), equalTo("curation.modified"));
        assertThat(upsert.getOutcomeField(), equalTo("import_meta.last_result"));
        assertThat(upsert.getGuardedFields().keySet(),
            contains("pref_label_bo", "alt_label_bo", "authors", "db_score"));
        assertThat(upsert.getAlwaysFields().keySet(),
            contains("source_meta.updated_at", "import_meta.last_run_at"));
        assertThat(upsert.getDefaultFields().get("curation"), equalTo(ImportUpsertEngine.zeroCuration()));
    }

    private static ParsedRecord parsed(String id, boolean released, String replacement) {
        return ParsedRecord.builder()
            .id(id)
            .type(RecordType.fromId(id))
            .released(released)
            .replacementId(replacement)
            .preferredLabel("ཀ")
            .build();
    }

    private static ImportRecord work(String id, String label, Double score) {
        return ImportRecord.builder()
            .id(id)
            .type(RecordType.fromId(id))
            .preferredLabel(label)
            .alternateLabels(List.of("ཆོས"))
            .authors(List.of("P000001"))
            .dbScore(score)
            .build();
    }
}
