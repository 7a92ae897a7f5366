package io.bdrc.catalogsync.sync;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.store.InMemoryCatalogStore;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

class WatermarkStoreTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final InMemoryCatalogStore store = new InMemoryCatalogStore();
    private final WatermarkStore watermarks = new WatermarkStore(store, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void missingWatermarkIsEmpty() {
        assertThat(watermarks.load(RecordType.WORK).isPresent(), is(false));
    }

    @Test
    void eachTypeHasItsOwnDocument() {
        watermarks.save(RecordType.WORK, "abc");
        watermarks.save(RecordType.PERSON, "def");

        var works = store.documents().get("work_import_record");
        assertThat(works.path("last_revision_imported").asText(), equalTo("abc"));
        assertThat(works.path("last_updated_at").asText(), equalTo(NOW.toString()));
        assertThat(store.documents().get("person_import_record").path("last_revision_imported").asText(),
            equalTo("def"));

        assertThat(watermarks.load(RecordType.WORK).get().getLastRevisionImported(), equalTo("abc"));
        assertThat(watermarks.load(RecordType.PERSON).get().getLastRevisionImported(), equalTo("def"));
    }

    @Test
    void saveReplacesThePreviousRevision() {
        watermarks.save(RecordType.WORK, "abc");
        watermarks.save(RecordType.WORK, "xyz");

        assertThat(watermarks.load(RecordType.WORK).get().getLastRevisionImported(), equalTo("xyz"));
    }

    @Test
    void extraFieldsAreIgnored() {
        store.put("work_import_record", "{\"last_revision_imported\":\"abc\",\"last_updated_at\":\"x\",\"note\":\"y\"}");

        assertThat(watermarks.load(RecordType.WORK).get().getLastRevisionImported(), equalTo("abc"));
    }
}
