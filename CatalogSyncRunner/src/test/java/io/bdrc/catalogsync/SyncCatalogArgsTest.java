package io.bdrc.catalogsync;

import java.util.Map;

import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.scores.EntityScoreLoader;
import io.bdrc.catalogsync.sync.SyncController;

import com.beust.jcommander.ParameterException;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SyncCatalogArgsTest {
    private static SyncCatalog.Args parse(Map<String, String> env, String... args) {
        return SyncCatalog.parseArgs(args, env::get);
    }

    @Test
    void defaults() {
        var arguments = parse(Map.of());

        assertThat(arguments.type, equalTo("all"));
        assertThat(arguments.dataDir, equalTo("./bdrc_data"));
        assertThat(arguments.force, is(false));
        assertThat(arguments.dryRun, is(false));
        assertThat(arguments.limit, nullValue());
        assertThat(arguments.batchSize, equalTo(SyncController.DEFAULT_BATCH_SIZE));
        assertThat(arguments.scoresUrl, equalTo(EntityScoreLoader.DEFAULT_SCORES_URL));
        assertThat(arguments.indexName, equalTo("bec"));
        assertThat(arguments.auditIndexName, equalTo("bec_changes"));
        assertThat(arguments.serve, is(false));
        assertThat(arguments.port, equalTo(8000));
        assertThat(arguments.storeArgs.host, equalTo("localhost"));
    }

    @Test
    void environmentFillsUnsetFlags() {
        var env = Map.of(
            "BDRC_DATA_DIR", "/srv/bdrc",
            "API_PORT", "9000",
            "OPENSEARCH_HOST", "search.internal",
            "OPENSEARCH_PASSWORD", "secret",
            "OPENSEARCH_USER", "importer",
            "OPENSEARCH_INDEX", "bec_test");

        var arguments = parse(env);

        assertThat(arguments.dataDir, equalTo("/srv/bdrc"));
        assertThat(arguments.port, equalTo(9000));
        assertThat(arguments.indexName, equalTo("bec_test"));
        assertThat(arguments.storeArgs.host, equalTo("search.internal"));
        assertThat(arguments.storeArgs.username, equalTo("importer"));
        assertThat(arguments.storeArgs.password, equalTo("secret"));
    }

    @Test
    void explicitFlagsWinOverEnvironment() {
        var arguments = parse(Map.of("BDRC_DATA_DIR", "/srv/bdrc", "API_PORT", "9000"),
            "--data-dir", "/tmp/mirror", "--port", "8123", "--type", "work", "--limit", "5", "--dry-run", "--force");

        assertThat(arguments.dataDir, equalTo("/tmp/mirror"));
        assertThat(arguments.port, equalTo(8123));
        assertThat(arguments.type, equalTo("work"));
        assertThat(arguments.limit, equalTo(5));
        assertThat(arguments.dryRun, is(true));
        assertThat(arguments.force, is(true));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(ParameterException.class, () -> parse(Map.of(), "--type", "instance"));
        var negativeLimit = new SyncCatalog.Args();
        negativeLimit.limit = -1;
        assertThrows(ParameterException.class, () -> SyncCatalog.validateArgs(negativeLimit));
        assertThrows(ParameterException.class, () -> parse(Map.of(), "--limit", "0"));
        assertThrows(ParameterException.class, () -> parse(Map.of(), "--batch-size", "0"));
    }

    @Test
    void typesForMapsEachChoice() {
        assertThat(CatalogSyncJob.typesFor("work"), contains(RecordType.WORK));
        assertThat(CatalogSyncJob.typesFor("person"), contains(RecordType.PERSON));
        assertThat(CatalogSyncJob.typesFor("all"), contains(RecordType.WORK, RecordType.PERSON));
        assertThrows(IllegalArgumentException.class, () -> CatalogSyncJob.typesFor("unknown"));
        assertThrows(IllegalArgumentException.class, () -> CatalogSyncJob.typesFor("W"));
    }
}
