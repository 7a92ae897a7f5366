package io.bdrc.catalogsync;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

import io.bdrc.catalogsync.audit.AuditLog;
import io.bdrc.catalogsync.common.RestClient;
import io.bdrc.catalogsync.mirror.GitSourceMirror;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.model.SyncCounts;
import io.bdrc.catalogsync.parsing.TrigRecordParser;
import io.bdrc.catalogsync.scores.EntityScoreLoader;
import io.bdrc.catalogsync.scores.ScoreProvider;
import io.bdrc.catalogsync.store.OpenSearchCatalogStore;
import io.bdrc.catalogsync.sync.ImportUpsertEngine;
import io.bdrc.catalogsync.sync.RecordClassifier;
import io.bdrc.catalogsync.sync.SyncController;
import io.bdrc.catalogsync.sync.SyncOptions;
import io.bdrc.catalogsync.sync.SyncRunLock;
import io.bdrc.catalogsync.sync.WatermarkStore;
import io.bdrc.catalogsync.transliteration.EwtsDecoder;

import lombok.extern.slf4j.Slf4j;

/**
 * One sync pass over a set of record types.  Scores are loaded once, before the first type is
 * touched, and counts are summed across types.
 */
@Slf4j
public class CatalogSyncJob {
    public static final String ALL_TYPES = "all";

    @FunctionalInterface
    public interface ControllerFactory {
        SyncController create(ScoreProvider scores);
    }

    private final Supplier<? extends ScoreProvider> scoreLoader;
    private final ControllerFactory controllerFactory;

    public CatalogSyncJob(Supplier<? extends ScoreProvider> scoreLoader, ControllerFactory controllerFactory) {
        this.scoreLoader = scoreLoader;
        this.controllerFactory = controllerFactory;
    }

    public SyncCounts run(List<RecordType> types, SyncOptions options) {
        var scores = scoreLoader.get();
        var controller = controllerFactory.create(scores);
        var total = SyncCounts.zero();
        for (var type : types) {
            total.add(controller.sync(type, options));
        }
        log.atInfo().setMessage("Sync complete: upserted={}, merged={}, withdrawn={}, skipped={}")
            .addArgument(total::getUpserted)
            .addArgument(total::getMerged)
            .addArgument(total::getWithdrawn)
            .addArgument(total::getSkipped)
            .log();
        return total;
    }

    /**
     * @param type {@code work}, {@code person} or {@code all}
     * @throws IllegalArgumentException for any other value
     */
    public static List<RecordType> typesFor(String type) {
        if (type == null || ALL_TYPES.equals(type)) {
            return List.of(RecordType.WORK, RecordType.PERSON);
        }
        var recordType = RecordType.fromValue(type);
        if (recordType == RecordType.UNKNOWN) {
            throw new IllegalArgumentException("Unknown record type: " + type);
        }
        return List.of(recordType);
    }

    public static CatalogSyncJob fromArgs(SyncCatalog.Args arguments) {
        var client = new RestClient(arguments.storeArgs.toConnectionContext());
        var store = new OpenSearchCatalogStore(client, arguments.indexName);
        var audit = new AuditLog(client, arguments.auditIndexName);
        var clock = Clock.systemUTC();
        var mirror = new GitSourceMirror(Path.of(arguments.dataDir), arguments.remoteBaseUrl);
        var parser = new TrigRecordParser(new EwtsDecoder());
        var watermarks = new WatermarkStore(store, clock);
        var runLock = new SyncRunLock(store);
        var upsertEngine = new ImportUpsertEngine(store, audit);
        var scoreLoader = new EntityScoreLoader(arguments.scoresUrl, Path.of(arguments.scoresCache));

        return new CatalogSyncJob(
            () -> scoreLoader.load(arguments.refreshScores),
            scores -> new SyncController(mirror, parser, store, new RecordClassifier(store, audit, scores),
                upsertEngine, watermarks, runLock, clock, arguments.batchSize));
    }
}
