package io.bdrc.catalogsync.sync;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import io.bdrc.catalogsync.mirror.SourceMirror;
import io.bdrc.catalogsync.model.ImportRecord;
import io.bdrc.catalogsync.model.ParsedRecord;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.model.SourceRepository;
import io.bdrc.catalogsync.model.SyncCounts;
import io.bdrc.catalogsync.model.SyncWatermark;
import io.bdrc.catalogsync.parsing.RecordParseException;
import io.bdrc.catalogsync.parsing.RecordParser;
import io.bdrc.catalogsync.store.CatalogStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs one sync of one record type: bring the mirror up to date, work out which files changed since
 * the watermark, push them through the classifier and the upsert engine in batches, then move the
 * watermark.  Any exception that escapes leaves the watermark where it was, so the next run repeats
 * the same files.
 */
@Slf4j
public class SyncController {
    public static final int DEFAULT_BATCH_SIZE = 5000;
    private static final int SHORT_REVISION_LENGTH = 8;

    private final SourceMirror mirror;
    private final RecordParser parser;
    private final CatalogStore store;
    private final RecordClassifier classifier;
    private final ImportUpsertEngine upsertEngine;
    private final WatermarkStore watermarks;
    private final SyncRunLock runLock;
    private final Clock clock;
    private final int batchSize;

    public SyncController(SourceMirror mirror, RecordParser parser, CatalogStore store, RecordClassifier classifier,
                          ImportUpsertEngine upsertEngine, WatermarkStore watermarks, SyncRunLock runLock,
                          Clock clock) {
        this(mirror, parser, store, classifier, upsertEngine, watermarks, runLock, clock, DEFAULT_BATCH_SIZE);
    }

    public SyncController(SourceMirror mirror, RecordParser parser, CatalogStore store, RecordClassifier classifier,
                          ImportUpsertEngine upsertEngine, WatermarkStore watermarks, SyncRunLock runLock,
                          Clock clock, int batchSize) {
        this.mirror = mirror;
        this.parser = parser;
        this.store = store;
        this.classifier = classifier;
        this.upsertEngine = upsertEngine;
        this.watermarks = watermarks;
        this.runLock = runLock;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    public SyncCounts sync(RecordType type, SyncOptions options) {
        var repository = SourceRepository.forType(type);
        if (options.isDryRun()) {
            return run(repository, options);
        }
        try (var ignored = runLock.acquire(repository)) {
            return run(repository, options);
        }
    }

    private SyncCounts run(SourceRepository repository, SyncOptions options) {
        var type = repository.getRecordType();
        var localPath = mirror.ensureLocal(repository);
        var head = mirror.headRevision(localPath);

        var lastRevision = watermarks.load(type).map(SyncWatermark::getLastRevisionImported).orElse(null);
        if (head.equals(lastRevision) && !options.isForce()) {
            log.atInfo().setMessage("Already up to date for {} (revision {})").addArgument(type)
                .addArgument(() -> shortRevision(head)).log();
            return SyncCounts.zero();
        }

        var files = selectFiles(type, localPath, lastRevision, head, options);
        if (files.isEmpty()) {
            log.atInfo().setMessage("No record files to process for {}").addArgument(type).log();
            if (!options.isDryRun()) {
                watermarks.save(type, head);
            }
            return SyncCounts.zero();
        }
        if (options.getLimit() != null && options.getLimit() < files.size()) {
            log.atWarn().setMessage("Limiting {} to {} of {} changed files; the watermark still advances to {}, "
                    + "so the remaining files are not picked up by the next incremental run")
                .addArgument(type).addArgument(options::getLimit).addArgument(files.size())
                .addArgument(() -> shortRevision(head)).log();
            files = files.subList(0, options.getLimit());
        }

        log.atInfo().setMessage("Processing {} record files for {}").addArgument(files.size()).addArgument(type).log();
        var now = clock.instant().toString();
        var total = SyncCounts.zero();
        int parseErrors = 0;

        for (int start = 0; start < files.size(); start += batchSize) {
            var batch = files.subList(start, Math.min(start + batchSize, files.size()));
            log.atInfo().setMessage("Batch {}-{} of {}").addArgument(start).addArgument(start + batch.size())
                .addArgument(files.size()).log();

            var parsed = new ArrayList<ParsedRecord>(batch.size());
            for (var file : batch) {
                try {
                    parsed.add(parser.parse(file));
                } catch (RecordParseException e) {
                    log.atDebug().setCause(e).setMessage("Could not parse {}").addArgument(file).log();
                    parseErrors++;
                }
            }

            if (options.isDryRun()) {
                parsed.forEach(SyncController::logDryRun);
                total.addSkipped(parsed.size());
            } else {
                total.add(processBatch(parsed, now));
            }
        }

        if (parseErrors > 0) {
            log.atWarn().setMessage("Failed to parse {} files").addArgument(parseErrors).log();
        }
        if (!options.isDryRun()) {
            store.refresh();
            watermarks.save(type, head);
        }
        log.atInfo().setMessage("Finished {} sync: {}").addArgument(type).addArgument(total).log();
        return total;
    }

    private List<Path> selectFiles(RecordType type, Path localPath, String lastRevision, String head,
                                   SyncOptions options) {
        var fullImport = options.isForce()
            || lastRevision == null
            || !mirror.revisionExists(localPath, lastRevision);
        if (fullImport) {
            log.atInfo().setMessage("Full import for {}").addArgument(type).log();
            return mirror.allFiles(localPath);
        }
        log.atInfo().setMessage("Incremental import for {}: {}..{}").addArgument(type)
            .addArgument(() -> shortRevision(lastRevision)).addArgument(() -> shortRevision(head)).log();
        return mirror.changedFilesSince(localPath, lastRevision);
    }

    private SyncCounts processBatch(List<ParsedRecord> parsed, String now) {
        var counts = SyncCounts.zero();
        var toUpsert = new ArrayList<ImportRecord>();
        for (var record : parsed) {
            classifier.classify(record, now, counts).ifPresent(toUpsert::add);
        }
        counts.add(upsertEngine.upsert(toUpsert, now));
        log.atInfo().setMessage("Record processing complete: {} upserted, {} merged, {} withdrawn, {} skipped")
            .addArgument(counts::getUpserted).addArgument(counts::getMerged)
            .addArgument(counts::getWithdrawn).addArgument(counts::getSkipped).log();
        return counts;
    }

    private static void logDryRun(ParsedRecord record) {
        log.atInfo().setMessage("[dry-run] {} {} | released={} | label={} | authors={}")
            .addArgument(record.getType())
            .addArgument(record.getId())
            .addArgument(record.isReleased())
            .addArgument(record.getPreferredLabel())
            .addArgument(record.getAuthors())
            .log();
    }

    private static String shortRevision(String revision) {
        return revision.length() > SHORT_REVISION_LENGTH ? revision.substring(0, SHORT_REVISION_LENGTH) : revision;
    }
}
