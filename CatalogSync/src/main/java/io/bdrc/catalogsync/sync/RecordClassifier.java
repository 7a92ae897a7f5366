package io.bdrc.catalogsync.sync;

import java.util.Optional;

import io.bdrc.catalogsync.audit.AuditSink;
import io.bdrc.catalogsync.common.CatalogSyncException;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.CatalogFields;
import io.bdrc.catalogsync.model.ImportRecord;
import io.bdrc.catalogsync.model.ParsedRecord;
import io.bdrc.catalogsync.model.RecordStatus;
import io.bdrc.catalogsync.model.SyncCounts;
import io.bdrc.catalogsync.scores.ScoreProvider;
import io.bdrc.catalogsync.store.CatalogStore;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides what a parsed record means for the catalog.  Released records are returned for the bulk
 * upsert.  Unreleased records that the catalog already holds are merged or withdrawn on the spot; a record
 * that already carries that status is counted but neither rewritten nor audited again.
 */
@Slf4j
public class RecordClassifier {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private final CatalogStore store;
    private final AuditSink audit;
    private final ScoreProvider scores;

    public RecordClassifier(CatalogStore store, AuditSink audit, ScoreProvider scores) {
        this.store = store;
        this.audit = audit;
        this.scores = scores;
    }

    /**
     * @param now run timestamp stamped into curation bookkeeping
     * @param counts receives merged, withdrawn and skipped outcomes
     * @return the record to upsert, when it is released
     */
    public Optional<ImportRecord> classify(ParsedRecord record, String now, SyncCounts counts) {
        if (record.isReleased()) {
            return Optional.of(ImportRecord.from(record, scores.scoreFor(record.getId()).orElse(null)));
        }
        try {
            var merging = record.getReplacementId() != null;
            var status = merging ? RecordStatus.DUPLICATE : RecordStatus.WITHDRAWN;
            var change = store.changeStatus(record.getId(), status.getValue(), record.getReplacementId(),
                CatalogFields.IMPORTER_ACTOR, now);
            switch (change) {
                case MISSING:
                    log.atDebug().setMessage("Skipping unreleased {} {} (not in catalog)").addArgument(record.getType())
                        .addArgument(record.getId()).log();
                    counts.incrementSkipped();
                    break;
                case UNCHANGED:
                    log.atDebug().setMessage("{} {} is already {}").addArgument(record.getType())
                        .addArgument(record.getId()).addArgument(status.getValue()).log();
                    countStatus(merging, counts);
                    break;
                case APPLIED:
                    if (merging) {
                        auditMerge(record);
                    } else {
                        auditWithdraw(record);
                    }
                    countStatus(merging, counts);
                    break;
                default:
                    throw new IllegalStateException("Unexpected status change " + change);
            }
        } catch (CatalogSyncException e) {
            log.atError().setCause(e).setMessage("Could not apply release status of {} {}")
                .addArgument(record.getType()).addArgument(record.getId()).log();
            counts.incrementSkipped();
        }
        return Optional.empty();
    }

    private static void countStatus(boolean merging, SyncCounts counts) {
        if (merging) {
            counts.incrementMerged();
        } else {
            counts.incrementWithdrawn();
        }
    }

    private void auditMerge(ParsedRecord record) {
        var diff = OBJECT_MAPPER.createObjectNode().put(CatalogFields.CANONICAL_ID, record.getReplacementId());
        audit.emit(record.getId(), record.getType(), AuditSink.ACTION_MERGE, CatalogFields.IMPORTER_ACTOR, diff, null);
        log.atInfo().setMessage("Merged {} {} -> {}").addArgument(record.getType()).addArgument(record.getId())
            .addArgument(record.getReplacementId()).log();
    }

    private void auditWithdraw(ParsedRecord record) {
        audit.emit(record.getId(), record.getType(), AuditSink.ACTION_WITHDRAW, CatalogFields.IMPORTER_ACTOR);
        log.atInfo().setMessage("Withdrew {} {}").addArgument(record.getType()).addArgument(record.getId()).log();
    }
}
