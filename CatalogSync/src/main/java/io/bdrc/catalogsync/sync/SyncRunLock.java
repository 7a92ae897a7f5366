package io.bdrc.catalogsync.sync;

import java.time.Duration;
import java.util.UUID;

import io.bdrc.catalogsync.common.CatalogSyncException;
import io.bdrc.catalogsync.model.SourceRepository;
import io.bdrc.catalogsync.store.CatalogStore;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps two runs for the same record type from interleaving.  The lock is a leased document, so a
 * holder that dies without releasing it only blocks others until the lease expires.
 */
@Slf4j
public class SyncRunLock {
    public static final Duration DEFAULT_LEASE = Duration.ofHours(6);

    private final CatalogStore store;
    @Getter
    private final String holderId;
    private final Duration leaseDuration;

    public SyncRunLock(CatalogStore store) {
        this(store, "sync-" + UUID.randomUUID(), DEFAULT_LEASE);
    }

    public SyncRunLock(CatalogStore store, String holderId, Duration leaseDuration) {
        this.store = store;
        this.holderId = holderId;
        this.leaseDuration = leaseDuration;
    }

    /**
     * @throws SyncAlreadyRunningException if another holder has an unexpired lease
     */
    public Lease acquire(SourceRepository repository) {
        var lockId = repository.getLockId();
        if (!store.acquireLease(lockId, holderId, leaseDuration)) {
            throw new SyncAlreadyRunningException(repository.getRecordType());
        }
        log.atDebug().setMessage("Acquired {} as {}").addArgument(lockId).addArgument(holderId).log();
        return new Lease(lockId);
    }

    public class Lease implements AutoCloseable {
        @Getter
        private final String lockId;

        private Lease(String lockId) {
            this.lockId = lockId;
        }

        @Override
        public void close() {
            try {
                store.releaseLease(lockId, holderId);
            } catch (CatalogSyncException e) {
                log.atWarn().setCause(e).setMessage("Could not release {}; it expires after {}").addArgument(lockId)
                    .addArgument(leaseDuration).log();
            }
        }
    }
}
