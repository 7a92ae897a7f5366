package io.bdrc.catalogsync.sync;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncOptions {
    /** Ignore the watermark and import every file. */
    boolean force;
    /** Process at most this many files, or all when null.  Must be positive. */
    Integer limit;
    /** Parse and log only; nothing is written. */
    boolean dryRun;

    public static SyncOptions defaults() {
        return SyncOptions.builder().build();
    }
}
