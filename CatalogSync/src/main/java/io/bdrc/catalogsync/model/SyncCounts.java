package io.bdrc.catalogsync.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Running totals of one sync run, or of several runs once {@link #add}ed together.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class SyncCounts {
    private int upserted;
    private int merged;
    private int withdrawn;
    private int skipped;

    public static SyncCounts zero() {
        return new SyncCounts();
    }

    public SyncCounts add(SyncCounts other) {
        upserted += other.upserted;
        merged += other.merged;
        withdrawn += other.withdrawn;
        skipped += other.skipped;
        return this;
    }

    public void addUpserted(int count) {
        upserted += count;
    }

    public void incrementMerged() {
        merged++;
    }

    public void incrementWithdrawn() {
        withdrawn++;
    }

    public void addSkipped(int count) {
        skipped += count;
    }

    public void incrementSkipped() {
        skipped++;
    }
}
