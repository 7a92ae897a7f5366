package io.bdrc.catalogsync.mirror;

import java.nio.file.Path;
import java.util.List;

import io.bdrc.catalogsync.model.SourceRepository;

/**
 * A local working copy of a source repository.  All methods throw {@link MirrorException} on failure.
 */
public interface SourceMirror {
    /** Clones the repository if it is not present locally, otherwise brings it up to date. */
    Path ensureLocal(SourceRepository repository);

    String headRevision(Path localPath);

    boolean revisionExists(Path localPath, String revision);

    /** Record files touched between {@code revision} and HEAD that still exist in the working tree. */
    List<Path> changedFilesSince(Path localPath, String revision);

    /** Every record file of the working tree, sorted. */
    List<Path> allFiles(Path localPath);
}
