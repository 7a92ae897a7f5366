package io.bdrc.catalogsync.mirror;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import io.bdrc.catalogsync.model.SourceRepository;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;

/**
 * {@link SourceMirror} backed by JGit clones under one data directory, one subdirectory per repository.
 */
@Slf4j
public class GitSourceMirror implements SourceMirror {
    public static final String DEFAULT_REMOTE_BASE_URL = "https://gitlab.com/bdrc-data";
    public static final String RECORD_FILE_EXTENSION = ".trig";
    private static final String GIT_DIR = ".git";

    @Getter
    private final Path dataDir;
    private final String remoteBaseUrl;

    public GitSourceMirror(Path dataDir) {
        this(dataDir, DEFAULT_REMOTE_BASE_URL);
    }

    public GitSourceMirror(Path dataDir, String remoteBaseUrl) {
        this.dataDir = dataDir;
        this.remoteBaseUrl = remoteBaseUrl.endsWith("/")
            ? remoteBaseUrl.substring(0, remoteBaseUrl.length() - 1)
            : remoteBaseUrl;
    }

    public String remoteUrl(SourceRepository repository) {
        return remoteBaseUrl + "/" + repository.getRepositoryName() + ".git";
    }

    @Override
    public Path ensureLocal(SourceRepository repository) {
        var localPath = dataDir.resolve(repository.getRepositoryName());
        if (Files.isDirectory(localPath.resolve(GIT_DIR))) {
            pull(localPath);
        } else {
            clone(remoteUrl(repository), localPath);
        }
        return localPath;
    }

    private void clone(String url, Path localPath) {
        log.atInfo().setMessage("Cloning {} into {}").addArgument(url).addArgument(localPath).log();
        try {
            Files.createDirectories(localPath.getParent());
            Git.cloneRepository()
                .setURI(url)
                .setDirectory(localPath.toFile())
                .call()
                .close();
        } catch (GitAPIException | IOException e) {
            throw new MirrorException("Failed to clone " + url + " into " + localPath, e);
        }
    }

    private void pull(Path localPath) {
        log.atInfo().setMessage("Pulling {}").addArgument(localPath).log();
        try (var git = Git.open(localPath.toFile())) {
            var result = git.pull().setFastForward(MergeCommand.FastForwardMode.FF_ONLY).call();
            if (!result.isSuccessful()) {
                throw new MirrorException("Fast-forward pull of " + localPath + " did not succeed: " + result);
            }
        } catch (GitAPIException | IOException e) {
            throw new MirrorException("Failed to pull " + localPath, e);
        }
    }

    @Override
    public String headRevision(Path localPath) {
        try (var git = Git.open(localPath.toFile())) {
            var head = git.getRepository().resolve("HEAD");
            if (head == null) {
                throw new MirrorException("Repository at " + localPath + " has no HEAD commit");
            }
            return head.getName();
        } catch (IOException e) {
            throw new MirrorException("Failed to read HEAD of " + localPath, e);
        }
    }

    @Override
    public boolean revisionExists(Path localPath, String revision) {
        if (revision == null || revision.isBlank()) {
            return false;
        }
        try (var git = Git.open(localPath.toFile())) {
            return git.getRepository().resolve(revision + "^{commit}") != null;
        } catch (RevisionSyntaxException | IOException e) {
            log.atDebug().setCause(e).setMessage("Revision {} is not resolvable in {}").addArgument(revision)
                .addArgument(localPath).log();
            return false;
        }
    }

    @Override
    public List<Path> changedFilesSince(Path localPath, String revision) {
        try (var git = Git.open(localPath.toFile())) {
            var repo = git.getRepository();
            var oldHead = repo.resolve(revision + "^{commit}");
            if (oldHead == null) {
                throw new MirrorException("Revision " + revision + " not found in " + localPath);
            }
            var newHead = repo.resolve("HEAD");
            var diffs = git.diff()
                .setOldTree(prepareTreeParser(repo, oldHead))
                .setNewTree(prepareTreeParser(repo, newHead))
                .call();

            var changed = new ArrayList<Path>();
            for (var entry : diffs) {
                if (entry.getChangeType() == DiffEntry.ChangeType.DELETE) {
                    continue;
                }
                var path = entry.getNewPath();
                if (!path.endsWith(RECORD_FILE_EXTENSION)) {
                    continue;
                }
                var file = localPath.resolve(path);
                if (Files.isRegularFile(file)) {
                    changed.add(file);
                }
            }
            log.atInfo().setMessage("{} record files changed in {} since {}").addArgument(changed::size)
                .addArgument(localPath).addArgument(revision).log();
            return changed;
        } catch (GitAPIException | IOException e) {
            throw new MirrorException("Failed to diff " + localPath + " against " + revision, e);
        }
    }

    private static AbstractTreeIterator prepareTreeParser(Repository repo, ObjectId commitId) throws IOException {
        try (var walk = new RevWalk(repo); ObjectReader reader = repo.newObjectReader()) {
            var commit = walk.parseCommit(commitId);
            var parser = new CanonicalTreeParser();
            parser.reset(reader, commit.getTree().getId());
            return parser;
        }
    }

    @Override
    public List<Path> allFiles(Path localPath) {
        var gitDir = localPath.resolve(GIT_DIR);
        try (var files = Files.walk(localPath)) {
            return files
                .filter(p -> !p.startsWith(gitDir))
                .filter(p -> p.getFileName().toString().endsWith(RECORD_FILE_EXTENSION))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MirrorException("Failed to list record files under " + localPath, e);
        }
    }
}
