package io.bdrc.catalogsync.mirror;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import io.bdrc.catalogsync.model.SourceRepository;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GitSourceMirrorTest {
    @TempDir
    Path tempDir;

    Path originDir;
    Git origin;
    GitSourceMirror mirror;

    @BeforeEach
    void setUp() throws GitAPIException {
        originDir = tempDir.resolve("remote").resolve(SourceRepository.WORKS.getRepositoryName() + ".git");
        origin = Git.init().setDirectory(originDir.toFile()).call();
        mirror = new GitSourceMirror(tempDir.resolve("data"), tempDir.resolve("remote").toUri().toString());
    }

    @AfterEach
    void tearDown() {
        origin.close();
    }

    @Test
    void remoteUrlAppendsRepositoryName() {
        var withSlash = new GitSourceMirror(tempDir, "https://gitlab.com/bdrc-data/");

        assertThat(withSlash.remoteUrl(SourceRepository.PERSONS),
            equalTo("https://gitlab.com/bdrc-data/persons-20220922.git"));
    }

    @Test
    void cloneThenPullAndDiff() throws IOException, GitAPIException {
        write("W000001.trig", "one");
        write("W000002.trig", "two");
        write("README.md", "readme");
        write("sub/W000009.trig", "nine");
        var first = commit("initial");

        var local = mirror.ensureLocal(SourceRepository.WORKS);

        assertThat(local, equalTo(tempDir.resolve("data").resolve("works-20220922")));
        assertThat(mirror.headRevision(local), equalTo(first));
        assertThat(mirror.allFiles(local), contains(
            local.resolve("W000001.trig"),
            local.resolve("W000002.trig"),
            local.resolve("sub/W000009.trig")));

        write("W000001.trig", "one, edited");
        write("W000003.trig", "three");
        write("README.md", "readme, edited");
        origin.rm().addFilepattern("W000002.trig").call();
        var second = commit("second");

        mirror.ensureLocal(SourceRepository.WORKS);

        assertThat(mirror.headRevision(local), equalTo(second));
        assertThat(mirror.changedFilesSince(local, first), contains(
            local.resolve("W000001.trig"),
            local.resolve("W000003.trig")));
        assertThat(mirror.changedFilesSince(local, second).isEmpty(), is(true));
    }

    @Test
    void revisionExistsOnlyForKnownCommits() throws IOException, GitAPIException {
        write("W000001.trig", "one");
        var first = commit("initial");
        var local = mirror.ensureLocal(SourceRepository.WORKS);

        assertThat(mirror.revisionExists(local, first), is(true));
        assertThat(mirror.revisionExists(local, "0123456789abcdef0123456789abcdef01234567"), is(false));
        assertThat(mirror.revisionExists(local, ""), is(false));
        assertThat(mirror.revisionExists(local, null), is(false));
    }

    @Test
    void diffAgainstUnknownRevisionFails() throws IOException, GitAPIException {
        write("W000001.trig", "one");
        commit("initial");
        var local = mirror.ensureLocal(SourceRepository.WORKS);

        assertThrows(MirrorException.class,
            () -> mirror.changedFilesSince(local, "0123456789abcdef0123456789abcdef01234567"));
    }

    @Test
    void missingRemoteFailsToClone() {
        var noRemote = new GitSourceMirror(tempDir.resolve("data"), tempDir.resolve("nowhere").toUri().toString());

        assertThrows(MirrorException.class, () -> noRemote.ensureLocal(SourceRepository.PERSONS));
    }

    private void write(String relativePath, String content) throws IOException {
        var file = originDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private String commit(String message) throws GitAPIException {
        origin.add().addFilepattern(".").call();
        return origin.commit()
            .setMessage(message)
            .setAuthor("Catalog Tests", "tests@bdrc.io")
            .setCommitter("Catalog Tests", "tests@bdrc.io")
            .setSign(false)
            .call()
            .getName();
    }
}
