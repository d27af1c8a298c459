package com.dcruver.compass.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Sync sequences against the real git executable and a bare repository on disk.
 * Git's own config is isolated, so a fresh repository starts on git's stock initial branch.
 */
class GitSyncWithGitExecutableTest {

    private ProcessCommandRunner runner;
    private Path remote;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        runner = new ProcessCommandRunner(Map.of(
            "GIT_TERMINAL_PROMPT", "0",
            "GIT_CONFIG_NOSYSTEM", "1",
            "GIT_CONFIG_GLOBAL", tempDir.resolve("gitconfig").toString(),
            "GIT_CEILING_DIRECTORIES", tempDir.toString(),
            "GIT_AUTHOR_NAME", "Compass Test",
            "GIT_AUTHOR_EMAIL", "compass@example.com",
            "GIT_COMMITTER_NAME", "Compass Test",
            "GIT_COMMITTER_EMAIL", "compass@example.com"));
        assumeTrue(runner.run(tempDir, List.of("git", "--version")).isSuccess(), "needs git on the PATH");

        remote = tempDir.resolve("remote.git");
        assertTrue(runner.run(tempDir, List.of("git", "init", "--bare", remote.toString())).isSuccess());
    }

    private GitSyncService serviceFor(Path dataDir) throws Exception {
        Files.createDirectories(dataDir);
        SyncConfigCache cache = new SyncConfigCache(dataDir.resolveSibling(dataDir.getFileName() + "-sync.json"),
            "main", Clock.systemUTC());
        return new GitSyncService(new GitClient(runner, "git", dataDir), cache, "origin", Clock.systemUTC());
    }

    @Test
    void testFirstPushFromFreshDirectory() throws Exception {
        Path data = tempDir.resolve("data");
        GitSyncService service = serviceFor(data);
        Files.writeString(data.resolve("problems.json"), "[]");

        SyncResult first = service.push(remote.toString(), null, "first");

        assertEquals(SyncOutcome.SUCCESS, first.getOutcome(), first.getTranscript());
        CommandResult remoteBranch = runner.run(tempDir,
            List.of("git", "--git-dir", remote.toString(), "rev-parse", "--verify", "refs/heads/main"));
        assertTrue(remoteBranch.isSuccess(), remoteBranch.getStderr());

        assertEquals(SyncOutcome.NO_CHANGES, service.push(null, null, "second").getOutcome());
    }

    @Test
    void testPullIntoFreshDirectory() throws Exception {
        Path source = tempDir.resolve("source");
        GitSyncService sourceService = serviceFor(source);
        Files.writeString(source.resolve("contests.json"), "[]");
        assertTrue(sourceService.push(remote.toString(), null, "seed").isSuccess());

        Path copy = tempDir.resolve("copy");
        SyncResult pulled = serviceFor(copy).pull(remote.toString(), null);

        assertTrue(pulled.isSuccess(), pulled.getTranscript());
        assertEquals("[]", Files.readString(copy.resolve("contests.json")));
    }

    @Test
    void testOptionLikeBranchNeverReachesGit() throws Exception {
        Path data = tempDir.resolve("data");
        GitSyncService service = serviceFor(data);
        Path marker = tempDir.resolve("pwned");

        SyncResult result = service.pull(remote.toString(), "--upload-pack=touch " + marker + ";");

        assertEquals(SyncOutcome.FAILED, result.getOutcome());
        assertFalse(Files.exists(marker));
        assertEquals("main", service.currentConfig().getBranch());
    }
}
