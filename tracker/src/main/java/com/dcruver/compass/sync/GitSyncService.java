package com.dcruver.compass.sync;

import com.dcruver.compass.model.SyncConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Synchronizes the data directory with a remote git repository.
 *
 * Each operation runs a fixed sequence of git commands, appending every command's exit
 * code and raw output to a transcript. A failing step ends the sequence, except for the
 * two one-shot fallbacks: {@code push -u} after a failed push, and
 * {@code pull --allow-unrelated-histories} after a failed pull. Nothing is rolled back.
 *
 * Operations on one service instance are serialized by the service itself, so callers
 * sharing the bean need no coordination of their own. This lock is independent of the
 * record stores' locks.
 *
 * Branch names and remote locations end up as git arguments, so a value starting with
 * {@code -} is refused before any command runs.
 */
@Slf4j
public class GitSyncService {

    private static final DateTimeFormatter MESSAGE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final GitClient git;
    private final SyncConfigCache configCache;
    private final String remoteName;
    private final Clock clock;
    private final Lock syncLock = new ReentrantLock();

    public GitSyncService(GitClient git, SyncConfigCache configCache, String remoteName, Clock clock) {
        this.git = git;
        this.configCache = configCache;
        this.remoteName = remoteName;
        this.clock = clock;
    }

    /**
     * Make the data directory a repository (if it is not one yet) and point the remote
     * at {@code remoteUrl}. A blank {@code remoteUrl} skips remote configuration.
     */
    public SyncResult init(String remoteUrl, String branch) {
        return serialized("init", () -> {
            SyncTranscript transcript = new SyncTranscript();
            String resolvedRemote = trimToEmpty(remoteUrl);
            String resolvedBranch = resolveBranch(branch);
            SyncResult rejected = rejectUnsafe(resolvedRemote, resolvedBranch, transcript);
            if (rejected != null) {
                return rejected;
            }
            return initialize(resolvedRemote, resolvedBranch, transcript);
        });
    }

    /**
     * Stage everything, commit, and push. Returns {@link SyncOutcome#NO_CHANGES} without
     * committing when nothing is staged.
     */
    public SyncResult push(String remoteUrl, String branch, String message) {
        return serialized("push", () -> {
            SyncTranscript transcript = new SyncTranscript();
            String resolvedRemote = resolveRemote(remoteUrl);
            String resolvedBranch = resolveBranch(branch);
            SyncResult notReady = rejectUnsafe(resolvedRemote, resolvedBranch, transcript);
            if (notReady == null) {
                notReady = prepare(resolvedRemote, resolvedBranch, transcript);
            }
            if (notReady != null) {
                return notReady;
            }

            transcript.section("git add -A");
            CommandResult add = git.addAll();
            transcript.output(add);
            if (!add.isSuccess()) {
                transcript.failure("git add failed");
                return SyncResult.failed("add", transcript);
            }

            CommandResult diff = git.stagedFileNames();
            if (!diff.isSuccess()) {
                transcript.output(diff).failure("could not list staged changes");
                return SyncResult.failed("diff", transcript);
            }
            if (diff.getStdout().isBlank()) {
                transcript.note("No changes to commit");
                return SyncResult.noChanges(transcript);
            }
            transcript.line("Changed files:").line(diff.getStdout().strip());

            transcript.section("git commit");
            CommandResult commit = git.commit(isBlank(message) ? defaultCommitMessage() : message);
            transcript.output(commit);
            if (!commit.isSuccess()) {
                transcript.failure("git commit failed");
                return SyncResult.failed("commit", transcript);
            }

            transcript.section("git push " + remoteName + " " + resolvedBranch);
            CommandResult push = git.push(remoteName, resolvedBranch, false);
            transcript.output(push);
            if (push.isSuccess()) {
                transcript.ok("Pushed to remote");
                return SyncResult.success(transcript);
            }

            transcript.section("git push -u " + remoteName + " " + resolvedBranch);
            CommandResult upstream = git.push(remoteName, resolvedBranch, true);
            transcript.output(upstream);
            if (upstream.isSuccess()) {
                transcript.ok("Pushed to remote (upstream branch set)");
                return SyncResult.success(transcript);
            }
            transcript.failure("Push failed");
            return SyncResult.failed("push", transcript);
        });
    }

    /**
     * Pull from the remote, retrying once with {@code --allow-unrelated-histories}.
     */
    public SyncResult pull(String remoteUrl, String branch) {
        return serialized("pull", () -> {
            SyncTranscript transcript = new SyncTranscript();
            String resolvedRemote = resolveRemote(remoteUrl);
            String resolvedBranch = resolveBranch(branch);
            SyncResult notReady = rejectUnsafe(resolvedRemote, resolvedBranch, transcript);
            if (notReady == null) {
                notReady = prepare(resolvedRemote, resolvedBranch, transcript);
            }
            if (notReady != null) {
                return notReady;
            }

            transcript.section("git pull " + remoteName + " " + resolvedBranch);
            CommandResult pull = git.pull(remoteName, resolvedBranch, false);
            transcript.output(pull);
            if (pull.isSuccess()) {
                transcript.ok("Pulled remote changes");
                return SyncResult.success(transcript);
            }

            transcript.note("First pull into an independent history? Retrying with --allow-unrelated-histories");
            transcript.section("git pull " + remoteName + " " + resolvedBranch + " --allow-unrelated-histories");
            CommandResult unrelated = git.pull(remoteName, resolvedBranch, true);
            transcript.output(unrelated);
            if (unrelated.isSuccess()) {
                transcript.ok("Pulled remote changes");
                return SyncResult.success(transcript);
            }
            transcript.failure("Pull failed");
            return SyncResult.failed("pull", transcript);
        });
    }

    /**
     * Read-only summary: current branch, configured remote, and uncommitted changes.
     */
    public SyncResult status() {
        return serialized("status", () -> {
            SyncTranscript transcript = new SyncTranscript();
            if (!isRepository()) {
                transcript.note("Data directory " + git.getWorkingDirectory() + " is not a git repository yet");
                return SyncResult.success(transcript);
            }

            transcript.line("Data repository: " + git.getWorkingDirectory());
            CommandResult branch = git.currentBranch();
            if (branch.isSuccess()) {
                transcript.line("Branch: " + branch.getStdout().strip());
            }

            CommandResult remote = git.remoteGetUrl(remoteName);
            transcript.line("Remote: " + (remote.isSuccess() ? remote.getStdout().strip() : "not configured"));

            CommandResult status = git.statusShort();
            if (!status.isSuccess()) {
                transcript.output(status).failure("git status failed");
                return SyncResult.failed("status", transcript);
            }
            if (status.getStdout().isBlank()) {
                transcript.ok("Working tree clean");
            } else {
                transcript.line("Uncommitted changes:");
                transcript.line(status.getStdout().stripTrailing());
            }
            return SyncResult.success(transcript);
        });
    }

    public SyncConfig currentConfig() {
        return configCache.load();
    }

    private SyncResult initialize(String remoteUrl, String branch, SyncTranscript transcript) {
        if (isRepository()) {
            transcript.note("Data directory is already a git repository");
        } else {
            transcript.section("git init");
            CommandResult init = git.init();
            transcript.output(init);
            if (!init.isSuccess()) {
                transcript.failure("git init failed");
                return SyncResult.failed("init", transcript);
            }
            CommandResult head = git.pointHeadAt(branch);
            if (!head.isSuccess()) {
                transcript.output(head).failure("Could not switch the new repository to branch " + branch);
                return SyncResult.failed("init", transcript);
            }
            transcript.ok("Repository initialized on branch " + branch);
        }

        if (remoteUrl.isEmpty()) {
            transcript.note("No remote location supplied, skipping remote configuration");
            return SyncResult.success(transcript);
        }

        if (!configureRemote(remoteUrl, branch, transcript)) {
            return SyncResult.failed("remote", transcript);
        }
        return SyncResult.success(transcript);
    }

    /**
     * Bring the repository and remote up to date before a push or pull.
     *
     * @return null when ready, otherwise the result to return
     */
    private SyncResult prepare(String remoteUrl, String branch, SyncTranscript transcript) {
        if (!isRepository()) {
            SyncResult init = initialize(remoteUrl, branch, transcript);
            if (!init.isSuccess()) {
                return init;
            }
        } else if (!remoteUrl.isEmpty() && !configureRemote(remoteUrl, branch, transcript)) {
            return SyncResult.failed("remote", transcript);
        }

        if (!git.remoteGetUrl(remoteName).isSuccess()) {
            transcript.failure("Remote '" + remoteName + "' is not configured");
            transcript.line("Supply the repository location (for example https://github.com/<user>/<repo>.git "
                + "or git@github.com:<user>/<repo>.git) and run init first.");
            return SyncResult.remoteNotConfigured(transcript);
        }
        return null;
    }

    private boolean configureRemote(String remoteUrl, String branch, SyncTranscript transcript) {
        transcript.section("configure remote " + remoteName);
        boolean exists = git.remoteGetUrl(remoteName).isSuccess();
        CommandResult result = exists
            ? git.remoteSetUrl(remoteName, remoteUrl)
            : git.remoteAdd(remoteName, remoteUrl);
        transcript.line((exists ? "Updating remote URL: " : "Adding remote: ") + remoteUrl);
        if (!result.isSuccess()) {
            transcript.output(result).failure("Remote configuration failed");
            return false;
        }
        transcript.ok("Remote configured");

        try {
            configCache.save(remoteUrl, branch);
            transcript.ok("Settings saved to " + configCache.getFile().getFileName());
        } catch (IOException e) {
            log.warn("Could not save sync config {}: {}", configCache.getFile(), e.getMessage());
            transcript.failure("Could not save settings: " + e.getMessage());
        }
        return true;
    }

    /**
     * @return null when both values are safe to pass to git, otherwise the failed result
     */
    private SyncResult rejectUnsafe(String remoteUrl, String branch, SyncTranscript transcript) {
        if (remoteUrl.startsWith("-")) {
            transcript.failure("Refusing remote location starting with '-': " + remoteUrl);
            return SyncResult.failed("remote", transcript);
        }
        if (branch.isEmpty() || branch.startsWith("-")) {
            transcript.failure("Refusing invalid branch name: '" + branch + "'");
            return SyncResult.failed("branch", transcript);
        }
        CommandResult check = git.checkBranchName(branch);
        if (!check.isSuccess()) {
            transcript.output(check).failure("Invalid branch name: '" + branch + "'");
            return SyncResult.failed("branch", transcript);
        }
        return null;
    }

    private boolean isRepository() {
        CommandResult result = git.isInsideWorkTree();
        return result.isSuccess() && "true".equals(result.getStdout().strip());
    }

    private String resolveRemote(String remoteUrl) {
        return isBlank(remoteUrl) ? trimToEmpty(configCache.load().getRemote()) : remoteUrl.trim();
    }

    private String resolveBranch(String branch) {
        return isBlank(branch) ? configCache.load().getBranch() : branch.trim();
    }

    private String defaultCommitMessage() {
        return "update data (" + LocalDateTime.now(clock).format(MESSAGE_TIMESTAMP) + ")";
    }

    private SyncResult serialized(String operation, Supplier<SyncResult> body) {
        syncLock.lock();
        try {
            log.info("Sync {} in {}", operation, git.getWorkingDirectory());
            SyncResult result = body.get();
            if (result.isSuccess()) {
                log.info("Sync {} finished: {}", operation, result.getOutcome());
            } else {
                log.warn("Sync {} ended with {} at step {}", operation, result.getOutcome(), result.getFailedStep());
            }
            return result;
        } finally {
            syncLock.unlock();
        }
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static String trimToEmpty(String text) {
        return text == null ? "" : text.trim();
    }
}
