package com.dcruver.compass.sync;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The git subcommands the sync orchestrator uses, run in one working directory.
 */
@Slf4j
public class GitClient {

    private final CommandRunner runner;
    private final String executable;

    @Getter
    private final Path workingDirectory;

    public GitClient(CommandRunner runner, String executable, Path workingDirectory) {
        this.runner = runner;
        this.executable = executable;
        this.workingDirectory = workingDirectory;
    }

    public CommandResult isInsideWorkTree() {
        return git("rev-parse", "--is-inside-work-tree");
    }

    public CommandResult currentBranch() {
        return git("rev-parse", "--abbrev-ref", "HEAD");
    }

    public CommandResult init() {
        return git("init");
    }

    /**
     * Point HEAD of a freshly initialized repository at {@code branch}, whatever git's
     * default initial branch is.
     */
    public CommandResult pointHeadAt(String branch) {
        return git("symbolic-ref", "HEAD", "refs/heads/" + branch);
    }

    /**
     * Exit code 0 when {@code branch} is a valid branch name.
     */
    public CommandResult checkBranchName(String branch) {
        return git("check-ref-format", "--branch", branch);
    }

    public CommandResult remoteGetUrl(String remote) {
        return git("remote", "get-url", remote);
    }

    public CommandResult remoteAdd(String remote, String url) {
        return git("remote", "add", remote, url);
    }

    public CommandResult remoteSetUrl(String remote, String url) {
        return git("remote", "set-url", remote, url);
    }

    public CommandResult addAll() {
        return git("add", "-A");
    }

    public CommandResult stagedFileNames() {
        return git("diff", "--cached", "--name-only");
    }

    /**
     * Commit with the message passed as a single argument, verbatim.
     */
    public CommandResult commit(String message) {
        return git("commit", "-m", message);
    }

    public CommandResult push(String remote, String branch, boolean setUpstream) {
        return setUpstream
            ? git("push", "-u", remote, branch)
            : git("push", remote, branch);
    }

    public CommandResult pull(String remote, String branch, boolean allowUnrelatedHistories) {
        return allowUnrelatedHistories
            ? git("pull", remote, branch, "--allow-unrelated-histories")
            : git("pull", remote, branch);
    }

    public CommandResult statusShort() {
        return git("status", "--short");
    }

    private CommandResult git(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(executable);
        command.addAll(List.of(args));
        CommandResult result = runner.run(workingDirectory, command);
        log.debug("{} -> exit {}", result.commandLine(), result.getExitCode());
        return result;
    }
}
