package com.dcruver.compass.app;

import com.dcruver.compass.model.SyncConfig;
import com.dcruver.compass.sync.GitSyncService;
import com.dcruver.compass.sync.SyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Spring Shell commands for syncing the data directory through git.
 * Omitted remote and branch options fall back to the last-used values.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class SyncShellCommands {

    private final GitSyncService syncService;

    @ShellMethod(key = "sync init", value = "Initialize the data repository and configure its remote")
    public String init(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Repository URL") String remote,
        @ShellOption(defaultValue = ShellOption.NULL) String branch
    ) {
        if (remote == null || remote.isBlank()) {
            return "Please supply --remote with the repository location.";
        }
        return render(syncService.init(remote, branch));
    }

    @ShellMethod(key = "sync push", value = "Commit all data changes and push them")
    public String push(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Repository URL") String remote,
        @ShellOption(defaultValue = ShellOption.NULL) String branch,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Commit message") String message
    ) {
        return render(syncService.push(remote, branch, message));
    }

    @ShellMethod(key = "sync pull", value = "Pull remote data changes")
    public String pull(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Repository URL") String remote,
        @ShellOption(defaultValue = ShellOption.NULL) String branch
    ) {
        return render(syncService.pull(remote, branch));
    }

    @ShellMethod(key = "sync status", value = "Show branch, remote and uncommitted changes of the data repository")
    public String status() {
        return render(syncService.status());
    }

    @ShellMethod(key = "sync config", value = "Show the cached remote and branch")
    public String config() {
        SyncConfig config = syncService.currentConfig();
        return String.format("Remote: %s\nBranch: %s\nLast updated: %s\n",
            config.getRemote().isEmpty() ? "not configured" : config.getRemote(),
            config.getBranch(),
            config.getLastUpdated() != null ? config.getLastUpdated() : "never");
    }

    private String render(SyncResult result) {
        if (result.isSuccess()) {
            return result.getTranscript();
        }
        return result.getTranscript() + "\nSync " + result.getOutcome() + " at step '" + result.getFailedStep() + "'\n";
    }
}
