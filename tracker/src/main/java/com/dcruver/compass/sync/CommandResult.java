package com.dcruver.compass.sync;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Exit code and captured output of one external command.
 */
@Value
@Builder
public class CommandResult {
    /** Exit code reported when the process could not be started or waited for. */
    public static final int ABORTED = -1;

    List<String> command;
    int exitCode;
    @Builder.Default
    String stdout = "";
    @Builder.Default
    String stderr = "";

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String commandLine() {
        return String.join(" ", command);
    }

    public static CommandResult aborted(List<String> command, String reason) {
        return CommandResult.builder()
            .command(List.copyOf(command))
            .exitCode(ABORTED)
            .stderr(reason)
            .build();
    }
}
