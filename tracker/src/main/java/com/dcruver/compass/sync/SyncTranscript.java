package com.dcruver.compass.sync;

/**
 * Human-readable, cumulative log of a sync operation.
 */
class SyncTranscript {

    private final StringBuilder text = new StringBuilder();

    SyncTranscript section(String title) {
        if (text.length() > 0 && !endsWithBlankLine()) {
            text.append('\n');
        }
        text.append("=== ").append(title).append(" ===\n");
        return this;
    }

    SyncTranscript line(String line) {
        text.append(line).append('\n');
        return this;
    }

    SyncTranscript ok(String message) {
        return line("✓ " + message);
    }

    SyncTranscript failure(String message) {
        return line("✗ " + message);
    }

    SyncTranscript note(String message) {
        return line("ℹ " + message);
    }

    /**
     * Append a command's exit code and its raw stdout/stderr, unedited.
     */
    SyncTranscript output(CommandResult result) {
        line("$ " + result.commandLine());
        line("Return code: " + result.getExitCode());
        if (!result.getStdout().isBlank()) {
            line("stdout:");
            text.append(result.getStdout());
            if (!result.getStdout().endsWith("\n")) {
                text.append('\n');
            }
        }
        if (!result.getStderr().isBlank()) {
            line("stderr:");
            text.append(result.getStderr());
            if (!result.getStderr().endsWith("\n")) {
                text.append('\n');
            }
        }
        return this;
    }

    private boolean endsWithBlankLine() {
        int length = text.length();
        return length >= 2 && text.charAt(length - 1) == '\n' && text.charAt(length - 2) == '\n';
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
