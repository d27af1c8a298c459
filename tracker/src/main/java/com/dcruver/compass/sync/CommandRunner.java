package com.dcruver.compass.sync;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command as an argument vector; no shell is involved,
 * so argument text is never re-parsed.
 */
@FunctionalInterface
public interface CommandRunner {

    CommandResult run(Path workingDirectory, List<String> command);
}
