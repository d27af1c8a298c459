package com.dcruver.compass.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessCommandRunnerTest {

    private ProcessCommandRunner runner;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs a POSIX shell");
        runner = new ProcessCommandRunner(Map.of("COMPASS_TEST_VAR", "from-env"));
    }

    @Test
    void testCapturesExitCodeAndBothStreams() {
        CommandResult result = runner.run(tempDir,
            List.of("/bin/sh", "-c", "echo out; echo err >&2; echo $COMPASS_TEST_VAR; exit 3"));

        assertEquals(3, result.getExitCode());
        assertFalse(result.isSuccess());
        assertEquals("out\nfrom-env\n", result.getStdout());
        assertEquals("err\n", result.getStderr());
    }

    @Test
    void testArgumentsAreNotReinterpreted() {
        String payload = "say \"hi\"; touch injected $(id)";

        CommandResult result = runner.run(tempDir, List.of("/bin/sh", "-c", "printf '%s' \"$1\"", "sh", payload));

        assertTrue(result.isSuccess());
        assertEquals(payload, result.getStdout());
        assertFalse(Files.exists(tempDir.resolve("injected")));
    }

    @Test
    void testRunsInWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "x");

        CommandResult result = runner.run(tempDir, List.of("/bin/sh", "-c", "ls"));

        assertTrue(result.getStdout().contains("marker.txt"));
    }

    @Test
    void testMissingExecutableIsAborted() {
        CommandResult result = runner.run(tempDir, List.of("/definitely/not/a/git-binary", "status"));

        assertEquals(CommandResult.ABORTED, result.getExitCode());
        assertFalse(result.getStderr().isEmpty());
    }
}
