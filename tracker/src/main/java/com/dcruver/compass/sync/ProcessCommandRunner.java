package com.dcruver.compass.sync;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Blocks until the process exits;
 * stdout and stderr are drained concurrently so neither pipe can fill up and stall it.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    private final Map<String, String> environment;

    public ProcessCommandRunner() {
        this(Map.of());
    }

    public ProcessCommandRunner(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    @Override
    public CommandResult run(Path workingDirectory, List<String> command) {
        log.debug("Running {} in {}", command, workingDirectory);

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to start {}: {}", command.get(0), e.getMessage());
            return CommandResult.aborted(command, e.getMessage());
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", command.get(0), e.getMessage());
        }
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            String stdout = drain(process.getInputStream());
            int exitCode = process.waitFor();
            return CommandResult.builder()
                .command(List.copyOf(command))
                .exitCode(exitCode)
                .stdout(stdout)
                .stderr(stderr.get())
                .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CommandResult.aborted(command, "Interrupted while waiting for " + command.get(0));
        } catch (ExecutionException | UncheckedIOException e) {
            process.destroyForcibly();
            return CommandResult.aborted(command, "Failed to read output: " + e.getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
