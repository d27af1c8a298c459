package com.dcruver.compass.store;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * One markdown side-file per problem, holding its solution write-up.
 *
 * A missing file means "no solution yet". Blank text is never stored: writing it
 * deletes the file. This class does no locking of its own; {@link ProblemStore}
 * calls it while holding the collection lock.
 */
@Slf4j
public class SolutionStore {

    private static final String EXTENSION = ".md";

    @Getter
    private final Path directory;

    public SolutionStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    public void ensureExists() throws IOException {
        Files.createDirectories(directory);
    }

    /**
     * Whether the id can name a side-file inside the solutions directory.
     */
    public boolean isValidId(String id) {
        return id != null && !id.isBlank() && !id.contains("/") && !id.contains("\\")
            && !id.equals(".") && !id.equals("..");
    }

    public Path pathFor(String id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid record id for side-file: " + id);
        }
        return directory.resolve(id + EXTENSION);
    }

    /**
     * Create or overwrite the write-up. Blank text removes it instead.
     */
    public void write(String id, String text) throws IOException {
        if (text == null || text.isBlank()) {
            delete(id);
            return;
        }
        Path path = pathFor(id);
        Files.createDirectories(directory);
        Files.writeString(path, text, StandardCharsets.UTF_8);
        log.debug("Wrote solution for {} ({} chars)", id, text.length());
    }

    public Optional<String> read(String id) throws IOException {
        Path path = pathFor(id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public boolean exists(String id) {
        return isValidId(id) && Files.isRegularFile(pathFor(id));
    }

    public void delete(String id) throws IOException {
        if (Files.deleteIfExists(pathFor(id))) {
            log.debug("Deleted solution for {}", id);
        }
    }
}
