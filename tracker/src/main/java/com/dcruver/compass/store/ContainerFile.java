package com.dcruver.compass.store;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * The single file holding one record collection, plus its sibling backups.
 *
 * Writes go to a temporary sibling which then replaces the container in one move,
 * so a reader sees either the old or the new content.
 */
@Slf4j
public class ContainerFile {

    static final String EMPTY_CONTAINER = "[]";

    @Getter
    private final Path path;

    public ContainerFile(Path path) {
        this.path = path.toAbsolutePath().normalize();
    }

    /**
     * Create the parent directory and an empty container if the file does not exist.
     */
    public void ensureExists() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        if (!Files.exists(path)) {
            Files.writeString(path, EMPTY_CONTAINER, StandardCharsets.UTF_8);
            log.info("Created empty container: {}", path);
        }
    }

    public byte[] read() throws IOException {
        ensureExists();
        return Files.readAllBytes(path);
    }

    public void writeAtomically(byte[] content) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            out.write(content);
            out.flush();
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Path of the sibling backup with the given suffix, e.g. {@code problems.json} and
     * {@code .backup.json} give {@code problems.backup.json}.
     */
    public Path siblingPath(String suffix) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return path.resolveSibling(stem + suffix);
    }

    /**
     * Preserve the given bytes under a sibling backup name.
     */
    public Path backup(String suffix, byte[] content) throws IOException {
        Path backup = siblingPath(suffix);
        Files.write(backup, content);
        log.info("Created backup: {}", backup);
        return backup;
    }

    /**
     * Copy the current container to a sibling backup name.
     */
    public Path copyTo(String suffix) throws IOException {
        ensureExists();
        Path backup = siblingPath(suffix);
        Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
        log.info("Created backup: {}", backup);
        return backup;
    }
}
