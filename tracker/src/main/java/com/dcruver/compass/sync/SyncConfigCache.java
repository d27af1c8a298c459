package com.dcruver.compass.sync;

import com.dcruver.compass.model.SyncConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Remembers the last-used remote location and branch in a small JSON file.
 *
 * Loading never fails: a missing or unreadable file yields an empty remote and the
 * default branch.
 */
@Slf4j
public class SyncConfigCache {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Getter
    private final Path file;
    private final String defaultBranch;
    private final Clock clock;

    public SyncConfigCache(Path file, String defaultBranch, Clock clock) {
        this.file = file.toAbsolutePath().normalize();
        this.defaultBranch = defaultBranch;
        this.clock = clock;
    }

    public SyncConfig load() {
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SyncConfig config = objectMapper.readValue(file.toFile(), SyncConfig.class);
            if (config == null) {
                return defaults();
            }
            String remote = config.getRemote() != null ? config.getRemote().trim() : "";
            String branch = isBlank(config.getBranch()) ? defaultBranch : config.getBranch().trim();
            if (remote.startsWith("-") || branch.startsWith("-")) {
                log.warn("Ignoring sync config {} with an option-like remote or branch", file);
                return defaults();
            }
            return SyncConfig.builder()
                .remote(remote)
                .branch(branch)
                .lastUpdated(config.getLastUpdated())
                .build();
        } catch (IOException e) {
            log.warn("Ignoring unreadable sync config {}: {}", file, e.getMessage());
            return defaults();
        }
    }

    /**
     * Overwrite the cache with the given settings and a fresh timestamp.
     *
     * @throws IllegalArgumentException if the remote or branch starts with {@code -}
     */
    public SyncConfig save(String remote, String branch) throws IOException {
        String cleanRemote = remote != null ? remote.trim() : "";
        String cleanBranch = isBlank(branch) ? defaultBranch : branch.trim();
        if (cleanRemote.startsWith("-") || cleanBranch.startsWith("-")) {
            throw new IllegalArgumentException("Remote and branch must not start with '-'");
        }
        SyncConfig config = SyncConfig.builder()
            .remote(cleanRemote)
            .branch(cleanBranch)
            .lastUpdated(clock.instant().toString())
            .build();

        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), config);
        log.debug("Saved sync config to {}", file);
        return config;
    }

    private SyncConfig defaults() {
        return SyncConfig.builder().remote("").branch(defaultBranch).build();
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
