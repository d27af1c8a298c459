package com.dcruver.compass.sync;

import com.dcruver.compass.model.SyncConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SyncConfigCacheTest {

    private Path file;
    private SyncConfigCache cache;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("nested/.git_config.json");
        cache = new SyncConfigCache(file, "main",
            Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testMissingFileGivesDefaults() {
        SyncConfig config = cache.load();

        assertEquals("", config.getRemote());
        assertEquals("main", config.getBranch());
        assertNull(config.getLastUpdated());
    }

    @Test
    void testSaveWritesOriginalKeys() throws Exception {
        cache.save(" https://example.com/data.git ", "dev");

        JsonNode stored = new ObjectMapper().readTree(file.toFile());
        assertEquals("https://example.com/data.git", stored.get("repo_url").asText());
        assertEquals("dev", stored.get("branch").asText());
        assertEquals("2025-01-15T10:00:00Z", stored.get("last_updated").asText());

        SyncConfig loaded = cache.load();
        assertEquals("https://example.com/data.git", loaded.getRemote());
        assertEquals("dev", loaded.getBranch());
    }

    @Test
    void testUnreadableFileGivesDefaults() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ broken");

        assertEquals("", cache.load().getRemote());
    }

    @Test
    void testBlankBranchFallsBackToDefault() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"repo_url\": \"u\", \"branch\": \"\", \"extra\": 1}");

        SyncConfig config = cache.load();
        assertEquals("u", config.getRemote());
        assertEquals("main", config.getBranch());
    }

    @Test
    void testOptionLikeValuesAreNeverSavedOrLoaded() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> cache.save("u", "--upload-pack=evil"));
        assertThrows(IllegalArgumentException.class, () -> cache.save("-oProxyCommand=evil", "main"));
        assertFalse(Files.exists(file));

        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"repo_url\": \"u\", \"branch\": \"--upload-pack=evil\"}");

        SyncConfig config = cache.load();
        assertEquals("", config.getRemote());
        assertEquals("main", config.getBranch());
    }
}
