package com.dcruver.compass.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SolutionStoreTest {

    private SolutionStore store;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        store = new SolutionStore(tempDir.resolve("solutions"));
        store.ensureExists();
    }

    @Test
    void testWriteReadDelete() throws Exception {
        store.write("abc", "# Idea\n\nUse a segment tree.\n");

        assertTrue(store.exists("abc"));
        assertEquals(Optional.of("# Idea\n\nUse a segment tree.\n"), store.read("abc"));
        assertTrue(Files.isRegularFile(tempDir.resolve("solutions/abc.md")));

        store.delete("abc");
        assertFalse(store.exists("abc"));
        assertEquals(Optional.empty(), store.read("abc"));
        store.delete("abc");
    }

    @Test
    void testBlankTextRemovesFile() throws Exception {
        store.write("abc", "draft");
        store.write("abc", "  \n\t ");

        assertFalse(store.exists("abc"));
        assertFalse(Files.exists(store.pathFor("abc")));
    }

    @Test
    void testIdsThatEscapeTheDirectoryAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.pathFor("../x"));
        assertThrows(IllegalArgumentException.class, () -> store.pathFor(".."));
        assertThrows(IllegalArgumentException.class, () -> store.pathFor(" "));
        assertFalse(store.exists(null));
        assertFalse(store.isValidId("a/b"));
    }
}
