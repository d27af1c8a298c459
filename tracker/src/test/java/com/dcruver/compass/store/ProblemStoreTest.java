package com.dcruver.compass.store;

import com.dcruver.compass.model.Problem;
import com.dcruver.compass.model.SolutionView;
import com.dcruver.compass.model.UnsolvedStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the problem collection: self-healing loads, corruption recovery and
 * solution side-files.
 */
class ProblemStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private ProblemStore store;
    private SolutionStore solutions;
    private Path container;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        container = tempDir.resolve("problems.json");
        solutions = new SolutionStore(tempDir.resolve("solutions"));
        store = new ProblemStore(new ContainerFile(container), new JsonRecordCodec(), new ProblemMigrator(), solutions);
        store.initialize();
    }

    @Test
    void testInitializeCreatesEmptyContainer() throws Exception {
        assertEquals("[]", Files.readString(container));
        assertTrue(Files.isDirectory(tempDir.resolve("solutions")));
        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    void testCorruptContainerIsBackedUpAndReset() throws Exception {
        byte[] corrupt = "[{\"id\": \"p1\", \"title\": ".getBytes(StandardCharsets.UTF_8);
        Files.write(container, corrupt);

        List<Problem> problems = store.loadAll();

        assertTrue(problems.isEmpty());
        Path backup = tempDir.resolve("problems.backup.json");
        assertArrayEquals(corrupt, Files.readAllBytes(backup));
        assertEquals(List.of(), new JsonRecordCodec().decode(Files.readAllBytes(container)));

        store.saveAll(List.of(Problem.builder().id("p2").title("After reset").build()));

        List<Map<String, Object>> saved = new JsonRecordCodec().decode(Files.readAllBytes(container));
        assertEquals(1, saved.size());
        assertEquals("After reset", saved.get(0).get("title"));
        assertEquals("After reset", store.findById("p2").getTitle());
        assertArrayEquals(corrupt, Files.readAllBytes(backup));
    }

    @Test
    void testLegacyRecordMigratesOnceThenLoadsByteIdentical() throws Exception {
        Files.writeString(container, """
            [
              {"id": "p1", "title": "Two Sum", "status": "Done", "solution_markdown": "# notes"}
            ]
            """);

        Problem problem = store.findById("p1");

        assertTrue(problem.isSolved());
        assertNull(problem.getUnsolvedStage());
        assertNull(problem.getUnsolvedCustomLabel());
        assertTrue(problem.isHasSolution());
        assertEquals("# notes", Files.readString(tempDir.resolve("solutions/p1.md")));

        byte[] afterFirstLoad = Files.readAllBytes(container);
        assertFalse(new String(afterFirstLoad, StandardCharsets.UTF_8).contains("solution_markdown"));

        store.loadAll();
        assertArrayEquals(afterFirstLoad, Files.readAllBytes(container));
    }

    @Test
    void testHasSolutionIsNeverStored() throws Exception {
        store.saveAll(List.of(Problem.builder().id("p1").title("A").hasSolution(true).build()));

        String stored = Files.readString(container);
        assertFalse(stored.contains(Problem.HAS_SOLUTION));
        assertFalse(store.findById("p1").isHasSolution());
    }

    @Test
    void testWhitespaceSolutionMeansNoSolution() throws Exception {
        store.saveAll(List.of(Problem.builder().id("p1").title("A").build()));

        store.putSolution("p1", "first draft", NOW);
        assertTrue(store.findById("p1").isHasSolution());

        SolutionView view = store.putSolution("p1", "   \n ", NOW);

        assertFalse(view.isHasSolution());
        assertFalse(store.findById("p1").isHasSolution());
        assertFalse(Files.exists(tempDir.resolve("solutions/p1.md")));
        assertEquals(NOW, store.findById("p1").getUpdatedAt());
    }

    @Test
    void testSolutionLineEndingsNormalized() throws Exception {
        store.saveAll(List.of(Problem.builder().id("p1").title("A").build()));

        store.putSolution("p1", "line one\r\nline two\r\n", NOW);

        assertEquals("line one\nline two\n", store.getSolution("p1").getMarkdown());
    }

    @Test
    void testMissingRecordIsNotFound() throws Exception {
        RecordNotFoundException e = assertThrows(RecordNotFoundException.class, () -> store.findById("nope"));
        assertEquals("nope", e.getId());
        assertThrows(RecordNotFoundException.class, () -> store.getSolution("nope"));
        assertThrows(RecordNotFoundException.class, () -> store.putSolution("nope", "x", NOW));
        assertThrows(RecordNotFoundException.class, () -> store.remove("nope"));
    }

    @Test
    void testRemoveDeletesSideFile() throws Exception {
        store.saveAll(List.of(Problem.builder().id("p1").title("A").build()));
        store.putSolution("p1", "text", NOW);

        store.remove("p1");

        assertTrue(store.loadAll().isEmpty());
        assertFalse(solutions.exists("p1"));
    }

    @Test
    void testUnknownKeysSurviveRewrite() throws Exception {
        Files.writeString(container, """
            [{"id": "p1", "title": "A", "owner": "dan", "difficulty": 1800}]
            """);

        store.update(records -> records.set(0, records.get(0).withUnsolvedStage(UnsolvedStage.UNSEEN)));

        Map<String, Object> stored = new JsonRecordCodec().decode(Files.readAllBytes(container)).get(0);
        assertEquals(1800, stored.get("difficulty"));
        assertEquals("dan", stored.get("assignee"));
        assertEquals("unseen", stored.get("unsolved_stage"));
        assertFalse(stored.containsKey("owner"));
    }

    @Test
    void testConcurrentAppendsAreAllKept() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = "p" + i;
                futures.add(executor.submit(() ->
                    store.update(records -> records.add(Problem.builder().id(id).title(id).build()))));
            }
            for (Future<Boolean> future : futures) {
                assertTrue(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(40, store.loadAll().size());
    }

    @Test
    void testExportInlinesSolutions() throws Exception {
        store.saveAll(List.of(
            Problem.builder().id("p1").title("A").build(),
            Problem.builder().id("p2").title("B").build()));
        store.putSolution("p1", "# write-up", NOW);

        List<Map<String, Object>> exported = store.export();

        assertEquals("# write-up", exported.get(0).get("solution_markdown"));
        assertFalse(exported.get(1).containsKey("solution_markdown"));
        assertFalse(exported.get(0).containsKey(Problem.HAS_SOLUTION));
    }

    @Test
    void testImportReplacesCollectionAndKeepsBackup() throws Exception {
        store.saveAll(List.of(Problem.builder().id("old").title("Old").build()));
        String before = Files.readString(container);

        int count = store.importAll(List.of(
            Map.of("id", "n1", "title", "New", "solution_md", "imported text"),
            Map.of("title", "No id")), NOW);

        assertEquals(2, count);
        assertEquals(before, Files.readString(tempDir.resolve("problems.bak.json")));

        List<Problem> problems = store.loadAll();
        assertEquals(2, problems.size());
        assertEquals("n1", problems.get(0).getId());
        assertTrue(problems.get(0).isHasSolution());
        assertEquals("imported text", solutions.read("n1").orElseThrow());
        assertNotNull(problems.get(1).getId());
        assertEquals(NOW, problems.get(1).getCreatedAt());
        assertThrows(RecordNotFoundException.class, () -> store.findById("old"));
    }
}
