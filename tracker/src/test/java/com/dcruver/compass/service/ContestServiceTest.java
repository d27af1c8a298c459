package com.dcruver.compass.service;

import com.dcruver.compass.model.Contest;
import com.dcruver.compass.model.ContestProblem;
import com.dcruver.compass.model.ContestStatus;
import com.dcruver.compass.store.ContainerFile;
import com.dcruver.compass.store.ContestNormalizer;
import com.dcruver.compass.store.ContestStore;
import com.dcruver.compass.store.JsonRecordCodec;
import com.dcruver.compass.store.RecordNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContestServiceTest {

    private static final Instant NOW = Instant.parse("2025-02-01T08:30:00Z");

    private ContestService service;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        ContestNormalizer normalizer = new ContestNormalizer();
        ContestStore store = new ContestStore(new ContainerFile(tempDir.resolve("contests.json")),
            new JsonRecordCodec(), normalizer);
        store.initialize();
        service = new ContestService(store, normalizer, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCreateBuildsLetteredProblems() throws Exception {
        Contest created = service.create(Contest.builder().name(" ICPC Regional ").totalProblems(5).build());

        assertEquals("ICPC Regional", created.getName());
        assertEquals(5, created.getProblems().size());
        assertEquals("E", created.getProblems().get(4).getLetter());
        assertEquals(NOW, created.getCreatedAt());
        assertEquals(created, service.get(created.getId()));
    }

    @Test
    void testCreateRejectsInvalidDrafts() {
        assertThrows(IllegalArgumentException.class,
            () -> service.create(Contest.builder().name("x").totalProblems(0).build()));
        assertThrows(IllegalArgumentException.class,
            () -> service.create(Contest.builder().name("x").totalProblems(16).build()));
        assertThrows(IllegalArgumentException.class,
            () -> service.create(Contest.builder().name(" ").totalProblems(3).build()));
    }

    @Test
    void testResizeKeepsExistingEntries() throws Exception {
        Contest created = service.create(Contest.builder().name("Weekly").totalProblems(2).build());
        List<ContestProblem> problems = new ArrayList<>(created.getProblems());
        problems.set(0, problems.get(0).withStatus(ContestStatus.ACCEPTED).withPassCount(120));

        Contest grown = service.update(created.getId(), created.toBuilder().totalProblems(4).problems(problems).build());

        assertEquals(4, grown.getProblems().size());
        assertEquals(ContestStatus.ACCEPTED, grown.getProblems().get(0).getStatus());
        assertEquals(120, grown.getProblems().get(0).getPassCount());
        assertEquals("D", grown.getProblems().get(3).getLetter());
        assertEquals(1, service.get(created.getId()).getSolvedCount());

        Contest shrunk = service.update(created.getId(), grown.toBuilder().totalProblems(1).build());
        assertEquals(1, shrunk.getProblems().size());
    }

    @Test
    void testDelete() throws Exception {
        Contest created = service.create(Contest.builder().name("Weekly").totalProblems(2).build());

        service.delete(created.getId());

        assertThrows(RecordNotFoundException.class, () -> service.get(created.getId()));
        assertThrows(RecordNotFoundException.class, () -> service.delete(created.getId()));
    }
}
