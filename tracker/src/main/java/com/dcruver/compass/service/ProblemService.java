package com.dcruver.compass.service;

import com.dcruver.compass.model.Problem;
import com.dcruver.compass.model.SolutionView;
import com.dcruver.compass.store.ProblemMigrator;
import com.dcruver.compass.store.ProblemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Problem operations as the operator surface sees them: identities and timestamps are
 * assigned here, and every mutation is one atomic read-modify-write on the store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProblemService {

    private final ProblemStore problemStore;
    private final ProblemMigrator migrator;
    private final Clock clock;

    public List<Problem> list() throws IOException {
        return problemStore.loadAll();
    }

    public Problem get(String id) throws IOException {
        return problemStore.findById(id);
    }

    /**
     * Create a problem from the editable fields of {@code draft}.
     */
    public Problem create(Problem draft) throws IOException {
        requireTitle(draft);
        Instant now = clock.instant();
        Problem created = migrator.enforceInvariants(draft.toBuilder()
            .id(UUID.randomUUID().toString())
            .title(draft.getTitle().trim())
            .createdAt(now)
            .updatedAt(now)
            .hasSolution(false)
            .extras(new LinkedHashMap<>())
            .build());

        problemStore.update(records -> records.add(created));
        log.info("Created problem {} ({})", created.getId(), created.getTitle());
        return problemStore.withSolutionFlag(created);
    }

    /**
     * Replace the editable fields of an existing problem. Solving it clears its
     * unsolved stage and label.
     */
    public Problem update(String id, Problem draft) throws IOException {
        requireTitle(draft);
        Problem updated = problemStore.update(records -> {
            int index = problemStore.indexOf(records, id);
            Problem next = migrator.enforceInvariants(records.get(index).toBuilder()
                .title(draft.getTitle().trim())
                .link(draft.getLink())
                .source(draft.getSource())
                .tags(draft.getTags())
                .assignee(draft.getAssignee())
                .solved(draft.isSolved())
                .unsolvedStage(draft.getUnsolvedStage())
                .unsolvedCustomLabel(draft.getUnsolvedCustomLabel())
                .passCount(draft.getPassCount())
                .notes(draft.getNotes())
                .updatedAt(clock.instant())
                .build());
            records.set(index, next);
            return next;
        });
        log.info("Updated problem {}", id);
        return problemStore.withSolutionFlag(updated);
    }

    public void delete(String id) throws IOException {
        problemStore.remove(id);
    }

    public SolutionView getSolution(String id) throws IOException {
        return problemStore.getSolution(id);
    }

    public SolutionView putSolution(String id, String markdown) throws IOException {
        return problemStore.putSolution(id, markdown, clock.instant());
    }

    public SolutionView deleteSolution(String id) throws IOException {
        return problemStore.deleteSolution(id, clock.instant());
    }

    public List<Map<String, Object>> export() throws IOException {
        return problemStore.export();
    }

    public int importAll(List<Map<String, Object>> payload) throws IOException {
        return problemStore.importAll(payload, clock.instant());
    }

    private static void requireTitle(Problem draft) {
        if (draft == null || draft.getTitle() == null || draft.getTitle().isBlank()) {
            throw new IllegalArgumentException("Problem title must not be empty");
        }
    }
}
