package com.dcruver.compass.service;

import com.dcruver.compass.model.Contest;
import com.dcruver.compass.store.ContestNormalizer;
import com.dcruver.compass.store.ContestStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class ContestService {

    private final ContestStore contestStore;
    private final ContestNormalizer normalizer;
    private final Clock clock;

    public List<Contest> list() throws IOException {
        return contestStore.loadAll();
    }

    public Contest get(String id) throws IOException {
        return contestStore.findById(id);
    }

    public Contest create(Contest draft) throws IOException {
        requireValid(draft);
        Instant now = clock.instant();
        Contest created = normalizer.normalize(draft.toBuilder()
            .id(UUID.randomUUID().toString())
            .name(draft.getName().trim())
            .createdAt(now)
            .updatedAt(now)
            .extras(new LinkedHashMap<>())
            .build());

        contestStore.update(records -> records.add(created));
        log.info("Created contest {} ({}, {} problems)", created.getId(), created.getName(), created.getTotalProblems());
        return created;
    }

    /**
     * Replace a contest's editable fields; the problem list is re-synced to the new size.
     */
    public Contest update(String id, Contest draft) throws IOException {
        requireValid(draft);
        Contest updated = contestStore.update(records -> {
            int index = contestStore.indexOf(records, id);
            Contest next = normalizer.normalize(records.get(index).toBuilder()
                .name(draft.getName().trim())
                .totalProblems(draft.getTotalProblems())
                .problems(draft.getProblems())
                .rankStr(draft.getRankStr())
                .summary(draft.getSummary())
                .updatedAt(clock.instant())
                .build());
            records.set(index, next);
            return next;
        });
        log.info("Updated contest {}", id);
        return updated;
    }

    public void delete(String id) throws IOException {
        contestStore.remove(id);
    }

    private static void requireValid(Contest draft) {
        if (draft == null || draft.getName() == null || draft.getName().isBlank()) {
            throw new IllegalArgumentException("Contest name must not be empty");
        }
        if (draft.getTotalProblems() < Contest.MIN_PROBLEMS || draft.getTotalProblems() > Contest.MAX_PROBLEMS) {
            throw new IllegalArgumentException("Contest must have between " + Contest.MIN_PROBLEMS
                + " and " + Contest.MAX_PROBLEMS + " problems");
        }
    }
}
