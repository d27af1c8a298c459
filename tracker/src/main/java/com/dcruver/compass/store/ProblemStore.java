package com.dcruver.compass.store;

import com.dcruver.compass.model.Problem;
import com.dcruver.compass.model.SolutionView;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The problem collection plus its solution side-files.
 *
 * This store is the only writer of the problems container and the solutions directory.
 * {@code hasSolution} is computed from side-file presence after the lock is released,
 * so a concurrent solution write may be reflected one read late.
 */
@Slf4j
public class ProblemStore extends RecordStore<Problem> {

    static final String IMPORT_BACKUP_SUFFIX = ".bak.json";

    private final ProblemMigrator migrator;
    private final SolutionStore solutions;

    public ProblemStore(ContainerFile container, JsonRecordCodec codec, ProblemMigrator migrator,
                        SolutionStore solutions) {
        super(container, codec);
        this.migrator = migrator;
        this.solutions = solutions;
    }

    @Override
    public void initialize() throws IOException {
        super.initialize();
        solutions.ensureExists();
    }

    @Override
    protected Migration<Problem> migrate(Map<String, Object> raw) {
        return migrator.migrate(raw);
    }

    @Override
    protected String idOf(Problem record) {
        return record.getId();
    }

    @Override
    protected String kind() {
        return "problem";
    }

    @Override
    protected void afterMigration(Migration<Problem> migration) throws IOException {
        String extracted = migration.getExtractedSolution();
        String id = migration.getRecord().getId();
        if (extracted != null && solutions.isValidId(id)) {
            solutions.write(id, extracted);
            log.info("Moved legacy inline solution of problem {} to {}", id, solutions.pathFor(id));
        } else if (extracted != null) {
            log.warn("Dropped legacy inline solution of a problem without a usable id '{}' ({} chars)",
                id, extracted.length());
        }
    }

    @Override
    protected void afterRemoval(Problem removed) throws IOException {
        if (solutions.isValidId(removed.getId())) {
            solutions.delete(removed.getId());
        }
    }

    @Override
    protected Set<String> derivedKeys() {
        return Set.of(Problem.HAS_SOLUTION);
    }

    @Override
    protected Problem decorate(Problem record) {
        boolean hasSolution = solutions.exists(record.getId());
        return record.withHasSolution(hasSolution);
    }

    public Problem withSolutionFlag(Problem record) {
        return decorate(record);
    }

    public SolutionView getSolution(String id) throws IOException {
        return locked(records -> {
            Problem problem = records.get(indexOf(records, id));
            Optional<String> markdown = solutions.read(id);
            return SolutionView.builder()
                .id(id)
                .markdown(markdown.orElse(""))
                .hasSolution(markdown.isPresent())
                .updatedAt(problem.getUpdatedAt())
                .build();
        });
    }

    /**
     * Store a problem's write-up and bump its {@code updatedAt}. Line endings are
     * normalized to LF; blank text deletes the side-file.
     */
    public SolutionView putSolution(String id, String markdown, Instant now) throws IOException {
        String normalized = markdown == null ? "" : markdown.replace("\r\n", "\n");
        return update(records -> {
            int index = indexOf(records, id);
            solutions.write(id, normalized);
            boolean hasSolution = !normalized.isBlank();
            records.set(index, records.get(index).withUpdatedAt(now));
            log.info("{} solution for problem {}", hasSolution ? "Saved" : "Cleared", id);
            return SolutionView.builder()
                .id(id)
                .markdown(hasSolution ? normalized : "")
                .hasSolution(hasSolution)
                .updatedAt(now)
                .build();
        });
    }

    public SolutionView deleteSolution(String id, Instant now) throws IOException {
        return putSolution(id, "", now);
    }

    /**
     * Every problem as stored, with its write-up inlined under {@code solution_markdown}.
     */
    public List<Map<String, Object>> export() throws IOException {
        return locked(records -> {
            List<Map<String, Object>> exported = new ArrayList<>(records.size());
            for (Problem problem : records) {
                Map<String, Object> raw = toRaw(problem);
                if (solutions.isValidId(problem.getId())) {
                    solutions.read(problem.getId())
                        .ifPresent(markdown -> raw.put(ProblemMigrator.LEGACY_SOLUTION_KEYS.get(0), markdown));
                }
                exported.add(raw);
            }
            return exported;
        });
    }

    /**
     * Replace the whole collection with imported records. The current container is first
     * copied to {@code problems.bak.json}; inline solutions become side-files. Records
     * without an identity or timestamps get fresh ones.
     *
     * @return number of records now in the collection
     */
    public int importAll(List<Map<String, Object>> payload, Instant now) throws IOException {
        return update(records -> {
            Path backup = container.copyTo(IMPORT_BACKUP_SUFFIX);
            List<Problem> imported = new ArrayList<>(payload.size());
            for (Map<String, Object> raw : payload) {
                Migration<Problem> migration = migrator.migrate(raw);
                Problem problem = migration.getRecord();
                if (!solutions.isValidId(problem.getId())) {
                    problem = problem.withId(UUID.randomUUID().toString());
                }
                if (problem.getCreatedAt() == null) {
                    problem = problem.withCreatedAt(now);
                }
                if (problem.getUpdatedAt() == null) {
                    problem = problem.withUpdatedAt(now);
                }
                if (migration.getExtractedSolution() != null) {
                    solutions.write(problem.getId(), migration.getExtractedSolution());
                }
                imported.add(problem);
            }
            records.clear();
            records.addAll(imported);
            log.info("Imported {} problem(s), previous collection saved to {}", imported.size(), backup);
            return imported.size();
        });
    }
}
