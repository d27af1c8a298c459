package com.dcruver.compass.store;

import com.dcruver.compass.model.Problem;
import com.dcruver.compass.model.UnsolvedStage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upgrades a raw problem record of any vintage to the current {@link Problem} schema.
 *
 * Pure: the input map is not modified and nothing is written. Legacy inline solution
 * text is handed back in the {@link Migration} for the caller to store as a side-file.
 * Running the migrator on its own (serialized) output yields the same record.
 */
@Slf4j
public class ProblemMigrator {

    /** Legacy inline solution keys, in priority order. */
    static final List<String> LEGACY_SOLUTION_KEYS = List.of("solution_markdown", "solution_md", "solution");

    static final String LEGACY_STATUS = "status";
    static final String LEGACY_OWNER = "owner";

    private static final Set<String> KNOWN_KEYS = Set.of(
        "id", "title", "link", "source", "tags", "assignee", "solved", "unsolved_stage",
        "unsolved_custom_label", "pass_count", "notes", "created_at", "updated_at");

    public Migration<Problem> migrate(Map<String, Object> raw) {
        Map<String, Object> rec = new LinkedHashMap<>(raw);
        boolean changed = false;

        // 1. legacy inline solution; every legacy key is dropped so a later pass cannot extract again
        String extracted = null;
        for (String key : LEGACY_SOLUTION_KEYS) {
            if (!rec.containsKey(key)) {
                continue;
            }
            Object value = rec.remove(key);
            changed = true;
            if (extracted == null && value != null && !value.toString().isEmpty()) {
                extracted = value.toString();
                log.debug("Extracted legacy '{}' from problem {}", key, rec.get("id"));
            }
        }

        // 2. derived flag is never persisted
        if (rec.containsKey(Problem.HAS_SOLUTION)) {
            rec.remove(Problem.HAS_SOLUTION);
            changed = true;
        }

        Object owner = rec.remove(LEGACY_OWNER);
        if (owner != null) {
            changed = true;
        }

        // 3. solved, falling back to the legacy status text
        boolean solved = rec.containsKey("solved")
            ? RawValues.truthy(rec.get("solved"))
            : "done".equalsIgnoreCase(String.valueOf(rec.getOrDefault(LEGACY_STATUS, "")));

        // 4-5. unsolved metadata
        UnsolvedStage stage = UnsolvedStage.parse(RawValues.text(rec.get("unsolved_stage"))).orElse(null);
        String customLabel = RawValues.trimToNull(rec.get("unsolved_custom_label"));

        // 6-7. tags and pass count
        List<String> tags = RawValues.stringList(rec.get("tags"));
        Integer passCount = RawValues.nonNegativeInteger(rec.get("pass_count"));

        // 8. assignee, migrating the deprecated owner field
        Object assignee = rec.get("assignee");
        if (assignee == null && RawValues.truthy(owner)) {
            assignee = owner;
        }

        Map<String, Object> extras = new LinkedHashMap<>();
        rec.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extras.put(key, value);
            }
        });

        Problem problem = Problem.builder()
            .id(RawValues.text(rec.get("id")))
            .title(RawValues.text(rec.get("title")))
            .link(RawValues.text(rec.get("link")))
            .source(RawValues.text(rec.get("source")))
            .tags(tags)
            .assignee(RawValues.trimToNull(assignee))
            .solved(solved)
            .unsolvedStage(stage)
            .unsolvedCustomLabel(customLabel)
            .passCount(passCount)
            .notes(RawValues.text(rec.get("notes")))
            .createdAt(RawValues.instant(rec.get("created_at")))
            .updatedAt(RawValues.instant(rec.get("updated_at")))
            .extras(extras)
            .build();

        // 9. solved clears the unsolved metadata
        return new Migration<>(enforceInvariants(problem), extracted, changed);
    }

    /**
     * Apply the current schema's invariants to an already-typed record: optional text
     * trimmed to null, tags de-duplicated, and no unsolved metadata on a solved problem.
     */
    public Problem enforceInvariants(Problem problem) {
        Problem.ProblemBuilder builder = problem.toBuilder()
            .source(RawValues.trimToNull(problem.getSource()))
            .assignee(RawValues.trimToNull(problem.getAssignee()))
            .unsolvedCustomLabel(RawValues.trimToNull(problem.getUnsolvedCustomLabel()))
            .notes(RawValues.trimToNull(problem.getNotes()))
            .tags(RawValues.stringList(problem.getTags() != null ? problem.getTags() : new ArrayList<>()))
            .passCount(problem.getPassCount() != null && problem.getPassCount() >= 0 ? problem.getPassCount() : null)
            .extras(new LinkedHashMap<>(problem.getExtras() != null ? problem.getExtras() : Map.of()));

        if (problem.isSolved()) {
            builder.unsolvedStage(null).unsolvedCustomLabel(null);
        }
        return builder.build();
    }
}
