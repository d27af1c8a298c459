package com.dcruver.compass.store;

import com.dcruver.compass.model.Contest;
import com.dcruver.compass.model.ContestProblem;
import com.dcruver.compass.model.ContestStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes contest records so the problem list always matches {@code totalProblems}.
 */
public class ContestNormalizer {

    private static final String LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final Set<String> KNOWN_KEYS = Set.of(
        "id", "name", "total_problems", "problems", "rank_str", "summary", "created_at", "updated_at");

    public Migration<Contest> normalize(Map<String, Object> raw) {
        Integer declared = RawValues.clampedInteger(raw.get("total_problems"), Contest.MIN_PROBLEMS, Contest.MAX_PROBLEMS);
        int totalProblems = declared == null ? Contest.MIN_PROBLEMS : declared;

        List<ContestProblem> problems = new ArrayList<>();
        if (raw.get("problems") instanceof List<?> entries) {
            for (Object entry : entries) {
                problems.add(entry instanceof Map<?, ?> map ? toProblem(map) : null);
            }
        }

        Map<String, Object> extras = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extras.put(key, value);
            }
        });

        Contest contest = Contest.builder()
            .id(RawValues.text(raw.get("id")))
            .name(RawValues.text(raw.get("name")))
            .totalProblems(totalProblems)
            .problems(problems)
            .rankStr(RawValues.text(raw.get("rank_str")))
            .summary(RawValues.text(raw.get("summary")))
            .createdAt(RawValues.instant(raw.get("created_at")))
            .updatedAt(RawValues.instant(raw.get("updated_at")))
            .extras(extras)
            .build();

        return Migration.of(normalize(contest), false);
    }

    /**
     * Clamp {@code totalProblems} to 1..15 and resize the problem list to match,
     * assigning letters by position. Missing or null entries become blank entries.
     */
    public Contest normalize(Contest contest) {
        int total = Math.max(Contest.MIN_PROBLEMS, Math.min(Contest.MAX_PROBLEMS, contest.getTotalProblems()));
        List<ContestProblem> current = contest.getProblems() != null ? contest.getProblems() : List.of();

        List<ContestProblem> resized = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            String letter = letterAt(i);
            ContestProblem existing = i < current.size() ? current.get(i) : null;
            if (existing == null) {
                resized.add(ContestProblem.blank(letter));
                continue;
            }
            resized.add(existing.toBuilder()
                .letter(letter)
                .passCount(Math.max(0, existing.getPassCount()))
                .attemptCount(Math.max(0, existing.getAttemptCount()))
                .status(existing.getStatus() != null ? existing.getStatus() : ContestStatus.UNSUBMITTED)
                .build());
        }

        return contest.toBuilder()
            .totalProblems(total)
            .problems(resized)
            .extras(new LinkedHashMap<>(contest.getExtras() != null ? contest.getExtras() : Map.of()))
            .build();
    }

    private ContestProblem toProblem(Map<?, ?> entry) {
        Integer passCount = RawValues.nonNegativeInteger(entry.get("pass_count"));
        Integer attemptCount = RawValues.nonNegativeInteger(entry.get("attempt_count"));
        return ContestProblem.builder()
            .passCount(passCount != null ? passCount : 0)
            .attemptCount(attemptCount != null ? attemptCount : 0)
            .status(ContestStatus.parse(RawValues.text(entry.get("my_status"))).orElse(ContestStatus.UNSUBMITTED))
            .build();
    }

    static String letterAt(int index) {
        return String.valueOf(LETTERS.charAt(index));
    }
}
