package com.dcruver.compass.app;

import com.dcruver.compass.model.Contest;
import com.dcruver.compass.model.ContestProblem;
import com.dcruver.compass.model.ContestStatus;
import com.dcruver.compass.model.Problem;
import com.dcruver.compass.model.SolutionView;
import com.dcruver.compass.model.UnsolvedStage;
import com.dcruver.compass.service.ContestService;
import com.dcruver.compass.service.ProblemService;
import com.dcruver.compass.store.JsonRecordCodec;
import com.dcruver.compass.store.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Spring Shell commands for problems, solutions and contests.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class TrackerShellCommands {

    private final ProblemService problemService;
    private final ContestService contestService;
    private final JsonRecordCodec codec;

    @ShellMethod(key = "problems list", value = "List tracked problems")
    public String problemsList(
        @ShellOption(defaultValue = "false", help = "Only unsolved problems") boolean unsolved,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Only problems assigned to this person") String assignee
    ) {
        try {
            List<Problem> problems = problemService.list().stream()
                .filter(p -> !unsolved || !p.isSolved())
                .filter(p -> assignee == null || assignee.equalsIgnoreCase(p.getAssignee()))
                .toList();

            if (problems.isEmpty()) {
                return "No problems.";
            }

            StringBuilder sb = new StringBuilder();
            for (Problem problem : problems) {
                sb.append(String.format("%s %s  %s%s%s\n",
                    problem.isSolved() ? "✓" : "·",
                    problem.getId(),
                    problem.getTitle(),
                    problem.getAssignee() != null ? "  @" + problem.getAssignee() : "",
                    problem.isHasSolution() ? "  [solution]" : ""));
            }
            sb.append(String.format("\nTotal: %d problems\n", problems.size()));
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to list problems", e);
            return "Failed to list problems: " + e.getMessage();
        }
    }

    @ShellMethod(key = "problems show", value = "Show one problem")
    public String problemsShow(@ShellOption String id) {
        try {
            return describe(problemService.get(id));
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to show problem", e);
            return "Failed to show problem: " + e.getMessage();
        }
    }

    @ShellMethod(key = "problems add", value = "Track a new problem")
    public String problemsAdd(
        @ShellOption String title,
        @ShellOption(defaultValue = ShellOption.NULL) String link,
        @ShellOption(defaultValue = ShellOption.NULL) String source,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Comma-separated tags") String tags,
        @ShellOption(defaultValue = ShellOption.NULL) String assignee,
        @ShellOption(defaultValue = ShellOption.NULL, help = "How many contestants passed it") Integer passCount,
        @ShellOption(defaultValue = ShellOption.NULL) String notes
    ) {
        try {
            Problem created = problemService.create(Problem.builder()
                .title(title)
                .link(link)
                .source(source)
                .tags(splitTags(tags))
                .assignee(assignee)
                .passCount(passCount)
                .notes(notes)
                .build());
            return "✓ Created problem " + created.getId();
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to add problem", e);
            return "Failed to add problem: " + e.getMessage();
        }
    }

    @ShellMethod(key = "problems edit", value = "Change fields of a problem; omitted options keep their value")
    public String problemsEdit(
        @ShellOption String id,
        @ShellOption(defaultValue = ShellOption.NULL) String title,
        @ShellOption(defaultValue = ShellOption.NULL) String link,
        @ShellOption(defaultValue = ShellOption.NULL) String source,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Comma-separated tags") String tags,
        @ShellOption(defaultValue = ShellOption.NULL) String assignee,
        @ShellOption(defaultValue = ShellOption.NULL, arity = 1) Boolean solved,
        @ShellOption(defaultValue = ShellOption.NULL, help = "unseen, seen_no_idea or knows_approach_not_implemented") String stage,
        @ShellOption(defaultValue = ShellOption.NULL) String label,
        @ShellOption(defaultValue = ShellOption.NULL) Integer passCount,
        @ShellOption(defaultValue = ShellOption.NULL) String notes
    ) {
        try {
            Problem current = problemService.get(id);
            Problem.ProblemBuilder draft = current.toBuilder();
            if (title != null) draft.title(title);
            if (link != null) draft.link(link);
            if (source != null) draft.source(source);
            if (tags != null) draft.tags(splitTags(tags));
            if (assignee != null) draft.assignee(assignee);
            if (solved != null) draft.solved(solved);
            if (stage != null) {
                draft.unsolvedStage(UnsolvedStage.parse(stage)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + stage)));
            }
            if (label != null) draft.unsolvedCustomLabel(label);
            if (passCount != null) draft.passCount(passCount);
            if (notes != null) draft.notes(notes);

            return describe(problemService.update(id, draft.build()));
        } catch (RecordNotFoundException | IllegalArgumentException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to edit problem", e);
            return "Failed to edit problem: " + e.getMessage();
        }
    }

    @ShellMethod(key = "problems delete", value = "Delete a problem and its solution")
    public String problemsDelete(@ShellOption String id) {
        try {
            problemService.delete(id);
            return "✓ Deleted problem " + id;
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to delete problem", e);
            return "Failed to delete problem: " + e.getMessage();
        }
    }

    @ShellMethod(key = "solution show", value = "Print a problem's solution write-up")
    public String solutionShow(@ShellOption String id) {
        try {
            SolutionView solution = problemService.getSolution(id);
            return solution.isHasSolution() ? solution.getMarkdown() : "No solution yet for " + id;
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to show solution", e);
            return "Failed to show solution: " + e.getMessage();
        }
    }

    @ShellMethod(key = "solution set", value = "Store a solution write-up from text or a markdown file")
    public String solutionSet(
        @ShellOption String id,
        @ShellOption(defaultValue = ShellOption.NULL) String text,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Markdown file to read") String file
    ) {
        try {
            String markdown = file != null ? Files.readString(Path.of(file), StandardCharsets.UTF_8) : text;
            SolutionView solution = problemService.putSolution(id, markdown);
            return solution.isHasSolution()
                ? "✓ Saved solution for " + id
                : "Solution was blank; removed solution for " + id;
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to set solution", e);
            return "Failed to set solution: " + e.getMessage();
        }
    }

    @ShellMethod(key = "solution clear", value = "Remove a problem's solution write-up")
    public String solutionClear(@ShellOption String id) {
        try {
            problemService.deleteSolution(id);
            return "✓ Removed solution for " + id;
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to clear solution", e);
            return "Failed to clear solution: " + e.getMessage();
        }
    }

    @ShellMethod(key = "problems export", value = "Write all problems, solutions inlined, to a JSON file")
    public String problemsExport(@ShellOption String file) {
        try {
            List<Map<String, Object>> exported = problemService.export();
            Files.write(Path.of(file), codec.encode(exported));
            return String.format("✓ Exported %d problems to %s", exported.size(), file);
        } catch (Exception e) {
            log.error("Failed to export problems", e);
            return "Failed to export problems: " + e.getMessage();
        }
    }

    @ShellMethod(key = "problems import", value = "Replace all problems with the contents of a JSON file")
    public String problemsImport(@ShellOption String file) {
        try {
            List<Map<String, Object>> payload = codec.decode(Files.readAllBytes(Path.of(file)));
            int count = problemService.importAll(payload);
            return String.format("✓ Replaced collection with %d problems (previous data kept in problems.bak.json)", count);
        } catch (Exception e) {
            log.error("Failed to import problems", e);
            return "Failed to import problems: " + e.getMessage();
        }
    }

    @ShellMethod(key = "contests list", value = "List contests")
    public String contestsList() {
        try {
            List<Contest> contests = contestService.list();
            if (contests.isEmpty()) {
                return "No contests.";
            }
            StringBuilder sb = new StringBuilder();
            for (Contest contest : contests) {
                sb.append(String.format("%s  %s  solved %d/%d%s\n",
                    contest.getId(),
                    contest.getName(),
                    contest.getSolvedCount(),
                    contest.getTotalProblems(),
                    contest.getRankStr() != null ? "  rank " + contest.getRankStr() : ""));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to list contests", e);
            return "Failed to list contests: " + e.getMessage();
        }
    }

    @ShellMethod(key = "contests show", value = "Show one contest, problem by problem")
    public String contestsShow(@ShellOption String id) {
        try {
            Contest contest = contestService.get(id);
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Contest: %s\n", contest.getName()));
            sb.append(String.format("ID: %s\n", contest.getId()));
            if (contest.getRankStr() != null) {
                sb.append(String.format("Rank: %s\n", contest.getRankStr()));
            }
            sb.append(String.format("Solved: %d/%d\n\n", contest.getSolvedCount(), contest.getTotalProblems()));
            for (ContestProblem problem : contest.getProblems()) {
                sb.append(String.format("  %s  %-11s  passed %d / tried %d\n",
                    problem.getLetter(), problem.getStatus().getWireValue(),
                    problem.getPassCount(), problem.getAttemptCount()));
            }
            if (contest.getSummary() != null) {
                sb.append("\nSummary:\n").append(contest.getSummary()).append("\n");
            }
            return sb.toString();
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to show contest", e);
            return "Failed to show contest: " + e.getMessage();
        }
    }

    @ShellMethod(key = "contests add", value = "Record a new contest")
    public String contestsAdd(
        @ShellOption String name,
        @ShellOption(help = "Number of problems, 1 to 15") int problems,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Rank such as 12/180") String rank,
        @ShellOption(defaultValue = ShellOption.NULL) String summary
    ) {
        try {
            Contest created = contestService.create(Contest.builder()
                .name(name)
                .totalProblems(problems)
                .rankStr(rank)
                .summary(summary)
                .build());
            return "✓ Created contest " + created.getId();
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to add contest", e);
            return "Failed to add contest: " + e.getMessage();
        }
    }

    @ShellMethod(key = "contests mark", value = "Update one lettered problem of a contest")
    public String contestsMark(
        @ShellOption String id,
        @ShellOption String letter,
        @ShellOption(defaultValue = ShellOption.NULL, help = "ac, attempted or unsubmitted") String status,
        @ShellOption(defaultValue = ShellOption.NULL) Integer passed,
        @ShellOption(defaultValue = ShellOption.NULL) Integer attempted
    ) {
        try {
            Contest contest = contestService.get(id);
            List<ContestProblem> problems = new ArrayList<>(contest.getProblems());
            int index = letterIndex(letter, problems.size());
            ContestProblem.ContestProblemBuilder entry = problems.get(index).toBuilder();
            if (status != null) {
                entry.status(ContestStatus.parse(status)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + status)));
            }
            if (passed != null) entry.passCount(passed);
            if (attempted != null) entry.attemptCount(attempted);
            problems.set(index, entry.build());

            contestService.update(id, contest.withProblems(problems));
            return "✓ Updated " + id + " problem " + letter.toUpperCase();
        } catch (RecordNotFoundException | IllegalArgumentException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to update contest", e);
            return "Failed to update contest: " + e.getMessage();
        }
    }

    @ShellMethod(key = "contests delete", value = "Delete a contest")
    public String contestsDelete(@ShellOption String id) {
        try {
            contestService.delete(id);
            return "✓ Deleted contest " + id;
        } catch (RecordNotFoundException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Failed to delete contest", e);
            return "Failed to delete contest: " + e.getMessage();
        }
    }

    private String describe(Problem problem) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Problem: %s\n", problem.getTitle()));
        sb.append(String.format("ID: %s\n", problem.getId()));
        if (problem.getLink() != null) sb.append(String.format("Link: %s\n", problem.getLink()));
        if (problem.getSource() != null) sb.append(String.format("Source: %s\n", problem.getSource()));
        if (!problem.getTags().isEmpty()) sb.append(String.format("Tags: %s\n", String.join(", ", problem.getTags())));
        if (problem.getAssignee() != null) sb.append(String.format("Assignee: %s\n", problem.getAssignee()));
        sb.append(String.format("Solved: %s\n", problem.isSolved() ? "yes" : "no"));
        if (problem.getUnsolvedStage() != null) {
            sb.append(String.format("Stage: %s\n", problem.getUnsolvedStage().getWireValue()));
        }
        if (problem.getUnsolvedCustomLabel() != null) {
            sb.append(String.format("Label: %s\n", problem.getUnsolvedCustomLabel()));
        }
        if (problem.getPassCount() != null) sb.append(String.format("Passed by: %d\n", problem.getPassCount()));
        sb.append(String.format("Solution: %s\n", problem.isHasSolution() ? "yes" : "none"));
        sb.append(String.format("Updated: %s\n", problem.getUpdatedAt()));
        if (problem.getNotes() != null) sb.append("\nNotes:\n").append(problem.getNotes()).append("\n");
        return sb.toString();
    }

    private static List<String> splitTags(String tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.stream(tags.split(","))
            .map(String::trim)
            .filter(tag -> !tag.isEmpty())
            .toList());
    }

    private static int letterIndex(String letter, int size) {
        String normalized = letter == null ? "" : letter.trim().toUpperCase();
        int index = normalized.length() == 1 ? normalized.charAt(0) - 'A' : -1;
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException("No problem " + letter + " in this contest");
        }
        return index;
    }
}
