package com.waypoint.shell;

import com.waypoint.model.ChapterSummary;
import com.waypoint.model.OperationStats;
import com.waypoint.model.ProgressSnapshot;
import com.waypoint.model.ToolResult;
import com.waypoint.service.api.ProgressToolService;
import com.waypoint.service.api.ProgressTrackingService;
import lombok.RequiredArgsConstructor;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.boot.info.BuildProperties;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Spring Shell front end for the progress tools.
 * <p>
 * The shell plays the role of a single conversation: one session map is kept for its whole lifetime, so a
 * student id generated by the first command is reused by every later command until the user supplies
 * an explicit {@code --student}.
 * </p>
 */
@ShellComponent
@RequiredArgsConstructor
public class ProgressCommands {

    private final BuildProperties buildProperties;
    private final ProgressToolService toolService;
    private final ProgressTrackingService progressService;
    private final Terminal terminal;

    /**
     * Conversation-scoped state handed to every tool call.
     */
    private final Map<String, Object> session = new ConcurrentHashMap<>();

    // --- UI STYLES (Constants) ---
    private static final AttributedStyle STYLE_HEADER = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold();
    private static final AttributedStyle STYLE_LABEL = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);
    private static final AttributedStyle STYLE_KEY = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_INFO = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).italic();
    private static final AttributedStyle STYLE_ERROR = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.RED);
    private static final AttributedStyle STYLE_SUCCESS = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN).bold();
    private static final AttributedStyle STYLE_CHAPTER = AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA).bold();

    // --- COMMANDS ---

    /**
     * Prints the unit metadata and the ordered chapter list.
     */
    @ShellMethod(key = "outline", value = "Show the course outline in teaching order.")
    public void outline() {
        var result = toolService.getCourseOutline();
        if (!result.isSuccess()) {
            printError("Error: " + result.message());
            return;
        }
        var outline = result.payload();
        printHeader("\n" + (outline.unitName() != null ? outline.unitName() : "Course Outline"));
        if (outline.description() != null) {
            printInfo(outline.description());
        }
        outline.chapters().forEach(chapter -> {
            var line = new AttributedStringBuilder()
                    .append("  ")
                    .style(STYLE_KEY).append(String.format("%-8s", chapter.chapterId()))
                    .style(AttributedStyle.DEFAULT).append(" | ")
                    .append(chapter.weekLabel() != null ? chapter.weekLabel() + " | " : "")
                    .append(chapter.title() != null ? chapter.title() : "")
                    .toAnsi();
            terminal.writer().println(line);
        });
        printSeparator();
    }

    /**
     * Marks chapters as completed.
     *
     * @param chapters Comma-separated chapter references (ids, titles, week labels or "chapter N").
     * @param student  Optional explicit student id; overrides and replaces the session id.
     * @param note     Optional free-text note kept with the student's progress.
     */
    @ShellMethod(key = "record", value = "Record completed chapters for the current student.")
    public void record(
            @ShellOption(help = "Comma-separated chapters, e.g. 'Intro, chapter 2'.") String chapters,
            @ShellOption(help = "Explicit student id.", defaultValue = ShellOption.NULL) String student,
            @ShellOption(help = "A note to keep with the progress.", defaultValue = ShellOption.NULL) String note
    ) {
        var result = toolService.recordStudentProgress(student, splitChapters(chapters), note, session);
        if (!result.isSuccess()) {
            printError("Error: " + result.message());
            return;
        }
        var recorded = result.payload();
        if (recorded.addedChapters().isEmpty()) {
            printInfo(recorded.message() + ".");
        } else {
            printSuccess(recorded.message() + ": " + titles(recorded.addedChapters()));
        }
        printSnapshot(recorded.snapshot());
    }

    /**
     * Shows completed chapters, the next chapter and overall completion.
     */
    @ShellMethod(key = "snapshot", value = "Show the progress snapshot for the current student.")
    public void snapshot(@ShellOption(help = "Explicit student id.", defaultValue = ShellOption.NULL) String student) {
        var result = toolService.getProgressSnapshot(student, session);
        if (!result.isSuccess()) {
            printError("Error: " + result.message());
            return;
        }
        printSnapshot(result.payload());
    }

    /**
     * Recommends the first chapter in teaching order that is not completed yet.
     */
    @ShellMethod(key = "next", value = "Recommend the next chapter to study.")
    public void next(@ShellOption(help = "Explicit student id.", defaultValue = ShellOption.NULL) String student) {
        var result = toolService.getNextChapterRecommendation(student, session);
        if (!result.isSuccess()) {
            printError("Error: " + result.message());
            return;
        }
        var recommendation = result.payload();
        if (recommendation.nextChapter() == null) {
            printSuccess("\nAll chapters completed. Nothing left to recommend!");
            return;
        }
        printLabel("Completed so far: " + recommendation.completedCount());
        printChapter("Next up: ", recommendation.nextChapter());
    }

    @ShellMethod(key = "notes", value = "List the notes recorded for the current student.")
    public void notes(@ShellOption(help = "Explicit student id.", defaultValue = ShellOption.NULL) String student) {
        var notes = progressService.getNotes(student, session);
        if (notes.isEmpty()) {
            printInfo("No notes recorded yet. Use 'record --note' to add one.");
            return;
        }
        printHeader("\nNotes:");
        for (int i = 0; i < notes.size(); i++) {
            terminal.writer().println("[%d] %s".formatted(i + 1, notes.get(i)));
        }
        terminal.writer().flush();
    }

    @ShellMethod(key = "whoami", value = "Show the student id used by this session.")
    public void whoami() {
        printLabel("Student id: " + progressService.resolveStudent(null, session));
    }

    /**
     * Prints per-operation latency statistics collected since startup.
     */
    @ShellMethod(key = "metrics", value = "Show latency statistics per operation.")
    public void metrics() {
        ToolResult<Map<String, OperationStats>> result = toolService.getMetricsSummary();
        if (result.payload().isEmpty()) {
            printInfo("No operations timed yet.");
            return;
        }
        printHeader("\nLatency (ms):");
        result.payload().forEach((operation, stats) -> terminal.writer().println(String.format(Locale.ROOT,
                "%-34s count=%d avg=%.1f min=%.1f max=%.1f total=%.1f",
                operation, stats.count(), stats.avgMs(), stats.minMs(), stats.maxMs(), stats.totalMs())));
        terminal.writer().flush();
    }

    @ShellMethod(key = "version", value = "Display the application version.")
    public void version() {
        terminal.writer().println("waypoint version " + buildProperties.getVersion());
        terminal.writer().flush();
    }

    // --- INTERNAL HELPERS ---

    static List<String> splitChapters(String chapters) {
        if (chapters == null || chapters.isBlank()) {
            return List.of();
        }
        return Arrays.stream(chapters.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String titles(List<ChapterSummary> chapters) {
        return chapters.stream()
                .map(c -> c.title() != null ? c.title() : c.chapterId())
                .collect(Collectors.joining(", "));
    }

    private void printSnapshot(ProgressSnapshot snapshot) {
        printHeader("\nProgress for " + snapshot.studentId());
        printLabel(String.format(Locale.ROOT, "%d of %d chapters completed (%.1f%%)",
                snapshot.completedChapters().size(), snapshot.totalChapters(), snapshot.progressPct()));
        snapshot.completedChapters().forEach(c -> terminal.writer().println(
                new AttributedString("  ✔ " + c.chapterId() + " " + (c.title() != null ? c.title() : ""),
                        STYLE_SUCCESS).toAnsi()));
        snapshot.next().ifPresentOrElse(
                c -> printChapter("Next up: ", c),
                () -> printSuccess("Course complete!"));
    }

    private void printChapter(String prefix, ChapterSummary chapter) {
        var builder = new AttributedStringBuilder()
                .style(STYLE_LABEL).append(prefix)
                .style(STYLE_CHAPTER).append(chapter.title() != null ? chapter.title() : chapter.chapterId())
                .style(AttributedStyle.DEFAULT).append(" (" + chapter.chapterId() + ")");
        terminal.writer().println(builder.toAnsi());
        chapter.learningOutcomes().forEach(outcome -> terminal.writer().println("    - " + outcome));
        terminal.writer().flush();
    }

    // --- PRINTER UTILITIES ---

    private void printHeader(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_HEADER).toAnsi());
        printSeparator();
    }

    private void printLabel(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_LABEL).toAnsi());
        terminal.writer().flush();
    }

    private void printInfo(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_INFO).toAnsi());
        terminal.writer().flush();
    }

    private void printError(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_ERROR).toAnsi());
        terminal.writer().flush();
    }

    private void printSuccess(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_SUCCESS).toAnsi());
        terminal.writer().flush();
    }

    private void printSeparator() {
        terminal.writer().println("─".repeat(40));
        terminal.writer().flush();
    }
}
