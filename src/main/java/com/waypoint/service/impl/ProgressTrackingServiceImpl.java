package com.waypoint.service.impl;

import com.waypoint.model.ChapterSummary;
import com.waypoint.model.NextChapterRecommendation;
import com.waypoint.model.ProgressSnapshot;
import com.waypoint.model.RecordResult;
import com.waypoint.service.api.CourseCatalogService;
import com.waypoint.service.api.ProgressTrackingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ProgressTrackingService}.
 * <p>
 * Each student's state is guarded by its own monitor, so concurrent updates for one student are
 * serialized while different students never contend. Reads copy the state under the same monitor and
 * therefore always see a complete update.
 * </p>
 */
@Service
public class ProgressTrackingServiceImpl implements ProgressTrackingService {

    private static final Logger log = LoggerFactory.getLogger(ProgressTrackingServiceImpl.class);

    static final String DEFAULT_STUDENT_ID = "default_student";
    static final String MESSAGE_UPDATED = "Progress updated";
    static final String MESSAGE_NOTHING_NEW = "No new chapters recorded";

    private final CourseCatalogService catalogService;
    private final Map<String, StudentProgress> students = new ConcurrentHashMap<>();

    public ProgressTrackingServiceImpl(CourseCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @Override
    public String resolveStudent(String explicitId, Map<String, Object> session) {
        if (explicitId != null && !explicitId.isEmpty()) {
            var normalized = normalizeStudentId(explicitId);
            if (session != null) {
                session.put(SESSION_STUDENT_ID_KEY, normalized);
            }
            return normalized;
        }
        if (session == null) {
            return generateStudentId();
        }
        return storedOrGenerated(session);
    }

    @Override
    public RecordResult recordProgress(String studentId, List<String> chapters, String note,
                                       Map<String, Object> session) {
        catalogService.load();
        var canonicalStudent = resolveStudent(studentId, session);

        List<String> resolved = new ArrayList<>();
        for (var label : chapters == null ? List.<String>of() : chapters) {
            var chapterId = catalogService.resolve(label);
            if (chapterId.isPresent()) {
                resolved.add(chapterId.get());
            } else {
                log.debug("Ignoring unresolvable chapter label '{}'", label);
            }
        }

        var progress = students.computeIfAbsent(canonicalStudent, k -> new StudentProgress());
        var added = progress.complete(resolved, note, catalogComparator());
        if (!added.isEmpty()) {
            log.info("Student {} completed {}", canonicalStudent, added);
        }

        return new RecordResult(
                canonicalStudent,
                summaries(added),
                buildSnapshot(canonicalStudent),
                added.isEmpty() ? MESSAGE_NOTHING_NEW : MESSAGE_UPDATED);
    }

    @Override
    public ProgressSnapshot getSnapshot(String studentId, Map<String, Object> session) {
        catalogService.load();
        return buildSnapshot(resolveStudent(studentId, session));
    }

    @Override
    public NextChapterRecommendation getNextRecommendation(String studentId, Map<String, Object> session) {
        var snapshot = getSnapshot(studentId, session);
        return new NextChapterRecommendation(
                snapshot.studentId(),
                snapshot.nextChapter(),
                snapshot.completedChapters().size());
    }

    @Override
    public List<String> getNotes(String studentId, Map<String, Object> session) {
        var progress = students.get(resolveStudent(studentId, session));
        return progress == null ? List.of() : progress.notes();
    }

    private ProgressSnapshot buildSnapshot(String studentId) {
        var progress = students.get(studentId);
        List<String> completed = progress == null ? List.of() : progress.completed();
        var order = catalogService.order();

        Set<String> done = new LinkedHashSet<>(completed);
        ChapterSummary next = order.stream()
                .filter(id -> !done.contains(id))
                .findFirst()
                .flatMap(catalogService::summary)
                .orElse(null);

        return new ProgressSnapshot(
                studentId,
                summaries(completed),
                next,
                order.size(),
                percentage(completed.size(), order.size()));
    }

    private List<ChapterSummary> summaries(List<String> chapterIds) {
        return chapterIds.stream()
                .map(catalogService::summary)
                .flatMap(Optional::stream)
                .toList();
    }

    private Comparator<String> catalogComparator() {
        var order = catalogService.order();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            positions.put(order.get(i), i);
        }
        return Comparator.comparingInt(id -> positions.getOrDefault(id, Integer.MAX_VALUE));
    }

    /**
     * Rounds the exact binary value half-even to one decimal place; 0.0 for an empty catalog.
     */
    static double percentage(int completed, int total) {
        if (total == 0) {
            return 0.0;
        }
        return new BigDecimal((double) completed / total * 100)
                .setScale(1, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    private String storedOrGenerated(Map<String, Object> session) {
        synchronized (session) {
            var existing = session.get(SESSION_STUDENT_ID_KEY);
            if (existing != null && !existing.toString().isBlank()) {
                return existing.toString();
            }
            var generated = generateStudentId();
            session.put(SESSION_STUDENT_ID_KEY, generated);
            log.info("Assigned new student id {}", generated);
            return generated;
        }
    }

    /**
     * Trims and lowercases; whitespace-only input maps to {@link #DEFAULT_STUDENT_ID}.
     */
    private static String normalizeStudentId(String studentId) {
        var normalized = studentId.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? DEFAULT_STUDENT_ID : normalized;
    }

    private static String generateStudentId() {
        return "student_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Mutable state of one student. All access goes through this object's monitor.
     */
    static final class StudentProgress {

        private final List<String> completed = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();

        /**
         * Adds chapters not yet completed, re-sorts into catalog order and appends the note.
         *
         * @return The chapters that were newly added, in input order.
         */
        synchronized List<String> complete(List<String> chapterIds, String note, Comparator<String> catalogOrder) {
            List<String> added = new ArrayList<>();
            for (var chapterId : chapterIds) {
                if (!completed.contains(chapterId)) {
                    completed.add(chapterId);
                    added.add(chapterId);
                }
            }
            completed.sort(catalogOrder);
            // whitespace-only notes are dropped, not stored
            if (note != null && !note.isBlank()) {
                notes.add(note);
            }
            return Collections.unmodifiableList(added);
        }

        synchronized List<String> completed() {
            return List.copyOf(completed);
        }

        synchronized List<String> notes() {
            return List.copyOf(notes);
        }
    }
}
