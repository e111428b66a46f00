package com.waypoint.service.api;

import com.waypoint.model.NextChapterRecommendation;
import com.waypoint.model.ProgressSnapshot;
import com.waypoint.model.RecordResult;

import java.util.List;
import java.util.Map;

/**
 * Tracks which chapters each student has completed and computes what they should study next.
 * <p>
 * Students are identified by a canonical id (trimmed, lowercased). Callers may omit the id, in which
 * case the id stored in the conversation's session map is reused, or a new one is minted and stored there.
 * Progress lives for the lifetime of the process only.
 * </p>
 */
public interface ProgressTrackingService {

    /**
     * Session key under which the assigned student id is kept.
     */
    String SESSION_STUDENT_ID_KEY = "progress_student_id";

    /**
     * Determines the canonical student id for a call.
     * <p>
     * An explicit, non-blank id always wins and is written into the session. Without one, the id already
     * in the session is returned; failing that a new random id is minted and stored. Repeated calls on the
     * same session therefore return the same generated id.
     * </p>
     *
     * @param explicitId Optional id supplied by the caller.
     * @param session    Conversation-scoped key-value store, may be {@code null}.
     * @return The canonical student id.
     */
    String resolveStudent(String explicitId, Map<String, Object> session);

    /**
     * Marks chapters as completed for a student.
     * <p>
     * Labels that do not resolve against the catalog are skipped without error. Chapters the student
     * already completed are not added twice.
     * </p>
     *
     * @param studentId Optional student id.
     * @param chapters  Free-text chapter labels, may be {@code null}.
     * @param note      Optional note appended to the student's log when not blank.
     * @param session   Conversation-scoped key-value store, may be {@code null}.
     * @return The newly added chapters, the resulting snapshot and an outcome message.
     */
    RecordResult recordProgress(String studentId, List<String> chapters, String note, Map<String, Object> session);

    /**
     * Builds the full progress snapshot for a student. Unknown students have no completed chapters.
     */
    ProgressSnapshot getSnapshot(String studentId, Map<String, Object> session);

    /**
     * Returns only the next chapter and the completed count.
     */
    NextChapterRecommendation getNextRecommendation(String studentId, Map<String, Object> session);

    /**
     * @return The notes recorded for a student in the order they were added.
     */
    List<String> getNotes(String studentId, Map<String, Object> session);
}
