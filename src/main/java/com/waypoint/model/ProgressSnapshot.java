package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Computed view of a student's progress. Derived on demand, never stored.
 *
 * @param studentId         Canonical student id.
 * @param completedChapters Completed chapters in catalog order.
 * @param nextChapter       First catalog chapter not yet completed, or {@code null} when all are done.
 * @param totalChapters     Number of chapters in the catalog.
 * @param progressPct       Completion percentage rounded to one decimal place.
 */
public record ProgressSnapshot(
        @JsonProperty("student_id") String studentId,
        @JsonProperty("completed_chapters") List<ChapterSummary> completedChapters,
        @JsonProperty("next_chapter") ChapterSummary nextChapter,
        @JsonProperty("total_chapters") int totalChapters,
        @JsonProperty("progress_pct") double progressPct) {

    public Optional<ChapterSummary> next() {
        return Optional.ofNullable(nextChapter);
    }
}
