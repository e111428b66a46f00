package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of recording completed chapters for a student.
 *
 * @param studentId     Canonical id the progress was recorded under.
 * @param addedChapters Chapters that were newly marked complete by this call, in input order.
 * @param snapshot      Snapshot after the update.
 * @param message       {@code "Progress updated"} or {@code "No new chapters recorded"}.
 */
public record RecordResult(
        @JsonProperty("student_id") String studentId,
        @JsonProperty("added_chapters") List<ChapterSummary> addedChapters,
        @JsonProperty("snapshot") ProgressSnapshot snapshot,
        @JsonProperty("message") String message) {
}
