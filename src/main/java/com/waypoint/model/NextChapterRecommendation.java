package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lightweight recommendation payload: the next chapter and how many are already done.
 */
public record NextChapterRecommendation(
        @JsonProperty("student_id") String studentId,
        @JsonProperty("next_chapter") ChapterSummary nextChapter,
        @JsonProperty("completed_count") int completedCount) {
}
