package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Public projection of a {@link Chapter} returned by progress operations.
 * The id is always the canonical (lowercased) chapter id.
 */
public record ChapterSummary(
        @JsonProperty("chapter_id") String chapterId,
        @JsonProperty("title") String title,
        @JsonProperty("order") int order,
        @JsonProperty("week_label") String weekLabel,
        @JsonProperty("learning_outcomes") List<String> learningOutcomes) {
}
