package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The canonical course outline: unit metadata and every chapter sorted by {@code order}.
 */
public record CourseOutline(
        @JsonProperty("unit_id") String unitId,
        @JsonProperty("unit_name") String unitName,
        @JsonProperty("description") String description,
        @JsonProperty("learning_outcomes_overall") List<String> learningOutcomesOverall,
        @JsonProperty("chapters") List<Chapter> chapters) {
}
