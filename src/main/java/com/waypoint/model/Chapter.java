package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * A single curriculum unit as it appears in the course document.
 * <p>
 * The {@code order} field defines the canonical position of the chapter inside the course; load order
 * of the document is irrelevant. {@code prerequisites} are informational and never enforced as a gate.
 * </p>
 *
 * @param chapterId        Unique (case-insensitive) identifier, e.g. {@code "ch1"}. Required.
 * @param title            Human-readable title, may be {@code null}.
 * @param order            Strictly unique position of the chapter. Required.
 * @param weekLabel        Teaching week label such as {@code "Week 1"}, may be {@code null}.
 * @param learningOutcomes Ordered outcomes. Never {@code null} after construction.
 * @param prerequisites    Chapter ids expected to precede this one. Never {@code null} after construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chapter(
        @JsonProperty("chapter_id") String chapterId,
        @JsonProperty("title") String title,
        @JsonProperty("order") Integer order,
        @JsonProperty("week_label") String weekLabel,
        @JsonProperty("learning_outcomes") List<String> learningOutcomes,
        @JsonProperty("prerequisites") List<String> prerequisites) {

    /**
     * Replaces missing lists with empty immutable ones so callers never see {@code null}.
     */
    public Chapter {
        learningOutcomes = learningOutcomes == null ? Collections.emptyList() : List.copyOf(learningOutcomes);
        prerequisites = prerequisites == null ? Collections.emptyList() : List.copyOf(prerequisites);
    }
}
