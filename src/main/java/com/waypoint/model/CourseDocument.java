package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Raw binding of the curriculum JSON document: unit metadata plus the list of chapters.
 *
 * @param unitId                  Identifier of the teaching unit.
 * @param unitName                Display name of the unit.
 * @param description             Free-text unit description.
 * @param learningOutcomesOverall Unit-level learning outcomes.
 * @param chapters                Chapters in document order (not yet sorted).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CourseDocument(
        @JsonProperty("unit_id") String unitId,
        @JsonProperty("unit_name") String unitName,
        @JsonProperty("description") String description,
        @JsonProperty("learning_outcomes_overall") List<String> learningOutcomesOverall,
        @JsonProperty("chapters") List<Chapter> chapters) {

    public CourseDocument {
        learningOutcomesOverall = learningOutcomesOverall == null ? Collections.emptyList() : learningOutcomesOverall;
        chapters = chapters == null ? Collections.emptyList() : chapters;
    }
}
