package com.waypoint.service.api;

import com.waypoint.model.ChapterSummary;
import com.waypoint.model.CourseOutline;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the curriculum catalog.
 * <p>
 * The catalog is built from the curriculum document on first use and is immutable afterwards. It provides:
 * <ul>
 *   <li>The canonical chapter sequence, ordered by each chapter's {@code order} field.</li>
 *   <li>Resolution of free-text chapter references (id, title, week label, "chapter N") to canonical ids.</li>
 *   <li>Public chapter projections and the full course outline.</li>
 * </ul>
 * </p>
 * <p>
 * Every method triggers the lazy load if it has not happened yet and may therefore throw
 * {@link com.waypoint.exception.CatalogConfigException}.
 * </p>
 */
public interface CourseCatalogService {

    /**
     * Loads and indexes the curriculum document if that has not happened yet.
     * <p>
     * Concurrent first callers block until a single load completes. When the load fails no catalog is
     * recorded and the next call attempts the load again.
     * </p>
     *
     * @throws com.waypoint.exception.CatalogConfigException if the document is missing, malformed,
     *         or violates the uniqueness rules for ids, orders or aliases.
     */
    void load();

    /**
     * Resolves a free-text chapter label to a canonical chapter id.
     * <p>
     * The label is trimmed and lowercased, then matched against the canonical ids first and the alias
     * table second. No fuzzy matching is attempted.
     * </p>
     *
     * @param label A chapter id, title, week label or ordinal phrase such as {@code "Chapter 2"}.
     * @return The canonical chapter id, or empty if nothing matches (including {@code null} or blank input).
     */
    Optional<String> resolve(String label);

    /**
     * @return Canonical chapter ids in ascending {@code order}. Immutable.
     */
    List<String> order();

    /**
     * Projects the public fields of a chapter.
     *
     * @param chapterId Canonical chapter id.
     * @return The summary, or empty when the id is unknown or {@code null}.
     */
    Optional<ChapterSummary> summary(String chapterId);

    /**
     * @return The unit metadata and every chapter, sorted by {@code order}.
     */
    CourseOutline outline();

    /**
     * @return Number of chapters in the catalog, possibly zero.
     */
    int chapterCount();
}
