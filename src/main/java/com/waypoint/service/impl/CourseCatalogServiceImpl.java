package com.waypoint.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.exception.CatalogConfigException;
import com.waypoint.model.Chapter;
import com.waypoint.model.ChapterSummary;
import com.waypoint.model.CourseDocument;
import com.waypoint.model.CourseOutline;
import com.waypoint.service.api.CourseCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Implementation of {@link CourseCatalogService} backed by a JSON curriculum document.
 * <p>
 * The document location is a Spring resource string ({@code classpath:}, {@code file:} ...). The document
 * is parsed with Jackson the first time any method is called; the resulting {@link Catalog} is published
 * through a volatile field only after it has been fully built and validated.
 * </p>
 */
@Service
public class CourseCatalogServiceImpl implements CourseCatalogService {

    private static final Logger log = LoggerFactory.getLogger(CourseCatalogServiceImpl.class);

    private static final String DEFAULT_LOCATION = "classpath:curriculum/course.json";

    /**
     * Immutable, fully indexed catalog.
     */
    record Catalog(CourseDocument document,
                   List<Chapter> chapters,
                   List<String> order,
                   Map<String, Chapter> chaptersById,
                   Map<String, String> aliases) {}

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String location;

    private final Object loadLock = new Object();
    private volatile Catalog catalog;

    public CourseCatalogServiceImpl(ObjectMapper objectMapper,
                                    ResourceLoader resourceLoader,
                                    @Value("${app.catalog.location:" + DEFAULT_LOCATION + "}") String location) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    @Override
    public void load() {
        catalog();
    }

    @Override
    public Optional<String> resolve(String label) {
        if (label == null) {
            return Optional.empty();
        }
        var key = normalize(label);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        var current = catalog();
        if (current.chaptersById().containsKey(key)) {
            return Optional.of(key);
        }
        return Optional.ofNullable(current.aliases().get(key));
    }

    @Override
    public List<String> order() {
        return catalog().order();
    }

    @Override
    public Optional<ChapterSummary> summary(String chapterId) {
        if (chapterId == null) {
            return Optional.empty();
        }
        var chapter = catalog().chaptersById().get(chapterId);
        if (chapter == null) {
            return Optional.empty();
        }
        return Optional.of(new ChapterSummary(
                chapterId,
                chapter.title(),
                chapter.order(),
                chapter.weekLabel(),
                chapter.learningOutcomes()));
    }

    @Override
    public CourseOutline outline() {
        var current = catalog();
        var document = current.document();
        return new CourseOutline(
                document.unitId(),
                document.unitName(),
                document.description(),
                List.copyOf(document.learningOutcomesOverall()),
                current.chapters());
    }

    @Override
    public int chapterCount() {
        return catalog().order().size();
    }

    /**
     * Returns the published catalog, building it on first use.
     */
    private Catalog catalog() {
        var current = catalog;
        if (current != null) {
            return current;
        }
        synchronized (loadLock) {
            if (catalog == null) {
                log.info("Loading curriculum from {}", location);
                // Assigned only after a successful build; a failure leaves the field null for a retry.
                catalog = buildCatalog(readDocument());
                log.info("Curriculum loaded: {} chapters, {} aliases",
                        catalog.order().size(), catalog.aliases().size());
            }
            return catalog;
        }
    }

    private CourseDocument readDocument() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogConfigException("Curriculum document not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            // a fractional order must not be truncated into another chapter's slot
            CourseDocument document = objectMapper.readerFor(CourseDocument.class)
                    .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                    .readValue(in);
            if (document == null) {
                throw new CatalogConfigException("Curriculum document at " + location + " is empty");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new CatalogConfigException("Curriculum document at " + location + " is malformed: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogConfigException("Failed to read curriculum document at " + location, e);
        }
    }

    /**
     * Validates the raw document and builds the ordered index and alias table.
     */
    private Catalog buildCatalog(CourseDocument document) {
        List<Chapter> normalized = new ArrayList<>();
        for (int i = 0; i < document.chapters().size(); i++) {
            var chapter = document.chapters().get(i);
            if (chapter == null) {
                throw new CatalogConfigException("Chapter entry #" + (i + 1) + " is null");
            }
            var id = chapter.chapterId() == null ? "" : normalize(chapter.chapterId());
            if (id.isEmpty()) {
                throw new CatalogConfigException("Chapter entry #" + (i + 1) + " has no chapter_id");
            }
            if (chapter.order() == null) {
                throw new CatalogConfigException("Chapter '" + id + "' has no order");
            }
            normalized.add(new Chapter(id, chapter.title(), chapter.order(), chapter.weekLabel(),
                    chapter.learningOutcomes(), chapter.prerequisites()));
        }
        normalized.sort(Comparator.comparingInt(Chapter::order));

        Map<String, Chapter> byId = new LinkedHashMap<>();
        Map<Integer, String> byOrder = new HashMap<>();
        for (var chapter : normalized) {
            if (byId.putIfAbsent(chapter.chapterId(), chapter) != null) {
                throw new CatalogConfigException("Duplicate chapter_id '" + chapter.chapterId() + "'");
            }
            var previous = byOrder.putIfAbsent(chapter.order(), chapter.chapterId());
            if (previous != null) {
                throw new CatalogConfigException("Chapters '" + previous + "' and '" + chapter.chapterId()
                        + "' share order " + chapter.order());
            }
        }

        Map<String, String> aliases = new HashMap<>();
        for (var chapter : normalized) {
            for (var alias : aliasesOf(chapter)) {
                var owner = aliases.putIfAbsent(alias, chapter.chapterId());
                if (owner != null && !owner.equals(chapter.chapterId())) {
                    throw new CatalogConfigException("Alias '" + alias + "' is claimed by both '" + owner
                            + "' and '" + chapter.chapterId() + "'");
                }
            }
        }

        return new Catalog(
                document,
                List.copyOf(normalized),
                List.copyOf(byId.keySet()),
                Map.copyOf(byId),
                Map.copyOf(aliases));
    }

    private static Set<String> aliasesOf(Chapter chapter) {
        Set<String> aliases = new LinkedHashSet<>();
        aliases.add(chapter.chapterId());
        if (chapter.title() != null) {
            aliases.add(normalize(chapter.title()));
        }
        if (chapter.weekLabel() != null) {
            aliases.add(normalize(chapter.weekLabel()));
        }
        if (chapter.order() != 0) {
            aliases.add("chapter " + chapter.order());
        }
        aliases.remove("");
        return aliases;
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
