package com.waypoint.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.exception.CatalogConfigException;
import com.waypoint.model.CourseDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link CourseCatalogServiceImpl}, loading real JSON fixtures from the test classpath.
 */
class CourseCatalogServiceImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CourseCatalogServiceImpl catalogAt(String location) {
        return new CourseCatalogServiceImpl(objectMapper, new DefaultResourceLoader(), location);
    }

    private CourseCatalogServiceImpl fixture(String name) {
        return catalogAt("classpath:curriculum/" + name);
    }

    @Test
    @DisplayName("order should follow the 'order' field, not document order")
    void testOrderUsesOrderField() {
        var catalog = fixture("two-chapters.json");

        assertThat(catalog.order()).containsExactly("ch1", "ch2");
        assertThat(catalog.chapterCount()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ch1", "CH1", "  ch1  ", "Intro", "INTRO", "week 1", "Week 1", "chapter 1", "Chapter 1"})
    @DisplayName("resolve should map id, title, week label and ordinal phrase to the same canonical id")
    void testResolveAliases(String label) {
        var catalog = fixture("two-chapters.json");

        assertThat(catalog.resolve(label)).contains("ch1");
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "Intr", "chapter 3", "ch1 intro", "Week 9"})
    @DisplayName("resolve should return empty for unknown or blank labels")
    void testResolveUnknown(String label) {
        var catalog = fixture("two-chapters.json");

        assertThat(catalog.resolve(label)).isEmpty();
    }

    @Test
    @DisplayName("summary should project public fields with the canonical id")
    void testSummary() {
        var catalog = fixture("two-chapters.json");

        var summary = catalog.summary("ch1").orElseThrow();

        assertThat(summary.chapterId()).isEqualTo("ch1");
        assertThat(summary.title()).isEqualTo("Intro");
        assertThat(summary.order()).isEqualTo(1);
        assertThat(summary.weekLabel()).isEqualTo("Week 1");
        assertThat(summary.learningOutcomes()).containsExactly("Say hello");
        assertThat(catalog.summary("ch9")).isEmpty();
        assertThat(catalog.summary(null)).isEmpty();
    }

    @Test
    @DisplayName("outline should expose unit metadata and sorted chapters with prerequisites")
    void testOutline() {
        var catalog = fixture("course.json");

        var outline = catalog.outline();

        assertThat(outline.unitId()).isEqualTo("COMP1511");
        assertThat(outline.learningOutcomesOverall()).hasSize(3);
        assertThat(outline.chapters()).extracting(c -> c.chapterId())
                .containsExactly("ch1", "ch2", "ch3", "ch4", "ch5", "ch6");
        assertThat(outline.chapters().get(4).prerequisites()).containsExactly("ch3", "ch4");
    }

    @Test
    @DisplayName("An empty chapter list should load as an empty catalog")
    void testEmptyCatalog() {
        var catalog = fixture("empty.json");

        assertThat(catalog.order()).isEmpty();
        assertThat(catalog.chapterCount()).isZero();
        assertThat(catalog.resolve("chapter 1")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"malformed.json", "missing-id.json", "missing-order.json", "duplicate-order.json",
            "duplicate-id.json", "alias-collision.json", "fractional-order.json", "does-not-exist.json"})
    @DisplayName("load should fail with CatalogConfigException for invalid documents")
    void testInvalidDocuments(String name) {
        var catalog = fixture(name);

        assertThatThrownBy(catalog::load).isInstanceOf(CatalogConfigException.class);
    }

    @Test
    @DisplayName("Error messages should name the offending chapter or alias")
    void testErrorMessages() {
        assertThatThrownBy(() -> fixture("alias-collision.json").load())
                .hasMessageContaining("Alias 'review'");
        assertThatThrownBy(() -> fixture("missing-id.json").load())
                .hasMessageContaining("#2 has no chapter_id");
        assertThatThrownBy(() -> fixture("does-not-exist.json").load())
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("A fractional order should be rejected as malformed instead of truncated")
    void testFractionalOrderRejected() {
        assertThatThrownBy(() -> fixture("fractional-order.json").load())
                .isInstanceOf(CatalogConfigException.class)
                .hasMessageContaining("is malformed")
                .hasMessageNotContaining("share order");
    }

    @Test
    @DisplayName("A chapter with order 0 should get no 'chapter 0' alias")
    void testZeroOrderHasNoOrdinalAlias() {
        var catalog = fixture("zero-order.json");

        assertThat(catalog.order()).containsExactly("setup", "basics");
        assertThat(catalog.resolve("chapter 0")).isEmpty();
        assertThat(catalog.resolve("setup")).contains("setup");
        assertThat(catalog.resolve("Week 0")).contains("setup");
        assertThat(catalog.resolve("chapter 1")).contains("basics");
    }

    @Test
    @DisplayName("A failed load should publish nothing and be retried on the next access")
    void testRetryAfterFailure(@TempDir Path dir) throws IOException {
        var file = dir.resolve("course.json");
        Files.writeString(file, "{ \"chapters\": [ { \"title\": \"no id\", \"order\": 1 } ] }");
        var catalog = catalogAt(file.toUri().toString());

        assertThatThrownBy(catalog::order).isInstanceOf(CatalogConfigException.class);

        Files.writeString(file, "{ \"chapters\": [ { \"chapter_id\": \"a1\", \"title\": \"Fixed\", \"order\": 1 } ] }");

        assertThat(catalog.order()).containsExactly("a1");
        assertThat(catalog.resolve("fixed")).contains("a1");
    }

    @Test
    @DisplayName("Concurrent first accesses should parse the document exactly once")
    void testLoadsOnceUnderContention() throws Exception {
        var spyMapper = spy(new ObjectMapper());
        var catalog = new CourseCatalogServiceImpl(spyMapper, new DefaultResourceLoader(),
                "classpath:curriculum/course.json");
        int threads = 8;
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return catalog.order();
                }));
            }
            start.countDown();
            for (var future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).hasSize(6);
            }
        } finally {
            pool.shutdownNow();
        }

        verify(spyMapper, times(1)).readerFor(CourseDocument.class);
    }
}
