package com.waypoint.service.impl;

import com.waypoint.exception.CatalogConfigException;
import com.waypoint.model.ChapterSummary;
import com.waypoint.model.NextChapterRecommendation;
import com.waypoint.model.ProgressSnapshot;
import com.waypoint.model.RecordResult;
import com.waypoint.model.ToolResult;
import com.waypoint.service.api.CourseCatalogService;
import com.waypoint.service.api.ProgressTrackingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressToolServiceImplTest {

    @Mock private CourseCatalogService catalogService;
    @Mock private ProgressTrackingService progressService;

    private LatencyMetricsServiceImpl metricsService;
    private ProgressToolServiceImpl toolService;
    private final Map<String, Object> session = new HashMap<>();

    private static final ChapterSummary CH2 = new ChapterSummary("ch2", "Loops", 2, "Week 2", List.of());

    @BeforeEach
    void setUp() {
        metricsService = new LatencyMetricsServiceImpl(1000);
        toolService = new ProgressToolServiceImpl(catalogService, progressService, metricsService);
    }

    @Test
    @DisplayName("recordStudentProgress should wrap the result and reuse its message")
    void testRecordSuccess() {
        var snapshot = new ProgressSnapshot("s1", List.of(), CH2, 2, 50.0);
        var recorded = new RecordResult("s1", List.of(), snapshot, "No new chapters recorded");
        when(progressService.recordProgress("s1", List.of("intro"), null, session)).thenReturn(recorded);

        var result = toolService.recordStudentProgress("s1", List.of("intro"), null, session);

        assertThat(result.status()).isEqualTo(ToolResult.Status.SUCCESS);
        assertThat(result.message()).isEqualTo("No new chapters recorded");
        assertThat(result.payload()).isSameAs(recorded);
        assertThat(metricsService.metrics()).singleElement()
                .satisfies(m -> {
                    assertThat(m.operation()).isEqualTo("record_student_progress");
                    assertThat(m.metadata()).containsEntry("chapter_count", 1);
                });
    }

    @Test
    @DisplayName("A catalog failure should become an error result and still be timed")
    void testCatalogFailureBecomesError() {
        when(catalogService.outline()).thenThrow(new CatalogConfigException("Curriculum document not found at x"));

        var result = toolService.getCourseOutline();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.status().wireName()).isEqualTo("error");
        assertThat(result.message()).contains("not found");
        assertThat(result.payload()).isNull();
        assertThat(metricsService.summary().get("get_course_outline").count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unexpected exceptions should propagate after being timed")
    void testOtherExceptionsPropagate() {
        when(progressService.getSnapshot(any(), any())).thenThrow(new IllegalStateException("bug"));

        assertThatThrownBy(() -> toolService.getProgressSnapshot(null, session))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("bug");
        assertThat(metricsService.summary()).containsKey("get_progress_snapshot");
    }

    @Test
    @DisplayName("getNextChapterRecommendation and getMetricsSummary should report success")
    void testNextAndMetrics() {
        when(progressService.getNextRecommendation(null, session))
                .thenReturn(new NextChapterRecommendation("s1", CH2, 1));

        var next = toolService.getNextChapterRecommendation(null, session);
        var metrics = toolService.getMetricsSummary();

        assertThat(next.payload().nextChapter()).isEqualTo(CH2);
        assertThat(next.message()).isEqualTo("Next chapter recommendation computed");
        assertThat(metrics.isSuccess()).isTrue();
        assertThat(metrics.payload()).containsKey("get_next_chapter_recommendation");
    }
}
