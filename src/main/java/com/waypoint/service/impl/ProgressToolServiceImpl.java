package com.waypoint.service.impl;

import com.waypoint.exception.CatalogConfigException;
import com.waypoint.model.CourseOutline;
import com.waypoint.model.NextChapterRecommendation;
import com.waypoint.model.OperationStats;
import com.waypoint.model.ProgressSnapshot;
import com.waypoint.model.RecordResult;
import com.waypoint.model.ToolResult;
import com.waypoint.service.api.CourseCatalogService;
import com.waypoint.service.api.LatencyMetricsService;
import com.waypoint.service.api.ProgressToolService;
import com.waypoint.service.api.ProgressTrackingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Default {@link ProgressToolService}: times every operation and wraps its outcome in a {@link ToolResult}.
 */
@Service
public class ProgressToolServiceImpl implements ProgressToolService {

    private static final Logger log = LoggerFactory.getLogger(ProgressToolServiceImpl.class);

    private final CourseCatalogService catalogService;
    private final ProgressTrackingService progressService;
    private final LatencyMetricsService metricsService;

    public ProgressToolServiceImpl(CourseCatalogService catalogService,
                                   ProgressTrackingService progressService,
                                   LatencyMetricsService metricsService) {
        this.catalogService = catalogService;
        this.progressService = progressService;
        this.metricsService = metricsService;
    }

    @Override
    public ToolResult<CourseOutline> getCourseOutline() {
        return invoke("get_course_outline", Map.of(),
                () -> ToolResult.success("Course outline retrieved", catalogService.outline()));
    }

    @Override
    public ToolResult<RecordResult> recordStudentProgress(String studentId, List<String> completedChapters,
                                                          String note, Map<String, Object> session) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("chapter_count", completedChapters == null ? 0 : completedChapters.size());
        return invoke("record_student_progress", metadata, () -> {
            var result = progressService.recordProgress(studentId, completedChapters, note, session);
            return ToolResult.success(result.message(), result);
        });
    }

    @Override
    public ToolResult<ProgressSnapshot> getProgressSnapshot(String studentId, Map<String, Object> session) {
        return invoke("get_progress_snapshot", Map.of(),
                () -> ToolResult.success("Progress snapshot retrieved", progressService.getSnapshot(studentId, session)));
    }

    @Override
    public ToolResult<NextChapterRecommendation> getNextChapterRecommendation(String studentId,
                                                                              Map<String, Object> session) {
        return invoke("get_next_chapter_recommendation", Map.of(),
                () -> ToolResult.success("Next chapter recommendation computed",
                        progressService.getNextRecommendation(studentId, session)));
    }

    @Override
    public ToolResult<Map<String, OperationStats>> getMetricsSummary() {
        return ToolResult.success("Metrics summary retrieved", metricsService.summary());
    }

    private <T> ToolResult<T> invoke(String operation, Map<String, Object> metadata, Supplier<ToolResult<T>> work) {
        try (var ignored = metricsService.startTimer(operation, metadata)) {
            return work.get();
        } catch (CatalogConfigException e) {
            log.error("{} failed, curriculum unavailable: {}", operation, e.getMessage());
            return ToolResult.error(e.getMessage());
        }
    }
}
