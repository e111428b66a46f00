package com.waypoint.service.api;

import com.waypoint.model.CourseOutline;
import com.waypoint.model.NextChapterRecommendation;
import com.waypoint.model.OperationStats;
import com.waypoint.model.ProgressSnapshot;
import com.waypoint.model.RecordResult;
import com.waypoint.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * The operations exposed to the orchestration layer.
 * <p>
 * Each call is timed under its own operation name and returns a {@link ToolResult} envelope. A catalog
 * that cannot be loaded is reported as an {@code error} result rather than an exception.
 * </p>
 */
public interface ProgressToolService {

    ToolResult<CourseOutline> getCourseOutline();

    ToolResult<RecordResult> recordStudentProgress(String studentId, List<String> completedChapters, String note,
                                                   Map<String, Object> session);

    ToolResult<ProgressSnapshot> getProgressSnapshot(String studentId, Map<String, Object> session);

    ToolResult<NextChapterRecommendation> getNextChapterRecommendation(String studentId, Map<String, Object> session);

    ToolResult<Map<String, OperationStats>> getMetricsSummary();
}
