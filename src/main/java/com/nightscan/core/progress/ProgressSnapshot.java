package com.nightscan.core.progress;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over a persisted progress document.
 */
public final class ProgressSnapshot {
    public final String startTime;
    public final String endTime;
    public final StageStatus overallStatus;
    public final double overallProgress;
    public final String executionTime;
    public final String estimatedRemaining;
    public final String estimatedCompletion;
    public final Map<PipelineStage, StageView> stages;
    public final Map<String, Long> metrics;
    public final List<String> errors;
    public final List<String> warnings;

    private ProgressSnapshot(JSONObject doc) {
        this.startTime = text(doc, "start_time");
        this.endTime = text(doc, "end_time");
        this.overallStatus = StageStatus.fromWireName(doc.optString("overall_status", "pending"));
        this.overallProgress = doc.optDouble("overall_progress", 0.0);
        this.executionTime = text(doc, "execution_time_formatted");
        this.estimatedRemaining = text(doc, "estimated_remaining_formatted");
        this.estimatedCompletion = text(doc, "estimated_completion_time");

        Map<PipelineStage, StageView> stageMap = new EnumMap<>(PipelineStage.class);
        JSONObject stageJson = doc.optJSONObject("stages");
        for (PipelineStage stage : PipelineStage.values()) {
            JSONObject s = stageJson == null ? null : stageJson.optJSONObject(stage.wireName());
            stageMap.put(stage, s == null
                    ? new StageView(StageStatus.PENDING, 0.0, "")
                    : new StageView(StageStatus.fromWireName(s.optString("status", "pending")),
                    s.optDouble("progress", 0.0), s.optString("message", "")));
        }
        this.stages = Collections.unmodifiableMap(stageMap);

        Map<String, Long> metricMap = new LinkedHashMap<>();
        JSONObject metricJson = doc.optJSONObject("metrics");
        for (PipelineMetric metric : PipelineMetric.values()) {
            metricMap.put(metric.wireName(), metricJson == null ? 0L : metricJson.optLong(metric.wireName(), 0L));
        }
        this.metrics = Collections.unmodifiableMap(metricMap);
        this.errors = messages(doc.optJSONArray("errors"));
        this.warnings = messages(doc.optJSONArray("warnings"));
    }

    public static ProgressSnapshot fromJson(JSONObject doc) {
        return new ProgressSnapshot(doc);
    }

    /**
     * The last stage, in pipeline order, whose persisted status is complete.
     */
    public Optional<PipelineStage> lastCompletedStage() {
        PipelineStage last = null;
        for (PipelineStage stage : PipelineStage.values()) {
            if (stages.get(stage).status == StageStatus.COMPLETE) {
                last = stage;
            }
        }
        return Optional.ofNullable(last);
    }

    public long metric(PipelineMetric metric) {
        return metrics.getOrDefault(metric.wireName(), 0L);
    }

    /**
     * Multi-line status summary for the command line.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Pipeline: ").append(overallStatus.wireName())
                .append(" (").append(String.format(Locale.US, "%.1f", overallProgress)).append("%)\n");
        sb.append("Started: ").append(orDash(startTime)).append("  Elapsed: ").append(orDash(executionTime));
        if (estimatedRemaining != null) {
            sb.append("  Remaining: ").append(estimatedRemaining);
        }
        if (estimatedCompletion != null && endTime == null) {
            sb.append("  ETA: ").append(estimatedCompletion);
        }
        sb.append('\n');
        for (Map.Entry<PipelineStage, StageView> entry : stages.entrySet()) {
            StageView view = entry.getValue();
            sb.append(String.format(Locale.US, "  %-18s %-8s %5.1f%% %s%n",
                    entry.getKey().wireName(), view.status.wireName(), view.progress, view.message));
        }
        sb.append("Metrics: ").append(metrics).append('\n');
        sb.append("Errors: ").append(errors.size()).append("  Warnings: ").append(warnings.size());
        if (!errors.isEmpty()) {
            sb.append("\nLast error: ").append(errors.get(errors.size() - 1));
        }
        return sb.toString();
    }

    private static String text(JSONObject doc, String key) {
        if (!doc.has(key) || doc.isNull(key)) {
            return null;
        }
        return doc.optString(key, null);
    }

    private static List<String> messages(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            JSONObject e = arr.optJSONObject(i);
            if (e != null) {
                out.add(e.optString("message", ""));
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static String orDash(String value) {
        return value == null ? "-" : value;
    }

    public static final class StageView {
        public final StageStatus status;
        public final double progress;
        public final String message;

        StageView(StageStatus status, double progress, String message) {
            this.status = status;
            this.progress = progress;
            this.message = message;
        }
    }
}
