package com.nightscan.core.progress;

import com.nightscan.output.PipelineNotifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：PipelineProgressTracker（class）。
 * 主要职责：维护七个阶段的状态机、整体进度与 ETA、指标计数以及错误/警告列表；每次变更都完整写入 ProgressStore。
 * 使用建议：所有公开方法均为 synchronized，工作线程只调用 incrementMetric / addWarning / isCancelled；
 * 第一次进入终态时恰好通知一次并归档一次。
 */
public final class PipelineProgressTracker {
    private static final Logger LOG = LogManager.getLogger(PipelineProgressTracker.class);
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    static final double PROGRESS_EPSILON = 1e-6;

    private final ProgressStore store;
    private final PipelineNotifier notifier;
    private final Clock clock;

    private final Map<PipelineStage, StageState> stages = new EnumMap<>(PipelineStage.class);
    private final Map<PipelineMetric, Long> metrics = new EnumMap<>(PipelineMetric.class);
    private final List<Entry> errors = new ArrayList<>();
    private final List<Entry> warnings = new ArrayList<>();

    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private StageStatus overallStatus = StageStatus.PENDING;
    private boolean cancelRequested;
    private boolean finalized;
    private Path reportPath;

    public PipelineProgressTracker(ProgressStore store, PipelineNotifier notifier) {
        this(store, notifier, Clock.systemDefaultZone());
    }

    public PipelineProgressTracker(ProgressStore store, PipelineNotifier notifier, Clock clock) {
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
        resetState();
    }

    /**
     * Begins a new run: all stages pending, overall running, document persisted.
     */
    public synchronized void start() {
        if (overallStatus == StageStatus.RUNNING) {
            throw new IllegalStateException("pipeline already running");
        }
        resetState();
        startTime = now();
        overallStatus = StageStatus.RUNNING;
        LOG.info("Pipeline started at {}", TIMESTAMP.format(startTime));
        persist();
    }

    /**
     * 方法说明：updateStage，唯一的阶段状态变更入口。
     * 处理流程：校验迁移合法性 → 更新阶段 → 重新计算整体状态与 ETA → 持久化 → 首次进入终态时归档并通知。
     * 维护提示：只允许 pending→running/failed、running→running/complete/failed；终态阶段不可再变更。
     */
    public synchronized void updateStage(PipelineStage stage, StageStatus status, double progress, String message) {
        requireStarted();
        if (finalized) {
            throw new IllegalStateException("pipeline already " + overallStatus.wireName() + "; cannot update " + stage.wireName());
        }
        StageState state = stages.get(stage);
        checkTransition(stage, state.status, status);
        state.status = status;
        state.progress = status == StageStatus.COMPLETE ? 100.0 : clampProgress(progress);
        state.message = message == null ? "" : message;
        if (status == StageStatus.FAILED) {
            errors.add(new Entry(now(), stage.wireName() + " failed: " + state.message));
        }
        LOG.info("Stage {} -> {} ({}%) {}", stage.wireName(), status.wireName(),
                String.format(Locale.US, "%.1f", state.progress), state.message);
        recomputeOverall();
        if (overallStatus.isTerminal()) {
            finalizeRun();
        } else {
            persist();
        }
    }

    public synchronized void incrementMetric(PipelineMetric metric, long amount) {
        requireStarted();
        metrics.merge(metric, amount, Long::sum);
        persist();
    }

    public synchronized void addError(String message) {
        requireStarted();
        errors.add(new Entry(now(), message));
        LOG.error("Pipeline error: {}", message);
        persist();
    }

    public synchronized void addWarning(String message) {
        requireStarted();
        warnings.add(new Entry(now(), message));
        LOG.warn("Pipeline warning: {}", message);
        persist();
    }

    /**
     * Cooperative cancellation: the running stage is marked failed and loops stop before their next unit.
     */
    public synchronized void requestCancel(String reason) {
        requireStarted();
        if (cancelRequested || finalized) {
            cancelRequested = true;
            return;
        }
        cancelRequested = true;
        String message = "cancelled: " + (reason == null ? "requested" : reason);
        warnings.add(new Entry(now(), message));
        failActiveStage(message);
    }

    public synchronized boolean isCancelled() {
        return cancelRequested || overallStatus == StageStatus.FAILED;
    }

    /**
     * Marks the running (or next pending) stage failed. Ignored once the run has already finished.
     */
    public synchronized void markFailed(String error) {
        requireStarted();
        if (finalized) {
            LOG.debug("markFailed ignored, pipeline already {}", overallStatus.wireName());
            return;
        }
        failActiveStage(error == null ? "pipeline failed" : error);
    }

    /**
     * Completes the report_generation stage with the produced report. Every earlier stage must be complete.
     */
    public synchronized void complete(Path reportPath) {
        requireStarted();
        if (finalized) {
            LOG.debug("complete ignored, pipeline already {}", overallStatus.wireName());
            return;
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage != PipelineStage.REPORT_GENERATION && stages.get(stage).status != StageStatus.COMPLETE) {
                throw new IllegalStateException("stage " + stage.wireName() + " is not complete");
            }
        }
        this.reportPath = reportPath;
        StageState report = stages.get(PipelineStage.REPORT_GENERATION);
        if (report.status == StageStatus.PENDING) {
            report.status = StageStatus.RUNNING;
        }
        updateStage(PipelineStage.REPORT_GENERATION, StageStatus.COMPLETE, 100.0,
                reportPath == null ? "report generated" : "report written to " + reportPath);
    }

    public synchronized StageStatus overallStatus() {
        return overallStatus;
    }

    public synchronized StageStatus stageStatus(PipelineStage stage) {
        return stages.get(stage).status;
    }

    public synchronized long metric(PipelineMetric metric) {
        return metrics.getOrDefault(metric, 0L);
    }

    public synchronized double overallProgress() {
        return computeOverallProgress();
    }

    /**
     * Snapshot of the full progress document as persisted.
     */
    public synchronized JSONObject toJson() {
        LocalDateTime current = now();
        double overall = computeOverallProgress();
        JSONObject doc = new JSONObject();
        doc.put("start_time", startTime == null ? JSONObject.NULL : TIMESTAMP.format(startTime));
        doc.put("end_time", endTime == null ? JSONObject.NULL : TIMESTAMP.format(endTime));
        doc.put("overall_status", overallStatus.wireName());
        doc.put("overall_progress", round1(overall));
        doc.put("current_time", TIMESTAMP.format(current));

        Duration elapsed = startTime == null
                ? Duration.ZERO
                : Duration.between(startTime, endTime == null ? current : endTime);
        doc.put("execution_time_formatted", formatDuration(elapsed));
        if (overall > 0.0 && endTime == null) {
            double fraction = overall / 100.0;
            long remainingSeconds = Math.round(elapsed.getSeconds() * (1.0 - fraction) / Math.max(fraction, PROGRESS_EPSILON));
            doc.put("estimated_remaining_formatted", formatDuration(Duration.ofSeconds(remainingSeconds)));
            doc.put("estimated_completion_time", TIMESTAMP.format(current.plusSeconds(remainingSeconds)));
        } else if (overall > 0.0) {
            doc.put("estimated_remaining_formatted", formatDuration(Duration.ZERO));
            doc.put("estimated_completion_time", TIMESTAMP.format(endTime));
        } else {
            doc.put("estimated_remaining_formatted", JSONObject.NULL);
            doc.put("estimated_completion_time", JSONObject.NULL);
        }

        JSONObject stageJson = new JSONObject();
        for (PipelineStage stage : PipelineStage.values()) {
            StageState state = stages.get(stage);
            JSONObject s = new JSONObject();
            s.put("status", state.status.wireName());
            s.put("progress", round1(state.progress));
            s.put("message", state.message);
            stageJson.put(stage.wireName(), s);
        }
        doc.put("stages", stageJson);

        JSONObject metricJson = new JSONObject();
        for (PipelineMetric metric : PipelineMetric.values()) {
            metricJson.put(metric.wireName(), metrics.getOrDefault(metric, 0L));
        }
        doc.put("metrics", metricJson);
        doc.put("errors", entries(errors));
        doc.put("warnings", entries(warnings));
        if (reportPath != null) {
            doc.put("report_path", reportPath.toString());
        }
        return doc;
    }

    static String formatDuration(Duration duration) {
        long seconds = Math.max(0L, duration.getSeconds());
        return String.format(Locale.US, "%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    private void failActiveStage(String message) {
        PipelineStage target = null;
        for (PipelineStage stage : PipelineStage.values()) {
            if (stages.get(stage).status == StageStatus.RUNNING) {
                target = stage;
                break;
            }
        }
        if (target == null) {
            for (PipelineStage stage : PipelineStage.values()) {
                if (stages.get(stage).status == StageStatus.PENDING) {
                    target = stage;
                    break;
                }
            }
        }
        if (target == null) {
            errors.add(new Entry(now(), message));
            overallStatus = StageStatus.FAILED;
            finalizeRun();
            return;
        }
        StageState state = stages.get(target);
        updateStage(target, StageStatus.FAILED, state.progress, message);
    }

    private void checkTransition(PipelineStage stage, StageStatus from, StageStatus to) {
        boolean ok;
        switch (from) {
            case PENDING:
                ok = to == StageStatus.RUNNING || to == StageStatus.FAILED;
                break;
            case RUNNING:
                ok = true;
                break;
            default:
                ok = false;
                break;
        }
        if (!ok || to == StageStatus.PENDING) {
            throw new IllegalStateException("illegal transition for " + stage.wireName() + ": "
                    + from.wireName() + " -> " + to.wireName());
        }
    }

    private void recomputeOverall() {
        boolean allComplete = true;
        for (StageState state : stages.values()) {
            if (state.status == StageStatus.FAILED) {
                overallStatus = StageStatus.FAILED;
                return;
            }
            if (state.status != StageStatus.COMPLETE) {
                allComplete = false;
            }
        }
        overallStatus = allComplete ? StageStatus.COMPLETE : StageStatus.RUNNING;
    }

    private double computeOverallProgress() {
        double weighted = 0.0;
        for (Map.Entry<PipelineStage, StageState> entry : stages.entrySet()) {
            weighted += entry.getKey().expectedMinutes() * entry.getValue().progress;
        }
        return weighted / PipelineStage.totalExpectedMinutes();
    }

    /**
     * Writes and archives the terminal document, then notifies. A store failure does not suppress the
     * notification; it is rethrown once the notifier has run.
     */
    private void finalizeRun() {
        if (finalized) {
            return;
        }
        finalized = true;
        endTime = now();
        JSONObject doc = toJson();
        ProgressPersistenceException storeFailure = null;
        try {
            store.write(doc);
            store.archive(doc, startTime);
        } catch (ProgressPersistenceException e) {
            LOG.error("Final progress document not persisted: {}", e.getMessage());
            storeFailure = e;
        }
        LOG.info("Pipeline {} after {}", overallStatus.wireName(), doc.getString("execution_time_formatted"));
        notifyFinished(doc, storeFailure == null);
        if (storeFailure != null) {
            throw storeFailure;
        }
    }

    private void notifyFinished(JSONObject doc, boolean storeHealthy) {
        if (notifier == null) {
            return;
        }
        try {
            if (overallStatus == StageStatus.COMPLETE) {
                notifier.sendSuccess(doc, reportPath);
            } else {
                notifier.sendFailure(lastErrorMessage(), doc);
            }
        } catch (RuntimeException e) {
            LOG.error("Pipeline notification failed: {}", e.toString());
            warnings.add(new Entry(now(), "notification failed: " + e.getMessage()));
            if (storeHealthy) {
                persist();
            }
        }
    }

    private String lastErrorMessage() {
        return errors.isEmpty() ? "pipeline failed" : errors.get(errors.size() - 1).message;
    }

    private void persist() {
        store.write(toJson());
    }

    private void requireStarted() {
        if (startTime == null) {
            throw new IllegalStateException("pipeline not started");
        }
    }

    private void resetState() {
        stages.clear();
        for (PipelineStage stage : PipelineStage.values()) {
            stages.put(stage, new StageState());
        }
        metrics.clear();
        for (PipelineMetric metric : PipelineMetric.values()) {
            metrics.put(metric, 0L);
        }
        errors.clear();
        warnings.clear();
        startTime = null;
        endTime = null;
        cancelRequested = false;
        finalized = false;
        reportPath = null;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).withNano(0);
    }

    private static JSONArray entries(List<Entry> list) {
        JSONArray arr = new JSONArray();
        for (Entry entry : list) {
            JSONObject e = new JSONObject();
            e.put("timestamp", TIMESTAMP.format(entry.timestamp));
            e.put("message", entry.message);
            arr.put(e);
        }
        return arr;
    }

    private static double clampProgress(double progress) {
        if (!Double.isFinite(progress)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, progress));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static final class StageState {
        StageStatus status = StageStatus.PENDING;
        double progress;
        String message = "";
    }

    private static final class Entry {
        final LocalDateTime timestamp;
        final String message;

        Entry(LocalDateTime timestamp, String message) {
            this.timestamp = timestamp;
            this.message = message == null ? "" : message;
        }
    }
}
