package com.nightscan.core.progress;

import com.nightscan.output.PipelineNotifier;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineProgressTrackerTest {

    @Test
    void start_shouldPersistRunningDocumentWithPendingStages() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        PipelineProgressTracker tracker = new PipelineProgressTracker(store, null, new StepClock());

        tracker.start();

        JSONObject doc = store.read().orElseThrow();
        assertEquals("running", doc.getString("overall_status"));
        assertEquals("pending", doc.getJSONObject("stages").getJSONObject("initialization").getString("status"));
        assertTrue(doc.isNull("estimated_remaining_formatted"));
        assertTrue(doc.isNull("estimated_completion_time"));
        assertEquals(0L, doc.getJSONObject("metrics").getLong("stocks_scanned"));
    }

    @Test
    void updateStage_shouldRejectIllegalTransitions() {
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null, new StepClock());
        tracker.start();

        assertThrows(IllegalStateException.class,
                () -> tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "skip running"));
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 10, "loading");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "done");
        assertThrows(IllegalStateException.class,
                () -> tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "again"));
        assertThrows(IllegalStateException.class,
                () -> tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.PENDING, 0, "back"));
    }

    @Test
    void updateStage_shouldRequireStart() {
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null, new StepClock());

        assertThrows(IllegalStateException.class,
                () -> tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "early"));
    }

    @Test
    void stageFailure_shouldFailOverallImmediatelyAndNotifyOnce() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        RecordingNotifier notifier = new RecordingNotifier();
        PipelineProgressTracker tracker = new PipelineProgressTracker(store, notifier, new StepClock());
        tracker.start();
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "loading");

        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.FAILED, 40, "universe missing");

        assertEquals(StageStatus.FAILED, tracker.overallStatus());
        assertTrue(tracker.isCancelled());
        assertEquals(List.of("initialization failed: universe missing"), notifier.failures);
        assertEquals(0, notifier.successes.size());
        assertEquals(1, store.archived.size());
        assertEquals("failed", store.read().orElseThrow().getString("overall_status"));

        assertThrows(IllegalStateException.class,
                () -> tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.RUNNING, 0, "late"));
        tracker.markFailed("second failure");
        assertEquals(1, notifier.failures.size());
        assertEquals(1, store.archived.size());
    }

    @Test
    void overallProgress_shouldWeightStagesByExpectedMinutes() {
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null, new StepClock());
        tracker.start();

        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 0, "");
        tracker.updateStage(PipelineStage.UNIVERSE_SCAN, StageStatus.RUNNING, 50, "");

        double expected = (2 * 100.0 + 30 * 50.0) / PipelineStage.totalExpectedMinutes();
        assertEquals(expected, tracker.overallProgress(), 1e-9);
    }

    @Test
    void toJson_shouldEstimateRemainingTimeFromElapsedAndProgress() {
        StepClock clock = new StepClock();
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null, clock);
        tracker.start();
        clock.advance(Duration.ofMinutes(10));
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "");

        JSONObject doc = tracker.toJson();

        assertEquals("0:10:00", doc.getString("execution_time_formatted"));
        long remaining = Math.round(600 * (1.0 - 2.0 / 382.0) / (2.0 / 382.0));
        assertEquals(PipelineProgressTracker.formatDuration(Duration.ofSeconds(remaining)),
                doc.getString("estimated_remaining_formatted"));
        assertFalse(doc.isNull("estimated_completion_time"));
    }

    @Test
    void complete_shouldRequireEveryEarlierStage() {
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null, new StepClock());
        tracker.start();
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "");

        assertThrows(IllegalStateException.class, () -> tracker.complete(Path.of("report.html")));
    }

    @Test
    void complete_shouldFinishRunAndNotifySuccessWithReport() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        RecordingNotifier notifier = new RecordingNotifier();
        PipelineProgressTracker tracker = new PipelineProgressTracker(store, notifier, new StepClock());
        tracker.start();
        runAllStagesBeforeReport(tracker);
        tracker.incrementMetric(PipelineMetric.STOCKS_SCANNED, 3);

        tracker.complete(Path.of("reports", "report_20240308.html"));

        assertEquals(StageStatus.COMPLETE, tracker.overallStatus());
        assertEquals(100.0, tracker.overallProgress(), 1e-9);
        assertEquals(1, notifier.successes.size());
        assertEquals(Path.of("reports", "report_20240308.html"), notifier.reportPaths.get(0));
        JSONObject doc = store.read().orElseThrow();
        assertEquals("complete", doc.getString("overall_status"));
        assertEquals(3L, doc.getJSONObject("metrics").getLong("stocks_scanned"));
        assertEquals("0:00:00", doc.getString("estimated_remaining_formatted"));
        assertFalse(doc.isNull("end_time"));
        assertTrue(doc.getString("report_path").endsWith("report_20240308.html"));

        tracker.complete(Path.of("again.html"));
        assertEquals(1, notifier.successes.size());
    }

    @Test
    void notifierException_shouldBecomeWarning() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        RecordingNotifier notifier = new RecordingNotifier();
        notifier.failWith = new IllegalStateException("smtp down");
        PipelineProgressTracker tracker = new PipelineProgressTracker(store, notifier, new StepClock());
        tracker.start();

        tracker.markFailed("boom");

        JSONObject doc = store.read().orElseThrow();
        assertEquals("failed", doc.getString("overall_status"));
        String lastWarning = doc.getJSONArray("warnings").getJSONObject(0).getString("message");
        assertEquals("notification failed: smtp down", lastWarning);
    }

    @Test
    void markFailed_shouldStillNotifyWhenStoreRejectsWrites() {
        InMemoryProgressStore store = new FailingProgressStore(3);
        RecordingNotifier notifier = new RecordingNotifier();
        PipelineProgressTracker tracker = new PipelineProgressTracker(store, notifier, new StepClock());
        tracker.start();
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "loading");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "loaded");

        ProgressPersistenceException thrown = assertThrows(ProgressPersistenceException.class,
                () -> tracker.markFailed("cannot persist progress: disk full"));

        assertEquals("disk full", thrown.getMessage());
        assertEquals(StageStatus.FAILED, tracker.overallStatus());
        assertEquals(List.of("regime_detection failed: cannot persist progress: disk full"), notifier.failures);
        tracker.markFailed("again");
        assertEquals(1, notifier.failures.size());
    }

    @Test
    void requestCancel_shouldFailRunningStage() {
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null, new StepClock());
        tracker.start();
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "");
        tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.RUNNING, 30, "");

        tracker.requestCancel("operator");

        assertTrue(tracker.isCancelled());
        assertEquals(StageStatus.FAILED, tracker.stageStatus(PipelineStage.REGIME_DETECTION));
        assertEquals(StageStatus.COMPLETE, tracker.stageStatus(PipelineStage.INITIALIZATION));
        assertEquals(StageStatus.FAILED, tracker.overallStatus());
    }

    @Test
    void persistedDocument_shouldReloadWithLastCompletedStage() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        PipelineProgressTracker tracker = new PipelineProgressTracker(store, null, new StepClock());
        tracker.start();
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "");
        tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.COMPLETE, 100, "");
        tracker.updateStage(PipelineStage.UNIVERSE_SCAN, StageStatus.RUNNING, 25, "2/8 symbols scanned");
        tracker.addWarning("x.us: universe scan skipped");

        ProgressSnapshot snapshot = new ProgressStatusReader(store).read().orElseThrow();

        assertEquals(StageStatus.RUNNING, snapshot.overallStatus);
        assertEquals(PipelineStage.REGIME_DETECTION, snapshot.lastCompletedStage().orElseThrow());
        assertEquals("2/8 symbols scanned", snapshot.stages.get(PipelineStage.UNIVERSE_SCAN).message);
        assertEquals(List.of("x.us: universe scan skipped"), snapshot.warnings);
    }

    @Test
    void formatDuration_shouldUseHoursMinutesSeconds() {
        assertEquals("0:00:00", PipelineProgressTracker.formatDuration(Duration.ZERO));
        assertEquals("1:01:05", PipelineProgressTracker.formatDuration(Duration.ofSeconds(3665)));
        assertEquals("0:00:00", PipelineProgressTracker.formatDuration(Duration.ofSeconds(-5)));
    }

    static void runAllStagesBeforeReport(PipelineProgressTracker tracker) {
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage == PipelineStage.REPORT_GENERATION) {
                break;
            }
            tracker.updateStage(stage, StageStatus.RUNNING, 0, "");
            tracker.updateStage(stage, StageStatus.COMPLETE, 100, "");
        }
    }

    static final class RecordingNotifier implements PipelineNotifier {
        final List<JSONObject> successes = new ArrayList<>();
        final List<Path> reportPaths = new ArrayList<>();
        final List<String> failures = new ArrayList<>();
        RuntimeException failWith;

        @Override
        public void sendSuccess(JSONObject progressDocument, Path reportPath) {
            successes.add(progressDocument);
            reportPaths.add(reportPath);
            if (failWith != null) {
                throw failWith;
            }
        }

        @Override
        public void sendFailure(String errorMessage, JSONObject progressDocument) {
            failures.add(errorMessage);
            if (failWith != null) {
                throw failWith;
            }
        }
    }

    /**
     * Accepts the first {@code healthyWrites} writes, then rejects every write and archive.
     */
    static final class FailingProgressStore extends InMemoryProgressStore {
        private final int healthyWrites;
        private int attempts;

        FailingProgressStore(int healthyWrites) {
            this.healthyWrites = healthyWrites;
        }

        @Override
        public synchronized void write(JSONObject document) {
            attempts++;
            if (attempts > healthyWrites) {
                throw new ProgressPersistenceException("disk full", null);
            }
            super.write(document);
        }

        @Override
        public synchronized void archive(JSONObject document, LocalDateTime startTime) {
            throw new ProgressPersistenceException("disk full", null);
        }
    }

    /**
     * Clock that only moves when told to.
     */
    static final class StepClock extends Clock {
        private Instant now = Instant.parse("2024-03-08T22:00:00Z");

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
