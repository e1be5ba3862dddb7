package com.nightscan.core.progress;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressSnapshotTest {

    @Test
    void fromJson_shouldDefaultMissingSections() {
        ProgressSnapshot snapshot = ProgressSnapshot.fromJson(new JSONObject().put("overall_status", "running"));

        assertEquals(StageStatus.RUNNING, snapshot.overallStatus);
        assertNull(snapshot.startTime);
        assertEquals(StageStatus.PENDING, snapshot.stages.get(PipelineStage.SCORING).status);
        assertEquals(0L, snapshot.metric(PipelineMetric.MODELS_TRAINED));
        assertTrue(snapshot.lastCompletedStage().isEmpty());
    }

    @Test
    void render_shouldListStagesMetricsAndLastError() {
        PipelineProgressTracker tracker = new PipelineProgressTracker(new InMemoryProgressStore(), null,
                new PipelineProgressTrackerTest.StepClock());
        tracker.start();
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0, "");
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100, "config loaded");
        tracker.incrementMetric(PipelineMetric.STOCKS_SCANNED, 7);
        tracker.markFailed("regime fetch failed");

        ProgressSnapshot snapshot = ProgressSnapshot.fromJson(tracker.toJson());
        String text = snapshot.render();

        assertTrue(text.startsWith("Pipeline: failed"));
        assertTrue(text.contains("initialization"));
        assertTrue(text.contains("config loaded"));
        assertTrue(text.contains("stocks_scanned=7"));
        assertTrue(text.contains("Last error: regime_detection failed: regime fetch failed"));
        assertEquals(PipelineStage.INITIALIZATION, snapshot.lastCompletedStage().orElseThrow());
    }
}
