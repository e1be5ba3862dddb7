package com.nightscan.runner;

import com.nightscan.core.progress.StageStatus;
import com.nightscan.model.PredictionRecord;
import com.nightscan.model.RegimeResult;
import com.nightscan.model.ScoredOpportunity;
import com.nightscan.predict.BridgeAvailability;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * What one overnight run produced. Fields after the failing stage stay empty.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RunOutcome {
    public final LocalDate runDate;
    public final StageStatus status;
    public final String error;
    public final RegimeResult regime;
    public final BridgeAvailability availability;
    public final Map<String, PredictionRecord> predictions;
    public final List<ScoredOpportunity> scored;
    public final List<ScoredOpportunity> topOpportunities;
    public final Map<String, String> skipped;
    public final Path reportPath;

    public boolean succeeded() {
        return status == StageStatus.COMPLETE;
    }
}
