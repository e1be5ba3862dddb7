package com.nightscan.scoring;

import com.nightscan.model.PredictionRecord;
import com.nightscan.model.StockCandidate;
import com.nightscan.model.TechnicalSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the scorer needs about one stock.
 */
public final class ScoringInput {
    public final StockCandidate candidate;
    public final PredictionRecord prediction;
    public final TechnicalSnapshot technical;
    public final Map<String, Double> macroBetas;

    public ScoringInput(
            StockCandidate candidate,
            PredictionRecord prediction,
            TechnicalSnapshot technical,
            Map<String, Double> macroBetas
    ) {
        if (candidate == null || prediction == null || technical == null) {
            throw new IllegalArgumentException("candidate, prediction and technical snapshot are required");
        }
        this.candidate = candidate;
        this.prediction = prediction;
        this.technical = technical;
        this.macroBetas = macroBetas == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(macroBetas));
    }
}
