package com.nightscan.model;

import java.time.LocalDate;

/**
 * Output of the price-direction model for one symbol.
 */
public final class DirectionForecast {
    public final boolean modelTrained;
    public final boolean dataSufficient;
    public final double direction;
    public final double confidence;
    public final Double predictedPrice;
    public final LocalDate predictionDate;
    public final String note;

    public DirectionForecast(
            boolean modelTrained,
            boolean dataSufficient,
            double direction,
            double confidence,
            Double predictedPrice,
            LocalDate predictionDate,
            String note
    ) {
        this.modelTrained = modelTrained;
        this.dataSufficient = dataSufficient;
        this.direction = direction;
        this.confidence = confidence;
        this.predictedPrice = predictedPrice;
        this.predictionDate = predictionDate;
        this.note = note == null ? "" : note;
    }

    public static DirectionForecast untrained(boolean dataSufficient, String note) {
        return new DirectionForecast(false, dataSufficient, 0.0, 0.0, null, null, note);
    }

    public boolean usable() {
        return modelTrained && dataSufficient;
    }
}
