package com.nightscan.predict;

import com.nightscan.model.Bars;
import com.nightscan.model.DirectionForecast;
import com.nightscan.model.PriceSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogisticDirectionModelTest {
    private static final LocalDate START = LocalDate.of(2023, 1, 2);

    @Test
    void predict_shouldReportShortHistoryAsDataInsufficient() {
        LogisticDirectionModel model = new LogisticDirectionModel(60, 100, 0.1, 0.01);
        PriceSeries shortHistory = Bars.randomWalk("s", START, 45, 0.0, 0.01, 1L);

        assertFalse(model.refresh("s", shortHistory));
        DirectionForecast forecast = model.predict("s", shortHistory);

        assertFalse(forecast.usable());
        assertFalse(forecast.dataSufficient);
        assertFalse(model.hasModel("s"));
    }

    @Test
    void predict_shouldRequireRefreshBeforeUse() {
        LogisticDirectionModel model = new LogisticDirectionModel(60, 100, 0.1, 0.01);
        PriceSeries history = Bars.randomWalk("u", START, 120, 0.0, 0.01, 2L);

        DirectionForecast forecast = model.predict("u", history);

        assertFalse(forecast.modelTrained);
        assertTrue(forecast.dataSufficient);
        assertEquals("no trained model", forecast.note);
    }

    @Test
    void refresh_shouldProduceBoundedForecastThatVariesWithData() {
        LogisticDirectionModel model = new LogisticDirectionModel(60, 200, 0.1, 0.01);
        PriceSeries a = Bars.randomWalk("a", START, 200, 0.002, 0.01, 3L);
        PriceSeries b = Bars.randomWalk("b", START, 200, -0.001, 0.025, 4L);

        assertTrue(model.refresh("a", a));
        assertTrue(model.refresh("b", b));
        DirectionForecast fa = model.predict("a", a);
        DirectionForecast fb = model.predict("b", b);

        assertTrue(fa.usable());
        assertTrue(fa.direction >= -1.0 && fa.direction <= 1.0);
        assertTrue(fa.confidence >= 0.0 && fa.confidence <= 1.0);
        assertNotNull(fa.predictedPrice);
        assertEquals(a.last().date.plusDays(1), fa.predictionDate);
        assertNotEquals(fa.confidence, fb.confidence);
    }

    @Test
    void features_shouldHaveFixedWidthAndBeFinite() {
        double[] closes = Bars.randomWalk("f", START, 40, 0.0, 0.01, 5L).closes();

        double[] x = LogisticDirectionModel.features(closes, 30);

        assertEquals(LogisticDirectionModel.FEATURES, x.length);
        for (double v : x) {
            assertTrue(Double.isFinite(v));
        }
    }
}
