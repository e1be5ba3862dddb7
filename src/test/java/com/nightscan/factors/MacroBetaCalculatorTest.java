package com.nightscan.factors;

import com.nightscan.data.FetchException;
import com.nightscan.data.MarketDataService;
import com.nightscan.model.Bars;
import com.nightscan.model.PriceSeries;
import com.nightscan.quality.DataQualityValidator;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MacroBetaCalculatorTest {
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate AS_OF = LocalDate.of(2024, 4, 30);
    private static final int BARS = 85;

    @Test
    void computeBetas_shouldRecoverKnownSlope() {
        PriceSeries factor = Bars.randomWalk("^spx", START, BARS, 0.0, 0.01, 11L);
        FakeMarketData market = new FakeMarketData();
        market.series.put("^spx", factor);
        market.series.put("lev.us", leveraged("lev.us", factor, 2.0));

        MacroBetaResult result = calculator(market).computeBetas(List.of("lev.us"), AS_OF);

        assertEquals(2.0, result.beta("lev.us", "market").getAsDouble(), 1e-6);
        assertTrue(result.missing().isEmpty());
    }

    @Test
    void computeBetas_shouldOmitPairWhenFactorVarianceIsZero() {
        double[] flat = new double[BARS];
        Arrays.fill(flat, 50.0);
        FakeMarketData market = new FakeMarketData();
        market.series.put("^spx", Bars.fromCloses("^spx", START, flat, 0));
        market.series.put("aaa.us", Bars.randomWalk("aaa.us", START, BARS, 0.0, 0.01, 3L));

        MacroBetaResult result = calculator(market).computeBetas(List.of("aaa.us"), AS_OF);

        assertFalse(result.beta("aaa.us", "market").isPresent());
        assertEquals("degenerate factor variance", result.missing().get("aaa.us/market"));
    }

    @Test
    void computeBetas_shouldNotAbortBatchWhenOneSymbolFails() {
        PriceSeries factor = Bars.randomWalk("^spx", START, BARS, 0.0, 0.01, 5L);
        FakeMarketData market = new FakeMarketData();
        market.series.put("^spx", factor);
        market.series.put("ok.us", leveraged("ok.us", factor, 0.5));

        MacroBetaResult result = calculator(market).computeBetas(List.of("broken.us", "ok.us"), AS_OF);

        assertTrue(result.missing().get("broken.us").startsWith("fetch failed"));
        assertEquals(0.5, result.beta("ok.us", "market").getAsDouble(), 1e-6);
    }

    @Test
    void computeBetas_shouldSurviveRuntimeErrorFromSymbolFetch() {
        PriceSeries factor = Bars.randomWalk("^spx", START, BARS, 0.0, 0.01, 7L);
        FakeMarketData market = new FakeMarketData();
        market.series.put("^spx", factor);
        market.series.put("aaa.us", leveraged("aaa.us", factor, 1.5));
        market.series.put("ccc.us", leveraged("ccc.us", factor, 0.8));
        market.crashing.put("bad.us", new IllegalStateException("socket reset"));

        MacroBetaResult result = calculator(market).computeBetas(List.of("aaa.us", "bad.us", "ccc.us"), AS_OF);

        assertEquals(1.5, result.beta("aaa.us", "market").getAsDouble(), 1e-6);
        assertEquals(0.8, result.beta("ccc.us", "market").getAsDouble(), 1e-6);
        assertEquals("fetch failed: socket reset", result.missing().get("bad.us"));
    }

    @Test
    void computeBetas_shouldSurviveRuntimeErrorFromFactorFetch() {
        FakeMarketData market = new FakeMarketData();
        market.series.put("aaa.us", Bars.randomWalk("aaa.us", START, BARS, 0.0, 0.01, 4L));
        market.crashing.put("^spx", new IllegalStateException("socket reset"));

        MacroBetaResult result = calculator(market).computeBetas(List.of("aaa.us"), AS_OF);

        assertTrue(result.betasFor("aaa.us").isEmpty());
        assertEquals("factor fetch failed: socket reset", result.missing().get("*/market"));
    }

    @Test
    void computeBetas_shouldReportInsufficientOverlap() {
        PriceSeries factor = Bars.randomWalk("^spx", START, BARS, 0.0, 0.01, 9L);
        FakeMarketData market = new FakeMarketData();
        market.series.put("^spx", factor);
        Map<String, PriceSeries> histories = Map.of("short.us", factor.lastN(10));

        MacroBetaResult result = calculator(market).computeBetas(histories, AS_OF);

        assertTrue(result.betasFor("short.us").isEmpty());
        assertTrue(result.missing().get("short.us/market").startsWith("insufficient overlap"));
    }

    @Test
    void ols_shouldReturnNaNForConstantFactor() {
        assertTrue(Double.isNaN(MacroBetaCalculator.ols(List.of(new double[]{0.1, 0.0}, new double[]{0.2, 0.0}))));
    }

    @Test
    void parse_shouldRejectMalformedFactorToken() {
        assertEquals("market", FactorDefinition.parse(List.of("market:^spx")).get(0).name);
        assertThrows(IllegalArgumentException.class, () -> FactorDefinition.parse(List.of("market")));
    }

    private static MacroBetaCalculator calculator(MarketDataService market) {
        return new MacroBetaCalculator(market, new DataQualityValidator(),
                List.of(new FactorDefinition("market", "^spx")), 90, 40);
    }

    private static PriceSeries leveraged(String symbol, PriceSeries factor, double beta) {
        double[] source = factor.closes();
        double[] closes = new double[source.length];
        closes[0] = 100.0;
        for (int i = 1; i < source.length; i++) {
            closes[i] = closes[i - 1] * (1.0 + beta * (source[i] / source[i - 1] - 1.0));
        }
        return Bars.fromCloses(symbol, START, closes, 1_000_000);
    }

    private static final class FakeMarketData implements MarketDataService {
        final Map<String, PriceSeries> series = new HashMap<>();
        final Map<String, RuntimeException> crashing = new HashMap<>();

        @Override
        public PriceSeries fetch(String symbol, LocalDate start, LocalDate end) throws FetchException {
            if (crashing.containsKey(symbol)) {
                throw crashing.get(symbol);
            }
            PriceSeries out = series.get(symbol);
            if (out == null) {
                throw new FetchException(symbol, "no data for " + symbol);
            }
            return out;
        }
    }
}
