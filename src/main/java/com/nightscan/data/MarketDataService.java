package com.nightscan.data;

import com.nightscan.model.MarketFrame;
import com.nightscan.model.PriceSeries;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily price source shared by the regime engine, the beta calculator and the predictor.
 * Implementations must be idempotent and free of side effects visible to callers.
 */
public interface MarketDataService {

    /**
     * Bars for {@code symbol} dated within [start, end]. An empty result is reported as a {@link FetchException}.
     */
    PriceSeries fetch(String symbol, LocalDate start, LocalDate end) throws FetchException;

    /**
     * Several symbols at once as a layered-column frame. Fails as a whole when any symbol fails.
     */
    default MarketFrame fetchMany(List<String> symbols, LocalDate start, LocalDate end) throws FetchException {
        Map<String, PriceSeries> bySymbol = new LinkedHashMap<>();
        for (String symbol : symbols) {
            bySymbol.put(symbol, fetch(symbol, start, end));
        }
        return MarketFrame.fromSeries(bySymbol);
    }
}
