package com.nightscan.predict;

import com.nightscan.model.NewsItem;
import com.nightscan.model.SentimentReading;

import java.util.List;

public interface SentimentModel {

    /**
     * Sentiment of the given headlines. An empty list yields {@link SentimentReading#noSignal()}.
     */
    SentimentReading analyze(String symbol, List<NewsItem> news) throws ModelUnavailableException;

    /**
     * Start-up failure of the underlying model, or null when it is ready.
     */
    default String initError() {
        return null;
    }
}
