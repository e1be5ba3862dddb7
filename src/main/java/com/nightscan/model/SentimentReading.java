package com.nightscan.model;

import java.util.List;

/**
 * Headline sentiment for one symbol. {@code articleCount == 0} means "no signal".
 */
public final class SentimentReading {
    public final String label;
    public final double confidencePct;
    public final double direction;
    public final int articleCount;
    public final List<String> sources;

    public SentimentReading(String label, double confidencePct, double direction, int articleCount, List<String> sources) {
        this.label = label == null ? "neutral" : label;
        this.confidencePct = Math.max(0.0, Math.min(100.0, confidencePct));
        this.direction = Math.max(-1.0, Math.min(1.0, direction));
        this.articleCount = Math.max(0, articleCount);
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static SentimentReading noSignal() {
        return new SentimentReading("neutral", 0.0, 0.0, 0, List.of());
    }

    public boolean hasSignal() {
        return articleCount > 0;
    }
}
