package com.nightscan.data;

import java.util.Locale;

/**
 * A data source could not deliver a series. Callers treat it as a per-unit failure.
 */
public class FetchException extends Exception {
    private final String symbol;
    private final String category;

    public FetchException(String symbol, String message) {
        this(symbol, message, null);
    }

    public FetchException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol == null ? "" : symbol;
        this.category = classify(message);
    }

    public String symbol() {
        return symbol;
    }

    /**
     * One of {@code timeout}, {@code rate_limit}, {@code no_data}, {@code other}.
     */
    public String category() {
        return category;
    }

    public boolean isTimeout() {
        return "timeout".equals(category);
    }

    public static String classify(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return "timeout";
        }
        if (msg.contains("rate_limit") || msg.contains("daily hits limit") || msg.contains("http status=429")) {
            return "rate_limit";
        }
        if (msg.contains("no data") || msg.contains("no_data")) {
            return "no_data";
        }
        return "other";
    }
}
