package com.nightscan.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one per-symbol unit of work: either a value or a cause code with a message.
 */
public final class Outcome<T> {
    public final String symbol;
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String message;
    public final Map<String, Object> details;

    private Outcome(String symbol, boolean success, T value, CauseCode causeCode, String message, Map<String, Object> details) {
        this.symbol = symbol == null ? "" : symbol;
        this.success = success;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.message = message == null ? "" : message;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(String symbol, T value) {
        return new Outcome<>(symbol, true, value, CauseCode.NONE, "", Map.of());
    }

    public static <T> Outcome<T> success(String symbol, T value, Map<String, Object> details) {
        return new Outcome<>(symbol, true, value, CauseCode.NONE, "", copy(details));
    }

    public static <T> Outcome<T> failure(String symbol, CauseCode causeCode, String message) {
        return new Outcome<>(symbol, false, null, causeCode, message, Map.of());
    }

    public static <T> Outcome<T> failure(String symbol, CauseCode causeCode, String message, Map<String, Object> details) {
        return new Outcome<>(symbol, false, null, causeCode, message, copy(details));
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : in.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        if (success) {
            return "Outcome[" + symbol + " ok]";
        }
        return "Outcome[" + symbol + " " + causeCode + ": " + message + "]";
    }
}
