package com.nightscan.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Multi-symbol fetch result. Columns are layered as (symbol, field) and aligned on the union of dates;
 * a value a symbol does not have on a date is {@code NaN}.
 */
public final class MarketFrame {
    public static final String OPEN = "open";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String CLOSE = "close";
    public static final String ADJ_CLOSE = "adj_close";
    public static final String VOLUME = "volume";

    private final List<LocalDate> dates;
    private final Map<ColumnKey, double[]> columns;

    public MarketFrame(List<LocalDate> dates, Map<ColumnKey, double[]> columns) {
        this.dates = dates == null ? List.of() : List.copyOf(dates);
        Map<ColumnKey, double[]> copy = new LinkedHashMap<>();
        if (columns != null) {
            for (Map.Entry<ColumnKey, double[]> entry : columns.entrySet()) {
                double[] values = entry.getValue();
                if (values == null || values.length != this.dates.size()) {
                    throw new IllegalArgumentException("column " + entry.getKey() + " length does not match "
                            + this.dates.size() + " dates");
                }
                copy.put(entry.getKey(), values.clone());
            }
        }
        this.columns = Collections.unmodifiableMap(copy);
    }

    public static MarketFrame empty() {
        return new MarketFrame(List.of(), Map.of());
    }

    /**
     * Outer-joins the series on date with the standard OHLCV fields.
     */
    public static MarketFrame fromSeries(Map<String, PriceSeries> seriesBySymbol) {
        TreeSet<LocalDate> allDates = new TreeSet<>();
        for (PriceSeries series : seriesBySymbol.values()) {
            allDates.addAll(series.dates());
        }
        List<LocalDate> dates = new ArrayList<>(allDates);
        Map<LocalDate, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < dates.size(); i++) {
            index.put(dates.get(i), i);
        }
        Map<ColumnKey, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, PriceSeries> entry : seriesBySymbol.entrySet()) {
            String symbol = entry.getKey();
            double[] open = nanArray(dates.size());
            double[] high = nanArray(dates.size());
            double[] low = nanArray(dates.size());
            double[] close = nanArray(dates.size());
            double[] volume = nanArray(dates.size());
            for (PriceBar bar : entry.getValue().bars()) {
                int i = index.get(bar.date);
                open[i] = bar.open;
                high[i] = bar.high;
                low[i] = bar.low;
                close[i] = bar.close;
                volume[i] = bar.volume;
            }
            columns.put(new ColumnKey(symbol, OPEN), open);
            columns.put(new ColumnKey(symbol, HIGH), high);
            columns.put(new ColumnKey(symbol, LOW), low);
            columns.put(new ColumnKey(symbol, CLOSE), close);
            columns.put(new ColumnKey(symbol, VOLUME), volume);
        }
        return new MarketFrame(dates, columns);
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public int rowCount() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty() || columns.isEmpty();
    }

    public Set<ColumnKey> columnKeys() {
        return columns.keySet();
    }

    public Set<String> symbols() {
        Set<String> out = new LinkedHashSet<>();
        for (ColumnKey key : columns.keySet()) {
            out.add(key.symbol);
        }
        return out;
    }

    public Set<String> fields() {
        Set<String> out = new LinkedHashSet<>();
        for (ColumnKey key : columns.keySet()) {
            out.add(key.field);
        }
        return out;
    }

    public boolean has(String symbol, String field) {
        return columns.containsKey(new ColumnKey(symbol, field));
    }

    /**
     * A copy of the column, or {@code null} when the frame has no such column.
     */
    public double[] column(String symbol, String field) {
        double[] values = columns.get(new ColumnKey(symbol, field));
        return values == null ? null : values.clone();
    }

    private static double[] nanArray(int size) {
        double[] out = new double[size];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    public static final class ColumnKey {
        public final String symbol;
        public final String field;

        public ColumnKey(String symbol, String field) {
            this.symbol = symbol == null ? "" : symbol;
            this.field = field == null ? "" : field;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ColumnKey)) {
                return false;
            }
            ColumnKey other = (ColumnKey) o;
            return symbol.equals(other.symbol) && field.equals(other.field);
        }

        @Override
        public int hashCode() {
            return Objects.hash(symbol, field);
        }

        @Override
        public String toString() {
            return "(" + symbol + ", " + field + ")";
        }
    }
}
