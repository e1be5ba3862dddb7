package com.nightscan.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/**
 * Daily bars for one symbol with strictly increasing, duplicate-free dates.
 */
public final class PriceSeries {
    public final String symbol;
    private final List<PriceBar> bars;

    public PriceSeries(String symbol, List<PriceBar> bars) {
        this.symbol = symbol == null ? "" : symbol;
        List<PriceBar> copy = bars == null ? List.of() : new ArrayList<>(bars);
        for (int i = 1; i < copy.size(); i++) {
            if (!copy.get(i).date.isAfter(copy.get(i - 1).date)) {
                throw new IllegalArgumentException("dates must be strictly increasing for " + this.symbol
                        + ": " + copy.get(i - 1).date + " then " + copy.get(i).date);
            }
        }
        this.bars = Collections.unmodifiableList(copy);
    }

    /**
     * Sorts bars by date and keeps the last bar seen for a repeated date.
     */
    public static PriceSeries sorted(String symbol, List<PriceBar> bars) {
        TreeMap<LocalDate, PriceBar> byDate = new TreeMap<>();
        if (bars != null) {
            for (PriceBar bar : bars) {
                if (bar != null && bar.date != null) {
                    byDate.put(bar.date, bar);
                }
            }
        }
        return new PriceSeries(symbol, new ArrayList<>(byDate.values()));
    }

    public static PriceSeries empty(String symbol) {
        return new PriceSeries(symbol, List.of());
    }

    public List<PriceBar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public PriceBar first() {
        return bars.isEmpty() ? null : bars.get(0);
    }

    public PriceBar last() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    public double[] closes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).close;
        }
        return out;
    }

    public double[] volumes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).volume;
        }
        return out;
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            out.add(bar.date);
        }
        return out;
    }

    /**
     * Bars dated on or after {@code start}.
     */
    public PriceSeries since(LocalDate start) {
        List<PriceBar> out = new ArrayList<>();
        for (PriceBar bar : bars) {
            if (!bar.date.isBefore(start)) {
                out.add(bar);
            }
        }
        return new PriceSeries(symbol, out);
    }

    public PriceSeries lastN(int n) {
        if (n >= bars.size()) {
            return this;
        }
        return new PriceSeries(symbol, bars.subList(bars.size() - Math.max(0, n), bars.size()));
    }
}
