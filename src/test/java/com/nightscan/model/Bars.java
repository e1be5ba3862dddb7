package com.nightscan.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic business-day price series for tests.
 */
public final class Bars {

    private Bars() {
    }

    public static PriceSeries fromCloses(String symbol, LocalDate start, double[] closes, double volume) {
        List<PriceBar> bars = new ArrayList<>();
        LocalDate date = start;
        for (double close : closes) {
            date = nextBusinessDay(date);
            bars.add(new PriceBar(symbol, date, close, close * 1.01, close * 0.99, close, volume));
            date = date.plusDays(1);
        }
        return new PriceSeries(symbol, bars);
    }

    /**
     * Geometric random walk with drift; the same seed always gives the same series.
     */
    public static PriceSeries randomWalk(String symbol, LocalDate start, int count, double drift, double vol, long seed) {
        Random random = new Random(seed);
        double[] closes = new double[count];
        double price = 100.0;
        for (int i = 0; i < count; i++) {
            price *= 1.0 + drift + vol * random.nextGaussian();
            closes[i] = Math.max(1.0, price);
        }
        return fromCloses(symbol, start, closes, 1_000_000.0);
    }

    /**
     * A random walk that ends on {@code end}.
     */
    public static PriceSeries endingOn(String symbol, LocalDate end, int count, double drift, double vol, long seed) {
        LocalDate start = end;
        int business = 0;
        while (business < count) {
            if (start.getDayOfWeek() != DayOfWeek.SATURDAY && start.getDayOfWeek() != DayOfWeek.SUNDAY) {
                business++;
            }
            if (business < count) {
                start = start.minusDays(1);
            }
        }
        return randomWalk(symbol, start, count, drift, vol, seed);
    }

    private static LocalDate nextBusinessDay(LocalDate date) {
        LocalDate d = date;
        while (d.getDayOfWeek() == DayOfWeek.SATURDAY || d.getDayOfWeek() == DayOfWeek.SUNDAY) {
            d = d.plusDays(1);
        }
        return d;
    }
}
