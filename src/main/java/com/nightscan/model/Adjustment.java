package com.nightscan.model;

/**
 * A named signed bonus (positive) or penalty (negative) on the opportunity score.
 */
public final class Adjustment {
    public final String name;
    public final double amount;
    public final String reason;

    public Adjustment(String name, double amount, String reason) {
        this.name = name;
        this.amount = amount;
        this.reason = reason == null ? "" : reason;
    }

    public boolean isPenalty() {
        return amount < 0;
    }

    public boolean isBonus() {
        return amount > 0;
    }
}
