package com.nightscan.model;

public enum Signal {
    BUY,
    SELL,
    HOLD;

    public static Signal fromDirection(double direction, double buyThreshold, double sellThreshold) {
        if (direction > buyThreshold) {
            return BUY;
        }
        if (direction < sellThreshold) {
            return SELL;
        }
        return HOLD;
    }
}
