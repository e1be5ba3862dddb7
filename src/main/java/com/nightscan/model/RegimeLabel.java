package com.nightscan.model;

public enum RegimeLabel {
    CALM("calm"),
    NORMAL("normal"),
    HIGH_VOL("high_vol"),
    UNKNOWN("unknown");

    private final String wireName;

    RegimeLabel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Label for the state at {@code rank} once states are sorted by ascending volatility.
     */
    public static RegimeLabel forRank(int rank, int stateCount) {
        if (stateCount <= 1) {
            return NORMAL;
        }
        if (rank <= 0) {
            return CALM;
        }
        if (rank >= stateCount - 1) {
            return HIGH_VOL;
        }
        return NORMAL;
    }
}
