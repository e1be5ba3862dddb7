package com.nightscan.core.progress;

import java.util.Locale;

public enum StageStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public static StageStatus fromWireName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
