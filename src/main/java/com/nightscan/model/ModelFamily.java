package com.nightscan.model;

public enum ModelFamily {
    DIRECTION("direction_model"),
    SENTIMENT("sentiment_model"),
    TECHNICAL("technical");

    private final String wireName;

    ModelFamily(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
