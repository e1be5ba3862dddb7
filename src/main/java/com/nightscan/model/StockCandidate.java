package com.nightscan.model;

/**
 * One universe member.
 */
public final class StockCandidate {
    public final String symbol;
    public final String name;
    public final String sector;

    public StockCandidate(String symbol, String name, String sector) {
        this.symbol = symbol == null ? "" : symbol.trim();
        this.name = name == null || name.isBlank() ? this.symbol : name.trim();
        this.sector = sector == null || sector.isBlank() ? "Unknown" : sector.trim();
    }
}
