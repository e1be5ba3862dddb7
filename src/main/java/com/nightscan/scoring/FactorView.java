package com.nightscan.scoring;

import org.json.JSONObject;

import java.util.List;

/**
 * Per-stock rows, per-sector rollup and overall summary of one scoring run.
 */
public final class FactorView {
    public final List<String> factorNames;
    public final List<FactorViewRow> rows;
    public final List<SectorSummary> sectors;
    public final JSONObject summary;

    public FactorView(List<String> factorNames, List<FactorViewRow> rows, List<SectorSummary> sectors, JSONObject summary) {
        this.factorNames = List.copyOf(factorNames);
        this.rows = List.copyOf(rows);
        this.sectors = List.copyOf(sectors);
        this.summary = summary;
    }
}
