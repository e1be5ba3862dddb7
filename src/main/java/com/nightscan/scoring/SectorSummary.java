package com.nightscan.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SectorSummary {
    public final String sector;
    public final int count;
    public final double avgOpportunityScore;
    public final Map<String, Double> avgBetas;
    public final int buyCount;
    public final int sellCount;

    public SectorSummary(String sector, int count, double avgOpportunityScore, Map<String, Double> avgBetas, int buyCount, int sellCount) {
        this.sector = sector;
        this.count = count;
        this.avgOpportunityScore = avgOpportunityScore;
        this.avgBetas = Collections.unmodifiableMap(new LinkedHashMap<>(avgBetas));
        this.buyCount = buyCount;
        this.sellCount = sellCount;
    }
}
