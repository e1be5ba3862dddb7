package com.nightscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TechnicalSnapshot {
    public final int barCount;
    public final double lastClose;
    public final double sma10;
    public final double sma20;
    public final double sma30;
    public final double sma50;
    public final double rsi14;
    public final double return5dPct;
    public final double return20dPct;
    public final double pctFromSma20;
    public final double zFromSma20;
    public final double volatility20Pct;
    public final double avgVolume20;
}
