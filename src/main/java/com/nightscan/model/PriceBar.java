package com.nightscan.model;

import java.time.LocalDate;

/**
 * 模块说明：PriceBar（class）。
 * 主要职责：单个交易日的 OHLCV 数据，缺失字段以 NaN 表示。
 * 使用建议：数值合法性由 DataQualityValidator 判断，这里不做校验。
 */
public final class PriceBar {
    public final String symbol;
    public final LocalDate date;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public PriceBar(String symbol, LocalDate date, double open, double high, double low, double close, double volume) {
        this.symbol = symbol;
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public PriceBar withValues(double open, double high, double low, double close, double volume) {
        return new PriceBar(symbol, date, open, high, low, close, volume);
    }
}
