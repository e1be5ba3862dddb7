package com.nightscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.Map;

/**
 * 模块说明：RegimeResult（class）。
 * 主要职责：一次运行的市场波动状态结论，失败或数据不足时以 unknown / none 作为哨兵值。
 * 使用建议：构造后不可变，下游只读使用。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RegimeResult {
    public final RegimeLabel regimeLabel;
    public final FitMethod regimeMethod;
    public final FitMethod volMethod;
    public final Double vol1d;
    public final Double volAnnual;
    public final Map<String, Double> regimeProbabilities;
    public final double crashRiskScore;
    public final LocalDate windowStart;
    public final LocalDate windowEnd;
    public final int featureRows;
    public final String error;
    public final String warning;

    public static RegimeResult failed(String error, LocalDate windowStart, LocalDate windowEnd) {
        return unknown(windowStart, windowEnd).toBuilder().error(error).build();
    }

    public static RegimeResult insufficient(String warning, LocalDate windowStart, LocalDate windowEnd, int featureRows) {
        return unknown(windowStart, windowEnd).toBuilder().warning(warning).featureRows(featureRows).build();
    }

    private static RegimeResult unknown(LocalDate windowStart, LocalDate windowEnd) {
        return RegimeResult.builder()
                .regimeLabel(RegimeLabel.UNKNOWN)
                .regimeMethod(FitMethod.NONE)
                .volMethod(FitMethod.NONE)
                .regimeProbabilities(Map.of())
                .crashRiskScore(0.0)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .build();
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    public double probability(RegimeLabel label) {
        if (regimeProbabilities == null) {
            return 0.0;
        }
        Double p = regimeProbabilities.get(label.wireName());
        return p == null ? 0.0 : p;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("regime_label", regimeLabel.wireName());
        json.put("regime_method", regimeMethod.wireName());
        json.put("vol_method", volMethod.wireName());
        json.put("vol_1d", vol1d == null ? JSONObject.NULL : vol1d);
        json.put("vol_annual", volAnnual == null ? JSONObject.NULL : volAnnual);
        json.put("regime_probabilities", new JSONObject(regimeProbabilities == null ? Map.of() : regimeProbabilities));
        json.put("crash_risk_score", crashRiskScore);
        JSONObject window = new JSONObject();
        window.put("start", windowStart == null ? JSONObject.NULL : windowStart.toString());
        window.put("end", windowEnd == null ? JSONObject.NULL : windowEnd.toString());
        json.put("data_window", window);
        json.put("feature_rows", featureRows);
        if (error != null) {
            json.put("error", error);
        }
        if (warning != null) {
            json.put("warning", warning);
        }
        return json;
    }
}
