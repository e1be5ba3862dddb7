package com.nightscan.quality;

import org.json.JSONObject;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of {@link DataQualityValidator#validate}. {@code statistics} is null only for an empty series.
 */
public final class ValidationResult {
    public final String symbol;
    public final boolean valid;
    public final List<String> issues;
    public final List<String> warnings;
    public final List<LocalDate> outlierDates;
    public final List<LocalDate> splitCandidates;
    public final int missingBusinessDays;
    public final Statistics statistics;

    public ValidationResult(
            String symbol,
            List<String> issues,
            List<String> warnings,
            List<LocalDate> outlierDates,
            List<LocalDate> splitCandidates,
            int missingBusinessDays,
            Statistics statistics
    ) {
        this.symbol = symbol == null ? "" : symbol;
        this.issues = issues == null ? List.of() : List.copyOf(issues);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.outlierDates = outlierDates == null ? List.of() : List.copyOf(outlierDates);
        this.splitCandidates = splitCandidates == null ? List.of() : List.copyOf(splitCandidates);
        this.missingBusinessDays = Math.max(0, missingBusinessDays);
        this.statistics = statistics;
        this.valid = this.issues.isEmpty();
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("symbol", symbol);
        json.put("is_valid", valid);
        json.put("issues", issues);
        json.put("warnings", warnings);
        json.put("statistics", statistics == null ? new JSONObject() : statistics.toJson());
        return json;
    }

    public static final class Statistics {
        public final int recordCount;
        public final LocalDate startDate;
        public final LocalDate endDate;
        public final long spanDays;
        public final double priceMin;
        public final double priceMax;
        public final double priceMean;
        public final double priceStd;
        public final double volumeMean;
        public final double volumeStd;
        public final double volumeTotal;
        /** Return figures are NaN when the series has fewer than two bars. */
        public final double returnMean;
        public final double returnStd;
        public final double returnMin;
        public final double returnMax;

        public Statistics(
                int recordCount,
                LocalDate startDate,
                LocalDate endDate,
                long spanDays,
                double priceMin,
                double priceMax,
                double priceMean,
                double priceStd,
                double volumeMean,
                double volumeStd,
                double volumeTotal,
                double returnMean,
                double returnStd,
                double returnMin,
                double returnMax
        ) {
            this.recordCount = recordCount;
            this.startDate = startDate;
            this.endDate = endDate;
            this.spanDays = spanDays;
            this.priceMin = priceMin;
            this.priceMax = priceMax;
            this.priceMean = priceMean;
            this.priceStd = priceStd;
            this.volumeMean = volumeMean;
            this.volumeStd = volumeStd;
            this.volumeTotal = volumeTotal;
            this.returnMean = returnMean;
            this.returnStd = returnStd;
            this.returnMin = returnMin;
            this.returnMax = returnMax;
        }

        public JSONObject toJson() {
            JSONObject json = new JSONObject();
            json.put("record_count", recordCount);
            JSONObject range = new JSONObject();
            range.put("start", String.valueOf(startDate));
            range.put("end", String.valueOf(endDate));
            range.put("days", spanDays);
            json.put("date_range", range);
            JSONObject price = new JSONObject();
            price.put("min", priceMin);
            price.put("max", priceMax);
            price.put("mean", priceMean);
            price.put("std", priceStd);
            json.put("price_range", price);
            JSONObject volume = new JSONObject();
            volume.put("mean", volumeMean);
            volume.put("std", volumeStd);
            volume.put("total", volumeTotal);
            json.put("volume", volume);
            if (Double.isFinite(returnMean)) {
                JSONObject returns = new JSONObject();
                returns.put("mean_daily", returnMean);
                returns.put("std_daily", returnStd);
                returns.put("min", returnMin);
                returns.put("max", returnMax);
                json.put("returns", returns);
            }
            return json;
        }
    }
}
