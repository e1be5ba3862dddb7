package com.nightscan.quality;

import com.nightscan.config.Config;
import com.nightscan.model.PriceBar;
import com.nightscan.model.PriceSeries;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 模块说明：DataQualityValidator（class）。
 * 主要职责：检查单个价格序列的完整性与合理性，输出致命问题、非致命告警与统计量。
 * 使用建议：拆股调整必须显式调用 adjustForSplits，检测结果本身不会修改数据。
 */
public final class DataQualityValidator {
    static final int MAX_REPORTED_OUTLIERS = 5;
    static final int VOLUME_WINDOW = 20;

    private final double outlierZscore;
    private final double splitReturnThreshold;
    private final double splitVolumeMultiple;

    public DataQualityValidator() {
        this(3.0, -0.40, 2.0);
    }

    public DataQualityValidator(Config config) {
        this(config.getDouble("validation.outlier_zscore"),
                config.getDouble("validation.split_return_threshold"),
                config.getDouble("validation.split_volume_multiple"));
    }

    public DataQualityValidator(double outlierZscore, double splitReturnThreshold, double splitVolumeMultiple) {
        this.outlierZscore = outlierZscore;
        this.splitReturnThreshold = splitReturnThreshold;
        this.splitVolumeMultiple = splitVolumeMultiple;
    }

/**
 * 方法说明：validate，负责校验单个序列。
 * 处理流程：先检查空序列、缺失字段与非正价格（致命），再检查缺失交易日、收益率离群值与疑似未调整拆股（告警）。
 * 维护提示：只要序列非空就会计算统计量，包括无效序列。
 */
    public ValidationResult validate(PriceSeries series, String symbol) {
        String label = symbol == null || symbol.isBlank() ? (series == null ? "" : series.symbol) : symbol;
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (series == null || series.isEmpty()) {
            issues.add("empty series");
            return new ValidationResult(label, issues, warnings, List.of(), List.of(), 0, null);
        }

        Set<String> missingFields = new LinkedHashSet<>();
        int nonPositive = 0;
        for (PriceBar bar : series.bars()) {
            checkField(missingFields, "open", bar.open);
            checkField(missingFields, "high", bar.high);
            checkField(missingFields, "low", bar.low);
            checkField(missingFields, "close", bar.close);
            checkField(missingFields, "volume", bar.volume);
            if (bar.open <= 0 || bar.high <= 0 || bar.low <= 0 || bar.close <= 0) {
                nonPositive++;
            }
        }
        if (!missingFields.isEmpty()) {
            issues.add("missing required fields: " + String.join(", ", missingFields));
        }
        if (nonPositive > 0) {
            issues.add(nonPositive + " bars with non-positive OHLC prices");
        }

        ValidationResult.Statistics statistics = statistics(series);
        int missingDays = 0;
        List<LocalDate> outliers = List.of();
        List<LocalDate> splits = List.of();
        if (issues.isEmpty()) {
            missingDays = missingBusinessDays(series);
            if (missingDays > 0) {
                warnings.add(missingDays + " missing business days");
            }
            outliers = outlierDates(series);
            if (!outliers.isEmpty()) {
                List<LocalDate> shown = outliers.subList(0, Math.min(MAX_REPORTED_OUTLIERS, outliers.size()));
                warnings.add(String.format(Locale.US, "%d return outliers (|z| > %.1f): %s",
                        outliers.size(), outlierZscore, shown));
            }
            splits = splitCandidates(series);
            for (LocalDate date : splits) {
                warnings.add("potential unadjusted split on " + date);
            }
        }
        return new ValidationResult(label, issues, warnings, outliers, splits, missingDays, statistics);
    }

/**
 * 方法说明：adjustForSplits，按已确认的拆股日重算历史价格。
 * 处理流程：比例 = 拆股前一日收盘价 / 拆股当日收盘价；拆股日之前的 OHLC 除以比例，成交量乘以比例。
 * 维护提示：多个拆股日按时间顺序依次调整；不在序列中的日期忽略。
 */
    public PriceSeries adjustForSplits(PriceSeries series, List<LocalDate> splitDates) {
        if (series == null || series.isEmpty() || splitDates == null || splitDates.isEmpty()) {
            return series;
        }
        List<PriceBar> bars = new ArrayList<>(series.bars());
        List<LocalDate> ordered = new ArrayList<>(new HashSet<>(splitDates));
        ordered.sort(null);
        for (LocalDate splitDate : ordered) {
            int idx = indexOf(bars, splitDate);
            if (idx <= 0) {
                continue;
            }
            double splitClose = bars.get(idx).close;
            double priorClose = bars.get(idx - 1).close;
            if (!(splitClose > 0) || !(priorClose > 0)) {
                continue;
            }
            double ratio = priorClose / splitClose;
            for (int i = 0; i < idx; i++) {
                PriceBar bar = bars.get(i);
                bars.set(i, bar.withValues(bar.open / ratio, bar.high / ratio, bar.low / ratio, bar.close / ratio,
                        bar.volume * ratio));
            }
        }
        return new PriceSeries(series.symbol, bars);
    }

    List<LocalDate> outlierDates(PriceSeries series) {
        double[] returns = returns(series.closes());
        List<LocalDate> out = new ArrayList<>();
        if (returns.length < 3) {
            return out;
        }
        double mean = mean(returns);
        double std = sampleStd(returns, mean);
        if (!(std > 0)) {
            return out;
        }
        List<PriceBar> bars = series.bars();
        for (int i = 0; i < returns.length; i++) {
            if (Math.abs((returns[i] - mean) / std) > outlierZscore) {
                out.add(bars.get(i + 1).date);
            }
        }
        return out;
    }

    List<LocalDate> splitCandidates(PriceSeries series) {
        List<PriceBar> bars = series.bars();
        List<LocalDate> out = new ArrayList<>();
        double windowSum = 0.0;
        for (int i = 0; i < bars.size(); i++) {
            windowSum += bars.get(i).volume;
            if (i >= VOLUME_WINDOW) {
                windowSum -= bars.get(i - VOLUME_WINDOW).volume;
            }
            if (i < VOLUME_WINDOW - 1) {
                continue;
            }
            double rollingMean = windowSum / VOLUME_WINDOW;
            double ret = bars.get(i).close / bars.get(i - 1).close - 1.0;
            if (ret < splitReturnThreshold && rollingMean > 0 && bars.get(i).volume > splitVolumeMultiple * rollingMean) {
                out.add(bars.get(i).date);
            }
        }
        return out;
    }

    static int missingBusinessDays(PriceSeries series) {
        LocalDate start = series.first().date;
        LocalDate end = series.last().date;
        int businessDays = 0;
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY) {
                businessDays++;
            }
        }
        return Math.max(0, businessDays - series.size());
    }

    static ValidationResult.Statistics statistics(PriceSeries series) {
        double[] closes = series.closes();
        double[] volumes = series.volumes();
        double priceMin = Double.POSITIVE_INFINITY;
        double priceMax = Double.NEGATIVE_INFINITY;
        for (double c : closes) {
            if (Double.isFinite(c)) {
                priceMin = Math.min(priceMin, c);
                priceMax = Math.max(priceMax, c);
            }
        }
        double priceMean = mean(closes);
        double volumeMean = mean(volumes);
        double[] returns = returns(closes);
        double retMean = Double.NaN;
        double retStd = Double.NaN;
        double retMin = Double.NaN;
        double retMax = Double.NaN;
        if (returns.length > 0) {
            retMean = mean(returns);
            retStd = sampleStd(returns, retMean);
            retMin = Double.POSITIVE_INFINITY;
            retMax = Double.NEGATIVE_INFINITY;
            for (double r : returns) {
                retMin = Math.min(retMin, r);
                retMax = Math.max(retMax, r);
            }
        }
        LocalDate start = series.first().date;
        LocalDate end = series.last().date;
        return new ValidationResult.Statistics(
                series.size(),
                start,
                end,
                ChronoUnit.DAYS.between(start, end),
                Double.isFinite(priceMin) ? priceMin : Double.NaN,
                Double.isFinite(priceMax) ? priceMax : Double.NaN,
                priceMean,
                sampleStd(closes, priceMean),
                volumeMean,
                sampleStd(volumes, volumeMean),
                sum(volumes),
                retMean,
                retStd,
                retMin,
                retMax
        );
    }

    private static void checkField(Set<String> missing, String name, double value) {
        if (Double.isNaN(value)) {
            missing.add(name);
        }
    }

    private static int indexOf(List<PriceBar> bars, LocalDate date) {
        for (int i = 0; i < bars.size(); i++) {
            if (bars.get(i).date.equals(date)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Simple returns between consecutive finite, positive closes.
     */
    static double[] returns(double[] closes) {
        if (closes.length < 2) {
            return new double[0];
        }
        double[] out = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            double prev = closes[i - 1];
            out[i - 1] = prev > 0 ? closes[i] / prev - 1.0 : Double.NaN;
        }
        return out;
    }

    private static double mean(double[] values) {
        double total = 0.0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                total += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : total / n;
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                total += v;
            }
        }
        return total;
    }

    private static double sampleStd(double[] values, double mean) {
        double acc = 0.0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                double d = v - mean;
                acc += d * d;
                n++;
            }
        }
        return n < 2 ? 0.0 : Math.sqrt(acc / (n - 1));
    }
}
