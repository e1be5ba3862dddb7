package com.nightscan.factors;

import com.nightscan.config.Config;
import com.nightscan.data.FetchException;
import com.nightscan.data.MarketDataService;
import com.nightscan.model.PriceBar;
import com.nightscan.model.PriceSeries;
import com.nightscan.quality.DataQualityValidator;
import com.nightscan.quality.ValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模块说明：MacroBetaCalculator（class）。
 * 主要职责：计算每个标的对各宏观因子的 OLS beta = cov(个股收益, 因子收益) / var(因子收益)。
 * 使用建议：重叠样本不足或因子方差近零时该组合不输出 beta，并在 missing 中记录原因；单个标的失败不影响其它标的。
 */
public final class MacroBetaCalculator {
    private static final Logger LOG = LogManager.getLogger(MacroBetaCalculator.class);
    static final double MIN_FACTOR_VARIANCE = 1e-12;

    private final MarketDataService marketData;
    private final DataQualityValidator validator;
    private final List<FactorDefinition> factors;
    private final int lookbackDays;
    private final int minObservations;

    public MacroBetaCalculator(MarketDataService marketData, DataQualityValidator validator, Config config) {
        this(marketData, validator,
                FactorDefinition.parse(config.getList("beta.factors")),
                config.getInt("beta.lookback_days"),
                config.getInt("beta.min_obs"));
    }

    public MacroBetaCalculator(
            MarketDataService marketData,
            DataQualityValidator validator,
            List<FactorDefinition> factors,
            int lookbackDays,
            int minObservations
    ) {
        if (factors == null || factors.isEmpty()) {
            throw new IllegalArgumentException("at least one macro factor is required");
        }
        this.marketData = marketData;
        this.validator = validator;
        this.factors = List.copyOf(factors);
        this.lookbackDays = Math.max(1, lookbackDays);
        this.minObservations = Math.max(2, minObservations);
    }

    public List<FactorDefinition> factors() {
        return factors;
    }

    /**
     * Fetches each symbol's history and computes its betas as of {@code asOf}.
     */
    public MacroBetaResult computeBetas(List<String> symbols, LocalDate asOf) {
        Map<String, PriceSeries> histories = new LinkedHashMap<>();
        Map<String, String> missing = new LinkedHashMap<>();
        LocalDate start = fetchStart(asOf);
        for (String symbol : symbols) {
            try {
                histories.put(symbol, marketData.fetch(symbol, start, asOf));
            } catch (FetchException | RuntimeException e) {
                LOG.warn("Beta fetch failed symbol={} err={}", symbol, e.getMessage());
                missing.put(symbol, "fetch failed: " + e.getMessage());
            }
        }
        return compute(histories, asOf, missing);
    }

    /**
     * Computes betas from histories the caller already holds; only factor series are fetched.
     */
    public MacroBetaResult computeBetas(Map<String, PriceSeries> histories, LocalDate asOf) {
        return compute(histories, asOf, new LinkedHashMap<>());
    }

    private MacroBetaResult compute(Map<String, PriceSeries> histories, LocalDate asOf, Map<String, String> missing) {
        LocalDate start = fetchStart(asOf);
        Map<String, TreeMap<LocalDate, Double>> factorReturns = new LinkedHashMap<>();
        for (FactorDefinition factor : factors) {
            try {
                factorReturns.put(factor.name, returnsByDate(marketData.fetch(factor.symbol, start, asOf)));
            } catch (FetchException | RuntimeException e) {
                LOG.warn("Factor fetch failed factor={} symbol={} err={}", factor.name, factor.symbol, e.getMessage());
                missing.put("*/" + factor.name, "factor fetch failed: " + e.getMessage());
            }
        }

        Map<String, Map<String, Double>> betas = new LinkedHashMap<>();
        for (Map.Entry<String, PriceSeries> entry : histories.entrySet()) {
            String symbol = entry.getKey();
            try {
                ValidationResult validation = validator.validate(entry.getValue(), symbol);
                if (!validation.valid) {
                    missing.put(symbol, "invalid series: " + String.join("; ", validation.issues));
                    continue;
                }
                TreeMap<LocalDate, Double> stockReturns = returnsByDate(entry.getValue());
                Map<String, Double> symbolBetas = new LinkedHashMap<>();
                for (Map.Entry<String, TreeMap<LocalDate, Double>> factor : factorReturns.entrySet()) {
                    String reason = betaOrReason(stockReturns, factor.getValue(), symbolBetas, factor.getKey());
                    if (reason != null) {
                        missing.put(symbol + "/" + factor.getKey(), reason);
                    }
                }
                if (!symbolBetas.isEmpty()) {
                    betas.put(symbol, symbolBetas);
                }
            } catch (RuntimeException e) {
                LOG.warn("Beta computation failed symbol={} err={}", symbol, e.toString());
                missing.put(symbol, "beta computation failed: " + e.getMessage());
            }
        }
        List<String> names = new ArrayList<>();
        for (FactorDefinition factor : factors) {
            names.add(factor.name);
        }
        LOG.info("Macro betas computed symbols={} with_betas={} omitted={}", histories.size(), betas.size(), missing.size());
        return new MacroBetaResult(names, betas, missing);
    }

    /**
     * Puts the beta into {@code out} and returns null, or returns why it is undefined.
     */
    private String betaOrReason(
            TreeMap<LocalDate, Double> stock,
            TreeMap<LocalDate, Double> factor,
            Map<String, Double> out,
            String factorName
    ) {
        List<LocalDate> common = new ArrayList<>();
        for (LocalDate date : stock.keySet()) {
            if (factor.containsKey(date)) {
                common.add(date);
            }
        }
        if (common.isEmpty()) {
            return "no overlapping observations";
        }
        LocalDate windowStart = common.get(common.size() - 1).minusDays(lookbackDays);
        List<double[]> pairs = new ArrayList<>();
        for (LocalDate date : common) {
            if (date.isAfter(windowStart)) {
                pairs.add(new double[]{stock.get(date), factor.get(date)});
            }
        }
        if (pairs.size() < minObservations) {
            return String.format(Locale.US, "insufficient overlap: %d < %d observations", pairs.size(), minObservations);
        }
        double beta = ols(pairs);
        if (Double.isNaN(beta)) {
            return "degenerate factor variance";
        }
        out.put(factorName, beta);
        return null;
    }

    /**
     * Slope of stock returns on factor returns; NaN when the factor variance is (near) zero.
     */
    static double ols(List<double[]> pairs) {
        int n = pairs.size();
        double meanS = 0.0;
        double meanF = 0.0;
        for (double[] p : pairs) {
            meanS += p[0];
            meanF += p[1];
        }
        meanS /= n;
        meanF /= n;
        double cov = 0.0;
        double var = 0.0;
        for (double[] p : pairs) {
            cov += (p[0] - meanS) * (p[1] - meanF);
            var += (p[1] - meanF) * (p[1] - meanF);
        }
        cov /= n - 1;
        var /= n - 1;
        if (!(var > MIN_FACTOR_VARIANCE)) {
            return Double.NaN;
        }
        double beta = cov / var;
        return Double.isFinite(beta) ? beta : Double.NaN;
    }

    static TreeMap<LocalDate, Double> returnsByDate(PriceSeries series) {
        TreeMap<LocalDate, Double> out = new TreeMap<>();
        List<PriceBar> bars = series.bars();
        for (int i = 1; i < bars.size(); i++) {
            double prev = bars.get(i - 1).close;
            double current = bars.get(i).close;
            if (prev > 0 && Double.isFinite(current)) {
                double r = current / prev - 1.0;
                if (Double.isFinite(r)) {
                    out.put(bars.get(i).date, r);
                }
            }
        }
        return out;
    }

    private LocalDate fetchStart(LocalDate asOf) {
        return asOf.minusDays(lookbackDays + 10L);
    }
}
