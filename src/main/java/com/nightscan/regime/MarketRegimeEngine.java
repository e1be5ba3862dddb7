package com.nightscan.regime;

import com.nightscan.config.Config;
import com.nightscan.data.FetchException;
import com.nightscan.data.MarketDataService;
import com.nightscan.model.FitMethod;
import com.nightscan.model.MarketFrame;
import com.nightscan.model.RegimeLabel;
import com.nightscan.model.RegimeResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：MarketRegimeEngine（class）。
 * 主要职责：拉取指数、波动代理与汇率序列，构造特征，按 HMM → GMM 识别波动状态，按 GARCH → EWMA 估计当前波动，并给出崩盘风险分。
 * 使用建议：analyse 永不抛出异常；拉取失败写 error，数据不足写 warning，二者都返回 unknown / none。
 */
public final class MarketRegimeEngine {
    private static final Logger LOG = LogManager.getLogger(MarketRegimeEngine.class);

    private final MarketDataService marketData;
    private final Settings settings;
    private final RegimeClassifier primary;
    private final RegimeClassifier fallback;
    private final GarchVolatility garch;
    private final EwmaVolatility ewma;

    public MarketRegimeEngine(MarketDataService marketData, Config config) {
        this(marketData, Settings.fromConfig(config));
    }

    public MarketRegimeEngine(MarketDataService marketData, Settings settings) {
        this.marketData = marketData;
        this.settings = settings;
        this.primary = new GaussianHmm(settings.hmmMaxIterations, settings.tolerance, RegimeFeatures.REALIZED_VOL_10D);
        this.fallback = new GaussianMixture(settings.gmmMaxIterations, settings.tolerance, RegimeFeatures.REALIZED_VOL_10D);
        this.garch = new GarchVolatility(settings.garchMinObservations);
        this.ewma = new EwmaVolatility(settings.ewmaLambda);
    }

    public RegimeResult analyse(LocalDate asOf) {
        LocalDate start = asOf.minusDays(settings.lookbackDays);
        List<String> symbols = settings.symbols();
        MarketFrame frame;
        try {
            frame = marketData.fetchMany(symbols, start, asOf);
        } catch (FetchException e) {
            LOG.warn("Regime fetch failed symbols={} err={}", symbols, e.getMessage());
            return RegimeResult.failed("fetch failed for " + symbols + ": " + e.getMessage(), start, asOf);
        } catch (RuntimeException e) {
            LOG.warn("Regime fetch raised symbols={} err={}", symbols, e.toString());
            return RegimeResult.failed("fetch failed for " + symbols + ": " + e, start, asOf);
        }
        if (frame == null || frame.isEmpty()) {
            return RegimeResult.failed("empty market data for " + symbols, start, asOf);
        }
        try {
            return analyseFrame(frame, start, asOf);
        } catch (RuntimeException e) {
            LOG.error("Regime analysis failed: {}", e.toString(), e);
            return RegimeResult.failed("regime analysis failed: " + e, start, asOf);
        }
    }

    RegimeResult analyseFrame(MarketFrame frame, LocalDate start, LocalDate end) {
        double[] index = extractClose(frame, settings.indexSymbol);
        if (index == null) {
            return RegimeResult.failed(missingClose(frame, settings.indexSymbol), start, end);
        }
        double[] vol = null;
        if (!settings.volSymbol.isEmpty()) {
            vol = extractClose(frame, settings.volSymbol);
            if (vol == null) {
                return RegimeResult.failed(missingClose(frame, settings.volSymbol), start, end);
            }
        }
        double[] fx = null;
        if (!settings.fxSymbol.isEmpty()) {
            fx = extractClose(frame, settings.fxSymbol);
            if (fx == null) {
                return RegimeResult.failed(missingClose(frame, settings.fxSymbol), start, end);
            }
        }

        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < index.length; i++) {
            if (Double.isFinite(index[i]) && index[i] > 0) {
                keep.add(i);
            }
        }
        List<LocalDate> dates = new ArrayList<>(keep.size());
        for (int i : keep) {
            dates.add(frame.dates().get(i));
        }
        LocalDate windowStart = dates.isEmpty() ? start : dates.get(0);
        LocalDate windowEnd = dates.isEmpty() ? end : dates.get(dates.size() - 1);
        if (keep.size() < settings.minRows) {
            return RegimeResult.insufficient(String.format(Locale.US, "insufficient_data: %d rows < %d",
                    keep.size(), settings.minRows), windowStart, windowEnd, 0);
        }

        RegimeFeatures features = RegimeFeatures.build(dates, select(index, keep),
                vol == null ? null : select(vol, keep), fx == null ? null : select(fx, keep));
        if (features.size() < settings.minFeatureRows) {
            return RegimeResult.insufficient(String.format(Locale.US, "insufficient_features: %d rows < %d",
                    features.size(), settings.minFeatureRows), windowStart, windowEnd, features.size());
        }

        double[][] x = RegimeFeatures.standardize(features.rows);
        Optional<RegimeFit> fit = settings.hmmEnabled ? primary.fit(x, settings.states) : Optional.empty();
        if (fit.isEmpty()) {
            if (settings.hmmEnabled) {
                LOG.info("HMM fit unavailable, falling back to {}", fallback.name());
            }
            fit = fallback.fit(x, settings.states);
        }

        double[] returns = features.column(RegimeFeatures.RET_INDEX);
        Optional<VolatilityEstimate> garchEstimate = settings.garchEnabled ? garch.forecast(returns) : Optional.empty();
        VolatilityEstimate volEstimate = garchEstimate.orElseGet(() -> ewma.forecast(returns));

        Map<String, Double> probabilities = new LinkedHashMap<>();
        RegimeLabel label = RegimeLabel.UNKNOWN;
        FitMethod regimeMethod = FitMethod.NONE;
        String warning = null;
        if (fit.isPresent()) {
            RegimeFit f = fit.get();
            regimeMethod = f.method;
            int[] rankOfState = rankStates(f.means, RegimeFeatures.REALIZED_VOL_10D);
            for (RegimeLabel l : List.of(RegimeLabel.CALM, RegimeLabel.NORMAL, RegimeLabel.HIGH_VOL)) {
                probabilities.put(l.wireName(), 0.0);
            }
            int bestState = 0;
            for (int k = 0; k < f.stateCount(); k++) {
                String key = RegimeLabel.forRank(rankOfState[k], f.stateCount()).wireName();
                probabilities.merge(key, f.lastProbabilities[k], Double::sum);
                if (f.lastProbabilities[k] > f.lastProbabilities[bestState]) {
                    bestState = k;
                }
            }
            label = RegimeLabel.forRank(rankOfState[bestState], f.stateCount());
        } else {
            warning = "regime_fit_failed: hmm and gmm did not converge";
            LOG.warn("Regime classifiers failed on {} feature rows", features.size());
        }

        double pHigh = probabilities.getOrDefault(RegimeLabel.HIGH_VOL.wireName(), 0.0);
        double percentile = percentileOf(volEstimate.volAnnual, features.column(RegimeFeatures.REALIZED_VOL_10D));
        double crash = clamp01(settings.crashProbWeight * pHigh + (1.0 - settings.crashProbWeight) * percentile);

        RegimeResult result = RegimeResult.builder()
                .regimeLabel(label)
                .regimeMethod(regimeMethod)
                .volMethod(volEstimate.method)
                .vol1d(volEstimate.vol1d)
                .volAnnual(volEstimate.volAnnual)
                .regimeProbabilities(probabilities)
                .crashRiskScore(crash)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .featureRows(features.size())
                .warning(warning)
                .build();
        LOG.info("Regime label={} method={} vol_method={} vol_annual={} crash_risk={}",
                label.wireName(), regimeMethod.wireName(), volEstimate.method.wireName(),
                String.format(Locale.US, "%.4f", volEstimate.volAnnual), String.format(Locale.US, "%.3f", crash));
        return result;
    }

    /**
     * Close column for {@code symbol}, preferring an adjusted close. Null when neither field exists.
     */
    static double[] extractClose(MarketFrame frame, String symbol) {
        if (frame.has(symbol, MarketFrame.ADJ_CLOSE)) {
            return frame.column(symbol, MarketFrame.ADJ_CLOSE);
        }
        if (frame.has(symbol, MarketFrame.CLOSE)) {
            return frame.column(symbol, MarketFrame.CLOSE);
        }
        return null;
    }

    private static String missingClose(MarketFrame frame, String symbol) {
        return "no close field for " + symbol + " in columns " + frame.columnKeys();
    }

    private static double[] select(double[] values, List<Integer> rows) {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[rows.get(i)];
        }
        return out;
    }

    /**
     * rank[k] = position of state k when states are sorted by ascending mean of {@code column}.
     */
    static int[] rankStates(double[][] means, int column) {
        Integer[] order = new Integer[means.length];
        for (int k = 0; k < order.length; k++) {
            order[k] = k;
        }
        Arrays.sort(order, (a, b) -> Double.compare(means[a][column], means[b][column]));
        int[] rank = new int[means.length];
        for (int pos = 0; pos < order.length; pos++) {
            rank[order[pos]] = pos;
        }
        return rank;
    }

    static double percentileOf(double value, double[] history) {
        if (history.length == 0 || !Double.isFinite(value)) {
            return 0.0;
        }
        int atOrBelow = 0;
        for (double h : history) {
            if (h <= value) {
                atOrBelow++;
            }
        }
        return (double) atOrBelow / history.length;
    }

    private static double clamp01(double v) {
        if (!Double.isFinite(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    public static final class Settings {
        public final String indexSymbol;
        public final String volSymbol;
        public final String fxSymbol;
        public final int lookbackDays;
        public final int minRows;
        public final int minFeatureRows;
        public final int states;
        public final boolean hmmEnabled;
        public final int hmmMaxIterations;
        public final int gmmMaxIterations;
        public final double tolerance;
        public final boolean garchEnabled;
        public final int garchMinObservations;
        public final double ewmaLambda;
        public final double crashProbWeight;

        public Settings(
                String indexSymbol,
                String volSymbol,
                String fxSymbol,
                int lookbackDays,
                int minRows,
                int minFeatureRows,
                int states,
                boolean hmmEnabled,
                int hmmMaxIterations,
                int gmmMaxIterations,
                double tolerance,
                boolean garchEnabled,
                int garchMinObservations,
                double ewmaLambda,
                double crashProbWeight
        ) {
            if (indexSymbol == null || indexSymbol.isBlank()) {
                throw new IllegalArgumentException("regime index symbol is required");
            }
            this.indexSymbol = indexSymbol.trim();
            this.volSymbol = volSymbol == null ? "" : volSymbol.trim();
            this.fxSymbol = fxSymbol == null ? "" : fxSymbol.trim();
            this.lookbackDays = Math.max(30, lookbackDays);
            this.minRows = Math.max(2, minRows);
            this.minFeatureRows = Math.max(2, minFeatureRows);
            this.states = Math.max(2, states);
            this.hmmEnabled = hmmEnabled;
            this.hmmMaxIterations = hmmMaxIterations;
            this.gmmMaxIterations = gmmMaxIterations;
            this.tolerance = tolerance;
            this.garchEnabled = garchEnabled;
            this.garchMinObservations = garchMinObservations;
            this.ewmaLambda = ewmaLambda;
            this.crashProbWeight = Math.max(0.0, Math.min(1.0, crashProbWeight));
        }

        public static Settings fromConfig(Config config) {
            return new Settings(
                    config.getString("regime.index_symbol"),
                    config.getRawString("regime.vol_symbol"),
                    config.getRawString("regime.fx_symbol"),
                    config.getInt("regime.lookback_days"),
                    config.getInt("regime.min_rows"),
                    config.getInt("regime.min_feature_rows"),
                    config.getInt("regime.states"),
                    config.getBoolean("regime.hmm.enabled", true),
                    config.getInt("regime.hmm.max_iter"),
                    config.getInt("regime.gmm.max_iter"),
                    config.getDouble("regime.hmm.tol"),
                    config.getBoolean("regime.garch.enabled", true),
                    config.getInt("regime.garch.min_obs"),
                    config.getDouble("regime.ewma.lambda"),
                    config.getDouble("regime.crash.prob_weight")
            );
        }

        List<String> symbols() {
            List<String> out = new ArrayList<>();
            out.add(indexSymbol);
            if (!volSymbol.isEmpty()) {
                out.add(volSymbol);
            }
            if (!fxSymbol.isEmpty()) {
                out.add(fxSymbol);
            }
            return out;
        }
    }
}
