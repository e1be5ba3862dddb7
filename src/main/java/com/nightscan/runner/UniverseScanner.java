package com.nightscan.runner;

import com.nightscan.core.diagnostics.CauseCode;
import com.nightscan.core.diagnostics.Outcome;
import com.nightscan.core.progress.PipelineMetric;
import com.nightscan.core.progress.PipelineProgressTracker;
import com.nightscan.core.progress.PipelineStage;
import com.nightscan.core.progress.StageStatus;
import com.nightscan.data.FetchException;
import com.nightscan.data.MarketDataService;
import com.nightscan.model.PriceSeries;
import com.nightscan.model.StockCandidate;
import com.nightscan.quality.DataQualityValidator;
import com.nightscan.quality.ValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：UniverseScanner（class）。
 * 主要职责：并发拉取股票池每个标的的日线并做数据质量校验，产出可用于建模的历史序列。
 * 使用建议：单标的拉取失败或校验失败只记录告警；无论成功与否 stocks_scanned 都会加一。
 */
final class UniverseScanner {
    private static final Logger LOG = LogManager.getLogger(UniverseScanner.class);

    private final MarketDataService marketData;
    private final DataQualityValidator validator;
    private final int threads;
    private final int lookbackDays;
    private final int logEvery;

    UniverseScanner(MarketDataService marketData, DataQualityValidator validator, int threads, int lookbackDays, int logEvery) {
        this.marketData = marketData;
        this.validator = validator;
        this.threads = Math.max(1, threads);
        this.lookbackDays = Math.max(1, lookbackDays);
        this.logEvery = Math.max(0, logEvery);
    }

    ScanResult scan(List<StockCandidate> universe, LocalDate asOf, PipelineProgressTracker tracker) throws InterruptedException {
        int total = universe.size();
        Map<String, PriceSeries> histories = new LinkedHashMap<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        if (total == 0) {
            return new ScanResult(histories, skipped, false);
        }
        LocalDate start = asOf.minusDays(lookbackDays);
        long startedNanos = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, total));
        CompletionService<Outcome<PriceSeries>> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Outcome<PriceSeries>>, String> symbolsByFuture = new HashMap<>();
        for (StockCandidate candidate : universe) {
            Future<Outcome<PriceSeries>> future = completion.submit(() -> scanOne(candidate.symbol, start, asOf, tracker));
            symbolsByFuture.put(future, candidate.symbol);
        }

        Map<String, PriceSeries> fetched = new HashMap<>();
        boolean cancelled = false;
        try {
            for (int i = 0; i < total; i++) {
                Future<Outcome<PriceSeries>> future = completion.take();
                String symbol = symbolsByFuture.get(future);
                Outcome<PriceSeries> outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    outcome = Outcome.failure(symbol, CauseCode.RUNTIME_ERROR, String.valueOf(cause.getMessage()));
                }
                tracker.incrementMetric(PipelineMetric.STOCKS_SCANNED, 1);
                if (outcome.success) {
                    fetched.put(symbol, outcome.value);
                } else if (outcome.causeCode == CauseCode.CANCELLED) {
                    cancelled = true;
                    skipped.put(symbol, "cancelled");
                } else {
                    skipped.put(symbol, outcome.causeCode + ": " + outcome.message);
                    tracker.addWarning(symbol + ": universe scan skipped (" + outcome.causeCode + "): " + outcome.message);
                }
                int completed = i + 1;
                if (completed == total || (logEvery > 0 && completed % logEvery == 0)) {
                    logProgress(completed, total, skipped.size(), startedNanos);
                    if (!tracker.isCancelled()) {
                        tracker.updateStage(PipelineStage.UNIVERSE_SCAN, StageStatus.RUNNING, completed * 100.0 / total,
                                completed + "/" + total + " symbols scanned");
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }
        for (StockCandidate candidate : universe) {
            PriceSeries series = fetched.get(candidate.symbol);
            if (series != null) {
                histories.put(candidate.symbol, series);
            }
        }
        return new ScanResult(histories, skipped, cancelled);
    }

    private Outcome<PriceSeries> scanOne(String symbol, LocalDate start, LocalDate asOf, PipelineProgressTracker tracker) {
        if (tracker.isCancelled()) {
            return Outcome.failure(symbol, CauseCode.CANCELLED, "cancelled before start");
        }
        PriceSeries series;
        try {
            series = marketData.fetch(symbol, start, asOf);
        } catch (FetchException e) {
            return Outcome.failure(symbol, e.isTimeout() ? CauseCode.FETCH_TIMEOUT : CauseCode.FETCH_FAILED,
                    e.category() + ": " + e.getMessage());
        }
        if (series.isEmpty()) {
            return Outcome.failure(symbol, CauseCode.NO_BARS, "no bars returned");
        }
        ValidationResult validation = validator.validate(series, symbol);
        if (!validation.valid) {
            return Outcome.failure(symbol, CauseCode.VALIDATION_FAILED, String.join("; ", validation.issues));
        }
        for (String warning : validation.warnings) {
            LOG.debug("Data warning symbol={} {}", symbol, warning);
        }
        return Outcome.success(symbol, series);
    }

    private void logProgress(int completed, int total, int skipped, long startedNanos) {
        double elapsedSec = (System.nanoTime() - startedNanos) / 1_000_000_000.0;
        LOG.info(String.format(Locale.US, "Progress[universe_scan] %d/%d (%.1f%%) skipped=%d elapsed=%.1fs",
                completed, total, completed * 100.0 / total, skipped, elapsedSec));
    }

    static final class ScanResult {
        final Map<String, PriceSeries> histories;
        final Map<String, String> skipped;
        final boolean cancelled;

        ScanResult(Map<String, PriceSeries> histories, Map<String, String> skipped, boolean cancelled) {
            this.histories = histories;
            this.skipped = skipped;
            this.cancelled = cancelled;
        }
    }
}
