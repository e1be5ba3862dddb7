package com.nightscan.predict;

import com.nightscan.config.Config;
import com.nightscan.core.diagnostics.CauseCode;
import com.nightscan.core.diagnostics.Outcome;
import com.nightscan.core.progress.PipelineMetric;
import com.nightscan.core.progress.PipelineProgressTracker;
import com.nightscan.model.PredictionRecord;
import com.nightscan.model.PriceSeries;
import com.nightscan.model.StockCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * 模块说明：BatchPredictor（class）。
 * 主要职责：用固定大小线程池遍历股票池，对每个标的调用 PredictionBridge，汇总预测结果与失败原因。
 * 使用建议：每个标的开始前检查取消标记；超时的标的按单标的失败记录，不影响其它标的。
 */
public final class BatchPredictor {
    private static final Logger LOG = LogManager.getLogger(BatchPredictor.class);
    static final long POLL_MILLIS = 200L;

    private final PredictionBridge bridge;
    private final int threads;
    private final long symbolTimeoutMillis;
    private final int logEvery;

    public BatchPredictor(PredictionBridge bridge, Config config) {
        this(bridge,
                config.getInt("predict.threads"),
                config.getLong("predict.symbol_timeout_sec", 120L) * 1000L,
                config.getInt("predict.progress.log_every"));
    }

    public BatchPredictor(PredictionBridge bridge, int threads, long symbolTimeoutMillis, int logEvery) {
        this.bridge = bridge;
        this.threads = Math.max(1, threads);
        this.symbolTimeoutMillis = Math.max(1L, symbolTimeoutMillis);
        this.logEvery = Math.max(0, logEvery);
    }

    public BridgeAvailability availability() {
        return bridge.isAvailable();
    }

    /**
     * Fits the direction model for every symbol that has history. Increments {@code models_trained} per fit.
     */
    public BatchResult<Boolean> refreshModels(
            List<StockCandidate> candidates,
            Map<String, PriceSeries> histories,
            PipelineProgressTracker tracker
    ) throws InterruptedException {
        if (!bridge.isAvailable().directionModelAvailable) {
            LOG.info("Direction model unavailable, model refresh skipped");
            return new BatchResult<>(new LinkedHashMap<>(), List.of(), false);
        }
        return run("model_refresh", candidates, histories, tracker, (candidate, history) -> {
            boolean trained = bridge.refresh(candidate.symbol, history);
            if (trained && tracker != null) {
                tracker.incrementMetric(PipelineMetric.MODELS_TRAINED, 1);
            }
            return Outcome.success(candidate.symbol, trained);
        });
    }

    /**
     * 方法说明：predictAll，批量生成预测。
     * 处理流程：提交全部标的 → 轮询完成队列 → 取消超时任务 → 记录结果、告警与进度日志。
     * 维护提示：每条成功预测都会使 predictions_generated 加一。
     */
    public BatchResult<PredictionRecord> predictAll(
            List<StockCandidate> candidates,
            Map<String, PriceSeries> histories,
            PipelineProgressTracker tracker
    ) throws InterruptedException {
        return run("batch_prediction", candidates, histories, tracker, (candidate, history) -> {
            PredictionBridge.Result result = bridge.predict(candidate, history);
            if (tracker != null) {
                for (String warning : result.warnings) {
                    tracker.addWarning(warning);
                }
                tracker.incrementMetric(PipelineMetric.PREDICTIONS_GENERATED, 1);
            }
            return Outcome.success(candidate.symbol, result.record);
        });
    }

    private <T> BatchResult<T> run(
            String label,
            List<StockCandidate> candidates,
            Map<String, PriceSeries> histories,
            PipelineProgressTracker tracker,
            BiFunction<StockCandidate, PriceSeries, Outcome<T>> work
    ) throws InterruptedException {
        int total = candidates.size();
        Map<String, T> values = new LinkedHashMap<>();
        List<Outcome<T>> failures = new ArrayList<>();
        if (total == 0) {
            return new BatchResult<>(values, failures, false);
        }
        long startedNanos = System.nanoTime();
        Map<String, Long> taskStarts = new ConcurrentHashMap<>();
        Map<Future<Outcome<T>>, String> symbolsByFuture = new HashMap<>();
        Map<String, T> completed = new HashMap<>();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, total));
        CompletionService<Outcome<T>> completion = new ExecutorCompletionService<>(pool);
        for (StockCandidate candidate : candidates) {
            Callable<Outcome<T>> task = () -> {
                if (tracker != null && tracker.isCancelled()) {
                    return Outcome.failure(candidate.symbol, CauseCode.CANCELLED, "cancelled before start");
                }
                PriceSeries history = histories.get(candidate.symbol);
                if (history == null || history.isEmpty()) {
                    return Outcome.failure(candidate.symbol, CauseCode.NO_BARS, "no price history");
                }
                taskStarts.put(candidate.symbol, System.nanoTime());
                try {
                    return work.apply(candidate, history);
                } finally {
                    taskStarts.remove(candidate.symbol);
                }
            };
            symbolsByFuture.put(completion.submit(task), candidate.symbol);
        }

        boolean cancelled = false;
        try {
            int done = 0;
            while (done < total) {
                Future<Outcome<T>> future = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (future == null) {
                    cancelOverdue(symbolsByFuture, taskStarts);
                    continue;
                }
                done++;
                String symbol = symbolsByFuture.get(future);
                Outcome<T> outcome = outcomeOf(symbol, future);
                if (outcome.success) {
                    completed.put(symbol, outcome.value);
                } else {
                    failures.add(outcome);
                    if (outcome.causeCode == CauseCode.CANCELLED) {
                        cancelled = true;
                    } else if (tracker != null) {
                        tracker.addWarning(symbol + ": " + label + " failed (" + outcome.causeCode + "): " + outcome.message);
                    }
                }
                if (shouldLogProgress(done, total)) {
                    logProgress(label, done, total, failures.size(), startedNanos);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        for (StockCandidate candidate : candidates) {
            if (completed.containsKey(candidate.symbol)) {
                values.put(candidate.symbol, completed.get(candidate.symbol));
            }
        }
        return new BatchResult<>(values, failures, cancelled);
    }

    private <T> Outcome<T> outcomeOf(String symbol, Future<Outcome<T>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            return Outcome.failure(symbol, CauseCode.FETCH_TIMEOUT,
                    "timed out after " + (symbolTimeoutMillis / 1000L) + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Prediction task failed symbol={} err={}", symbol, cause.toString());
            return Outcome.failure(symbol, CauseCode.RUNTIME_ERROR, String.valueOf(cause.getMessage()));
        }
    }

    private <T> void cancelOverdue(Map<Future<Outcome<T>>, String> symbolsByFuture, Map<String, Long> taskStarts) {
        long now = System.nanoTime();
        for (Map.Entry<Future<Outcome<T>>, String> entry : symbolsByFuture.entrySet()) {
            Long started = taskStarts.get(entry.getValue());
            if (started != null && !entry.getKey().isDone()
                    && TimeUnit.NANOSECONDS.toMillis(now - started) > symbolTimeoutMillis) {
                LOG.warn("Cancelling overdue task symbol={}", entry.getValue());
                entry.getKey().cancel(true);
            }
        }
    }

    private boolean shouldLogProgress(int completed, int total) {
        if (completed == total) {
            return true;
        }
        return logEvery > 0 && completed % logEvery == 0;
    }

    private void logProgress(String label, int completed, int total, int failed, long startedNanos) {
        double elapsedSec = (System.nanoTime() - startedNanos) / 1_000_000_000.0;
        double rate = elapsedSec > 0 ? completed / elapsedSec : 0.0;
        LOG.info(String.format(Locale.US, "Progress[%s] %d/%d (%.1f%%) failed=%d rate=%.2f/s elapsed=%.1fs",
                label, completed, total, completed * 100.0 / total, failed, rate, elapsedSec));
    }

    /**
     * Per-symbol values in input order plus one failure outcome per symbol that produced nothing.
     */
    public static final class BatchResult<T> {
        public final Map<String, T> values;
        public final List<Outcome<T>> failures;
        public final boolean cancelled;

        BatchResult(Map<String, T> values, List<Outcome<T>> failures, boolean cancelled) {
            this.values = values;
            this.failures = List.copyOf(failures);
            this.cancelled = cancelled;
        }
    }
}
