package com.nightscan.runner;

import com.nightscan.core.PipelineStageException;
import com.nightscan.core.progress.PipelineMetric;
import com.nightscan.core.progress.PipelineProgressTracker;
import com.nightscan.core.progress.PipelineStage;
import com.nightscan.core.progress.ProgressPersistenceException;
import com.nightscan.core.progress.StageStatus;
import com.nightscan.data.FetchException;
import com.nightscan.factors.MacroBetaResult;
import com.nightscan.model.PredictionRecord;
import com.nightscan.model.PriceSeries;
import com.nightscan.model.RegimeResult;
import com.nightscan.model.ScoredOpportunity;
import com.nightscan.model.StockCandidate;
import com.nightscan.model.TechnicalSnapshot;
import com.nightscan.predict.BatchPredictor;
import com.nightscan.predict.BridgeAvailability;
import com.nightscan.scoring.FactorView;
import com.nightscan.scoring.FactorViewBuilder;
import com.nightscan.scoring.FactorViewExporter;
import com.nightscan.scoring.MarketContext;
import com.nightscan.scoring.OpportunityScorer;
import com.nightscan.scoring.ScoringInput;
import com.nightscan.scoring.ScoringSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：OvernightRunner（class）。
 * 主要职责：按固定顺序驱动七个阶段：初始化、市场状态识别、股票池扫描、模型刷新、批量预测、评分、报告生成。
 * 使用建议：单标的失败只记录告警；结构性失败（无法持久化进度、股票池不可用等）标记整体失败并触发失败通知。
 */
public final class OvernightRunner {
    private static final Logger LOG = LogManager.getLogger(OvernightRunner.class);

    private final PipelineComponents components;
    private final PipelineProgressTracker tracker;

    public OvernightRunner(PipelineComponents components) {
        this.components = components;
        this.tracker = components.tracker;
    }

    public PipelineProgressTracker tracker() {
        return tracker;
    }

    /**
     * 方法说明：run，执行一次完整的夜间批处理。
     * 处理流程：start → 逐阶段 RUNNING/COMPLETE → complete(reportPath)；任一阶段抛出结构性异常时 markFailed。
     * 维护提示：被取消时在下一阶段开始前停止，已完成阶段的结果保留在进度文档中。
     */
    public RunOutcome run(LocalDate asOf) {
        RunOutcome.RunOutcomeBuilder outcome = RunOutcome.builder()
                .runDate(asOf)
                .predictions(Map.of())
                .scored(List.of())
                .topOpportunities(List.of())
                .skipped(Map.of());
        try {
            tracker.start();
        } catch (ProgressPersistenceException e) {
            throw failOnPersistence(e);
        }
        try {
            List<StockCandidate> universe = initialize(outcome);
            checkCancelled();

            RegimeResult regime = detectRegime(asOf);
            outcome.regime(regime);
            checkCancelled();

            UniverseScanner.ScanResult scan = scanUniverse(universe, asOf);
            outcome.skipped(scan.skipped);
            checkCancelled();

            List<StockCandidate> scanned = new ArrayList<>();
            for (StockCandidate candidate : universe) {
                if (scan.histories.containsKey(candidate.symbol)) {
                    scanned.add(candidate);
                }
            }
            refreshModels(scanned, scan.histories);
            checkCancelled();

            Map<String, PredictionRecord> predictions = predict(scanned, scan.histories);
            outcome.predictions(predictions);
            checkCancelled();

            ScoringStageResult scoring = score(scanned, scan.histories, predictions, regime, asOf);
            outcome.scored(scoring.scored).topOpportunities(scoring.top);
            checkCancelled();

            Path report = writeReport(asOf, regime, scoring, scan.skipped);
            outcome.reportPath(report);
            tracker.complete(report);
            return outcome.status(tracker.overallStatus()).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tracker.requestCancel("interrupted");
            return outcome.status(StageStatus.FAILED).error("interrupted").build();
        } catch (ProgressPersistenceException e) {
            throw failOnPersistence(e);
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.error("Pipeline failed: {}", message, e);
            tracker.markFailed(message);
            return outcome.status(StageStatus.FAILED).error(message).build();
        }
    }

    /**
     * Marks the run failed so the failure notification still goes out, then hands the original error back
     * for rethrowing. The terminal write is expected to fail as well.
     */
    private ProgressPersistenceException failOnPersistence(ProgressPersistenceException e) {
        LOG.error("Progress persistence failed: {}", e.getMessage());
        try {
            tracker.markFailed("cannot persist progress: " + e.getMessage());
        } catch (ProgressPersistenceException again) {
            LOG.warn("Failed run could not be persisted either: {}", again.getMessage());
        }
        return e;
    }

    private List<StockCandidate> initialize(RunOutcome.RunOutcomeBuilder outcome) {
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.RUNNING, 0.0, "loading universe");
        List<StockCandidate> universe;
        try {
            universe = components.universe.load();
        } catch (IOException e) {
            throw new PipelineStageException("universe unavailable: " + e.getMessage(), e);
        }
        if (universe.isEmpty()) {
            throw new PipelineStageException("universe is empty");
        }
        BridgeAvailability availability = components.predictor.availability();
        outcome.availability(availability);
        tracker.updateStage(PipelineStage.INITIALIZATION, StageStatus.COMPLETE, 100.0,
                universe.size() + " symbols; " + availability);
        return universe;
    }

    private RegimeResult detectRegime(LocalDate asOf) {
        tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.RUNNING, 0.0, "fitting regime models");
        RegimeResult regime = components.regimeEngine.analyse(asOf);
        if (regime.hasError()) {
            tracker.addWarning("regime detection: " + regime.error);
        } else if (regime.warning != null && !regime.warning.isEmpty()) {
            tracker.addWarning("regime detection: " + regime.warning);
        }
        tracker.updateStage(PipelineStage.REGIME_DETECTION, StageStatus.COMPLETE, 100.0, String.format(Locale.US,
                "regime=%s method=%s vol=%s crash_risk=%.2f", regime.regimeLabel.wireName(),
                regime.regimeMethod.wireName(), regime.volMethod.wireName(), regime.crashRiskScore));
        return regime;
    }

    private UniverseScanner.ScanResult scanUniverse(List<StockCandidate> universe, LocalDate asOf) throws InterruptedException {
        tracker.updateStage(PipelineStage.UNIVERSE_SCAN, StageStatus.RUNNING, 0.0, "fetching " + universe.size() + " symbols");
        UniverseScanner scanner = new UniverseScanner(components.marketData, components.validator,
                components.scanThreads, components.scanLookbackDays, components.scanLogEvery);
        UniverseScanner.ScanResult scan = scanner.scan(universe, asOf, tracker);
        checkCancelled();
        if (scan.histories.isEmpty()) {
            throw new PipelineStageException("no symbol in the universe could be scanned");
        }
        tracker.updateStage(PipelineStage.UNIVERSE_SCAN, StageStatus.COMPLETE, 100.0,
                scan.histories.size() + " usable, " + scan.skipped.size() + " skipped");
        return scan;
    }

    private void refreshModels(List<StockCandidate> scanned, Map<String, PriceSeries> histories) throws InterruptedException {
        tracker.updateStage(PipelineStage.MODEL_REFRESH, StageStatus.RUNNING, 0.0, "fitting direction models");
        BatchPredictor.BatchResult<Boolean> refreshed = components.predictor.refreshModels(scanned, histories, tracker);
        checkCancelled();
        long trained = refreshed.values.values().stream().filter(Boolean::booleanValue).count();
        tracker.updateStage(PipelineStage.MODEL_REFRESH, StageStatus.COMPLETE, 100.0,
                trained + " models trained, " + refreshed.failures.size() + " failed");
    }

    private Map<String, PredictionRecord> predict(List<StockCandidate> scanned, Map<String, PriceSeries> histories)
            throws InterruptedException {
        tracker.updateStage(PipelineStage.BATCH_PREDICTION, StageStatus.RUNNING, 0.0, "predicting " + scanned.size() + " symbols");
        BatchPredictor.BatchResult<PredictionRecord> result = components.predictor.predictAll(scanned, histories, tracker);
        checkCancelled();
        tracker.updateStage(PipelineStage.BATCH_PREDICTION, StageStatus.COMPLETE, 100.0,
                result.values.size() + " predictions, " + result.failures.size() + " failed");
        return result.values;
    }

    private ScoringStageResult score(
            List<StockCandidate> scanned,
            Map<String, PriceSeries> histories,
            Map<String, PredictionRecord> predictions,
            RegimeResult regime,
            LocalDate asOf
    ) {
        tracker.updateStage(PipelineStage.SCORING, StageStatus.RUNNING, 0.0, "computing macro betas");
        MacroBetaResult betas = components.betaCalculator.computeBetas(histories, asOf);
        for (Map.Entry<String, String> missing : betas.missing().entrySet()) {
            tracker.addWarning("beta omitted " + missing.getKey() + ": " + missing.getValue());
        }
        tracker.updateStage(PipelineStage.SCORING, StageStatus.RUNNING, 40.0, "scoring opportunities");

        List<ScoringInput> inputs = new ArrayList<>();
        for (StockCandidate candidate : scanned) {
            PredictionRecord prediction = predictions.get(candidate.symbol);
            if (prediction == null) {
                continue;
            }
            TechnicalSnapshot technical = components.indicators.compute(histories.get(candidate.symbol));
            inputs.add(new ScoringInput(candidate, prediction, technical, betas.betasFor(candidate.symbol)));
        }
        MarketContext market = MarketContext.from(regime, indexSnapshot(asOf));
        List<ScoredOpportunity> scored = components.scorer.scoreAll(inputs, market);
        List<ScoredOpportunity> top = OpportunityScorer.topOpportunities(scored, components.minOpportunityScore, components.topN);
        tracker.incrementMetric(PipelineMetric.OPPORTUNITIES_FOUND, countAtLeast(scored, components.minOpportunityScore));

        FactorView view = FactorViewBuilder.build(scored, betas.factorNames());
        FactorViewExporter.ExportedFiles files;
        try {
            files = components.factorViewExporter.export(view, asOf);
        } catch (IOException e) {
            throw new PipelineStageException("factor view export failed: " + e.getMessage(), e);
        }
        ScoringSummary summary = OpportunityScorer.summarize(scored);
        tracker.updateStage(PipelineStage.SCORING, StageStatus.COMPLETE, 100.0, String.format(Locale.US,
                "%d scored, high=%d medium=%d low=%d", summary.total, summary.high, summary.medium, summary.low));
        return new ScoringStageResult(scored, top, summary, files.all());
    }

    private Path writeReport(LocalDate asOf, RegimeResult regime, ScoringStageResult scoring, Map<String, String> skipped) {
        tracker.updateStage(PipelineStage.REPORT_GENERATION, StageStatus.RUNNING, 0.0, "writing report");
        try {
            return components.reportWriter.write(asOf, regime, components.predictor.availability(),
                    scoring.summary, scoring.top, skipped, scoring.factorFiles);
        } catch (IOException e) {
            throw new PipelineStageException("report write failed: " + e.getMessage(), e);
        }
    }

    private TechnicalSnapshot indexSnapshot(LocalDate asOf) {
        if (components.indexSymbol == null || components.indexSymbol.isBlank()) {
            return null;
        }
        try {
            PriceSeries index = components.marketData.fetch(components.indexSymbol,
                    asOf.minusDays(components.scanLookbackDays), asOf);
            return index.isEmpty() ? null : components.indicators.compute(index);
        } catch (FetchException | RuntimeException e) {
            tracker.addWarning("index " + components.indexSymbol + " unavailable for market direction: " + e.getMessage());
            return null;
        }
    }

    private void checkCancelled() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("run interrupted");
        }
        if (tracker.isCancelled()) {
            throw new PipelineStageException("run cancelled");
        }
    }

    private static long countAtLeast(List<ScoredOpportunity> scored, double minScore) {
        return scored.stream().filter(s -> s.opportunityScore >= minScore).count();
    }

    private static final class ScoringStageResult {
        final List<ScoredOpportunity> scored;
        final List<ScoredOpportunity> top;
        final ScoringSummary summary;
        final List<Path> factorFiles;

        ScoringStageResult(List<ScoredOpportunity> scored, List<ScoredOpportunity> top, ScoringSummary summary, List<Path> factorFiles) {
            this.scored = scored;
            this.top = top;
            this.summary = summary;
            this.factorFiles = factorFiles;
        }
    }
}
