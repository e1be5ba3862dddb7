package com.nightscan.runner;

import com.nightscan.config.Config;
import com.nightscan.config.ScoringWeights;
import com.nightscan.core.progress.InMemoryProgressStore;
import com.nightscan.core.progress.PipelineMetric;
import com.nightscan.core.progress.PipelineProgressTracker;
import com.nightscan.core.progress.PipelineStage;
import com.nightscan.core.progress.ProgressPersistenceException;
import com.nightscan.core.progress.StageStatus;
import com.nightscan.data.FetchException;
import com.nightscan.data.MarketDataService;
import com.nightscan.data.NewsSource;
import com.nightscan.factors.MacroBetaCalculator;
import com.nightscan.indicator.IndicatorEngine;
import com.nightscan.model.Bars;
import com.nightscan.model.ModelFamily;
import com.nightscan.model.NewsItem;
import com.nightscan.model.PredictionRecord;
import com.nightscan.model.PriceSeries;
import com.nightscan.model.SentimentReading;
import com.nightscan.model.StockCandidate;
import com.nightscan.output.PipelineNotifier;
import com.nightscan.output.RunReportWriter;
import com.nightscan.predict.BatchPredictor;
import com.nightscan.predict.BridgeAvailability;
import com.nightscan.predict.LogisticDirectionModel;
import com.nightscan.predict.PredictionBridge;
import com.nightscan.predict.SentimentModel;
import com.nightscan.predict.TechnicalBaseline;
import com.nightscan.quality.DataQualityValidator;
import com.nightscan.regime.MarketRegimeEngine;
import com.nightscan.scoring.FactorViewExporter;
import com.nightscan.scoring.OpportunityScorer;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OvernightRunnerTest {
    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 8);

    @TempDir
    Path tempDir;

    @Test
    void run_shouldScorePartialUniverseAndSkipFailedSymbol() throws Exception {
        InMemoryProgressStore store = new InMemoryProgressStore();
        RecordingNotifier notifier = new RecordingNotifier();
        List<StockCandidate> universe = List.of(
                new StockCandidate("a.us", "Alpha Corp", "Tech"),
                new StockCandidate("b.us", "Beta Inc", "Energy"),
                new StockCandidate("c.us", "Gamma Ltd", "Tech"));
        OvernightRunner runner = new OvernightRunner(components(store, notifier, () -> universe));

        RunOutcome outcome = runner.run(AS_OF);

        assertTrue(outcome.succeeded(), String.valueOf(outcome.error));
        assertEquals(List.of("a.us", "b.us"), List.copyOf(outcome.predictions.keySet()));

        PredictionRecord a = outcome.predictions.get("a.us");
        assertEquals(3, a.components.size());
        assertTrue(a.directionUsed);
        assertTrue(a.sentimentUsed);

        PredictionRecord b = outcome.predictions.get("b.us");
        assertEquals(List.of(ModelFamily.TECHNICAL), List.copyOf(b.components.keySet()));
        assertFalse(b.directionUsed);
        assertFalse(b.sentimentUsed);

        assertTrue(outcome.skipped.containsKey("c.us"));
        assertEquals(2, outcome.scored.size());
        assertTrue(Files.isRegularFile(outcome.reportPath));
        assertTrue(Files.isRegularFile(tempDir.resolve("reports").resolve("factor_view_stocks_20240308.csv")));

        PipelineProgressTracker tracker = runner.tracker();
        assertEquals(StageStatus.COMPLETE, tracker.overallStatus());
        assertEquals(3, tracker.metric(PipelineMetric.STOCKS_SCANNED));
        assertEquals(1, tracker.metric(PipelineMetric.MODELS_TRAINED));
        assertEquals(2, tracker.metric(PipelineMetric.PREDICTIONS_GENERATED));
        assertEquals(1, notifier.successes);
        assertEquals(0, notifier.failures.size());
        assertEquals(1, store.archived.size());

        JSONObject doc = store.read().orElseThrow();
        assertEquals("complete", doc.getString("overall_status"));
        assertTrue(hasMessageStartingWith(doc.getJSONArray("warnings"), "c.us: universe scan skipped"));
    }

    @Test
    void run_shouldFailInitializationOnEmptyUniverse() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        RecordingNotifier notifier = new RecordingNotifier();
        OvernightRunner runner = new OvernightRunner(components(store, notifier, List::of));

        RunOutcome outcome = runner.run(AS_OF);

        assertFalse(outcome.succeeded());
        assertEquals("universe is empty", outcome.error);
        assertNull(outcome.reportPath);
        assertEquals(StageStatus.FAILED, runner.tracker().stageStatus(PipelineStage.INITIALIZATION));
        assertEquals(StageStatus.PENDING, runner.tracker().stageStatus(PipelineStage.REGIME_DETECTION));
        assertEquals(List.of("initialization failed: universe is empty"), notifier.failures);
        assertEquals(1, store.archived.size());
    }

    @Test
    void run_shouldFailWhenUniverseCannotBeRead() {
        RecordingNotifier notifier = new RecordingNotifier();
        OvernightRunner runner = new OvernightRunner(components(new InMemoryProgressStore(), notifier, () -> {
            throw new IOException("universe.csv not found");
        }));

        RunOutcome outcome = runner.run(AS_OF);

        assertFalse(outcome.succeeded());
        assertEquals("universe unavailable: universe.csv not found", outcome.error);
        assertEquals(1, notifier.failures.size());
    }

    @Test
    void run_shouldFailScanWhenNoSymbolIsUsable() {
        RecordingNotifier notifier = new RecordingNotifier();
        OvernightRunner runner = new OvernightRunner(components(new InMemoryProgressStore(), notifier,
                () -> List.of(new StockCandidate("c.us", "Gamma Ltd", "Tech"))));

        RunOutcome outcome = runner.run(AS_OF);

        assertFalse(outcome.succeeded());
        assertEquals(StageStatus.FAILED, runner.tracker().stageStatus(PipelineStage.UNIVERSE_SCAN));
        assertEquals(StageStatus.COMPLETE, runner.tracker().stageStatus(PipelineStage.REGIME_DETECTION));
        assertEquals(1, runner.tracker().metric(PipelineMetric.STOCKS_SCANNED));
    }

    @Test
    void run_shouldNotifyFailureWhenProgressCannotBePersisted() {
        RecordingNotifier notifier = new RecordingNotifier();
        OvernightRunner runner = new OvernightRunner(components(new RejectingProgressStore(1), notifier,
                () -> List.of(new StockCandidate("a.us", "Alpha Corp", "Tech"))));

        ProgressPersistenceException thrown = assertThrows(ProgressPersistenceException.class, () -> runner.run(AS_OF));

        assertEquals("progress disk full", thrown.getMessage());
        assertEquals(StageStatus.FAILED, runner.tracker().overallStatus());
        assertEquals(List.of("initialization failed: cannot persist progress: progress disk full"), notifier.failures);
        assertEquals(0, notifier.successes);
    }

    @Test
    void run_shouldTreatIndexRuntimeErrorAsWarning() {
        InMemoryProgressStore store = new InMemoryProgressStore();
        RecordingNotifier notifier = new RecordingNotifier();
        OvernightRunner runner = new OvernightRunner(components(store, notifier,
                () -> List.of(new StockCandidate("a.us", "Alpha Corp", "Tech")), "^ndx"));

        RunOutcome outcome = runner.run(AS_OF);

        assertTrue(outcome.succeeded(), String.valueOf(outcome.error));
        assertEquals(1, outcome.scored.size());
        assertTrue(hasMessageStartingWith(store.read().orElseThrow().getJSONArray("warnings"),
                "index ^ndx unavailable for market direction: socket reset"));
    }

    private PipelineComponents components(InMemoryProgressStore store, PipelineNotifier notifier, UniverseProvider universe) {
        return components(store, notifier, universe, "^spx");
    }

    private PipelineComponents components(InMemoryProgressStore store, PipelineNotifier notifier, UniverseProvider universe,
                                          String indexSymbol) {
        Config config = Config.of(tempDir, Map.of(
                "regime.vol_symbol", "",
                "regime.fx_symbol", "",
                "beta.factors", "market:^spx",
                "report.dir", "reports"));
        FakeMarketData market = new FakeMarketData();
        market.series.put("^spx", Bars.endingOn("^spx", AS_OF, 300, 0.0004, 0.01, 1L));
        market.series.put("a.us", Bars.endingOn("a.us", AS_OF, 300, 0.0006, 0.015, 2L));
        market.series.put("b.us", Bars.endingOn("b.us", AS_OF, 45, 0.0, 0.02, 3L));

        IndicatorEngine indicators = new IndicatorEngine();
        DataQualityValidator validator = new DataQualityValidator();
        PredictionBridge bridge = new PredictionBridge(
                new TechnicalBaseline(indicators),
                new LogisticDirectionModel(60, 200, 0.1, 0.01),
                new KeywordSentimentModel(),
                new FixedNewsSource("a.us"),
                new BridgeAvailability(true, true, true, List.of()),
                0.3, -0.3);
        return PipelineComponents.builder()
                .marketData(market)
                .validator(validator)
                .universe(universe)
                .regimeEngine(new MarketRegimeEngine(market, config))
                .betaCalculator(new MacroBetaCalculator(market, validator, config))
                .indicators(indicators)
                .predictor(new BatchPredictor(bridge, 2, 10_000L, 0))
                .scorer(new OpportunityScorer(ScoringWeights.defaults()))
                .factorViewExporter(new FactorViewExporter(config))
                .reportWriter(new RunReportWriter(config))
                .tracker(new PipelineProgressTracker(store, notifier))
                .indexSymbol(indexSymbol)
                .scanThreads(2)
                .scanLookbackDays(400)
                .scanLogEvery(0)
                .minOpportunityScore(65.0)
                .topN(10)
                .build();
    }

    private static boolean hasMessageStartingWith(JSONArray entries, String prefix) {
        for (int i = 0; i < entries.length(); i++) {
            if (entries.getJSONObject(i).getString("message").startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static final class FakeMarketData implements MarketDataService {
        final Map<String, PriceSeries> series = new HashMap<>();

        @Override
        public PriceSeries fetch(String symbol, LocalDate start, LocalDate end) throws FetchException {
            if ("^ndx".equals(symbol)) {
                throw new IllegalStateException("socket reset");
            }
            PriceSeries out = series.get(symbol);
            if (out == null) {
                throw new FetchException(symbol, "http 404 for " + symbol);
            }
            return out.since(start);
        }
    }

    private static final class RejectingProgressStore extends InMemoryProgressStore {
        private final int healthyWrites;
        private int attempts;

        RejectingProgressStore(int healthyWrites) {
            this.healthyWrites = healthyWrites;
        }

        @Override
        public synchronized void write(JSONObject document) {
            attempts++;
            if (attempts > healthyWrites) {
                throw new ProgressPersistenceException("progress disk full", null);
            }
            super.write(document);
        }

        @Override
        public synchronized void archive(JSONObject document, LocalDateTime startTime) {
            throw new ProgressPersistenceException("progress disk full", null);
        }
    }

    private static final class FixedNewsSource implements NewsSource {
        private final String symbolWithNews;

        FixedNewsSource(String symbolWithNews) {
            this.symbolWithNews = symbolWithNews;
        }

        @Override
        public List<NewsItem> fetch(String symbol, String companyName) {
            if (!symbolWithNews.equals(symbol)) {
                return List.of();
            }
            return List.of(new NewsItem(companyName + " beats estimates", "https://example.com/1", "Reuters",
                    ZonedDateTime.parse("2024-03-08T12:00:00Z")));
        }
    }

    private static final class KeywordSentimentModel implements SentimentModel {
        @Override
        public SentimentReading analyze(String symbol, List<NewsItem> news) {
            if (news.isEmpty()) {
                return SentimentReading.noSignal();
            }
            return new SentimentReading("positive", 70.0, 0.5, news.size(), List.of("Reuters"));
        }
    }

    private static final class RecordingNotifier implements PipelineNotifier {
        int successes;
        final List<String> failures = new ArrayList<>();

        @Override
        public void sendSuccess(JSONObject progressDocument, Path reportPath) {
            successes++;
        }

        @Override
        public void sendFailure(String errorMessage, JSONObject progressDocument) {
            failures.add(errorMessage);
        }
    }
}
