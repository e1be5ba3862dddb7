package com.nightscan.runner;

import com.nightscan.config.Config;
import com.nightscan.config.ScoringWeights;
import com.nightscan.core.progress.JsonFileProgressStore;
import com.nightscan.core.progress.PipelineProgressTracker;
import com.nightscan.data.MarketDataService;
import com.nightscan.data.StooqClient;
import com.nightscan.data.UniverseLoader;
import com.nightscan.data.rss.RssNewsSource;
import com.nightscan.factors.MacroBetaCalculator;
import com.nightscan.indicator.IndicatorEngine;
import com.nightscan.output.CompositeNotifier;
import com.nightscan.output.RunReportWriter;
import com.nightscan.predict.BatchPredictor;
import com.nightscan.predict.CapabilityNegotiator;
import com.nightscan.predict.LangChainSentimentModel;
import com.nightscan.predict.LogisticDirectionModel;
import com.nightscan.predict.PredictionBridge;
import com.nightscan.quality.DataQualityValidator;
import com.nightscan.regime.MarketRegimeEngine;
import com.nightscan.scoring.FactorViewExporter;
import com.nightscan.scoring.OpportunityScorer;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * 模块说明：PipelineComponents（class）。
 * 主要职责：集中持有一次运行所需的全部组件，启动时构建一次，再按引用传入各阶段。
 * 使用建议：生产环境用 fromConfig；测试用 builder 注入假实现。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineComponents {
    public final MarketDataService marketData;
    public final DataQualityValidator validator;
    public final UniverseProvider universe;
    public final MarketRegimeEngine regimeEngine;
    public final MacroBetaCalculator betaCalculator;
    public final IndicatorEngine indicators;
    public final BatchPredictor predictor;
    public final OpportunityScorer scorer;
    public final FactorViewExporter factorViewExporter;
    public final RunReportWriter reportWriter;
    public final PipelineProgressTracker tracker;
    public final String indexSymbol;
    public final int scanThreads;
    public final int scanLookbackDays;
    public final int scanLogEvery;
    public final double minOpportunityScore;
    public final int topN;

    /**
     * 方法说明：fromConfig，按配置装配生产组件。
     * 处理流程：构建数据源与校验器 → 协商可选子模型得到 PredictionBridge → 构建评分、导出与进度跟踪组件。
     * 维护提示：评分权重非法时在这里直接抛出 IllegalArgumentException。
     */
    public static PipelineComponents fromConfig(Config config) {
        MarketDataService marketData = new StooqClient(config);
        DataQualityValidator validator = new DataQualityValidator(config);
        IndicatorEngine indicators = new IndicatorEngine();
        PredictionBridge bridge = new CapabilityNegotiator(config).negotiate(
                indicators,
                () -> new LogisticDirectionModel(config),
                () -> new LangChainSentimentModel(config),
                () -> new RssNewsSource(config),
                config.getDouble("predict.buy_threshold"),
                config.getDouble("predict.sell_threshold")
        );
        UniverseLoader loader = new UniverseLoader();
        return PipelineComponents.builder()
                .marketData(marketData)
                .validator(validator)
                .universe(() -> loader.load(config.getPath("universe.path")))
                .regimeEngine(new MarketRegimeEngine(marketData, config))
                .betaCalculator(new MacroBetaCalculator(marketData, validator, config))
                .indicators(indicators)
                .predictor(new BatchPredictor(bridge, config))
                .scorer(new OpportunityScorer(ScoringWeights.fromConfig(config)))
                .factorViewExporter(new FactorViewExporter(config))
                .reportWriter(new RunReportWriter(config))
                .tracker(new PipelineProgressTracker(new JsonFileProgressStore(config), CompositeNotifier.fromConfig(config)))
                .indexSymbol(config.getString("regime.index_symbol"))
                .scanThreads(config.getInt("scan.threads"))
                .scanLookbackDays(config.getInt("scan.lookback_days"))
                .scanLogEvery(config.getInt("scan.progress.log_every"))
                .minOpportunityScore(config.getDouble("scoring.min_opportunity_score"))
                .topN(config.getInt("scoring.top_n"))
                .build();
    }
}
