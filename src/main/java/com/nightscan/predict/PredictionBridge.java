package com.nightscan.predict;

import com.nightscan.data.FetchException;
import com.nightscan.data.NewsSource;
import com.nightscan.model.DirectionForecast;
import com.nightscan.model.ModelFamily;
import com.nightscan.model.ModelSignal;
import com.nightscan.model.NewsItem;
import com.nightscan.model.PredictionRecord;
import com.nightscan.model.PriceSeries;
import com.nightscan.model.SentimentReading;
import com.nightscan.model.Signal;
import com.nightscan.model.StockCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：PredictionBridge（class）。
 * 主要职责：把方向模型、情绪模型和技术基线三个子模型的输出合并为单个标的的预测记录。
 * 使用建议：由 CapabilityNegotiator 在启动时构建一次并传入各阶段；可选模型缺失时自动退化为技术基线。
 */
public final class PredictionBridge {
    private static final Logger LOG = LogManager.getLogger(PredictionBridge.class);

    private final TechnicalBaseline baseline;
    private final DirectionModel directionModel;
    private final SentimentModel sentimentModel;
    private final NewsSource newsSource;
    private final BridgeAvailability availability;
    private final double buyThreshold;
    private final double sellThreshold;

    public PredictionBridge(
            TechnicalBaseline baseline,
            DirectionModel directionModel,
            SentimentModel sentimentModel,
            NewsSource newsSource,
            BridgeAvailability availability,
            double buyThreshold,
            double sellThreshold
    ) {
        if (buyThreshold < sellThreshold) {
            throw new IllegalArgumentException("buy threshold must not be below sell threshold");
        }
        this.baseline = baseline;
        this.directionModel = directionModel;
        this.sentimentModel = sentimentModel;
        this.newsSource = newsSource;
        this.availability = availability == null ? BridgeAvailability.baselineOnly() : availability;
        this.buyThreshold = buyThreshold;
        this.sellThreshold = sellThreshold;
    }

    public BridgeAvailability isAvailable() {
        return availability;
    }

    /**
     * Fits the direction model for one symbol. Returns false when the model is unavailable or the fit was skipped.
     */
    public boolean refresh(String symbol, PriceSeries history) {
        if (!availability.directionModelAvailable || directionModel == null) {
            return false;
        }
        return directionModel.refresh(symbol, history);
    }

    /**
     * 方法说明：predict，生成单个标的的集成预测。
     * 处理流程：技术基线必算；方向模型仅在已训练且数据充足时参与；情绪模型仅在有新闻时参与；最后按置信度加权融合。
     * 维护提示：可选模型的失败只写入 warnings，不会抛出。
     */
    public Result predict(StockCandidate candidate, PriceSeries history) {
        String symbol = candidate.symbol;
        List<String> warnings = new ArrayList<>();
        Map<ModelFamily, ModelSignal> components = new EnumMap<>(ModelFamily.class);
        components.put(ModelFamily.TECHNICAL, baseline.evaluate(history));

        Double predictedPrice = null;
        if (availability.directionModelAvailable && directionModel != null) {
            DirectionForecast forecast = directionModel.predict(symbol, history);
            if (forecast.usable()) {
                components.put(ModelFamily.DIRECTION, new ModelSignal(forecast.direction, forecast.confidence));
                predictedPrice = forecast.predictedPrice;
            } else {
                LOG.debug("Direction model skipped symbol={} note={}", symbol, forecast.note);
            }
        }

        SentimentReading sentiment = null;
        if (availability.sentimentAvailable && sentimentModel != null && newsSource != null) {
            try {
                List<NewsItem> news = newsSource.fetch(symbol, candidate.name);
                sentiment = sentimentModel.analyze(symbol, news);
                if (sentiment.hasSignal()) {
                    components.put(ModelFamily.SENTIMENT,
                            new ModelSignal(sentiment.direction, sentiment.confidencePct / 100.0));
                }
            } catch (FetchException e) {
                warnings.add(symbol + ": news fetch failed (" + e.category() + "): " + e.getMessage());
            } catch (ModelUnavailableException e) {
                warnings.add(symbol + ": sentiment unavailable: " + e.getMessage());
            }
        }

        double[] blended = blend(components);
        Signal signal = Signal.fromDirection(blended[0], buyThreshold, sellThreshold);
        PredictionRecord record = new PredictionRecord(
                symbol, components, blended[0], blended[1], signal, predictedPrice, sentiment);
        return new Result(record, warnings);
    }

    /**
     * Confidence-weighted blend: direction = Σ c·d / Σ c and confidence = Σ c² / Σ c, both 0 when Σ c = 0.
     */
    static double[] blend(Map<ModelFamily, ModelSignal> components) {
        double weight = 0.0;
        double weightedDirection = 0.0;
        double weightedConfidence = 0.0;
        for (ModelSignal s : components.values()) {
            weight += s.confidence;
            weightedDirection += s.confidence * s.direction;
            weightedConfidence += s.confidence * s.confidence;
        }
        if (weight <= 0.0) {
            return new double[]{0.0, 0.0};
        }
        double direction = Math.max(-1.0, Math.min(1.0, weightedDirection / weight));
        double confidence = Math.max(0.0, Math.min(1.0, weightedConfidence / weight));
        return new double[]{direction, confidence};
    }

    public static final class Result {
        public final PredictionRecord record;
        public final List<String> warnings;

        Result(PredictionRecord record, List<String> warnings) {
            this.record = record;
            this.warnings = List.copyOf(warnings);
        }
    }
}
