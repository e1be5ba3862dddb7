package com.nightscan.model;

import org.json.JSONObject;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 模块说明：PredictionRecord（class）。
 * 主要职责：单个标的的集成预测，含各子模型投票、加权后的方向与置信度以及 BUY/SELL/HOLD 信号。
 * 使用建议：directionUsed / sentimentUsed 说明该标的实际参与融合的可选模型。
 */
public final class PredictionRecord {
    public final String symbol;
    public final Map<ModelFamily, ModelSignal> components;
    public final double direction;
    public final double confidence;
    public final Signal signal;
    public final boolean directionUsed;
    public final boolean sentimentUsed;
    public final Double predictedPrice;
    public final SentimentReading sentiment;

    public PredictionRecord(
            String symbol,
            Map<ModelFamily, ModelSignal> components,
            double direction,
            double confidence,
            Signal signal,
            Double predictedPrice,
            SentimentReading sentiment
    ) {
        this.symbol = symbol;
        EnumMap<ModelFamily, ModelSignal> copy = new EnumMap<>(ModelFamily.class);
        if (components != null) {
            copy.putAll(components);
        }
        this.components = Collections.unmodifiableMap(copy);
        this.direction = direction;
        this.confidence = confidence;
        this.signal = signal == null ? Signal.HOLD : signal;
        this.directionUsed = copy.containsKey(ModelFamily.DIRECTION);
        this.sentimentUsed = copy.containsKey(ModelFamily.SENTIMENT);
        this.predictedPrice = predictedPrice;
        this.sentiment = sentiment;
    }

    public ModelSignal component(ModelFamily family) {
        return components.get(family);
    }

    public double confidencePct() {
        return confidence * 100.0;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("symbol", symbol);
        json.put("direction", direction);
        json.put("confidence", confidence);
        json.put("signal", signal.name());
        json.put("direction_model_used", directionUsed);
        json.put("sentiment_used", sentimentUsed);
        json.put("predicted_price", predictedPrice == null ? JSONObject.NULL : predictedPrice);
        JSONObject parts = new JSONObject();
        for (Map.Entry<ModelFamily, ModelSignal> entry : components.entrySet()) {
            JSONObject part = new JSONObject();
            part.put("direction", entry.getValue().direction);
            part.put("confidence", entry.getValue().confidence);
            parts.put(entry.getKey().wireName(), part);
        }
        json.put("components", parts);
        if (sentiment != null) {
            JSONObject s = new JSONObject();
            s.put("label", sentiment.label);
            s.put("confidence_pct", sentiment.confidencePct);
            s.put("article_count", sentiment.articleCount);
            s.put("sources", sentiment.sources);
            json.put("sentiment", s);
        }
        return json;
    }
}
