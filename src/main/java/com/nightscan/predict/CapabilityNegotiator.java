package com.nightscan.predict;

import com.nightscan.config.Config;
import com.nightscan.core.diagnostics.FeatureResolution;
import com.nightscan.core.diagnostics.FeatureStatusResolver;
import com.nightscan.data.NewsSource;
import com.nightscan.indicator.IndicatorEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 模块说明：CapabilityNegotiator（class）。
 * 主要职责：启动时一次性创建可选子模型（方向模型、情绪模型、新闻源），并按 配置 → 实现 → 初始化异常 解析其可用性。
 * 使用建议：factory 传 null 表示未提供实现；初始化失败只降级可用性，不向上抛出。
 */
public final class CapabilityNegotiator {
    private static final Logger LOG = LogManager.getLogger(CapabilityNegotiator.class);
    private static final String OWNER = "predict";

    private final boolean directionEnabled;
    private final boolean sentimentEnabled;
    private final boolean newsEnabled;

    public CapabilityNegotiator(Config config) {
        this(config.getBoolean("predict.direction.enabled", true),
                config.getBoolean("predict.sentiment.enabled", true),
                config.getBoolean("news.enabled", true));
    }

    public CapabilityNegotiator(boolean directionEnabled, boolean sentimentEnabled, boolean newsEnabled) {
        this.directionEnabled = directionEnabled;
        this.sentimentEnabled = sentimentEnabled;
        this.newsEnabled = newsEnabled;
    }

    /**
     * 方法说明：negotiate，构建预测桥。
     * 处理流程：依次尝试创建三个可选组件，记录每个组件的 FeatureResolution，再组装 BridgeAvailability。
     * 维护提示：情绪模型只有在新闻源可用时才算可用，因为它没有其它输入。
     */
    public PredictionBridge negotiate(
            IndicatorEngine indicators,
            Supplier<? extends DirectionModel> directionFactory,
            Supplier<? extends SentimentModel> sentimentFactory,
            Supplier<? extends NewsSource> newsFactory,
            double buyThreshold,
            double sellThreshold
    ) {
        List<FeatureResolution> resolutions = new ArrayList<>();

        Created<DirectionModel> direction = create("predict.direction", directionEnabled, directionFactory);
        resolutions.add(direction.resolution);

        Created<NewsSource> news = create("news", newsEnabled, newsFactory);
        resolutions.add(news.resolution);

        Created<SentimentModel> sentiment = create("predict.sentiment", sentimentEnabled, sentimentFactory);
        if (sentiment.instance != null && sentiment.instance.initError() != null) {
            sentiment = new Created<>(null, FeatureStatusResolver.resolveFeatureStatus(
                    "predict.sentiment", true, true, new IllegalStateException(sentiment.instance.initError()), OWNER));
        }
        resolutions.add(sentiment.resolution);

        boolean sentimentUsable = sentiment.instance != null && news.instance != null;
        BridgeAvailability availability = new BridgeAvailability(
                direction.instance != null,
                sentimentUsable,
                news.instance != null,
                resolutions
        );
        for (FeatureResolution resolution : resolutions) {
            LOG.info("Capability {}", resolution);
        }
        LOG.info("Prediction bridge availability: {}", availability);
        return new PredictionBridge(
                new TechnicalBaseline(indicators),
                direction.instance,
                sentimentUsable ? sentiment.instance : null,
                news.instance,
                availability,
                buyThreshold,
                sellThreshold
        );
    }

    private static <T> Created<T> create(String key, boolean enabled, Supplier<? extends T> factory) {
        if (!enabled || factory == null) {
            return new Created<>(null, FeatureStatusResolver.resolveFeatureStatus(key, enabled, factory != null, null, OWNER));
        }
        try {
            T instance = factory.get();
            if (instance == null) {
                return new Created<>(null, FeatureStatusResolver.resolveFeatureStatus(key, true, false, null, OWNER));
            }
            return new Created<>(instance, FeatureStatusResolver.resolveFeatureStatus(key, true, true, null, OWNER));
        } catch (RuntimeException e) {
            LOG.warn("Capability {} failed to initialise: {}", key, e.toString());
            return new Created<>(null, FeatureStatusResolver.resolveFeatureStatus(key, true, true, e, OWNER));
        }
    }

    private static final class Created<T> {
        final T instance;
        final FeatureResolution resolution;

        Created(T instance, FeatureResolution resolution) {
            this.instance = instance;
            this.resolution = resolution;
        }
    }
}
