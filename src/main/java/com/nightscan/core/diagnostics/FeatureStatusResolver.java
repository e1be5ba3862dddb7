package com.nightscan.core.diagnostics;

/**
 * 模块说明：FeatureStatusResolver（class）。
 * 主要职责：按 配置开关 → 实现是否存在 → 初始化异常 的优先级解析能力状态。
 * 使用建议：调用方负责捕获初始化异常并作为 runtimeError 传入。
 */
public final class FeatureStatusResolver {

    private FeatureStatusResolver() {
    }

    public static FeatureResolution resolveFeatureStatus(
            String featureKey,
            boolean configValue,
            boolean implementationPresent,
            Throwable runtimeError,
            String owner
    ) {
        if (!configValue) {
            return new FeatureResolution(
                    featureKey,
                    false,
                    implementationPresent,
                    FeatureStatus.DISABLED_BY_CONFIG,
                    CauseCode.FEATURE_DISABLED_BY_CONFIG,
                    owner,
                    "disabled by config",
                    ""
            );
        }
        if (!implementationPresent) {
            return new FeatureResolution(
                    featureKey,
                    true,
                    false,
                    FeatureStatus.DISABLED_NOT_IMPLEMENTED,
                    CauseCode.FEATURE_NOT_IMPLEMENTED,
                    owner,
                    "not configured",
                    ""
            );
        }
        if (runtimeError != null) {
            return new FeatureResolution(
                    featureKey,
                    true,
                    true,
                    FeatureStatus.DISABLED_RUNTIME_ERROR,
                    CauseCode.FEATURE_RUNTIME_ERROR,
                    owner,
                    runtimeError.getMessage() == null ? "initialization failed" : runtimeError.getMessage(),
                    runtimeError.getClass().getSimpleName()
            );
        }
        return new FeatureResolution(
                featureKey,
                true,
                true,
                FeatureStatus.ENABLED,
                CauseCode.NONE,
                owner,
                "enabled",
                ""
        );
    }
}
