package com.nightscan.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：统一标注单个标的或单个子模型降级、跳过、失败的原因。
 * 使用建议：新增原因时同步检查日志与报告里的展示。
 */
public enum CauseCode {
    NONE,
    FETCH_FAILED,
    FETCH_TIMEOUT,
    NO_BARS,
    HISTORY_SHORT,
    VALIDATION_FAILED,
    COMPUTATION_DEGENERATE,
    MODEL_UNAVAILABLE,
    FEATURE_DISABLED_BY_CONFIG,
    FEATURE_NOT_IMPLEMENTED,
    FEATURE_RUNTIME_ERROR,
    CANCELLED,
    RUNTIME_ERROR
}
