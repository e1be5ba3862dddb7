package com.nightscan.core.diagnostics;

/**
 * 模块说明：FeatureResolution（class）。
 * 主要职责：记录一个可选能力在启动协商时的最终状态及原因。
 * 使用建议：只在启动阶段生成一次，运行期按此结果分支，不再重复探测。
 */
public final class FeatureResolution {
    public final String featureKey;
    public final boolean configValue;
    public final boolean implementationPresent;
    public final FeatureStatus status;
    public final CauseCode causeCode;
    public final String owner;
    public final String message;
    public final String runtimeExceptionClass;

    public FeatureResolution(
            String featureKey,
            boolean configValue,
            boolean implementationPresent,
            FeatureStatus status,
            CauseCode causeCode,
            String owner,
            String message,
            String runtimeExceptionClass
    ) {
        this.featureKey = featureKey == null ? "" : featureKey;
        this.configValue = configValue;
        this.implementationPresent = implementationPresent;
        this.status = status == null ? FeatureStatus.DISABLED_NOT_IMPLEMENTED : status;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.message = message == null ? "" : message;
        this.runtimeExceptionClass = runtimeExceptionClass == null ? "" : runtimeExceptionClass;
    }

    public boolean enabled() {
        return status == FeatureStatus.ENABLED;
    }

    @Override
    public String toString() {
        return featureKey + "=" + status + " (" + message + ")";
    }
}
