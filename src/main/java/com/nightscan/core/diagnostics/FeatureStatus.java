package com.nightscan.core.diagnostics;

public enum FeatureStatus {
    ENABLED,
    DISABLED_BY_CONFIG,
    DISABLED_NOT_IMPLEMENTED,
    DISABLED_RUNTIME_ERROR
}
