package com.di.recalibrator.model;

public enum DriftSeverity {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public boolean atLeast(DriftSeverity other) {
        return compareTo(other) >= 0;
    }

    public static DriftSeverity max(DriftSeverity a, DriftSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
