package com.driftwatch.domain;

public enum PsiSeverity {
    LOW,
    MEDIUM,
    HIGH;

    public static PsiSeverity of(double psi, double lowThreshold, double highThreshold) {
        if (psi < lowThreshold) {
            return LOW;
        }
        return psi < highThreshold ? MEDIUM : HIGH;
    }
}
