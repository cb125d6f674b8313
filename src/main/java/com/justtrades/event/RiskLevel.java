package com.justtrades.event;

/**
 * Severity of a {@link RiskEvent}. CRITICAL means automation on the symbol has stopped.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
