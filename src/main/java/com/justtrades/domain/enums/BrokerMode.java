package com.justtrades.domain.enums;

/**
 * Selects the {@code BrokerGateway} implementation at startup.
 */
public enum BrokerMode {
    PAPER,
    LIVE
}
