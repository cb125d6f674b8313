package com.justtrades.domain.model;

import com.justtrades.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * An execution as reported by the broker, before the ledger assigns it a role and sequence.
 */
public record BrokerFill(
        String fillId, String orderId, OrderSide side, int quantity, BigDecimal price, Instant timestamp) {}
