package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TradovateFill(
        long id, long orderId, long contractId, Instant timestamp, String action, int qty, BigDecimal price,
        Boolean active) {}
