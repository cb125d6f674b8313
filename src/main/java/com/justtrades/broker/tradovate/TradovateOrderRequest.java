package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Body of {@code POST /order/placeorder}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TradovateOrderRequest(
        String accountSpec,
        long accountId,
        String action,
        String symbol,
        int orderQty,
        String orderType,
        BigDecimal price,
        String timeInForce,
        @JsonProperty("isAutomated") boolean isAutomated) {}
