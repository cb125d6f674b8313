package com.justtrades.exception;

import com.justtrades.domain.enums.OrderPurpose;
import java.util.Map;
import lombok.Getter;

/**
 * The broker refused an order. Never retried automatically for exits or scale-ins.
 */
@Getter
public class OrderRejectedException extends BaseException {

    private final String reason;

    public OrderRejectedException(String symbol, OrderPurpose purpose, String reason) {
        super(
                ErrorCode.ORDER_REJECTED,
                "Broker rejected " + purpose + " order for " + symbol + ": " + reason,
                Map.of("symbol", symbol, "purpose", purpose.name(), "reason", String.valueOf(reason)));
        this.reason = reason;
    }
}
