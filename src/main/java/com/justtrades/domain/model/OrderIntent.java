package com.justtrades.domain.model;

import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import java.math.BigDecimal;
import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * A request to the broker to place one order.
 *
 * <p>EXIT intents are always MARKET: the constructor coerces the type and drops
 * any limit price. A resting limit exit can be stranded when price gaps past
 * it, leaving the engine flat on paper while the broker still holds the
 * position. No caller or configuration can override this.
 */
@Value
public class OrderIntent {

    String accountId;
    String symbol;
    OrderSide side;
    int quantity;
    OrderType type;
    OrderPurpose purpose;
    BigDecimal limitPrice;

    /** Emergency orders (kill switch) skip the per-token rate limiter. */
    boolean emergency;

    @Builder
    private OrderIntent(
            String accountId,
            String symbol,
            OrderSide side,
            int quantity,
            OrderType type,
            OrderPurpose purpose,
            BigDecimal limitPrice,
            boolean emergency) {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(purpose, "purpose");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
        OrderType effectiveType = purpose == OrderPurpose.EXIT ? OrderType.MARKET : type;
        if (effectiveType == null) {
            effectiveType = OrderType.MARKET;
        }
        if (effectiveType == OrderType.LIMIT && limitPrice == null) {
            throw new IllegalArgumentException("LIMIT order requires a limit price");
        }
        this.accountId = accountId;
        this.symbol = symbol;
        this.side = side;
        this.quantity = quantity;
        this.type = effectiveType;
        this.purpose = purpose;
        this.limitPrice = effectiveType == OrderType.MARKET ? null : limitPrice;
        this.emergency = emergency;
    }

    public static OrderIntent market(PositionKey key, OrderSide side, int quantity, OrderPurpose purpose) {
        return OrderIntent.builder()
                .accountId(key.accountId())
                .symbol(key.symbol())
                .side(side)
                .quantity(quantity)
                .type(OrderType.MARKET)
                .purpose(purpose)
                .build();
    }

    public static OrderIntent exit(PositionKey key, OrderSide side, int quantity) {
        return market(key, side, quantity, OrderPurpose.EXIT);
    }

    public PositionKey key() {
        return PositionKey.of(accountId, symbol);
    }
}
