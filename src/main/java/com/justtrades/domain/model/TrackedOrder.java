package com.justtrades.domain.model;

import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An order this engine placed and is still waiting on (fill, cancel or reject).
 */
@Data
@Builder
public class TrackedOrder {

    private String orderId;
    private PositionKey key;
    private OrderSide side;
    private OrderType type;
    private OrderPurpose purpose;
    private int quantity;
    private int filledQuantity;
    private BigDecimal limitPrice;

    /** DCA rung index for DCA_ENTRY orders, otherwise null. */
    private Integer rungIndex;

    private Instant placedAt;

    public int remainingQuantity() {
        return quantity - filledQuantity;
    }

    public boolean isComplete() {
        return filledQuantity >= quantity;
    }

    public static TrackedOrder from(String orderId, OrderIntent intent, Integer rungIndex, Instant placedAt) {
        return TrackedOrder.builder()
                .orderId(orderId)
                .key(intent.key())
                .side(intent.getSide())
                .type(intent.getType())
                .purpose(intent.getPurpose())
                .quantity(intent.getQuantity())
                .limitPrice(intent.getLimitPrice())
                .rungIndex(rungIndex)
                .placedAt(placedAt)
                .build();
    }
}
