package com.justtrades.domain.model;

import com.justtrades.domain.enums.PositionSide;
import java.math.BigDecimal;

/**
 * The broker's authoritative view of one (account, symbol) position.
 * {@code averagePrice} may be null when the broker does not report it or the position is flat.
 */
public record BrokerPosition(int quantity, PositionSide side, BigDecimal averagePrice) {

    public static BrokerPosition flat() {
        return new BrokerPosition(0, PositionSide.FLAT, null);
    }

    public static BrokerPosition of(int quantity, BigDecimal averagePrice) {
        return new BrokerPosition(quantity, PositionSide.fromQuantity(quantity), averagePrice);
    }

    public boolean isFlat() {
        return quantity == 0;
    }
}
