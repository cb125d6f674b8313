package com.justtrades.domain.model;

import com.justtrades.domain.enums.FillRole;
import com.justtrades.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One execution against a position. Immutable; the ordered sequence of fills
 * for a key is the source of truth for its quantity and average price.
 *
 * <p>{@code fillId} is the broker's execution id and the dedupe key.
 * {@code sequence} is assigned by the ledger on append and defines replay order.
 */
@Value
@Builder(toBuilder = true)
public class Fill {

    String fillId;
    String orderId;
    String accountId;
    String symbol;
    OrderSide side;

    /** Always positive; direction is carried by {@link #side}. */
    int quantity;

    BigDecimal price;
    Instant timestamp;
    FillRole role;
    long sequence;

    /** Signed quantity delta this fill applies to the position. */
    public int signedQuantity() {
        return side.sign() * quantity;
    }
}
