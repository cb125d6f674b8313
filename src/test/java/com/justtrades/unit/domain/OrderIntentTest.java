package com.justtrades.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.OrderIntent;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderIntentTest {

    @Test
    @DisplayName("EXIT intents are always MARKET and never carry a limit price")
    void exit_coercedToMarket() {
        OrderIntent intent = OrderIntent.builder()
                .accountId("ACC-1")
                .symbol("MNQZ5")
                .side(OrderSide.SELL)
                .quantity(2)
                .type(OrderType.LIMIT)
                .limitPrice(new BigDecimal("21000"))
                .purpose(OrderPurpose.EXIT)
                .build();

        assertThat(intent.getType()).isEqualTo(OrderType.MARKET);
        assertThat(intent.getLimitPrice()).isNull();
    }

    @Test
    @DisplayName("Take-profit limits keep their price")
    void takeProfit_keepsLimit() {
        OrderIntent intent = OrderIntent.builder()
                .accountId("ACC-1")
                .symbol("MNQZ5")
                .side(OrderSide.SELL)
                .quantity(2)
                .type(OrderType.LIMIT)
                .limitPrice(new BigDecimal("21010.25"))
                .purpose(OrderPurpose.TAKE_PROFIT)
                .build();

        assertThat(intent.getType()).isEqualTo(OrderType.LIMIT);
        assertThat(intent.getLimitPrice()).isEqualByComparingTo("21010.25");
    }

    @Test
    @DisplayName("A LIMIT without a price or a non-positive quantity is refused")
    void invalid() {
        assertThatThrownBy(() -> OrderIntent.builder()
                        .accountId("ACC-1")
                        .symbol("MNQZ5")
                        .side(OrderSide.BUY)
                        .quantity(1)
                        .type(OrderType.LIMIT)
                        .purpose(OrderPurpose.ENTRY)
                        .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OrderIntent.builder()
                        .accountId("ACC-1")
                        .symbol("MNQZ5")
                        .side(OrderSide.BUY)
                        .quantity(0)
                        .purpose(OrderPurpose.ENTRY)
                        .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
