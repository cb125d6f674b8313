package com.justtrades.entity;

import com.justtrades.domain.enums.FillRole;
import com.justtrades.domain.enums.OrderSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the append-only fill log. Rows are inserted, never updated.
 */
@Entity
@Table(
        name = "fills",
        indexes = {@Index(name = "idx_fills_position", columnList = "account_id, symbol, sequence")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillEntity {

    @Id
    @Column(name = "fill_id", length = 64)
    private String fillId;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "account_id", length = 40, nullable = false)
    private String accountId;

    @Column(length = 40, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private OrderSide side;

    private int quantity;

    @Column(precision = 19, scale = 6)
    private BigDecimal price;

    @Column(name = "filled_at")
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private FillRole role;

    @Column(nullable = false)
    private long sequence;
}
