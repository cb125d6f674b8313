package com.justtrades.entity;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.PositionSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table: the persisted cache of one virtual position
 * plus its durable engine state. Keyed by {@code accountId:symbol}.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 100)
    private String id;

    @Column(name = "account_id", length = 40, nullable = false)
    private String accountId;

    @Column(length = 40, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private PositionSide side;

    private int quantity;

    @Column(name = "average_entry_price", precision = 19, scale = 6)
    private BigDecimal averageEntryPrice;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "realized_pnl", precision = 15, scale = 2)
    private BigDecimal realizedPnl;

    @Column(name = "unrealized_pnl", precision = 15, scale = 2)
    private BigDecimal unrealizedPnl;

    @Column(name = "worst_unrealized_pnl", precision = 15, scale = 2)
    private BigDecimal worstUnrealizedPnl;

    @Column(name = "best_unrealized_pnl", precision = 15, scale = 2)
    private BigDecimal bestUnrealizedPnl;

    @Column(name = "last_price", precision = 19, scale = 6)
    private BigDecimal lastPrice;

    /** Comma-separated fired rung indices, e.g. {@code 0,1}. */
    @Column(name = "dca_triggered_indices", length = 200)
    private String dcaTriggeredIndices;

    @Column(name = "dca_config", columnDefinition = "CLOB")
    private String dcaConfigJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_state", length = 20, nullable = false)
    private ExitState exitState;

    @Column(name = "take_profit_order_id", length = 64)
    private String takeProfitOrderId;

    @Column(name = "break_even_stop_price", precision = 19, scale = 6)
    private BigDecimal breakEvenStopPrice;

    @Column(name = "attention_required")
    private boolean attentionRequired;

    @Column(name = "attention_reason", length = 500)
    private String attentionReason;

    private boolean halted;

    @Column(name = "last_event", length = 500)
    private String lastEvent;

    @Column(name = "last_event_at")
    private Instant lastEventAt;

    @Column(name = "fill_count")
    private long fillCount;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
