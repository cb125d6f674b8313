package com.justtrades.domain.model;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The engine's virtual position for one (account, symbol).
 *
 * <p>Quantity is signed: positive = LONG, negative = SHORT. {@code quantity}
 * and {@code averageEntryPrice} are a cache derived from the fill log; the
 * ledger can always rebuild them. Everything else (exit state, DCA bookkeeping,
 * attention flags) is engine state persisted alongside the cache.
 *
 * <p>Instances are owned by the position's event loop. Other threads must read
 * through {@link #snapshot()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String accountId;
    private String symbol;

    private PositionSide side;

    /** Signed net quantity of all fills. */
    private int quantity;

    /** Volume-weighted entry price. Null whenever quantity is zero. */
    private BigDecimal averageEntryPrice;

    private Instant openedAt;
    private Instant closedAt;

    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;

    /** Most adverse unrealized PnL seen while open (MAE). Only ever decreases. */
    private BigDecimal worstUnrealizedPnl;

    /** Most favorable unrealized PnL seen while open (MFE). Only ever increases. */
    private BigDecimal bestUnrealizedPnl;

    private BigDecimal lastPrice;

    /** DCA rung indices already fired for the current position. Durable. */
    @Builder.Default
    private Set<Integer> dcaTriggeredIndices = new TreeSet<>();

    private DcaConfig dcaConfig;

    @Builder.Default
    private ExitState exitState = ExitState.IDLE;

    private String takeProfitOrderId;

    /** Engine-side stop at the average entry, set once break-even has armed. Null while unarmed. */
    private BigDecimal breakEvenStopPrice;

    private boolean attentionRequired;
    private String attentionReason;

    /** Set on fatal conditions. Blocks all automated order placement until operator reset. */
    private boolean halted;

    private String lastEvent;
    private Instant lastEventAt;

    /** Number of fills applied. Used to detect cache drift against the fill log. */
    private long fillCount;

    public static Position flat(PositionKey key) {
        return Position.builder()
                .accountId(key.accountId())
                .symbol(key.symbol())
                .side(PositionSide.FLAT)
                .quantity(0)
                .realizedPnl(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .worstUnrealizedPnl(BigDecimal.ZERO)
                .bestUnrealizedPnl(BigDecimal.ZERO)
                .build();
    }

    public PositionKey key() {
        return PositionKey.of(accountId, symbol);
    }

    public boolean isFlat() {
        return quantity == 0;
    }

    public int absQuantity() {
        return Math.abs(quantity);
    }

    /** True when automated order placement is blocked for this position. */
    public boolean isBlocked() {
        return halted || attentionRequired;
    }

    /** Records the last transition or rejection so status queries reflect it. */
    public void recordEvent(String event, Instant at) {
        this.lastEvent = event;
        this.lastEventAt = at;
    }

    /** Copy for readers outside the event loop. */
    public Position snapshot() {
        return toBuilder()
                .dcaTriggeredIndices(new TreeSet<>(dcaTriggeredIndices))
                .build();
    }
}
