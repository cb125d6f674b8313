package com.justtrades.core.engine;

import com.justtrades.audit.PositionAuditService;
import com.justtrades.dca.DcaEngine;
import com.justtrades.dca.ProtectiveOrderManager;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.PositionStatus;
import com.justtrades.event.TickEvent;
import com.justtrades.exception.BaseException;
import com.justtrades.exception.ConflictingIntentException;
import com.justtrades.exception.PositionHaltedException;
import com.justtrades.exception.ValidationException;
import com.justtrades.exit.ExitService;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.pnl.PnlEngine;
import com.justtrades.reconciliation.DriftReconciler;
import com.justtrades.risk.DailyLossMonitor;
import com.justtrades.risk.KillSwitchResult;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Entry point for signals, operator commands and price ticks.
 *
 * <p>Every command is submitted to the position's {@link PositionEventLoop} and
 * returns a future that completes when the loop has processed it. Status reads
 * are the one exception: they copy the cached position from the calling thread.
 *
 * <p>Signal routing against the current position:
 * <ul>
 *   <li>Flat, or same direction as the open position: entry (adds are capped by max quantity).</li>
 *   <li>Opposite direction: reversal. The position is exited and the new entry waits for confirmed flat.</li>
 *   <li>Exit in flight: same direction is refused, opposite direction parks a reversal entry.</li>
 * </ul>
 */
@Service
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final PositionEventLoop positionEventLoop;
    private final PositionLedger positionLedger;
    private final EntryService entryService;
    private final ExitService exitService;
    private final PnlEngine pnlEngine;
    private final DcaEngine dcaEngine;
    private final ProtectiveOrderManager protectiveOrderManager;
    private final DriftReconciler driftReconciler;
    private final PositionAuditService positionAuditService;
    private final DailyLossMonitor dailyLossMonitor;
    private final Clock clock;

    public TradingEngine(
            PositionEventLoop positionEventLoop,
            PositionLedger positionLedger,
            EntryService entryService,
            ExitService exitService,
            PnlEngine pnlEngine,
            DcaEngine dcaEngine,
            ProtectiveOrderManager protectiveOrderManager,
            DriftReconciler driftReconciler,
            PositionAuditService positionAuditService,
            DailyLossMonitor dailyLossMonitor,
            Clock clock) {
        this.positionEventLoop = positionEventLoop;
        this.positionLedger = positionLedger;
        this.entryService = entryService;
        this.exitService = exitService;
        this.pnlEngine = pnlEngine;
        this.dcaEngine = dcaEngine;
        this.protectiveOrderManager = protectiveOrderManager;
        this.driftReconciler = driftReconciler;
        this.positionAuditService = positionAuditService;
        this.dailyLossMonitor = dailyLossMonitor;
        this.clock = clock;
    }

    // ========================
    // COMMANDS
    // ========================

    /**
     * Opens, adds to, or reverses the position for a trading signal.
     *
     * @param dcaConfig scale-in settings; only adopted when the position opens from flat
     * @throws PositionHaltedException if the account has hit its daily loss limit
     */
    public CompletableFuture<PositionStatus> openOrScalePosition(
            String accountId, String symbol, OrderSide side, int quantity, DcaConfig dcaConfig) {
        if (quantity <= 0) {
            throw new ValidationException("Quantity must be positive: " + quantity);
        }
        PositionKey key = keyOf(accountId, symbol);
        if (dailyLossMonitor.isBreached(key.accountId())) {
            throw new PositionHaltedException(key, "daily loss limit reached for account " + key.accountId());
        }
        return positionEventLoop.submit(key, () -> {
            Position position = positionLedger.currentPosition(key);
            if (position.isBlocked()) {
                throw new PositionHaltedException(key, position.getAttentionReason());
            }
            boolean sameDirection = position.isFlat() || position.getSide().entrySide() == side;

            if (position.getExitState() != ExitState.IDLE) {
                if (sameDirection) {
                    throw new ConflictingIntentException(key, position.getExitState(),
                            "Signal " + side + " x" + quantity + " for " + key + " conflicts with exit in "
                                    + position.getExitState());
                }
                exitService.requestReversal(key, new PendingEntry(side, quantity, dcaConfig));
                return statusOf(key);
            }

            if (sameDirection) {
                log.info("Entry for {}: {} x{}", key, side, quantity);
                entryService.placeEntry(position, side, quantity, dcaConfig);
            } else {
                log.info("Reversal for {}: {} position of {} -> {} x{}", key, position.getSide(),
                        position.absQuantity(), side, quantity);
                exitService.requestReversal(key, new PendingEntry(side, quantity, dcaConfig));
            }
            return statusOf(key);
        });
    }

    public CompletableFuture<PositionStatus> requestExit(String accountId, String symbol, ExitReason reason) {
        PositionKey key = keyOf(accountId, symbol);
        return positionEventLoop.submit(key, () -> {
            exitService.requestExit(key, reason != null ? reason : ExitReason.MANUAL);
            return statusOf(key);
        });
    }

    /** Operator kill switch. Runs off the loop; the result is applied inside it. */
    public CompletableFuture<KillSwitchResult> requestForceFlatten(String accountId, String symbol) {
        PositionKey key = keyOf(accountId, symbol);
        log.warn("Force flatten requested for {}", key);
        return exitService.forceFlatten(key, "operator force flatten");
    }

    /**
     * Clears the attention flag after an operator has resolved the position. A
     * halted position is also un-halted, after its fill log replays cleanly.
     */
    public CompletableFuture<PositionStatus> clearAttention(String accountId, String symbol) {
        PositionKey key = keyOf(accountId, symbol);
        return positionEventLoop.submit(key, () -> {
            Position position = positionLedger.currentPosition(key);
            if (!position.isBlocked()) {
                return statusOf(key);
            }
            String previous = position.getAttentionReason();
            boolean wasHalted = position.isHalted();
            if (wasHalted) {
                positionLedger.rebuild(key.accountId(), key.symbol());
            }
            position.setAttentionRequired(false);
            position.setAttentionReason(null);
            position.setHalted(false);
            position.recordEvent("ATTENTION CLEARED", clock.instant());
            positionLedger.save(position);
            positionAuditService.record(key, "ATTENTION_CLEARED", "Cleared by operator: " + previous);
            log.warn("Attention cleared for {} (was halted: {}): {}", key, wasHalted, previous);
            return statusOf(key);
        });
    }

    // ========================
    // STATUS
    // ========================

    /** Last-known state of the position. Never blocks on the loop. */
    public PositionStatus getStatus(String accountId, String symbol) {
        return statusOf(keyOf(accountId, symbol));
    }

    private PositionStatus statusOf(PositionKey key) {
        Position snapshot = positionLedger.currentPosition(key).snapshot();
        return new PositionStatus(
                snapshot,
                snapshot.getExitState(),
                pnlEngine.snapshot(snapshot),
                driftReconciler.recentDrift(key),
                positionAuditService.recent(key));
    }

    // ========================
    // TICKS
    // ========================

    @EventListener
    @Order(1)
    public void onTick(TickEvent event) {
        for (PositionKey key : positionLedger.keysForSymbol(event.getSymbol())) {
            positionEventLoop.post(key, "tick", () -> handleTick(key, event.getLastPrice()));
        }
    }

    void handleTick(PositionKey key, BigDecimal lastPrice) {
        Position position = positionLedger.currentPosition(key);
        if (pnlEngine.mark(position, lastPrice)) {
            positionLedger.save(position);
        }
        if (position.isFlat() || position.getExitState() != ExitState.IDLE || position.isBlocked()) {
            return;
        }

        if (dcaEngine.evaluate(position, lastPrice).isPresent()) {
            return;
        }
        protectiveOrderManager.armBreakEven(position, lastPrice);
        ExitReason reason = null;
        if (protectiveOrderManager.stopLossHit(position, lastPrice)) {
            reason = protectiveOrderManager.breakEvenStopActive(position) ? ExitReason.BREAK_EVEN : ExitReason.STOP_LOSS;
        } else if (protectiveOrderManager.takeProfitHit(position, lastPrice)) {
            reason = ExitReason.TAKE_PROFIT;
        }
        if (reason == null) {
            return;
        }
        log.info("{} reached for {} at {}", reason, key, lastPrice);
        try {
            exitService.requestExit(key, reason);
        } catch (BaseException e) {
            log.error("{} exit for {} failed: {}", reason, key, e.getMessage());
        }
    }

    private static PositionKey keyOf(String accountId, String symbol) {
        if (accountId == null || accountId.isBlank() || symbol == null || symbol.isBlank()) {
            throw new ValidationException("accountId and symbol are required");
        }
        return PositionKey.of(accountId.trim(), symbol.trim().toUpperCase(Locale.ROOT));
    }
}
