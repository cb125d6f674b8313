package com.justtrades.exit;

import com.justtrades.broker.BrokerGateway;
import com.justtrades.config.EngineConfig;
import com.justtrades.core.engine.EntryService;
import com.justtrades.core.engine.PendingEntry;
import com.justtrades.core.engine.PositionEventLoop;
import com.justtrades.dca.DcaEngine;
import com.justtrades.domain.enums.DriftTrigger;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.KillSwitchOutcome;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.BaseException;
import com.justtrades.exception.BrokerException;
import com.justtrades.exception.DriftDetectedException;
import com.justtrades.exception.EngineTimeoutException;
import com.justtrades.exception.OrderRejectedException;
import com.justtrades.exception.PositionHaltedException;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.oms.OrderRouter;
import com.justtrades.reconciliation.DriftReconciler;
import com.justtrades.risk.KillSwitchResult;
import com.justtrades.risk.KillSwitchService;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives the exit state machine for every position.
 *
 * <p>All methods except {@link #forceFlatten} run inside the position's event
 * loop. The at-most-one-exit guarantee comes from that serialization plus the
 * IDLE guard in {@link #requestExit}; there are no locks.
 *
 * <p>Exit flow:
 * <ol>
 *   <li>IDLE -> PREPARE_EXIT: cancel all resting orders, query the broker quantity fresh.</li>
 *   <li>PREPARE_EXIT -> WORKING_EXIT: market exit for the broker quantity; start confirmation polling.</li>
 *   <li>WORKING_EXIT -> CONFIRM_FLAT: the exit fill has taken the ledger flat.</li>
 *   <li>CONFIRM_FLAT -> IDLE: the broker reports flat (poll or snapshot).</li>
 * </ol>
 * Confirmation timeout hands the position to the kill switch.
 */
@Service
public class ExitService {

    private static final Logger log = LoggerFactory.getLogger(ExitService.class);

    private final PositionLedger positionLedger;
    private final ExitStateMachine exitStateMachine;
    private final ExitConfirmationLoop confirmationLoop;
    private final OrderRouter orderRouter;
    private final BrokerGateway brokerGateway;
    private final DriftReconciler driftReconciler;
    private final KillSwitchService killSwitchService;
    private final DcaEngine dcaEngine;
    private final EntryService entryService;
    private final PositionEventLoop positionEventLoop;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineConfig engineConfig;
    private final Executor killSwitchExecutor;
    private final Clock clock;

    /** Exits in flight, by position. Touched only from the owning loop. */
    private final Map<PositionKey, ActiveExit> activeExits = new ConcurrentHashMap<>();

    /** Entries parked behind a reversal exit. */
    private final Map<PositionKey, PendingEntry> pendingEntries = new ConcurrentHashMap<>();

    public ExitService(
            PositionLedger positionLedger,
            ExitStateMachine exitStateMachine,
            ExitConfirmationLoop confirmationLoop,
            OrderRouter orderRouter,
            BrokerGateway brokerGateway,
            DriftReconciler driftReconciler,
            KillSwitchService killSwitchService,
            DcaEngine dcaEngine,
            EntryService entryService,
            PositionEventLoop positionEventLoop,
            EventPublisherHelper eventPublisherHelper,
            EngineConfig engineConfig,
            @Qualifier("killSwitchExecutor") Executor killSwitchExecutor,
            Clock clock) {
        this.positionLedger = positionLedger;
        this.exitStateMachine = exitStateMachine;
        this.confirmationLoop = confirmationLoop;
        this.orderRouter = orderRouter;
        this.brokerGateway = brokerGateway;
        this.driftReconciler = driftReconciler;
        this.killSwitchService = killSwitchService;
        this.dcaEngine = dcaEngine;
        this.entryService = entryService;
        this.positionEventLoop = positionEventLoop;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineConfig = engineConfig;
        this.killSwitchExecutor = killSwitchExecutor;
        this.clock = clock;
    }

    // ========================
    // REQUEST
    // ========================

    /**
     * Starts an exit. A no-op when an exit is already in flight or the position is flat.
     *
     * @return the exit state after the call
     * @throws PositionHaltedException if automation is blocked on the position
     */
    public ExitState requestExit(PositionKey key, ExitReason reason) {
        Position position = positionLedger.currentPosition(key);
        if (position.getExitState() != ExitState.IDLE) {
            log.info("Exit request for {} ({}) ignored: exit already {}", key, reason, position.getExitState());
            return position.getExitState();
        }
        if (position.isFlat()) {
            log.debug("Exit request for {} ignored: flat", key);
            return ExitState.IDLE;
        }
        if (position.isBlocked()) {
            throw new PositionHaltedException(key, position.getAttentionReason());
        }

        exitStateMachine.transition(position, ExitState.PREPARE_EXIT, reason, null);
        activeExits.put(key, new ActiveExit(reason));
        prepare(position, reason);
        return position.getExitState();
    }

    /** Parks {@code entry} and exits the current position; the entry goes out once flat is confirmed. */
    public ExitState requestReversal(PositionKey key, PendingEntry entry) {
        pendingEntries.put(key, entry);
        log.info("Reversal for {}: parked {} x{} until flat", key, entry.side(), entry.quantity());
        ExitState state;
        try {
            state = requestExit(key, ExitReason.REVERSAL);
        } catch (RuntimeException e) {
            pendingEntries.remove(key);
            throw e;
        }
        if (state == ExitState.IDLE) {
            placePendingEntry(positionLedger.currentPosition(key));
        }
        return state;
    }

    // ========================
    // PREPARE / WORK
    // ========================

    private void prepare(Position position, ExitReason reason) {
        PositionKey key = position.key();
        int brokerQuantity;
        try {
            orderRouter.cancelAllResting(key);
            position.setTakeProfitOrderId(null);
            brokerQuantity = brokerGateway.queryPosition(key.accountId(), key.symbol()).quantity();
        } catch (BrokerException e) {
            abort(position, "Exit preparation failed: " + e.getMessage());
            throw e;
        }

        try {
            verifyBrokerAgrees(position, brokerQuantity);
        } catch (DriftDetectedException e) {
            log.warn("{}; reconciling before exit", e.getMessage());
            driftReconciler.reconcile(key, brokerQuantity, DriftTrigger.EXIT, true);
            if (brokerQuantity == 0) {
                finishFlat(position, ExitState.IDLE, "broker already flat");
                return;
            }
        }
        submitExit(position, brokerQuantity);
    }

    private void submitExit(Position position, int brokerQuantity) {
        PositionKey key = position.key();
        ActiveExit exit = activeExits.computeIfAbsent(key, k -> new ActiveExit(ExitReason.MANUAL));
        OrderSide side = brokerQuantity > 0 ? OrderSide.SELL : OrderSide.BUY;
        try {
            orderRouter.place(OrderIntent.exit(key, side, Math.abs(brokerQuantity)));
        } catch (OrderRejectedException e) {
            onExitRejected(position, e.getReason());
            return;
        } catch (BrokerException e) {
            log.error("Exit order outcome unknown for {}; confirming against the broker", key);
        }
        if (position.getExitState() == ExitState.PREPARE_EXIT) {
            exitStateMachine.transition(position, ExitState.WORKING_EXIT, exit.reason,
                    "market exit " + side + " " + Math.abs(brokerQuantity));
        }
        startConfirmation(key);
    }

    private void verifyBrokerAgrees(Position position, int brokerQuantity) {
        if (brokerQuantity != position.getQuantity()) {
            throw new DriftDetectedException(position.key(), position.getQuantity(), brokerQuantity);
        }
    }

    private void startConfirmation(PositionKey key) {
        confirmationLoop.start(key, polled -> onConfirmPoll(key, polled), () -> onConfirmTimeout(key));
    }

    // ========================
    // BROKER EVENTS
    // ========================

    /** Called after an exit-side fill has been applied to the ledger. */
    public void onExitFill(Position position) {
        if (position.getExitState() == ExitState.WORKING_EXIT && position.isFlat()) {
            exitStateMachine.transition(position, ExitState.CONFIRM_FLAT, reasonFor(position.key()),
                    "exit filled; awaiting broker flat");
        }
    }

    /** Broker position snapshot. Zero confirms a pending exit. */
    public void onPositionSnapshot(PositionKey key, int brokerQuantity) {
        Position position = positionLedger.currentPosition(key);
        if (brokerQuantity == 0 && position.isFlat()) {
            confirmFlat(position, "broker snapshot flat");
        }
    }

    /** Exit order rejected, synchronously or by push. */
    public void onExitRejected(Position position, String reason) {
        PositionKey key = position.key();
        if (position.getExitState() == ExitState.IDLE) {
            return;
        }
        confirmationLoop.stop(key);
        log.warn("Exit for {} rejected: {}", key, reason);
        eventPublisherHelper.publishRisk(this, key, RiskEventType.EXIT_REJECTED, RiskLevel.WARNING, reason);

        BrokerPosition broker;
        try {
            broker = brokerGateway.queryPosition(key.accountId(), key.symbol());
        } catch (BrokerException e) {
            log.error("Cannot re-query {} after exit rejection: {}", key, e.getMessage());
            broker = null;
        }

        if (broker != null && broker.isFlat()) {
            if (!position.isFlat()) {
                driftReconciler.reconcile(key, 0, DriftTrigger.EXIT, true);
            }
            finishFlat(position, ExitState.IDLE, "exit rejected but broker flat");
            return;
        }

        ActiveExit exit = activeExits.computeIfAbsent(key, k -> new ActiveExit(ExitReason.MANUAL));
        String brokerQty = broker == null ? "unknown" : String.valueOf(broker.quantity());
        switch (engineConfig.getRejectedExitPolicy()) {
            case RETRY_ONCE -> {
                if (!exit.retried && broker != null) {
                    exit.retried = true;
                    log.warn("Retrying rejected exit once for {} (broker {})", key, brokerQty);
                    submitExit(position, broker.quantity());
                } else {
                    requireManualClear(position, reason, brokerQty);
                }
            }
            case ESCALATE_TO_KILL_SWITCH -> escalate(key, "exit rejected: " + reason);
            case REQUIRE_MANUAL_CLEAR -> requireManualClear(position, reason, brokerQty);
        }
    }

    /**
     * Confirmation poll result. A broker that stays flat while the ledger still
     * holds the position means the exit fill push was lost: after
     * {@code confirm-reconcile-polls} consecutive such polls the ledger is
     * reconciled from the broker and the exit confirmed.
     */
    void onConfirmPoll(PositionKey key, BrokerPosition broker) {
        Position position = positionLedger.currentPosition(key);
        ActiveExit exit = activeExits.get(key);
        if (!broker.isFlat()) {
            if (exit != null) {
                exit.brokerFlatPolls = 0;
            }
            return;
        }
        if (position.isFlat()) {
            confirmFlat(position, "broker position query flat");
            return;
        }
        if (exit == null || position.getExitState() != ExitState.WORKING_EXIT
                || ++exit.brokerFlatPolls < engineConfig.getConfirmReconcilePolls()) {
            return;
        }
        log.warn("Broker flat for {} polls while ledger holds {} for {}; reconciling", exit.brokerFlatPolls,
                position.getQuantity(), key);
        driftReconciler.reconcile(key, 0, DriftTrigger.EXIT, true);
        Position reconciled = positionLedger.currentPosition(key);
        if (reconciled.isFlat()) {
            confirmFlat(reconciled, "broker flat; exit fill recovered by reconciliation");
        }
    }

    void onConfirmTimeout(PositionKey key) {
        Position position = positionLedger.currentPosition(key);
        if (position.getExitState() == ExitState.IDLE) {
            return;
        }
        EngineTimeoutException timeout = new EngineTimeoutException(
                "Exit confirmation for " + key, engineConfig.getConfirmTimeout().toMillis());
        log.error("{}; escalating to kill switch", timeout.getMessage());
        eventPublisherHelper.publishRisk(this, key, RiskEventType.EXIT_CONFIRMATION_TIMEOUT, RiskLevel.CRITICAL,
                timeout.getMessage(), timeout.getDetails());
        escalate(key, "exit confirmation timeout");
    }

    // ========================
    // KILL SWITCH
    // ========================

    /**
     * Runs the kill switch on the calling thread, then applies its result inside
     * the position's loop. Must not be called from the loop itself.
     */
    public CompletableFuture<KillSwitchResult> forceFlatten(PositionKey key, String reason) {
        int ledgerQuantity = positionLedger.currentPosition(key).getQuantity();
        KillSwitchResult result = killSwitchService.activate(key, ledgerQuantity, reason);
        return positionEventLoop.submit(key, () -> {
            applyKillSwitchResult(key, result);
            return result;
        });
    }

    /** Applies a kill switch outcome. Runs in the loop. */
    public void applyKillSwitchResult(PositionKey key, KillSwitchResult result) {
        if (result.getOutcome() == KillSwitchOutcome.ALREADY_RUNNING) {
            return;
        }
        Position position = positionLedger.currentPosition(key);
        confirmationLoop.stop(key);
        activeExits.remove(key);

        if (result.getOutcome() == KillSwitchOutcome.DEADLINE_EXCEEDED) {
            pendingEntries.remove(key);
            exitStateMachine.forceIdle(position, "kill switch deadline exceeded");
            positionLedger.halt(position, new EngineTimeoutException(
                    "Kill switch flatten", engineConfig.getKillSwitchDeadline().toMillis()).getMessage());
            return;
        }

        exitStateMachine.forceIdle(position, "kill switch " + result.getOutcome());
        if (!position.isFlat()) {
            driftReconciler.reconcile(key, 0, DriftTrigger.EXIT, true);
        }
        finishFlat(positionLedger.currentPosition(key), ExitState.IDLE, null);
    }

    private void escalate(PositionKey key, String reason) {
        int ledgerQuantity = positionLedger.currentPosition(key).getQuantity();
        CompletableFuture.supplyAsync(() -> killSwitchService.activate(key, ledgerQuantity, reason), killSwitchExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Kill switch escalation for {} failed: {}", key, error.getMessage(), error);
                        return;
                    }
                    positionEventLoop.post(key, "apply-kill-switch", () -> applyKillSwitchResult(key, result));
                });
    }

    // ========================
    // RESTART
    // ========================

    /**
     * Resumes a position persisted mid-exit. Whether or not the exit order went
     * out before the restart, confirmation polling decides: flat finishes the
     * exit, otherwise the timeout hands it to the kill switch.
     */
    public void resumeAfterRestart(Position position) {
        if (position.getExitState() == ExitState.IDLE) {
            return;
        }
        log.warn("Resuming {} persisted in {}", position.key(), position.getExitState());
        activeExits.putIfAbsent(position.key(), new ActiveExit(ExitReason.MANUAL));
        startConfirmation(position.key());
    }

    public boolean hasPendingEntry(PositionKey key) {
        return pendingEntries.containsKey(key);
    }

    // ========================
    // INTERNALS
    // ========================

    private void confirmFlat(Position position, String detail) {
        switch (position.getExitState()) {
            case WORKING_EXIT -> {
                exitStateMachine.transition(position, ExitState.CONFIRM_FLAT, reasonFor(position.key()), detail);
                finishFlat(position, ExitState.IDLE, detail);
            }
            case CONFIRM_FLAT -> finishFlat(position, ExitState.IDLE, detail);
            case PREPARE_EXIT, IDLE -> {
                // nothing in flight to confirm
            }
        }
    }

    /** Final step of every exit path that ends flat. */
    private void finishFlat(Position position, ExitState target, String detail) {
        PositionKey key = position.key();
        confirmationLoop.stop(key);
        ExitReason reason = reasonFor(key);
        activeExits.remove(key);
        if (position.getExitState() != target) {
            exitStateMachine.transition(position, target, reason, detail);
        }
        if (position.isFlat()) {
            position.setUnrealizedPnl(BigDecimal.ZERO);
            dcaEngine.resetForFlat(position);
            positionLedger.save(position);
            log.info("Exit complete for {}: realized={}", key, position.getRealizedPnl());
            placePendingEntry(position);
        }
    }

    private void abort(Position position, String detail) {
        confirmationLoop.stop(position.key());
        ExitReason reason = reasonFor(position.key());
        activeExits.remove(position.key());
        pendingEntries.remove(position.key());
        exitStateMachine.transition(position, ExitState.IDLE, reason, detail);
        eventPublisherHelper.publishRisk(this, position.key(), RiskEventType.EXIT_REJECTED, RiskLevel.WARNING, detail);
    }

    private void requireManualClear(Position position, String reason, String brokerQuantity) {
        PositionKey key = position.key();
        ExitReason exitReason = reasonFor(key);
        activeExits.remove(key);
        pendingEntries.remove(key);
        if (position.getExitState() != ExitState.IDLE) {
            exitStateMachine.transition(position, ExitState.IDLE, exitReason, "exit rejected: " + reason);
        }
        position.setAttentionRequired(true);
        position.setAttentionReason("Exit rejected (" + reason + "); broker quantity " + brokerQuantity
                + "; manual clear required");
        position.recordEvent("ATTENTION: " + position.getAttentionReason(), clock.instant());
        positionLedger.save(position);
        log.error("Position {} needs attention: {}", key, position.getAttentionReason());
        eventPublisherHelper.publishRisk(this, key, RiskEventType.ATTENTION_REQUIRED, RiskLevel.CRITICAL,
                position.getAttentionReason(), Map.of("brokerQuantity", brokerQuantity));
    }

    private void placePendingEntry(Position position) {
        PendingEntry entry = pendingEntries.remove(position.key());
        if (entry == null || !position.isFlat() || position.getExitState() != ExitState.IDLE) {
            return;
        }
        try {
            entryService.placeEntry(position, entry.side(), entry.quantity(), entry.dcaConfig());
            log.info("Reversal entry placed for {}: {} x{}", position.key(), entry.side(), entry.quantity());
        } catch (BaseException e) {
            log.warn("Reversal entry for {} not placed: {}", position.key(), e.getMessage());
        }
    }

    private ExitReason reasonFor(PositionKey key) {
        ActiveExit exit = activeExits.get(key);
        return exit != null ? exit.reason : ExitReason.MANUAL;
    }

    private static final class ActiveExit {
        private final ExitReason reason;
        private boolean retried;
        private int brokerFlatPolls;

        private ActiveExit(ExitReason reason) {
            this.reason = reason;
        }
    }
}
