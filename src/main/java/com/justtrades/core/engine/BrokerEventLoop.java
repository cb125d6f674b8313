package com.justtrades.core.engine;

import com.justtrades.broker.BrokerEventListener;
import com.justtrades.broker.BrokerGateway;
import com.justtrades.dca.DcaEngine;
import com.justtrades.domain.enums.DriftResolution;
import com.justtrades.domain.enums.DriftTrigger;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.FillRole;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.model.BrokerFill;
import com.justtrades.domain.model.DriftRecord;
import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.event.DriftEvent;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.ConflictingIntentException;
import com.justtrades.exit.ExitService;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.oms.OrderTracker;
import com.justtrades.reconciliation.DriftReconciler;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Consumer of the broker push stream.
 *
 * <p>Each event is posted to the owning position's {@link PositionEventLoop}
 * in arrival order and handled there: the ledger first, then whichever of the
 * DCA engine, exit state machine or drift reconciler the event concerns.
 * Gateway threads never touch position state.
 */
@Component
public class BrokerEventLoop implements BrokerEventListener {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventLoop.class);

    private final BrokerGateway brokerGateway;
    private final PositionEventLoop positionEventLoop;
    private final PositionLedger positionLedger;
    private final OrderTracker orderTracker;
    private final DcaEngine dcaEngine;
    private final ExitService exitService;
    private final DriftReconciler driftReconciler;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public BrokerEventLoop(
            BrokerGateway brokerGateway,
            PositionEventLoop positionEventLoop,
            PositionLedger positionLedger,
            OrderTracker orderTracker,
            DcaEngine dcaEngine,
            ExitService exitService,
            DriftReconciler driftReconciler,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.positionEventLoop = positionEventLoop;
        this.positionLedger = positionLedger;
        this.orderTracker = orderTracker;
        this.dcaEngine = dcaEngine;
        this.exitService = exitService;
        this.driftReconciler = driftReconciler;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @PostConstruct
    public void subscribe() {
        brokerGateway.subscribe(this);
        log.info("Subscribed to broker push events via {}", brokerGateway.getClass().getSimpleName());
    }

    // ========================
    // LISTENER (gateway threads)
    // ========================

    @Override
    public void onFill(String accountId, String symbol, BrokerFill fill) {
        PositionKey key = PositionKey.of(accountId, symbol);
        positionEventLoop.post(key, "fill " + fill.fillId(), () -> handleFill(key, fill));
    }

    @Override
    public void onPositionSnapshot(String accountId, String symbol, int quantity) {
        PositionKey key = PositionKey.of(accountId, symbol);
        positionEventLoop.post(key, "snapshot", () -> handleSnapshot(key, quantity));
    }

    @Override
    public void onOrderRejected(String accountId, String orderId, String reason) {
        Optional<TrackedOrder> tracked = orderTracker.find(orderId);
        if (tracked.isEmpty()) {
            log.warn("Rejection for untracked order {} on account {}: {}", orderId, accountId, reason);
            return;
        }
        PositionKey key = tracked.get().getKey();
        positionEventLoop.post(key, "reject " + orderId, () -> handleRejection(key, orderId, reason));
    }

    // ========================
    // HANDLERS (position loop)
    // ========================

    void handleFill(PositionKey key, BrokerFill brokerFill) {
        if (positionLedger.hasFill(key, brokerFill.fillId())) {
            log.debug("Duplicate fill {} for {} ignored", brokerFill.fillId(), key);
            return;
        }
        Position position = positionLedger.currentPosition(key);
        FillRole role = orderTracker.roleFor(brokerFill.orderId(), position, brokerFill.side());
        Fill fill = Fill.builder()
                .fillId(brokerFill.fillId())
                .orderId(brokerFill.orderId())
                .accountId(key.accountId())
                .symbol(key.symbol())
                .side(brokerFill.side())
                .quantity(brokerFill.quantity())
                .price(brokerFill.price())
                .timestamp(brokerFill.timestamp())
                .role(role)
                .build();

        try {
            positionLedger.recordFill(fill);
        } catch (ConflictingIntentException e) {
            log.error("Conflicting fill for {}: {}", key, e.getMessage());
            eventPublisherHelper.publishRisk(this, key, RiskEventType.CONFLICTING_FILL, RiskLevel.CRITICAL,
                    e.getMessage(), Map.of("fillId", brokerFill.fillId(), "orderId",
                            String.valueOf(brokerFill.orderId())));
            return;
        }

        Optional<TrackedOrder> order = orderTracker.recordFill(brokerFill.orderId(), brokerFill.quantity());
        order.filter(TrackedOrder::isComplete).ifPresent(o -> eventPublisherHelper.publishOrderFilled(this, o));

        dispatchFill(position, role, order.map(TrackedOrder::getPurpose).orElse(null));
    }

    private void dispatchFill(Position position, FillRole role, OrderPurpose purpose) {
        if (position.getExitState() != ExitState.IDLE) {
            if (role == FillRole.EXIT) {
                exitService.onExitFill(position);
            }
            return;
        }
        if (position.isFlat()) {
            if (purpose == OrderPurpose.TAKE_PROFIT) {
                position.setTakeProfitOrderId(null);
            }
            releaseFlat(position);
            return;
        }
        if (role == FillRole.DCA) {
            dcaEngine.onScaleInFilled(position);
        } else if (role == FillRole.ENTRY && purpose == OrderPurpose.ENTRY) {
            dcaEngine.onEntryFilled(position);
        }
    }

    void handleSnapshot(PositionKey key, int quantity) {
        exitService.onPositionSnapshot(key, quantity);
        driftReconciler.reconcile(key, quantity, DriftTrigger.SNAPSHOT, false);
        Position position = positionLedger.currentPosition(key);
        if (quantity == 0 && position.isFlat() && position.getExitState() == ExitState.IDLE
                && position.getTakeProfitOrderId() != null) {
            // retry of a take-profit cancel that failed when the position went flat
            releaseFlat(position);
        }
    }

    /**
     * A drift correction can take a position flat without any fill passing
     * through {@link #handleFill}. Published from inside the position's loop,
     * so this runs there too.
     */
    @EventListener
    public void onDriftCorrected(DriftEvent event) {
        DriftRecord record = event.getRecord();
        if (record.getResolution() == DriftResolution.UNRESOLVED) {
            return;
        }
        Position position = positionLedger.currentPosition(record.getAccountId(), record.getSymbol());
        if (position.isFlat() && position.getExitState() == ExitState.IDLE) {
            releaseFlat(position);
        }
    }

    /** Position went flat outside the exit path: nothing may stay resting for it. */
    private void releaseFlat(Position position) {
        if (dcaEngine.resetForFlat(position)) {
            return;
        }
        log.error("Position {} is flat but resting orders could not all be cancelled", position.key());
        eventPublisherHelper.publishRisk(this, position.key(), RiskEventType.RESTING_ORDER_NOT_CANCELLED,
                RiskLevel.CRITICAL, "Flat position still has resting orders at the broker",
                Map.of("takeProfitOrderId", String.valueOf(position.getTakeProfitOrderId())));
    }

    void handleRejection(PositionKey key, String orderId, String reason) {
        Optional<TrackedOrder> removed = orderTracker.remove(orderId);
        if (removed.isEmpty()) {
            return;
        }
        TrackedOrder order = removed.get();
        eventPublisherHelper.publishOrderRejected(this, order, reason);
        Position position = positionLedger.currentPosition(key);
        switch (order.getPurpose()) {
            case EXIT -> exitService.onExitRejected(position, reason);
            case TAKE_PROFIT, STOP_LOSS -> {
                if (orderId.equals(position.getTakeProfitOrderId())) {
                    position.setTakeProfitOrderId(null);
                }
                position.recordEvent("REJECTED " + order.getPurpose() + ": " + reason, clock.instant());
                positionLedger.save(position);
            }
            case ENTRY, DCA_ENTRY -> {
                log.warn("{} order {} for {} rejected by broker: {}", order.getPurpose(), orderId, key, reason);
                position.recordEvent("REJECTED " + order.getPurpose() + ": " + reason, clock.instant());
                positionLedger.save(position);
                eventPublisherHelper.publishRisk(this, key, RiskEventType.ORDER_REJECTED, RiskLevel.WARNING, reason,
                        Map.of("purpose", order.getPurpose().name(), "orderId", orderId));
            }
        }
    }
}
