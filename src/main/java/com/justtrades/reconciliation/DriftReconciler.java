package com.justtrades.reconciliation;

import com.justtrades.broker.BrokerGateway;
import com.justtrades.core.engine.PositionEventLoop;
import com.justtrades.domain.enums.DriftResolution;
import com.justtrades.domain.enums.DriftTrigger;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.FillRole;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.BrokerFill;
import com.justtrades.domain.model.DriftRecord;
import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.BrokerException;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.mapper.DriftRecordMapper;
import com.justtrades.marketdata.PriceFeedAdapter;
import com.justtrades.oms.OrderTracker;
import com.justtrades.repository.jpa.DriftRecordJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps the virtual position consistent with the broker's.
 *
 * <p>Triggered by the scheduled audit, by every broker position snapshot, and
 * (forced) by the exit path. Always runs inside the position's event loop, as
 * one more event for that key, so it is the only corrective writer and never
 * races a fill.
 *
 * <p>On mismatch:
 * <ol>
 *   <li>Fetch the broker's fill history and find fills the ledger is missing.</li>
 *   <li>If replaying them explains the broker quantity, append them as-is
 *       ({@code REBUILT_FROM_BROKER_FILLS}).</li>
 *   <li>Otherwise append a single RECONCILIATION fill for the difference
 *       ({@code CORRECTED_TO_BROKER}), priced at the last trade.</li>
 * </ol>
 * The correction is accounting-only: no order is ever placed or cancelled here.
 * Unforced checks defer while an exit is in flight or a market order is
 * outstanding, since the difference is then expected to be transient.
 *
 * <p>Cleanup of resting orders on a position corrected to flat belongs to the
 * listeners of the published {@link com.justtrades.event.DriftEvent}.
 */
@Service
public class DriftReconciler {

    private static final Logger log = LoggerFactory.getLogger(DriftReconciler.class);

    private final PositionLedger positionLedger;
    private final BrokerGateway brokerGateway;
    private final OrderTracker orderTracker;
    private final PositionEventLoop positionEventLoop;
    private final PriceFeedAdapter priceFeedAdapter;
    private final DriftRecordJpaRepository driftRecordJpaRepository;
    private final DriftRecordMapper driftRecordMapper;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public DriftReconciler(
            PositionLedger positionLedger,
            BrokerGateway brokerGateway,
            OrderTracker orderTracker,
            PositionEventLoop positionEventLoop,
            PriceFeedAdapter priceFeedAdapter,
            DriftRecordJpaRepository driftRecordJpaRepository,
            DriftRecordMapper driftRecordMapper,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.positionLedger = positionLedger;
        this.brokerGateway = brokerGateway;
        this.orderTracker = orderTracker;
        this.positionEventLoop = positionEventLoop;
        this.priceFeedAdapter = priceFeedAdapter;
        this.driftRecordJpaRepository = driftRecordJpaRepository;
        this.driftRecordMapper = driftRecordMapper;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // TRIGGERS
    // ========================

    /**
     * Scheduled audit of every known position. Broker queries run here; the
     * comparison runs in each loop, and only if no fill reached the ledger
     * between the query and the comparison.
     */
    @Scheduled(
            fixedDelayString = "${justtrades.engine.drift-interval-ms:5000}",
            initialDelayString = "${justtrades.engine.drift-interval-ms:5000}")
    public void scheduledAudit() {
        for (PositionKey key : positionLedger.knownKeys()) {
            // read before the query: a stale count only ever causes a skip
            long fillCountAtQuery = positionLedger.currentPosition(key).getFillCount();
            int brokerQuantity;
            try {
                brokerQuantity = brokerGateway.queryPosition(key.accountId(), key.symbol()).quantity();
            } catch (BrokerException e) {
                log.warn("Drift audit skipped for {}: {}", key, e.getMessage());
                continue;
            }
            positionEventLoop.post(key, "drift-audit", () -> reconcileAsOf(key, brokerQuantity, fillCountAtQuery));
        }
    }

    /**
     * Scheduled comparison against a broker quantity read off the loop. Skipped
     * when the ledger has taken fills since {@code fillCountAtQuery}; the broker
     * figure may predate them and the next audit compares fresh values.
     * Must run inside the position's loop.
     */
    public Optional<DriftRecord> reconcileAsOf(PositionKey key, int brokerQuantity, long fillCountAtQuery) {
        long fillCount = positionLedger.currentPosition(key).getFillCount();
        if (fillCount != fillCountAtQuery) {
            log.debug("Drift audit for {} skipped: ledger moved from {} to {} fills since the broker query", key,
                    fillCountAtQuery, fillCount);
            return Optional.empty();
        }
        return reconcile(key, brokerQuantity, DriftTrigger.SCHEDULED, false);
    }

    // ========================
    // RECONCILIATION
    // ========================

    /**
     * Compares the ledger with {@code brokerQuantity} and corrects the ledger on mismatch.
     * Must run inside the position's loop.
     *
     * @param force skip the in-flight deferral (exit path)
     * @return the drift record, empty if quantities matched or the check was deferred
     */
    public Optional<DriftRecord> reconcile(PositionKey key, int brokerQuantity, DriftTrigger trigger, boolean force) {
        Position position = positionLedger.currentPosition(key);
        int virtualQuantity = position.getQuantity();
        if (virtualQuantity == brokerQuantity) {
            return Optional.empty();
        }
        if (!force && (position.getExitState() != ExitState.IDLE || orderTracker.hasInFlightMarketOrders(key))) {
            log.debug("Drift check for {} deferred: state={} virtual={} broker={}", key, position.getExitState(),
                    virtualQuantity, brokerQuantity);
            return Optional.empty();
        }

        Instant detectedAt = clock.instant();
        DriftRecord record = DriftRecord.builder()
                .id(UUID.randomUUID().toString())
                .accountId(key.accountId())
                .symbol(key.symbol())
                .virtualQuantity(virtualQuantity)
                .brokerQuantity(brokerQuantity)
                .trigger(trigger)
                .detectedAt(detectedAt)
                .build();
        log.warn("Drift detected for {} ({}): virtual={} broker={}", key, trigger, virtualQuantity, brokerQuantity);

        List<BrokerFill> missing = missingBrokerFills(key);
        int replayedQuantity = virtualQuantity + missing.stream()
                .mapToInt(f -> f.side().sign() * f.quantity())
                .sum();

        if (!missing.isEmpty() && replayedQuantity == brokerQuantity) {
            for (BrokerFill brokerFill : missing) {
                Position current = positionLedger.currentPosition(key);
                positionLedger.recordCorrection(toFill(key, brokerFill,
                        orderTracker.roleFor(brokerFill.orderId(), current, brokerFill.side())));
                orderTracker.recordFill(brokerFill.orderId(), brokerFill.quantity());
            }
            record.setResolution(DriftResolution.REBUILT_FROM_BROKER_FILLS);
            record.setCorrectionFills(missing.size());
        } else {
            Optional<BigDecimal> price = correctionPrice(position);
            if (price.isEmpty()) {
                record.setResolution(DriftResolution.UNRESOLVED);
                position.setAttentionRequired(true);
                position.setAttentionReason("Drift unresolved: no price to book a correction (virtual "
                        + virtualQuantity + ", broker " + brokerQuantity + ")");
                positionLedger.save(position);
                eventPublisherHelper.publishRisk(this, key, RiskEventType.ATTENTION_REQUIRED, RiskLevel.CRITICAL,
                        position.getAttentionReason());
            } else {
                int delta = brokerQuantity - virtualQuantity;
                positionLedger.recordCorrection(Fill.builder()
                        .fillId("RECON-" + record.getId())
                        .accountId(key.accountId())
                        .symbol(key.symbol())
                        .side(delta > 0 ? OrderSide.BUY : OrderSide.SELL)
                        .quantity(Math.abs(delta))
                        .price(price.get())
                        .timestamp(detectedAt)
                        .role(FillRole.RECONCILIATION)
                        .build());
                record.setResolution(DriftResolution.CORRECTED_TO_BROKER);
                record.setCorrectionFills(1);
            }
        }

        if (record.getResolution() != DriftResolution.UNRESOLVED) {
            record.setResolvedAt(clock.instant());
        }
        driftRecordJpaRepository.save(driftRecordMapper.toEntity(record));

        Position corrected = positionLedger.currentPosition(key);
        corrected.recordEvent("DRIFT " + record.getResolution() + ": virtual " + virtualQuantity + " -> "
                + corrected.getQuantity() + " (broker " + brokerQuantity + ")", clock.instant());
        positionLedger.save(corrected);
        log.info("Drift for {} resolved as {}: ledger now {}", key, record.getResolution(), corrected.getQuantity());
        eventPublisherHelper.publishDrift(this, record);
        return Optional.of(record);
    }

    public List<DriftRecord> recentDrift(PositionKey key) {
        return driftRecordMapper.toDomainList(driftRecordJpaRepository
                .findTop20ByAccountIdAndSymbolOrderByDetectedAtDesc(key.accountId(), key.symbol()));
    }

    // ========================
    // INTERNALS
    // ========================

    private List<BrokerFill> missingBrokerFills(PositionKey key) {
        try {
            return brokerGateway.queryFills(key.accountId(), key.symbol()).stream()
                    .filter(f -> !positionLedger.hasFill(key, f.fillId()))
                    .toList();
        } catch (BrokerException e) {
            log.warn("Broker fill history unavailable for {}: {}", key, e.getMessage());
            return List.of();
        }
    }

    private Optional<BigDecimal> correctionPrice(Position position) {
        return priceFeedAdapter
                .lastPrice(position.getSymbol())
                .or(() -> Optional.ofNullable(position.getLastPrice()))
                .or(() -> Optional.ofNullable(position.getAverageEntryPrice()));
    }

    private static Fill toFill(PositionKey key, BrokerFill brokerFill, FillRole role) {
        return Fill.builder()
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
    }
}
