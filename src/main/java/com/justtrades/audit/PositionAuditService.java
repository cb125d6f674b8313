package com.justtrades.audit;

import com.justtrades.domain.model.PositionAuditEntry;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.entity.PositionAuditEntity;
import com.justtrades.event.DriftEvent;
import com.justtrades.event.ExitStateEvent;
import com.justtrades.event.OrderEvent;
import com.justtrades.event.OrderEventType;
import com.justtrades.event.RiskEvent;
import com.justtrades.mapper.PositionAuditMapper;
import com.justtrades.repository.jpa.PositionAuditJpaRepository;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Writes the {@code position_audit} trail: every exit transition, rejection,
 * risk condition and drift correction, keyed by (account, symbol). Status
 * queries read the most recent entries back.
 *
 * <p>Listeners run synchronously on the publishing thread (usually the
 * position's loop). A failed audit write is logged and never propagates into
 * the engine.
 */
@Service
public class PositionAuditService {

    private static final Logger log = LoggerFactory.getLogger(PositionAuditService.class);

    private static final int MAX_DETAIL = 1000;

    private final PositionAuditJpaRepository positionAuditJpaRepository;
    private final PositionAuditMapper positionAuditMapper;
    private final Clock clock;

    public PositionAuditService(
            PositionAuditJpaRepository positionAuditJpaRepository, PositionAuditMapper positionAuditMapper, Clock clock) {
        this.positionAuditJpaRepository = positionAuditJpaRepository;
        this.positionAuditMapper = positionAuditMapper;
        this.clock = clock;
    }

    @EventListener
    @Order(10)
    public void onExitStateEvent(ExitStateEvent event) {
        String detail = event.getFrom() + " -> " + event.getTo() + " (" + event.getReason() + ")"
                + (event.getDetail() != null ? " " + event.getDetail() : "");
        record(event.getKey(), "EXIT_TRANSITION", detail);
    }

    @EventListener
    @Order(10)
    public void onRiskEvent(RiskEvent event) {
        if (event.getKey() == null) {
            return;
        }
        record(event.getKey(), event.getEventType().name(), event.getLevel() + ": " + event.getMessage());
    }

    @EventListener
    @Order(10)
    public void onDriftEvent(DriftEvent event) {
        var record = event.getRecord();
        record(PositionKey.of(record.getAccountId(), record.getSymbol()), "DRIFT",
                record.getTrigger() + " virtual=" + record.getVirtualQuantity() + " broker="
                        + record.getBrokerQuantity() + " -> " + record.getResolution());
    }

    @EventListener
    @Order(10)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() != OrderEventType.REJECTED || event.getOrder() == null) {
            return;
        }
        var order = event.getOrder();
        record(order.getKey(), "ORDER_REJECTED",
                order.getPurpose() + " " + order.getSide() + " " + order.getQuantity() + ": " + event.getReason());
    }

    public List<PositionAuditEntry> recent(PositionKey key) {
        return positionAuditMapper.toDomainList(positionAuditJpaRepository
                .findTop20ByAccountIdAndSymbolOrderByOccurredAtDescIdDesc(key.accountId(), key.symbol()));
    }

    public void record(PositionKey key, String eventType, String detail) {
        String trimmed = detail != null && detail.length() > MAX_DETAIL ? detail.substring(0, MAX_DETAIL) : detail;
        try {
            positionAuditJpaRepository.save(PositionAuditEntity.builder()
                    .accountId(key.accountId())
                    .symbol(key.symbol())
                    .eventType(eventType)
                    .detail(trimmed)
                    .occurredAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.error("Audit write failed for {} {}: {}", key, eventType, e.getMessage());
        }
    }
}
