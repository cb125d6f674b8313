package com.justtrades.unit.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.justtrades.audit.PositionAuditService;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.entity.PositionAuditEntity;
import com.justtrades.event.ExitStateEvent;
import com.justtrades.event.OrderEvent;
import com.justtrades.event.OrderEventType;
import com.justtrades.event.RiskEvent;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.mapper.PositionAuditMapper;
import com.justtrades.repository.jpa.PositionAuditJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PositionAuditServiceTest {

    private static final PositionKey KEY = PositionKey.of("ACC-1", "MNQZ5");
    private static final Instant NOW = Instant.parse("2025-03-03T14:30:00Z");

    @Mock
    private PositionAuditJpaRepository positionAuditJpaRepository;

    private PositionAuditService positionAuditService;

    @BeforeEach
    void setUp() {
        positionAuditService = new PositionAuditService(positionAuditJpaRepository,
                Mappers.getMapper(PositionAuditMapper.class), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Exit transitions are written with from, to and reason")
    void exitTransition() {
        positionAuditService.onExitStateEvent(new ExitStateEvent(
                this, KEY, ExitState.PREPARE_EXIT, ExitState.WORKING_EXIT, ExitReason.TAKE_PROFIT, "market exit SELL 2"));

        PositionAuditEntity saved = captureSaved();
        assertThat(saved.getAccountId()).isEqualTo("ACC-1");
        assertThat(saved.getSymbol()).isEqualTo("MNQZ5");
        assertThat(saved.getEventType()).isEqualTo("EXIT_TRANSITION");
        assertThat(saved.getDetail()).isEqualTo("PREPARE_EXIT -> WORKING_EXIT (TAKE_PROFIT) market exit SELL 2");
        assertThat(saved.getOccurredAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Risk events are recorded under their type; account-wide ones are skipped")
    void riskEvents() {
        positionAuditService.onRiskEvent(new RiskEvent(
                this, KEY, RiskEventType.EXIT_REJECTED, RiskLevel.CRITICAL, "insufficient margin", Map.of()));

        PositionAuditEntity saved = captureSaved();
        assertThat(saved.getEventType()).isEqualTo("EXIT_REJECTED");
        assertThat(saved.getDetail()).isEqualTo("CRITICAL: insufficient margin");

        positionAuditService.onRiskEvent(
                new RiskEvent(this, null, RiskEventType.LEDGER_CORRUPTION, RiskLevel.CRITICAL, "x", Map.of()));
        verify(positionAuditJpaRepository).save(any(PositionAuditEntity.class));
    }

    @Test
    @DisplayName("Only rejected orders are audited")
    void orderRejections() {
        TrackedOrder order = TrackedOrder.builder()
                .orderId("O-1")
                .key(KEY)
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .purpose(OrderPurpose.ENTRY)
                .quantity(2)
                .build();

        positionAuditService.onOrderEvent(new OrderEvent(this, order, OrderEventType.PLACED, null));
        verify(positionAuditJpaRepository, never()).save(any(PositionAuditEntity.class));

        positionAuditService.onOrderEvent(new OrderEvent(this, order, OrderEventType.REJECTED, "no price"));
        assertThat(captureSaved().getDetail()).isEqualTo("ENTRY BUY 2: no price");
    }

    @Test
    @DisplayName("Long details are truncated and a failed write does not propagate")
    void truncationAndFailure() {
        when(positionAuditJpaRepository.save(any(PositionAuditEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        positionAuditService.record(KEY, "NOTE", "x".repeat(5000));

        assertThat(captureSaved().getDetail()).hasSize(1000);
    }

    private PositionAuditEntity captureSaved() {
        ArgumentCaptor<PositionAuditEntity> captor = ArgumentCaptor.forClass(PositionAuditEntity.class);
        verify(positionAuditJpaRepository, atLeastOnce()).save(captor.capture());
        return captor.getValue();
    }
}
