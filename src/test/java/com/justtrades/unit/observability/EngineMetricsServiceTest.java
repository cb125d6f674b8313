package com.justtrades.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.justtrades.domain.enums.DriftResolution;
import com.justtrades.domain.enums.DriftTrigger;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.FillRole;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.DriftRecord;
import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.event.DriftEvent;
import com.justtrades.event.ExitStateEvent;
import com.justtrades.event.OrderEvent;
import com.justtrades.event.OrderEventType;
import com.justtrades.event.PositionEvent;
import com.justtrades.event.PositionEventType;
import com.justtrades.event.RiskEvent;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.event.TickEvent;
import com.justtrades.observability.EngineMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EngineMetricsServiceTest {

    private static final PositionKey KEY = PositionKey.of("ACC-1", "MNQZ5");
    private static final Instant NOW = Instant.parse("2025-03-03T14:30:00Z");

    private MeterRegistry meterRegistry;
    private EngineMetricsService engineMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engineMetricsService = new EngineMetricsService(meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("Order events are counted by purpose and lifecycle event")
        void orders() {
            TrackedOrder order = TrackedOrder.builder()
                    .orderId("O-1")
                    .key(KEY)
                    .side(OrderSide.BUY)
                    .type(OrderType.MARKET)
                    .purpose(OrderPurpose.ENTRY)
                    .quantity(1)
                    .build();

            engineMetricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.PLACED, null));
            engineMetricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.PLACED, null));
            engineMetricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.REJECTED, "margin"));

            assertThat(meterRegistry.get("justtrades.orders").tags("purpose", "ENTRY", "event", "PLACED")
                            .counter().count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.get("justtrades.orders").tags("purpose", "ENTRY", "event", "REJECTED")
                            .counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Only position events carrying a fill count as fills")
        void fills() {
            Fill fill = Fill.builder()
                    .fillId("F-1")
                    .side(OrderSide.SELL)
                    .quantity(1)
                    .price(BigDecimal.TEN)
                    .role(FillRole.EXIT)
                    .build();
            Position position = Position.flat(KEY);

            engineMetricsService.onPositionEvent(new PositionEvent(this, position, PositionEventType.CLOSED, fill));
            engineMetricsService.onPositionEvent(new PositionEvent(this, position, PositionEventType.CLOSED, null));

            assertThat(meterRegistry.get("justtrades.fills").tag("role", "EXIT").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Exit transitions, drift and risk events are tagged by outcome")
        void transitionsDriftAndRisk() {
            engineMetricsService.onExitStateEvent(new ExitStateEvent(
                    this, KEY, ExitState.IDLE, ExitState.PREPARE_EXIT, ExitReason.STOP_LOSS, null));
            engineMetricsService.onDriftEvent(new DriftEvent(this, DriftRecord.builder()
                    .trigger(DriftTrigger.SCHEDULED)
                    .resolution(DriftResolution.CORRECTED_TO_BROKER)
                    .build()));
            engineMetricsService.onRiskEvent(new RiskEvent(
                    this, KEY, RiskEventType.EXIT_REJECTED, RiskLevel.CRITICAL, "rejected", Map.of()));

            assertThat(meterRegistry.get("justtrades.exit.transitions")
                            .tags("to", "PREPARE_EXIT", "reason", "STOP_LOSS").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("justtrades.drift")
                            .tags("trigger", "SCHEDULED", "resolution", "CORRECTED_TO_BROKER").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("justtrades.risk")
                            .tags("type", "EXIT_REJECTED", "level", "CRITICAL").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Tick latency")
    class TickLatency {

        @Test
        @DisplayName("Records the delay since the tick was received")
        void recordsLatency() {
            engineMetricsService.onTickEvent(
                    new TickEvent(this, "MNQZ5", BigDecimal.TEN, NOW.minusMillis(15)));

            Timer timer = meterRegistry.get("justtrades.tick.latency").timer();
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(15.0);
        }

        @Test
        @DisplayName("Ticks without a receipt time are not recorded")
        void skipsMissingTimestamp() {
            engineMetricsService.onTickEvent(new TickEvent(this, "MNQZ5", BigDecimal.TEN, null));

            assertThat(meterRegistry.get("justtrades.tick.latency").timer().count()).isZero();
        }
    }
}
