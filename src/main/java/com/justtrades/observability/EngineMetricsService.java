package com.justtrades.observability;

import com.justtrades.event.DriftEvent;
import com.justtrades.event.ExitStateEvent;
import com.justtrades.event.OrderEvent;
import com.justtrades.event.PositionEvent;
import com.justtrades.event.RiskEvent;
import com.justtrades.event.TickEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the execution engine, exposed through actuator.
 *
 * <ul>
 *   <li><b>justtrades.orders</b> (counter, tags purpose/event): order lifecycle events</li>
 *   <li><b>justtrades.fills</b> (counter, tag role): fills applied to the ledger</li>
 *   <li><b>justtrades.exit.transitions</b> (counter, tags to/reason)</li>
 *   <li><b>justtrades.drift</b> (counter, tags trigger/resolution)</li>
 *   <li><b>justtrades.risk</b> (counter, tags type/level)</li>
 *   <li><b>justtrades.tick.latency</b> (timer): tick receipt to listener dispatch</li>
 * </ul>
 *
 * Counters are created on first use through the registry, which caches them by name and tags.
 */
@Service
public class EngineMetricsService {

    private final MeterRegistry meterRegistry;
    private final Timer tickLatencyTimer;
    private final Clock clock;

    public EngineMetricsService(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.tickLatencyTimer = Timer.builder("justtrades.tick.latency")
                .description("Delay between tick receipt and metrics listener dispatch")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        Counter.builder("justtrades.orders")
                .tag("purpose", event.getOrder().getPurpose().name())
                .tag("event", event.getEventType().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getFill() == null) {
            return;
        }
        meterRegistry.counter("justtrades.fills", "role", event.getFill().getRole().name()).increment();
    }

    @EventListener
    @Order(20)
    public void onExitStateEvent(ExitStateEvent event) {
        meterRegistry
                .counter("justtrades.exit.transitions", "to", event.getTo().name(), "reason",
                        String.valueOf(event.getReason()))
                .increment();
    }

    @EventListener
    @Order(20)
    public void onDriftEvent(DriftEvent event) {
        meterRegistry
                .counter("justtrades.drift", "trigger", event.getRecord().getTrigger().name(), "resolution",
                        String.valueOf(event.getRecord().getResolution()))
                .increment();
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        meterRegistry
                .counter("justtrades.risk", "type", event.getEventType().name(), "level", event.getLevel().name())
                .increment();
    }

    @EventListener
    @Order(20)
    public void onTickEvent(TickEvent event) {
        Instant receivedAt = event.getReceivedAt();
        if (receivedAt != null) {
            tickLatencyTimer.record(Duration.between(receivedAt, clock.instant()));
        }
    }
}
