package com.justtrades.risk;

import com.justtrades.broker.BrokerGateway;
import com.justtrades.config.EngineConfig;
import com.justtrades.domain.enums.KillSwitchOutcome;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.OrderNotFoundException;
import com.justtrades.oms.OrderTracker;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Bounded-latency emergency flatten for one position.
 *
 * <p>Sequence, all inside {@code kill-switch-deadline} (750ms) from activation:
 * <ol>
 *   <li>Query the broker quantity with a sub-budget; on timeout or error fall
 *       back to the ledger quantity so a flatten is always sent.</li>
 *   <li>Cancel working orders and send the market flatten in parallel. The
 *       flatten is an emergency order and skips the rate limiter.</li>
 *   <li>Poll the broker until flat or the deadline passes.</li>
 * </ol>
 *
 * <p>Runs outside the position event loop and never touches position state;
 * the caller applies the {@link KillSwitchResult} inside the loop. A per-key
 * flag prevents overlapping activations. A missed deadline is reported, not
 * retried: repeated flattens against an unresponsive broker risk duplicate fills.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final BrokerGateway brokerGateway;
    private final OrderTracker orderTracker;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineConfig engineConfig;
    private final Executor killSwitchExecutor;
    private final Clock clock;

    private final Map<PositionKey, AtomicBoolean> running = new ConcurrentHashMap<>();

    public KillSwitchService(
            BrokerGateway brokerGateway,
            OrderTracker orderTracker,
            EventPublisherHelper eventPublisherHelper,
            EngineConfig engineConfig,
            @Qualifier("killSwitchExecutor") Executor killSwitchExecutor,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.orderTracker = orderTracker;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineConfig = engineConfig;
        this.killSwitchExecutor = killSwitchExecutor;
        this.clock = clock;
    }

    // ========================
    // ACTIVATION
    // ========================

    /**
     * Flattens {@code key} at the broker.
     *
     * @param ledgerQuantity the virtual quantity, used only if the broker query misses its budget
     */
    public KillSwitchResult activate(PositionKey key, int ledgerQuantity, String reason) {
        Instant activatedAt = clock.instant();
        AtomicBoolean flag = running.computeIfAbsent(key, k -> new AtomicBoolean());
        if (!flag.compareAndSet(false, true)) {
            log.warn("Kill switch already running for {}", key);
            return KillSwitchResult.alreadyRunning(key, activatedAt);
        }
        try {
            log.error("KILL SWITCH ACTIVATED for {}: {}", key, reason);
            eventPublisherHelper.publishRisk(this, key, RiskEventType.KILL_SWITCH_TRIGGERED, RiskLevel.CRITICAL,
                    "Kill switch activated: " + reason);
            return run(key, ledgerQuantity, activatedAt);
        } finally {
            flag.set(false);
        }
    }

    public boolean isRunning(PositionKey key) {
        AtomicBoolean flag = running.get(key);
        return flag != null && flag.get();
    }

    private KillSwitchResult run(PositionKey key, int ledgerQuantity, Instant activatedAt) {
        long start = System.nanoTime();
        long deadlineNanos = start + engineConfig.getKillSwitchDeadline().toNanos();
        List<String> errors = Collections.synchronizedList(new ArrayList<>());

        // Step 1: quantity, bounded by the sub-budget
        Integer brokerQuantity = queryQuantity(key, engineConfig.getKillSwitchQuantityBudget().toMillis(), errors);
        boolean fromBroker = brokerQuantity != null;
        int quantity = fromBroker ? brokerQuantity : ledgerQuantity;

        KillSwitchResult.KillSwitchResultBuilder result = KillSwitchResult.builder()
                .key(key)
                .quantityAtActivation(quantity)
                .quantityFromBroker(fromBroker)
                .activatedAt(activatedAt)
                .flattenIssuedAfterMs(-1)
                .errors(errors);

        // Step 2: cancel and flatten in parallel
        AtomicInteger cancelled = new AtomicInteger();
        CompletableFuture<Void> cancelFuture =
                CompletableFuture.runAsync(() -> cancelAll(key, cancelled, errors), killSwitchExecutor);

        if (fromBroker && quantity == 0) {
            awaitQuietly(cancelFuture, deadlineNanos);
            log.info("Kill switch for {}: broker already flat", key);
            return result.outcome(KillSwitchOutcome.ALREADY_FLAT)
                    .ordersCancelled(cancelled.get())
                    .elapsedMs(elapsedMs(start))
                    .build();
        }

        AtomicReference<String> flattenOrderId = new AtomicReference<>();
        AtomicReference<Long> issuedAfter = new AtomicReference<>(-1L);
        CompletableFuture<Void> flattenFuture = quantity == 0
                ? CompletableFuture.completedFuture(null)
                : CompletableFuture.runAsync(() -> {
                    flattenOrderId.set(sendFlatten(key, quantity, errors));
                    issuedAfter.set(elapsedMs(start));
                }, killSwitchExecutor);

        awaitQuietly(CompletableFuture.allOf(cancelFuture, flattenFuture), deadlineNanos);
        result.flattenOrderId(flattenOrderId.get()).flattenIssuedAfterMs(issuedAfter.get());

        // Step 3: poll for flat until the deadline
        long pollMs = engineConfig.getKillSwitchPollInterval().toMillis();
        while (System.nanoTime() < deadlineNanos) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            Integer polled = queryQuantity(key, Math.max(1, remainingMs), errors);
            if (polled != null && polled == 0) {
                log.info("Kill switch for {}: flat confirmed in {}ms", key, elapsedMs(start));
                return result.outcome(KillSwitchOutcome.FLAT_CONFIRMED)
                        .ordersCancelled(cancelled.get())
                        .elapsedMs(elapsedMs(start))
                        .build();
            }
            sleep(Math.min(pollMs, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime())));
        }

        long elapsed = elapsedMs(start);
        log.error("Kill switch for {}: flat NOT confirmed within {}ms (elapsed {}ms), errors={}", key,
                engineConfig.getKillSwitchDeadline().toMillis(), elapsed, errors);
        eventPublisherHelper.publishRisk(this, key, RiskEventType.KILL_SWITCH_DEADLINE_EXCEEDED, RiskLevel.CRITICAL,
                "Kill switch deadline exceeded; manual intervention required",
                Map.of("elapsedMs", elapsed, "quantity", quantity, "errors", List.copyOf(errors)));
        return result.outcome(KillSwitchOutcome.DEADLINE_EXCEEDED)
                .ordersCancelled(cancelled.get())
                .elapsedMs(elapsed)
                .build();
    }

    // ========================
    // STEPS
    // ========================

    private Integer queryQuantity(PositionKey key, long budgetMs, List<String> errors) {
        CompletableFuture<Integer> query = CompletableFuture.supplyAsync(
                () -> brokerGateway.queryPosition(key.accountId(), key.symbol()).quantity(), killSwitchExecutor);
        try {
            return query.get(budgetMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            query.cancel(true);
            log.warn("Kill switch quantity query for {} exceeded {}ms", key, budgetMs);
            errors.add("position query timed out after " + budgetMs + "ms");
        } catch (ExecutionException e) {
            log.warn("Kill switch quantity query for {} failed: {}", key, e.getCause().getMessage());
            errors.add("position query failed: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("interrupted during position query");
        }
        return null;
    }

    private String sendFlatten(PositionKey key, int quantity, List<String> errors) {
        OrderIntent intent = OrderIntent.builder()
                .accountId(key.accountId())
                .symbol(key.symbol())
                .side(quantity > 0 ? OrderSide.SELL : OrderSide.BUY)
                .quantity(Math.abs(quantity))
                .type(OrderType.MARKET)
                .purpose(OrderPurpose.EXIT)
                .emergency(true)
                .build();
        try {
            String orderId = brokerGateway.placeOrder(intent);
            orderTracker.track(TrackedOrder.from(orderId, intent, null, clock.instant()));
            log.warn("Kill switch flatten sent for {}: {} x{} -> {}", key, intent.getSide(), intent.getQuantity(),
                    orderId);
            return orderId;
        } catch (RuntimeException e) {
            log.error("Kill switch flatten for {} failed: {}", key, e.getMessage());
            errors.add("flatten failed: " + e.getMessage());
            return null;
        }
    }

    private void cancelAll(PositionKey key, AtomicInteger cancelled, List<String> errors) {
        Set<String> orderIds = new LinkedHashSet<>();
        orderTracker.openOrders(key).stream()
                .filter(o -> o.getType() != OrderType.MARKET)
                .map(TrackedOrder::getOrderId)
                .forEach(orderIds::add);
        try {
            orderIds.addAll(brokerGateway.queryOrders(key.accountId(), key.symbol()));
        } catch (RuntimeException e) {
            errors.add("order query failed: " + e.getMessage());
        }
        for (String orderId : orderIds) {
            try {
                brokerGateway.cancelOrder(key.accountId(), orderId);
                orderTracker.remove(orderId);
                cancelled.incrementAndGet();
            } catch (OrderNotFoundException e) {
                orderTracker.remove(orderId);
            } catch (RuntimeException e) {
                errors.add("cancel " + orderId + " failed: " + e.getMessage());
            }
        }
    }

    private static void awaitQuietly(CompletableFuture<?> future, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            return;
        }
        try {
            future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.debug("Kill switch step did not complete cleanly: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
