package com.justtrades.risk;

import com.justtrades.config.EngineConfig;
import com.justtrades.domain.model.PnlSnapshot;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exit.ExitService;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.pnl.PnlEngine;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Account-level max daily loss.
 *
 * <p>Every check sums, per account, the realized PnL booked since the start
 * of the trading day and the open PnL of every position. When the total
 * reaches {@code -maxLoss} each open position of the account is handed to the
 * kill switch and a CRITICAL {@link RiskEventType#DAILY_LOSS_LIMIT_BREACHED}
 * is published. An account breaches at most once per trading day; the flag
 * and the realized baselines reset when the date in the trading zone changes.
 *
 * <p>Baselines are taken at the first check of the day. A position first seen
 * later in the day counts its whole realized PnL.
 */
@Service
public class DailyLossMonitor {

    private static final Logger log = LoggerFactory.getLogger(DailyLossMonitor.class);

    private final PositionLedger positionLedger;
    private final PnlEngine pnlEngine;
    private final ExitService exitService;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineConfig engineConfig;
    private final Executor killSwitchExecutor;
    private final Clock clock;

    private final Map<PositionKey, BigDecimal> realizedAtDayStart = new ConcurrentHashMap<>();
    private final Set<String> breachedToday = ConcurrentHashMap.newKeySet();
    private volatile LocalDate tradingDay;

    public DailyLossMonitor(
            PositionLedger positionLedger,
            PnlEngine pnlEngine,
            ExitService exitService,
            EventPublisherHelper eventPublisherHelper,
            EngineConfig engineConfig,
            @Qualifier("killSwitchExecutor") Executor killSwitchExecutor,
            Clock clock) {
        this.positionLedger = positionLedger;
        this.pnlEngine = pnlEngine;
        this.exitService = exitService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineConfig = engineConfig;
        this.killSwitchExecutor = killSwitchExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${justtrades.engine.daily-loss.check-interval-ms:1000}")
    public void checkAll() {
        rollDay();
        Map<String, List<Position>> byAccount = positionLedger.knownKeys().stream()
                .map(key -> positionLedger.currentPosition(key).snapshot())
                .collect(Collectors.groupingBy(Position::getAccountId, TreeMap::new, Collectors.toList()));
        byAccount.forEach(this::check);
    }

    /** Realized-since-day-start plus open PnL over {@code positions}. */
    public BigDecimal dailyPnl(List<Position> positions) {
        BigDecimal total = BigDecimal.ZERO;
        for (Position position : positions) {
            PnlSnapshot pnl = pnlEngine.snapshot(position);
            BigDecimal baseline = realizedAtDayStart.getOrDefault(position.key(), BigDecimal.ZERO);
            total = total.add(pnl.realized().subtract(baseline)).add(pnl.unrealized());
        }
        return total;
    }

    public boolean isBreached(String accountId) {
        return breachedToday.contains(accountId);
    }

    private void check(String accountId, List<Position> positions) {
        BigDecimal limit = engineConfig.getDailyLoss().limitFor(accountId);
        if (limit == null || limit.signum() <= 0 || breachedToday.contains(accountId)) {
            return;
        }
        BigDecimal total = dailyPnl(positions);
        if (total.compareTo(limit.negate()) > 0 || !breachedToday.add(accountId)) {
            return;
        }

        List<Position> open = positions.stream().filter(p -> !p.isFlat()).toList();
        log.error("DAILY LOSS LIMIT for account {}: PnL {} <= -{}; flattening {} position(s)", accountId, total,
                limit, open.size());
        Map<String, Object> details = Map.of("accountPnl", total, "limit", limit, "tradingDay", tradingDay.toString());
        if (open.isEmpty()) {
            eventPublisherHelper.publishRisk(this, positions.get(0).key(), RiskEventType.DAILY_LOSS_LIMIT_BREACHED,
                    RiskLevel.CRITICAL, "Daily loss limit reached for account " + accountId, details);
            return;
        }
        for (Position position : open) {
            PositionKey key = position.key();
            eventPublisherHelper.publishRisk(this, key, RiskEventType.DAILY_LOSS_LIMIT_BREACHED, RiskLevel.CRITICAL,
                    "Daily loss limit reached for account " + accountId + "; flattening", details);
            flatten(key);
        }
    }

    private void flatten(PositionKey key) {
        CompletableFuture.supplyAsync(() -> exitService.forceFlatten(key, "daily loss limit"), killSwitchExecutor)
                .thenCompose(Function.identity())
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Daily loss flatten for {} failed: {}", key, error.getMessage(), error);
                    } else {
                        log.warn("Daily loss flatten for {}: {}", key, result.getOutcome());
                    }
                });
    }

    private void rollDay() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), engineConfig.getDailyLoss().getTradingZone());
        if (today.equals(tradingDay)) {
            return;
        }
        realizedAtDayStart.clear();
        for (PositionKey key : positionLedger.knownKeys()) {
            realizedAtDayStart.put(key, pnlEngine.snapshot(positionLedger.currentPosition(key).snapshot()).realized());
        }
        breachedToday.clear();
        if (tradingDay != null) {
            log.info("Trading day {} started; daily loss tracking reset for {} position(s)", today,
                    realizedAtDayStart.size());
        }
        tradingDay = today;
    }
}
