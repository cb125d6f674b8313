package com.justtrades.config;

import com.justtrades.domain.enums.BrokerMode;
import com.justtrades.domain.enums.RejectedExitPolicy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Execution engine settings bound from {@code justtrades.engine.*}.
 *
 * <p>Timing defaults are the production values: exit confirmation polls every
 * 100ms for up to 2s, and the kill switch must confirm flat within 750ms of
 * activation. Instruments not listed under {@code instruments} fall back to
 * {@code default-instrument} (micro index future economics).
 */
@Configuration
@ConfigurationProperties(prefix = "justtrades.engine")
@Getter
@Setter
public class EngineConfig {

    /** Interval between broker position polls while confirming an exit. */
    private Duration confirmPollInterval = Duration.ofMillis(100);

    /** How long an exit may wait for broker-confirmed flat before the kill switch takes over. */
    private Duration confirmTimeout = Duration.ofMillis(2000);

    /**
     * Consecutive broker-flat confirmation polls, with the ledger still open,
     * after which the ledger is reconciled instead of waiting for the exit fill push.
     */
    private int confirmReconcilePolls = 3;

    /** Hard deadline from kill switch activation to confirmed flat. */
    private Duration killSwitchDeadline = Duration.ofMillis(750);

    /** Share of the kill switch deadline allowed for the fresh broker quantity query. */
    private Duration killSwitchQuantityBudget = Duration.ofMillis(250);

    /** Poll interval while the kill switch waits for flat. */
    private Duration killSwitchPollInterval = Duration.ofMillis(25);

    /** Interval of the scheduled drift audit, in milliseconds. Read by {@code DriftReconciler}. */
    private long driftIntervalMs = 5000;

    /** Behavior when an exit is rejected and the broker still holds a position. */
    private RejectedExitPolicy rejectedExitPolicy = RejectedExitPolicy.REQUIRE_MANUAL_CLEAR;

    /** Worker threads shared by all per-position event loops. */
    private int loopThreads = 8;

    private BrokerMode brokerMode = BrokerMode.PAPER;

    private Instrument defaultInstrument = new Instrument();

    /** Per symbol-root overrides, e.g. {@code MNQ}, {@code ES}. */
    private Map<String, Instrument> instruments = new HashMap<>();

    private Atr atr = new Atr();

    private DailyLoss dailyLoss = new DailyLoss();

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Getter
    @Setter
    public static class Instrument {
        private BigDecimal tickSize = new BigDecimal("0.25");
        private BigDecimal tickValue = new BigDecimal("0.50");
    }

    @Getter
    @Setter
    public static class Atr {
        private int period = 14;
        private Duration barDuration = Duration.ofMinutes(1);
        private int maxBars = 500;
    }

    /**
     * Account-level loss limit. Realized PnL booked since the start of the
     * trading day plus open PnL; reaching {@code -maxLoss} flattens every open
     * position of the account, once per day.
     */
    @Getter
    @Setter
    public static class DailyLoss {
        /** Default limit in account currency. Zero disables. */
        private BigDecimal maxLoss = BigDecimal.ZERO;

        /** Per-account limits, overriding {@code maxLoss}. */
        private Map<String, BigDecimal> accounts = new HashMap<>();

        /** Zone whose calendar date delimits a trading day. */
        private ZoneId tradingZone = ZoneId.of("America/Chicago");

        private long checkIntervalMs = 1000;

        public BigDecimal limitFor(String accountId) {
            return accounts.getOrDefault(accountId, maxLoss);
        }
    }
}
