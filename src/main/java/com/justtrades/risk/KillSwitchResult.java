package com.justtrades.risk;

import com.justtrades.domain.enums.KillSwitchOutcome;
import com.justtrades.domain.model.PositionKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one kill switch activation for a single position.
 *
 * <p>Individual cancel and flatten failures do not abort the activation; they
 * are collected in {@code errors}.
 */
@Data
@Builder
public class KillSwitchResult {

    private PositionKey key;
    private KillSwitchOutcome outcome;

    /** Quantity the flatten was sized from. */
    private int quantityAtActivation;

    /** False when the broker query missed its budget and the ledger quantity was used. */
    private boolean quantityFromBroker;

    private String flattenOrderId;
    private int ordersCancelled;

    /** Milliseconds from activation until the flatten order call returned, -1 if none was sent. */
    private long flattenIssuedAfterMs;

    private long elapsedMs;
    private Instant activatedAt;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static KillSwitchResult alreadyRunning(PositionKey key, Instant at) {
        return KillSwitchResult.builder()
                .key(key)
                .outcome(KillSwitchOutcome.ALREADY_RUNNING)
                .flattenIssuedAfterMs(-1)
                .activatedAt(at)
                .build();
    }

    public boolean isFlat() {
        return outcome == KillSwitchOutcome.FLAT_CONFIRMED || outcome == KillSwitchOutcome.ALREADY_FLAT;
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
