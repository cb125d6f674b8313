package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TradovateOrder(long id, long accountId, long contractId, String action, String ordStatus) {

    private static final Set<String> WORKING = Set.of("Working", "PendingNew", "PendingReplace", "Suspended");

    public boolean isWorking() {
        return ordStatus != null && WORKING.contains(ordStatus);
    }
}
