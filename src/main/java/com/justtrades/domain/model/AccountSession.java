package com.justtrades.domain.model;

import com.justtrades.domain.enums.TradingEnvironment;

/**
 * Broker session for one account. Several accounts may share one access token;
 * rate limiting is keyed by the token, not the account.
 */
public record AccountSession(
        String accountId, String accountSpec, String accessToken, TradingEnvironment environment) {

    @Override
    public String toString() {
        return "AccountSession[accountId=" + accountId + ", environment=" + environment + "]";
    }
}
