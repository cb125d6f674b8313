package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of order commands. Success carries {@code orderId} (place) or
 * {@code commandId} (cancel); failure carries {@code failureReason}/{@code failureText}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradovateCommandResponse(Long orderId, Long commandId, String failureReason, String failureText) {

    public boolean isFailure() {
        return failureReason != null || failureText != null;
    }

    public String failureDescription() {
        if (failureText != null && !failureText.isBlank()) {
            return failureText;
        }
        return failureReason != null ? failureReason : "unknown";
    }
}
