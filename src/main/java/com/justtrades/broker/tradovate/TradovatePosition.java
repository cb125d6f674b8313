package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TradovatePosition(long id, long accountId, long contractId, int netPos, BigDecimal netPrice) {}
