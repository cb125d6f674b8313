package com.justtrades.core.engine;

import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.DcaConfig;

/** Entry parked behind a reversal exit; placed once the exit confirms flat. */
public record PendingEntry(OrderSide side, int quantity, DcaConfig dcaConfig) {}
