package com.justtrades.domain.model;

import java.math.BigDecimal;

public record PnlSnapshot(
        BigDecimal realized,
        BigDecimal unrealized,
        BigDecimal worstUnrealized,
        BigDecimal bestUnrealized,
        BigDecimal lastPrice) {}
