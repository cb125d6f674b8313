package com.justtrades.domain.model;

import com.justtrades.domain.enums.ExitState;
import java.util.List;

/**
 * Read-only view returned by status queries: the last-known state of a position,
 * including mid-failure conditions.
 */
public record PositionStatus(
        Position position,
        ExitState exitState,
        PnlSnapshot pnl,
        List<DriftRecord> driftRecords,
        List<PositionAuditEntry> recentEvents) {}
