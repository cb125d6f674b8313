package com.justtrades.domain.model;

import com.justtrades.domain.enums.DriftResolution;
import com.justtrades.domain.enums.DriftTrigger;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record of one detected divergence between the virtual and broker positions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftRecord {

    private String id;
    private String accountId;
    private String symbol;
    private int virtualQuantity;
    private int brokerQuantity;
    private DriftTrigger trigger;
    private Instant detectedAt;
    private Instant resolvedAt;
    private DriftResolution resolution;

    /** Number of fills appended to the ledger by the correction. */
    private int correctionFills;
}
