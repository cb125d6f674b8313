package com.justtrades.entity;

import com.justtrades.domain.enums.DriftResolution;
import com.justtrades.domain.enums.DriftTrigger;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "drift_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftRecordEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "account_id", length = 40, nullable = false)
    private String accountId;

    @Column(length = 40, nullable = false)
    private String symbol;

    @Column(name = "virtual_quantity")
    private int virtualQuantity;

    @Column(name = "broker_quantity")
    private int brokerQuantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", length = 20)
    private DriftTrigger trigger;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 40)
    private DriftResolution resolution;

    @Column(name = "correction_fills")
    private int correctionFills;
}
