package com.justtrades.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionAuditEntry {

    private Long id;
    private String accountId;
    private String symbol;
    private String eventType;
    private String detail;
    private Instant occurredAt;
}
