package com.justtrades.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One scale-in level. {@code distance} is in the unit of the owning config's
 * trigger mode and is measured against the current average entry price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DcaRung {

    private BigDecimal distance;
    private int quantity;
}
