package com.justtrades.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Pins the ATR used by ATR-mode DCA rungs for a symbol. A null value removes
 * the override and the computed ATR applies again.
 */
@Data
public class AtrOverrideRequest {

    @DecimalMin(value = "0", inclusive = false, message = "atr must be positive")
    private BigDecimal atr;
}
