package com.justtrades.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TickRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "price is required")
    @DecimalMin(value = "0", inclusive = false, message = "price must be positive")
    private BigDecimal price;
}
