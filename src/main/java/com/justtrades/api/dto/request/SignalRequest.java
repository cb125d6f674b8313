package com.justtrades.api.dto.request;

import com.justtrades.domain.enums.OrderSide;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trading signal from a strategy or webhook. BUY/SELL is interpreted against
 * the current position: same direction adds, opposite direction reverses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    @NotBlank(message = "accountId is required")
    private String accountId;

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "action is required (BUY or SELL)")
    private OrderSide action;

    @Min(value = 1, message = "quantity must be at least 1")
    private int quantity;

    /** Only applied when the signal opens a position from flat. */
    @Valid
    private DcaConfigRequest dca;
}
