package com.justtrades.api.dto.request;

import com.justtrades.domain.enums.DcaTriggerMode;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.DcaRung;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DcaConfigRequest {

    @Builder.Default
    private DcaTriggerMode mode = DcaTriggerMode.TICKS;

    @Valid
    @Builder.Default
    private List<Rung> rungs = new ArrayList<>();

    @Min(value = 0, message = "maxQuantity cannot be negative")
    private int maxQuantity;

    @Min(value = 0, message = "takeProfitTicks cannot be negative")
    private int takeProfitTicks;

    @Min(value = 0, message = "stopLossTicks cannot be negative")
    private int stopLossTicks;

    @Min(value = 0, message = "breakEvenTicks cannot be negative")
    private int breakEvenTicks;

    public DcaConfig toDcaConfig() {
        List<DcaRung> dcaRungs = new ArrayList<>();
        if (rungs != null) {
            for (Rung rung : rungs) {
                dcaRungs.add(new DcaRung(rung.getDistance(), rung.getQuantity()));
            }
        }
        return DcaConfig.builder()
                .mode(mode != null ? mode : DcaTriggerMode.TICKS)
                .rungs(dcaRungs)
                .maxQuantity(maxQuantity)
                .takeProfitTicks(takeProfitTicks)
                .stopLossTicks(stopLossTicks)
                .breakEvenTicks(breakEvenTicks)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Rung {

        /** Adverse distance from the average entry, in the config's trigger unit. */
        @NotNull(message = "rung distance is required")
        private BigDecimal distance;

        @Min(value = 1, message = "rung quantity must be at least 1")
        private int quantity;
    }
}
