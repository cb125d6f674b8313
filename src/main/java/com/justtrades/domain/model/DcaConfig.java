package com.justtrades.domain.model;

import com.justtrades.domain.enums.DcaTriggerMode;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scale-in and protective-order settings for one position. Supplied with the
 * opening signal and persisted with the position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DcaConfig {

    private DcaTriggerMode mode;

    /** Rungs in index order. Index = position in this list. */
    @Builder.Default
    private List<DcaRung> rungs = new ArrayList<>();

    /** Hard cap on absolute position size, including in-flight scale-ins. */
    private int maxQuantity;

    /** Take-profit distance from the average entry, in ticks. Zero disables. */
    private int takeProfitTicks;

    /** Stop distance from the average entry, in ticks. Zero disables. */
    private int stopLossTicks;

    /** Favorable move from the average, in ticks, that arms a stop at the average itself. Zero disables. */
    private int breakEvenTicks;

    public static DcaConfig none() {
        return DcaConfig.builder().mode(DcaTriggerMode.TICKS).build();
    }

    public boolean hasRungs() {
        return rungs != null && !rungs.isEmpty();
    }
}
