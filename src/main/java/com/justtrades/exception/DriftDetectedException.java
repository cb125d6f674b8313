package com.justtrades.exception;

import com.justtrades.domain.model.PositionKey;
import java.util.Map;
import lombok.Getter;

/**
 * Informational: the acting component saw the virtual and broker quantities
 * disagree. Handled by routing the position to the drift reconciler.
 */
@Getter
public class DriftDetectedException extends BaseException {

    private final PositionKey key;
    private final int virtualQuantity;
    private final int brokerQuantity;

    public DriftDetectedException(PositionKey key, int virtualQuantity, int brokerQuantity) {
        super(
                ErrorCode.DRIFT_DETECTED,
                "Drift on " + key + ": virtual=" + virtualQuantity + " broker=" + brokerQuantity,
                Map.of("virtualQuantity", virtualQuantity, "brokerQuantity", brokerQuantity));
        this.key = key;
        this.virtualQuantity = virtualQuantity;
        this.brokerQuantity = brokerQuantity;
    }
}
