package com.justtrades.core.engine;

import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.exception.ValidationException;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.oms.OrderRouter;
import com.justtrades.oms.OrderTracker;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Places opening and adding entry orders. Runs inside the position's loop.
 */
@Service
public class EntryService {

    private static final Logger log = LoggerFactory.getLogger(EntryService.class);

    private final PositionLedger positionLedger;
    private final OrderRouter orderRouter;
    private final OrderTracker orderTracker;

    public EntryService(PositionLedger positionLedger, OrderRouter orderRouter, OrderTracker orderTracker) {
        this.positionLedger = positionLedger;
        this.orderRouter = orderRouter;
        this.orderTracker = orderTracker;
    }

    /**
     * Sends a market entry in {@code side}. A flat position adopts
     * {@code dcaConfig} and starts with no fired rungs; an open position keeps
     * the config it was opened with.
     *
     * @throws ValidationException if the entry would take the position past its max quantity
     */
    public TrackedOrder placeEntry(Position position, OrderSide side, int quantity, DcaConfig dcaConfig) {
        if (position.isFlat() && orderTracker.pendingEntryQuantity(position.key()) == 0) {
            position.setDcaConfig(dcaConfig != null ? dcaConfig : DcaConfig.none());
            position.setDcaTriggeredIndices(new TreeSet<>());
            positionLedger.save(position);
        } else if (dcaConfig != null) {
            log.debug("Keeping existing DCA config for open position {}", position.key());
        }

        DcaConfig config = position.getDcaConfig();
        if (config != null && config.getMaxQuantity() > 0) {
            int projected = position.absQuantity() + orderTracker.pendingEntryQuantity(position.key()) + quantity;
            if (projected > config.getMaxQuantity()) {
                throw new ValidationException("Entry of " + quantity + " would take " + position.key() + " to "
                        + projected + ", above max quantity " + config.getMaxQuantity());
            }
        }

        return orderRouter.place(OrderIntent.market(position.key(), side, quantity, OrderPurpose.ENTRY));
    }
}
