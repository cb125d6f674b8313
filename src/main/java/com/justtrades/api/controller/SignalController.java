package com.justtrades.api.controller;

import com.justtrades.api.dto.request.SignalRequest;
import com.justtrades.core.engine.TradingEngine;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.PositionStatus;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound trading signals.
 *
 * <p>POST /api/signals returns once the signal has been processed by the
 * position's event loop: the entry (or reversal exit) has been sent, not filled.
 */
@RestController
@RequestMapping("/api/signals")
public class SignalController {

    private static final Logger log = LoggerFactory.getLogger(SignalController.class);

    private final TradingEngine tradingEngine;

    public SignalController(TradingEngine tradingEngine) {
        this.tradingEngine = tradingEngine;
    }

    @PostMapping
    public ResponseEntity<PositionStatus> submitSignal(@Valid @RequestBody SignalRequest request) {
        log.info("Signal: {} {} x{} on {}", request.getAction(), request.getSymbol(), request.getQuantity(),
                request.getAccountId());
        DcaConfig dcaConfig = request.getDca() != null ? request.getDca().toDcaConfig() : null;
        PositionStatus status = tradingEngine
                .openOrScalePosition(request.getAccountId(), request.getSymbol(), request.getAction(),
                        request.getQuantity(), dcaConfig)
                .join();
        return ResponseEntity.ok(status);
    }
}
