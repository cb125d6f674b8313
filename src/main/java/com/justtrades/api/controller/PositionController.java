package com.justtrades.api.controller;

import com.justtrades.api.dto.request.ExitRequest;
import com.justtrades.core.engine.TradingEngine;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.model.PositionStatus;
import com.justtrades.risk.KillSwitchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Position status and operator commands.
 *
 * <ul>
 *   <li>GET /api/positions/{accountId}/{symbol} -- last-known status, including mid-failure state</li>
 *   <li>POST /api/positions/{accountId}/{symbol}/exit -- graceful exit through the state machine</li>
 *   <li>POST /api/positions/{accountId}/{symbol}/flatten -- kill switch</li>
 *   <li>POST /api/positions/{accountId}/{symbol}/clear-attention -- operator reset after manual resolution</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    private final TradingEngine tradingEngine;

    public PositionController(TradingEngine tradingEngine) {
        this.tradingEngine = tradingEngine;
    }

    @GetMapping("/{accountId}/{symbol}")
    public ResponseEntity<PositionStatus> getStatus(@PathVariable String accountId, @PathVariable String symbol) {
        return ResponseEntity.ok(tradingEngine.getStatus(accountId, symbol));
    }

    @PostMapping("/{accountId}/{symbol}/exit")
    public ResponseEntity<PositionStatus> exit(
            @PathVariable String accountId,
            @PathVariable String symbol,
            @RequestBody(required = false) ExitRequest request) {
        ExitReason reason = request != null && request.getReason() != null ? request.getReason() : ExitReason.MANUAL;
        log.info("Exit requested for {}:{} ({})", accountId, symbol, reason);
        return ResponseEntity.ok(tradingEngine.requestExit(accountId, symbol, reason).join());
    }

    @PostMapping("/{accountId}/{symbol}/flatten")
    public ResponseEntity<KillSwitchResult> flatten(@PathVariable String accountId, @PathVariable String symbol) {
        return ResponseEntity.ok(tradingEngine.requestForceFlatten(accountId, symbol).join());
    }

    @PostMapping("/{accountId}/{symbol}/clear-attention")
    public ResponseEntity<PositionStatus> clearAttention(
            @PathVariable String accountId, @PathVariable String symbol) {
        return ResponseEntity.ok(tradingEngine.clearAttention(accountId, symbol).join());
    }
}
