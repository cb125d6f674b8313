package com.justtrades.api.controller;

import com.justtrades.api.dto.request.AtrOverrideRequest;
import com.justtrades.api.dto.request.TickRequest;
import com.justtrades.marketdata.AtrTracker;
import com.justtrades.marketdata.PriceFeedAdapter;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Price input for feeds that push over HTTP, and ATR overrides.
 */
@RestController
@RequestMapping("/api/market")
public class MarketDataController {

    private final PriceFeedAdapter priceFeedAdapter;
    private final AtrTracker atrTracker;

    public MarketDataController(PriceFeedAdapter priceFeedAdapter, AtrTracker atrTracker) {
        this.priceFeedAdapter = priceFeedAdapter;
        this.atrTracker = atrTracker;
    }

    @PostMapping("/ticks")
    public ResponseEntity<Map<String, Object>> tick(@Valid @RequestBody TickRequest request) {
        priceFeedAdapter.onTick(request.getSymbol(), request.getPrice());
        return ResponseEntity.ok(Map.of("symbol", normalize(request.getSymbol()), "price", request.getPrice()));
    }

    @PutMapping("/{symbol}/atr")
    public ResponseEntity<Map<String, Object>> overrideAtr(
            @PathVariable String symbol, @Valid @RequestBody AtrOverrideRequest request) {
        String normalized = normalize(symbol);
        atrTracker.setOverride(normalized, request.getAtr());
        return ResponseEntity.ok(Map.of(
                "symbol", normalized,
                "atr", atrTracker.currentAtr(normalized).map(Object::toString).orElse("unavailable")));
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
