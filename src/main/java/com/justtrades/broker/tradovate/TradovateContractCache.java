package com.justtrades.broker.tradovate;

import com.justtrades.exception.BrokerException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.LongFunction;
import org.springframework.stereotype.Component;

/**
 * Two-way symbol/contract-id cache. Tradovate positions, orders and fills
 * reference contracts by numeric id while signals and the ledger use symbols
 * ({@code MNQZ5}). Contract ids are stable for a contract's life, so entries
 * never expire.
 */
@Component
public class TradovateContractCache {

    private final Map<String, Long> idsBySymbol = new ConcurrentHashMap<>();
    private final Map<Long, String> symbolsById = new ConcurrentHashMap<>();

    public long contractId(String symbol, Function<String, TradovateContract> lookup) {
        Long cached = idsBySymbol.get(symbol);
        if (cached != null) {
            return cached;
        }
        TradovateContract contract = lookup.apply(symbol);
        if (contract == null) {
            throw new BrokerException("Unknown contract symbol: " + symbol);
        }
        put(contract);
        return contract.id();
    }

    public String symbol(long contractId, LongFunction<TradovateContract> lookup) {
        String cached = symbolsById.get(contractId);
        if (cached != null) {
            return cached;
        }
        TradovateContract contract = lookup.apply(contractId);
        if (contract == null) {
            throw new BrokerException("Unknown contract id: " + contractId);
        }
        put(contract);
        return contract.name();
    }

    public void put(TradovateContract contract) {
        idsBySymbol.put(contract.name(), contract.id());
        symbolsById.put(contract.id(), contract.name());
    }
}
