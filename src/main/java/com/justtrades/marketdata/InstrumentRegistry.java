package com.justtrades.marketdata;

import com.justtrades.config.EngineConfig;
import com.justtrades.domain.model.InstrumentSpec;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Resolves contract economics for a traded symbol.
 *
 * <p>Lookup order: exact symbol (e.g. {@code MNQZ5}), then the symbol root with
 * the futures month code and year stripped ({@code MNQ}), then the configured default.
 */
@Component
public class InstrumentRegistry {

    private static final Pattern FUTURES_SYMBOL = Pattern.compile("^([A-Z0-9]+?)[FGHJKMNQUVXZ]\\d{1,2}$");

    private final EngineConfig engineConfig;
    private final Map<String, InstrumentSpec> resolved = new ConcurrentHashMap<>();

    public InstrumentRegistry(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    public InstrumentSpec specFor(String symbol) {
        return resolved.computeIfAbsent(symbol, this::resolve);
    }

    static String rootOf(String symbol) {
        Matcher matcher = FUTURES_SYMBOL.matcher(symbol);
        return matcher.matches() ? matcher.group(1) : symbol;
    }

    private InstrumentSpec resolve(String symbol) {
        Map<String, EngineConfig.Instrument> instruments = engineConfig.getInstruments();
        EngineConfig.Instrument instrument = instruments.get(symbol);
        if (instrument == null) {
            instrument = instruments.get(rootOf(symbol));
        }
        if (instrument == null) {
            instrument = engineConfig.getDefaultInstrument();
        }
        return new InstrumentSpec(instrument.getTickSize(), instrument.getTickValue());
    }
}
