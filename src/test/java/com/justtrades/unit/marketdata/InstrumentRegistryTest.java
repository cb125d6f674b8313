package com.justtrades.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;

import com.justtrades.config.EngineConfig;
import com.justtrades.domain.model.InstrumentSpec;
import com.justtrades.marketdata.InstrumentRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InstrumentRegistryTest {

    private InstrumentRegistry instrumentRegistry;

    private static EngineConfig.Instrument instrument(String tickSize, String tickValue) {
        EngineConfig.Instrument instrument = new EngineConfig.Instrument();
        instrument.setTickSize(new BigDecimal(tickSize));
        instrument.setTickValue(new BigDecimal(tickValue));
        return instrument;
    }

    @BeforeEach
    void setUp() {
        EngineConfig engineConfig = new EngineConfig();
        engineConfig.getInstruments().put("ES", instrument("0.25", "12.50"));
        engineConfig.getInstruments().put("CL", instrument("0.01", "10"));
        engineConfig.getInstruments().put("CLF6", instrument("0.01", "5"));
        instrumentRegistry = new InstrumentRegistry(engineConfig);
    }

    @Test
    @DisplayName("Contract symbols resolve through their root")
    void rootLookup() {
        InstrumentSpec spec = instrumentRegistry.specFor("ESZ5");

        assertThat(spec.tickValue()).isEqualByComparingTo("12.50");
        assertThat(spec.multiplier()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("An exact symbol entry wins over its root")
    void exactWins() {
        assertThat(instrumentRegistry.specFor("CLF6").tickValue()).isEqualByComparingTo("5");
        assertThat(instrumentRegistry.specFor("CLG6").tickValue()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Unknown symbols use the default instrument")
    void defaultInstrument() {
        InstrumentSpec spec = instrumentRegistry.specFor("MNQZ5");

        assertThat(spec.tickSize()).isEqualByComparingTo("0.25");
        assertThat(spec.multiplier()).isEqualByComparingTo("2");
    }

    @Test
    @DisplayName("Prices round to the nearest tick")
    void roundToTick() {
        InstrumentSpec spec = instrumentRegistry.specFor("ESZ5");

        assertThat(spec.roundToTick(new BigDecimal("5000.13"))).isEqualByComparingTo("5000.25");
        assertThat(spec.roundToTick(new BigDecimal("5000.12"))).isEqualByComparingTo("5000.00");
    }
}
