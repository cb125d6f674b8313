package com.justtrades.unit.dca;

import static org.assertj.core.api.Assertions.assertThat;

import com.justtrades.config.EngineConfig;
import com.justtrades.dca.DcaTriggerCalculator;
import com.justtrades.domain.enums.DcaTriggerMode;
import com.justtrades.domain.enums.PositionSide;
import com.justtrades.domain.model.DcaRung;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.marketdata.AtrTracker;
import com.justtrades.marketdata.InstrumentRegistry;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DcaTriggerCalculatorTest {

    private AtrTracker atrTracker;
    private DcaTriggerCalculator calculator;

    @BeforeEach
    void setUp() {
        EngineConfig engineConfig = new EngineConfig();
        atrTracker = new AtrTracker(engineConfig);
        calculator = new DcaTriggerCalculator(new InstrumentRegistry(engineConfig), atrTracker);
    }

    private static Position position(int quantity, String average) {
        Position position = Position.flat(PositionKey.of("ACC-1", "MNQZ5"));
        position.setQuantity(quantity);
        position.setSide(PositionSide.fromQuantity(quantity));
        position.setAverageEntryPrice(new BigDecimal(average));
        return position;
    }

    private static DcaRung rung(String distance) {
        return DcaRung.builder().distance(new BigDecimal(distance)).quantity(1).build();
    }

    @Test
    @DisplayName("TICKS: long triggers below the average, short above")
    void ticks() {
        assertThat(calculator.triggerPrice(position(2, "21000"), DcaTriggerMode.TICKS, rung("20")))
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("20995"));
        assertThat(calculator.triggerPrice(position(-2, "21000"), DcaTriggerMode.TICKS, rung("20")))
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("21005"));
    }

    @Test
    @DisplayName("Negative distances are treated as their magnitude")
    void negativeDistance() {
        assertThat(calculator.triggerPrice(position(2, "21000"), DcaTriggerMode.TICKS, rung("-20")))
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("20995"));
    }

    @Test
    @DisplayName("PERCENT: offset is a share of the average")
    void percent() {
        assertThat(calculator.triggerPrice(position(1, "200"), DcaTriggerMode.PERCENT, rung("1.5")))
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("197"));
    }

    @Test
    @DisplayName("ATR: no trigger until an ATR is known")
    void atr() {
        Position position = position(1, "21000");

        assertThat(calculator.triggerPrice(position, DcaTriggerMode.ATR, rung("2"))).isEmpty();

        atrTracker.setOverride("MNQZ5", new BigDecimal("12.5"));
        Optional<BigDecimal> trigger = calculator.triggerPrice(position, DcaTriggerMode.ATR, rung("2"));

        assertThat(trigger).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("20975"));
    }

    @Test
    @DisplayName("Flat positions have no trigger")
    void flat() {
        Position flat = Position.flat(PositionKey.of("ACC-1", "MNQZ5"));

        assertThat(calculator.triggerPrice(flat, DcaTriggerMode.TICKS, rung("4"))).isEmpty();
    }

    @Test
    @DisplayName("reached is inclusive of the trigger price")
    void reached() {
        BigDecimal trigger = new BigDecimal("20995");

        assertThat(calculator.reached(position(1, "21000"), trigger, new BigDecimal("20995"))).isTrue();
        assertThat(calculator.reached(position(1, "21000"), trigger, new BigDecimal("20995.25"))).isFalse();
        assertThat(calculator.reached(position(-1, "20990"), trigger, new BigDecimal("20995"))).isTrue();
        assertThat(calculator.reached(position(-1, "20990"), trigger, new BigDecimal("20994.75"))).isFalse();
    }
}
