package com.optionguard.unit.strategy;

import static com.optionguard.unit.Fixtures.expiryInDays;
import static com.optionguard.unit.Fixtures.leg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.ValidationException;
import com.optionguard.strategy.builder.StrategyFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrategyFactoryTest {

    private final StrategyFactory factory =
            new StrategyFactory(Clock.fixed(Instant.parse("2026-01-15T09:30:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Id carries type prefix, upper-cased symbol and timestamp")
    void idFormat() {
        assertThat(factory.generateId(StrategyType.IRON_CONDOR, "spy")).isEqualTo("IC_SPY_20260115_093000");
    }

    @Test
    @DisplayName("Ids in the same second get numbered suffixes per prefix and symbol")
    void sameSecondSuffix() {
        assertThat(factory.generateId(StrategyType.IRON_CONDOR, "SPY")).isEqualTo("IC_SPY_20260115_093000");
        assertThat(factory.generateId(StrategyType.VERTICAL_SPREAD, "SPY")).isEqualTo("VS_SPY_20260115_093000");
        assertThat(factory.generateId(StrategyType.IRON_CONDOR, "SPY")).isEqualTo("IC_SPY_20260115_093000_2");
        assertThat(factory.generateId(StrategyType.IRON_CONDOR, "SPY")).isEqualTo("IC_SPY_20260115_093000_3");
    }

    @Test
    @DisplayName("Custom strategy keeps legs in the given order")
    void custom() {
        Strategy custom = factory.custom(
                "QQQ",
                List.of(
                        leg(OptionRight.CALL, 450, LegAction.SELL, expiryInDays(20)),
                        leg(OptionRight.PUT, 400, LegAction.SELL, expiryInDays(20))),
                Map.of("credit", 300.0));

        assertThat(custom.getType()).isEqualTo(StrategyType.CUSTOM);
        assertThat(custom.getId()).isEqualTo("CU_QQQ_20260115_093000");
        assertThat(custom.getLegs()).extracting(l -> l.getRight()).containsExactly(OptionRight.CALL, OptionRight.PUT);
    }

    @Test
    @DisplayName("Custom strategy without legs is rejected")
    void customWithoutLegs() {
        assertThatThrownBy(() -> factory.custom("QQQ", List.of(), Map.of())).isInstanceOf(ValidationException.class);
    }
}
