package com.optionguard.unit.strategy;

import static com.optionguard.unit.Fixtures.expiryInDays;
import static com.optionguard.unit.Fixtures.leg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.StrategyBuildException;
import com.optionguard.strategy.builder.StrategyValidator;
import com.optionguard.unit.Fixtures;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrategyValidatorTest {

    private final StrategyValidator validator = new StrategyValidator();

    private static Strategy condor(List<Leg> legs) {
        return Strategy.builder().id("IC-X").symbol("SPY").type(StrategyType.IRON_CONDOR).legs(legs).build();
    }

    private static Strategy vertical(List<Leg> legs) {
        return Strategy.builder().id("VS-X").symbol("SPY").type(StrategyType.VERTICAL_SPREAD).legs(legs).build();
    }

    @Test
    @DisplayName("A well-formed condor has no problem")
    void validCondor() {
        assertThat(validator.findProblem(Fixtures.ironCondor("IC-1", "SPY", 30))).isEmpty();
    }

    @Test
    @DisplayName("Short put above short call is out of order")
    void strikesOutOfOrder() {
        LocalDate expiry = expiryInDays(30);
        Strategy inverted = condor(List.of(
                leg(OptionRight.PUT, 400, LegAction.BUY, expiry),
                leg(OptionRight.PUT, 415, LegAction.SELL, expiry),
                leg(OptionRight.CALL, 410, LegAction.SELL, expiry),
                leg(OptionRight.CALL, 420, LegAction.BUY, expiry)));

        assertThat(validator.findProblem(inverted)).hasValueSatisfying(p -> assertThat(p).contains("out of order"));
        assertThatThrownBy(() -> validator.validate(inverted)).isInstanceOf(StrategyBuildException.class);
    }

    @Test
    @DisplayName("A condor missing a role is rejected")
    void missingRole() {
        LocalDate expiry = expiryInDays(30);
        Strategy twoShortPuts = condor(List.of(
                leg(OptionRight.PUT, 380, LegAction.SELL, expiry),
                leg(OptionRight.PUT, 390, LegAction.SELL, expiry),
                leg(OptionRight.CALL, 410, LegAction.SELL, expiry),
                leg(OptionRight.CALL, 420, LegAction.BUY, expiry)));

        assertThat(validator.findProblem(twoShortPuts)).hasValueSatisfying(p -> assertThat(p).contains("missing"));
    }

    @Test
    @DisplayName("Condor legs must share one expiration")
    void mixedExpirations() {
        Strategy mixed = condor(List.of(
                leg(OptionRight.PUT, 380, LegAction.BUY, expiryInDays(30)),
                leg(OptionRight.PUT, 390, LegAction.SELL, expiryInDays(30)),
                leg(OptionRight.CALL, 410, LegAction.SELL, expiryInDays(37)),
                leg(OptionRight.CALL, 420, LegAction.BUY, expiryInDays(37))));

        assertThat(validator.findProblem(mixed)).hasValue("legs have different expirations");
    }

    @Test
    @DisplayName("A vertical needs one bought and one sold leg of the same right")
    void verticalRules() {
        LocalDate expiry = expiryInDays(30);

        assertThat(validator.findProblem(vertical(List.of(
                        leg(OptionRight.PUT, 390, LegAction.SELL, expiry),
                        leg(OptionRight.PUT, 385, LegAction.SELL, expiry)))))
                .hasValue("needs one bought and one sold leg");
        assertThat(validator.findProblem(vertical(List.of(
                        leg(OptionRight.PUT, 390, LegAction.SELL, expiry),
                        leg(OptionRight.CALL, 395, LegAction.BUY, expiry)))))
                .hasValue("legs have different rights");
        assertThat(validator.findProblem(vertical(List.of(
                        leg(OptionRight.PUT, 390, LegAction.SELL, expiry),
                        leg(OptionRight.PUT, 385, LegAction.BUY, expiry)))))
                .isEmpty();
    }
}
