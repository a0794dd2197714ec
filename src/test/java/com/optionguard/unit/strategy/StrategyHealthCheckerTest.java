package com.optionguard.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.domain.model.StrategyHealth;
import com.optionguard.strategy.builder.StrategyHealthChecker;
import com.optionguard.strategy.builder.StrategyValidator;
import com.optionguard.unit.Fixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrategyHealthCheckerTest {

    private final StrategyHealthChecker checker = new StrategyHealthChecker(new StrategyValidator());

    @Test
    @DisplayName("A filled condor is intact")
    void intact() {
        Strategy open = Fixtures.filled(Fixtures.ironCondor("IC-1", "SPY", 30));

        StrategyHealth health = checker.check(open);

        assertThat(health.isBroken()).isFalse();
    }

    @Test
    @DisplayName("An open leg without a contract id breaks the strategy")
    void missingContract() {
        Strategy open = Fixtures.filled(Fixtures.ironCondor("IC-1", "SPY", 30));
        List<Leg> legs = new ArrayList<>(open.getLegs());
        legs.set(2, legs.get(2).withContractId(null));

        StrategyHealth health = checker.check(open.withLegs(legs));

        assertThat(health.isBroken()).isTrue();
        assertThat(health.getReason()).contains("Leg 3");
    }

    @Test
    @DisplayName("Draft strategies are not required to carry contract ids")
    void draftWithoutContracts() {
        Strategy draft = Fixtures.ironCondor("IC-1", "SPY", 30);

        assertThat(draft.getStatus()).isEqualTo(StrategyStatus.DRAFT);
        assertThat(checker.check(draft).isBroken()).isFalse();
    }
}
