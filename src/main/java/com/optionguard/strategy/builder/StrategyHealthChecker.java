package com.optionguard.strategy.builder;

import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.domain.model.StrategyHealth;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Decides whether an open strategy is still the structure that was built.
 *
 * <p>Broken when a leg of an OPEN strategy has lost its broker contract id (assignment,
 * manual close at the broker) or when the legs no longer form a valid structure for
 * the strategy type.
 */
@Component
public class StrategyHealthChecker {

    private final StrategyValidator strategyValidator;

    public StrategyHealthChecker(StrategyValidator strategyValidator) {
        this.strategyValidator = strategyValidator;
    }

    public StrategyHealth check(Strategy strategy) {
        if (strategy.getStatus() == StrategyStatus.OPEN) {
            for (int i = 0; i < strategy.getLegs().size(); i++) {
                Leg leg = strategy.getLegs().get(i);
                if (leg.getContractId() == null || leg.getContractId().isBlank()) {
                    return StrategyHealth.broken(String.format(
                            "Leg %d (%s %s %s) has no broker contract",
                            i + 1, leg.getAction(), leg.getRight(), leg.getStrike()));
                }
            }
        }
        Optional<String> problem = strategyValidator.findProblem(strategy);
        return problem.map(StrategyHealth::broken).orElseGet(StrategyHealth::intact);
    }
}
