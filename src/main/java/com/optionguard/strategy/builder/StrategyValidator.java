package com.optionguard.strategy.builder;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.StrategyBuildException;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Structural checks for built strategies.
 *
 * <p>An iron condor is valid when it has one leg in each role (long put, short put,
 * short call, long call), strikes strictly ordered LP &lt; SP &lt; SC &lt; LC, a single
 * expiration, and positive wing widths. A vertical needs one bought and one sold leg of
 * the same right and expiration at different strikes.
 */
@Component
public class StrategyValidator {

    /**
     * @throws StrategyBuildException describing the first structural problem
     */
    public void validate(Strategy strategy) {
        findProblem(strategy).ifPresent(problem -> {
            throw new StrategyBuildException("Invalid " + strategy.getType() + " " + strategy.getId() + ": " + problem);
        });
    }

    /** The first structural problem, or empty when the strategy is well formed. */
    public Optional<String> findProblem(Strategy strategy) {
        if (strategy.getType().getRequiredLegCount() > 0
                && strategy.getLegs().size() != strategy.getType().getRequiredLegCount()) {
            return Optional.of(String.format(
                    "expected %d legs, found %d",
                    strategy.getType().getRequiredLegCount(),
                    strategy.getLegs().size()));
        }
        if (strategy.getType() == StrategyType.IRON_CONDOR) {
            return ironCondorProblem(strategy.getLegs());
        }
        if (strategy.getType() == StrategyType.VERTICAL_SPREAD) {
            return verticalProblem(strategy.getLegs());
        }
        return Optional.empty();
    }

    private Optional<String> ironCondorProblem(List<Leg> legs) {
        Optional<Leg> longPut = findLeg(legs, OptionRight.PUT, LegAction.BUY);
        Optional<Leg> shortPut = findLeg(legs, OptionRight.PUT, LegAction.SELL);
        Optional<Leg> shortCall = findLeg(legs, OptionRight.CALL, LegAction.SELL);
        Optional<Leg> longCall = findLeg(legs, OptionRight.CALL, LegAction.BUY);
        if (longPut.isEmpty() || shortPut.isEmpty() || shortCall.isEmpty() || longCall.isEmpty()) {
            return Optional.of("missing one of long put, short put, short call, long call");
        }
        double lp = longPut.get().getStrike();
        double sp = shortPut.get().getStrike();
        double sc = shortCall.get().getStrike();
        double lc = longCall.get().getStrike();
        if (!(lp < sp && sp < sc && sc < lc)) {
            return Optional.of(String.format("strikes out of order: LP=%s SP=%s SC=%s LC=%s", lp, sp, sc, lc));
        }
        if (legs.stream().map(Leg::getExpiration).distinct().count() > 1) {
            return Optional.of("legs have different expirations");
        }
        return Optional.empty();
    }

    private Optional<String> verticalProblem(List<Leg> legs) {
        Leg first = legs.get(0);
        Leg second = legs.get(1);
        if (first.getRight() != second.getRight()) {
            return Optional.of("legs have different rights");
        }
        if (first.getAction() == second.getAction()) {
            return Optional.of("needs one bought and one sold leg");
        }
        if (first.getStrike() == second.getStrike()) {
            return Optional.of("legs share strike " + first.getStrike());
        }
        if (!first.getExpiration().equals(second.getExpiration())) {
            return Optional.of("legs have different expirations");
        }
        return Optional.empty();
    }

    private Optional<Leg> findLeg(List<Leg> legs, OptionRight right, LegAction action) {
        return legs.stream()
                .filter(leg -> leg.getRight() == right && leg.getAction() == action)
                .findFirst();
    }
}
