package com.optionguard.unit;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.domain.model.Strategy;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for strategies and positions used across unit tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static LocalDate expiryInDays(int days) {
        return LocalDate.now().plusDays(days);
    }

    public static Leg leg(OptionRight right, double strike, LegAction action, LocalDate expiration) {
        return Leg.builder()
                .right(right)
                .strike(strike)
                .quantity(1)
                .action(action)
                .expiration(expiration)
                .build();
    }

    /** SPY-style iron condor 380/390/410/420 in builder leg order. */
    public static Strategy ironCondor(String id, String symbol, int daysToExpiry) {
        LocalDate expiry = expiryInDays(daysToExpiry);
        return Strategy.builder()
                .id(id)
                .symbol(symbol)
                .type(StrategyType.IRON_CONDOR)
                .legs(List.of(
                        leg(OptionRight.PUT, 380, LegAction.BUY, expiry),
                        leg(OptionRight.PUT, 390, LegAction.SELL, expiry),
                        leg(OptionRight.CALL, 410, LegAction.SELL, expiry),
                        leg(OptionRight.CALL, 420, LegAction.BUY, expiry)))
                .metadata(Map.of("put_width", 10.0, "call_width", 10.0, "short_put_delta", -0.16, "short_call_delta", 0.16))
                .build();
    }

    /** The strategy as held at the broker: OPEN, every leg carrying a contract id. */
    public static Strategy filled(Strategy strategy) {
        List<Leg> legs = new ArrayList<>();
        for (int i = 0; i < strategy.getLegs().size(); i++) {
            legs.add(strategy.getLegs().get(i).withContractId(strategy.getId() + "-" + (i + 1)));
        }
        return strategy.withLegs(legs).withStatus(StrategyStatus.OPEN);
    }

    public static OpenPosition position(String executionId, Strategy strategy, double entry, double current) {
        return OpenPosition.builder()
                .executionId(executionId)
                .strategy(filled(strategy))
                .quantity(1)
                .entryPremium(entry)
                .currentPremium(current)
                .unrealizedPnl((entry - current) * OpenPosition.CONTRACT_MULTIPLIER)
                .build();
    }
}
