package com.optionguard.monitor.rule;

import com.optionguard.domain.enums.DecisionAction;
import com.optionguard.domain.enums.Urgency;
import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.PositionSnapshot;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rolls a position out to the next cycle once it is inside the roll window.
 */
@Component
public class ExpirationRollRule implements DecisionRule {

    private final int rollDays;

    public ExpirationRollRule(@Value("${optionguard.rules.expiration.roll-days:21}") int rollDays) {
        this.rollDays = rollDays;
    }

    @Override
    public String name() {
        return "ExpirationRoll";
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public Optional<Decision> evaluate(PositionSnapshot snapshot, MarketContext context) {
        long dte = snapshot.getDaysToExpiration();
        if (dte > rollDays) {
            return Optional.empty();
        }
        return Optional.of(Decision.builder()
                .action(DecisionAction.ROLL)
                .urgency(Urgency.NORMAL)
                .reason(String.format("%d days to expiration, inside the %d-day roll window", dte, rollDays))
                .rule(name())
                .metadata(Map.of("dte", dte, "roll_days", rollDays))
                .build());
    }
}
