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
 * Closes immediately when the loss reaches {@code maxLossPct} of the entry value, or the
 * tighter {@code nearExpiryMaxLossPct} inside the last {@code nearExpiryDays} days, when
 * gamma makes losses accelerate.
 */
@Component
public class StopLossRule implements DecisionRule {

    private final double maxLossPct;
    private final int nearExpiryDays;
    private final double nearExpiryMaxLossPct;

    public StopLossRule(
            @Value("${optionguard.rules.stop-loss.max-loss-pct:2.0}") double maxLossPct,
            @Value("${optionguard.rules.stop-loss.near-expiry-days:7}") int nearExpiryDays,
            @Value("${optionguard.rules.stop-loss.near-expiry-max-loss-pct:0.5}") double nearExpiryMaxLossPct) {
        this.maxLossPct = maxLossPct;
        this.nearExpiryDays = nearExpiryDays;
        this.nearExpiryMaxLossPct = nearExpiryMaxLossPct;
    }

    @Override
    public String name() {
        return "StopLoss";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public Optional<Decision> evaluate(PositionSnapshot snapshot, MarketContext context) {
        double pnlPct = snapshot.getUnrealizedPnlPct();
        boolean nearExpiry = snapshot.getDaysToExpiration() < nearExpiryDays;
        double threshold = nearExpiry ? nearExpiryMaxLossPct : maxLossPct;
        if (pnlPct > -threshold) {
            return Optional.empty();
        }
        String reason = String.format(
                "Stop loss: unrealized P&L %.1f%% at or below -%.1f%%%s",
                pnlPct * 100,
                threshold * 100,
                nearExpiry ? " (" + snapshot.getDaysToExpiration() + " days to expiration)" : "");
        return Optional.of(Decision.builder()
                .action(DecisionAction.CLOSE)
                .urgency(Urgency.IMMEDIATE)
                .reason(reason)
                .rule(name())
                .metadata(Map.of(
                        "unrealized_pnl_pct", pnlPct,
                        "threshold_pct", -threshold,
                        "dte", snapshot.getDaysToExpiration()))
                .build());
    }
}
