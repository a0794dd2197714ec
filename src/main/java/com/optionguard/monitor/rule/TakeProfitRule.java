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

@Component
public class TakeProfitRule implements DecisionRule {

    private final double targetPct;

    public TakeProfitRule(@Value("${optionguard.rules.take-profit.target-pct:0.8}") double targetPct) {
        this.targetPct = targetPct;
    }

    @Override
    public String name() {
        return "TakeProfit";
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public Optional<Decision> evaluate(PositionSnapshot snapshot, MarketContext context) {
        double pnlPct = snapshot.getUnrealizedPnlPct();
        if (pnlPct < targetPct) {
            return Optional.empty();
        }
        return Optional.of(Decision.builder()
                .action(DecisionAction.CLOSE)
                .urgency(Urgency.NORMAL)
                .reason(String.format(
                        "Profit target reached: unrealized P&L %.1f%% >= %.1f%%", pnlPct * 100, targetPct * 100))
                .rule(name())
                .metadata(Map.of("unrealized_pnl_pct", pnlPct, "target_pct", targetPct))
                .build());
    }
}
