package com.optionguard.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionguard.domain.enums.DecisionAction;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.enums.Urgency;
import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.PositionSnapshot;
import com.optionguard.monitor.RuleBasedDecisionEvaluator;
import com.optionguard.monitor.rule.ExpirationRollRule;
import com.optionguard.monitor.rule.StopLossRule;
import com.optionguard.monitor.rule.TakeProfitRule;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RuleBasedDecisionEvaluatorTest {

    // Registered out of priority order on purpose
    private final RuleBasedDecisionEvaluator evaluator = new RuleBasedDecisionEvaluator(List.of(
            new ExpirationRollRule(21), new TakeProfitRule(0.8), new StopLossRule(2.0, 7, 0.5)));

    private final MarketContext context = MarketContext.builder().symbol("SPY").build();

    private static PositionSnapshot snapshot(double pnlPct, long dte) {
        return PositionSnapshot.builder()
                .executionId("EX-1")
                .symbol("SPY")
                .strategyType(StrategyType.IRON_CONDOR)
                .unrealizedPnlPct(pnlPct)
                .daysToExpiration(dte)
                .build();
    }

    // ==============================
    // STOP LOSS
    // ==============================

    @Nested
    @DisplayName("Stop loss")
    class StopLoss {

        @Test
        @DisplayName("Loss of twice the entry value closes immediately")
        void maxLoss() {
            Decision decision = evaluator.evaluate(snapshot(-2.0, 30), context);

            assertThat(decision.getAction()).isEqualTo(DecisionAction.CLOSE);
            assertThat(decision.getUrgency()).isEqualTo(Urgency.IMMEDIATE);
            assertThat(decision.getRule()).isEqualTo("StopLoss");
        }

        @Test
        @DisplayName("Near expiration the tighter threshold applies")
        void nearExpiry() {
            assertThat(evaluator.evaluate(snapshot(-0.6, 5), context).getRule()).isEqualTo("StopLoss");
        }

        @Test
        @DisplayName("Stop loss outranks the roll window")
        void outranksRoll() {
            assertThat(evaluator.evaluate(snapshot(-2.5, 10), context).getRule()).isEqualTo("StopLoss");
        }
    }

    // ==============================
    // OTHER RULES
    // ==============================

    @Nested
    @DisplayName("Take profit and roll")
    class OtherRules {

        @Test
        @DisplayName("Profit at target closes at normal urgency")
        void takeProfit() {
            Decision decision = evaluator.evaluate(snapshot(0.8, 30), context);

            assertThat(decision.getAction()).isEqualTo(DecisionAction.CLOSE);
            assertThat(decision.getUrgency()).isEqualTo(Urgency.NORMAL);
            assertThat(decision.getRule()).isEqualTo("TakeProfit");
        }

        @Test
        @DisplayName("Inside the roll window the position rolls")
        void roll() {
            Decision decision = evaluator.evaluate(snapshot(0.1, 21), context);

            assertThat(decision.getAction()).isEqualTo(DecisionAction.ROLL);
            assertThat(decision.getRule()).isEqualTo("ExpirationRoll");
        }

        @Test
        @DisplayName("No rule firing yields the default hold")
        void defaultHold() {
            Decision decision = evaluator.evaluate(snapshot(-0.6, 30), context);

            assertThat(decision.isHold()).isTrue();
            assertThat(decision.getRule()).isEqualTo("Default");
            assertThat(decision.getReason()).isEqualTo("No rule triggered");
        }
    }
}
