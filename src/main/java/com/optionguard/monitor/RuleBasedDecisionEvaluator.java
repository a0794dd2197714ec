package com.optionguard.monitor;

import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.PositionSnapshot;
import com.optionguard.monitor.rule.DecisionRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates the registered {@link DecisionRule}s in priority order; the first rule that
 * fires decides. HOLD when none fires.
 */
@Component
public class RuleBasedDecisionEvaluator implements DecisionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDecisionEvaluator.class);

    private final List<DecisionRule> rules;

    public RuleBasedDecisionEvaluator(List<DecisionRule> rules) {
        List<DecisionRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(DecisionRule::priority));
        this.rules = List.copyOf(sorted);
        log.info("Decision rules in order: {}", this.rules.stream().map(DecisionRule::name).toList());
    }

    @Override
    public Decision evaluate(PositionSnapshot snapshot, MarketContext context) {
        for (DecisionRule rule : rules) {
            Optional<Decision> decision = rule.evaluate(snapshot, context);
            if (decision.isPresent()) {
                log.debug("Rule {} fired for {}: {}", rule.name(), snapshot.getExecutionId(), decision.get().getAction());
                return decision.get();
            }
        }
        return Decision.hold("No rule triggered", "Default");
    }
}
