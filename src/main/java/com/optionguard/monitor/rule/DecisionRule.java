package com.optionguard.monitor.rule;

import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.PositionSnapshot;
import java.util.Optional;

/**
 * One exit or adjustment rule. Lower priority values are evaluated first.
 */
public interface DecisionRule {

    String name();

    int priority();

    /** A decision when the rule fires, empty otherwise. */
    Optional<Decision> evaluate(PositionSnapshot snapshot, MarketContext context);
}
