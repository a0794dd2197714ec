package com.optionguard.monitor;

import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.PositionSnapshot;

/**
 * Rule engine consulted for every open position whose trailing stop has not triggered.
 */
public interface DecisionEvaluator {

    Decision evaluate(PositionSnapshot snapshot, MarketContext context);
}
