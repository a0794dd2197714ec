package com.optionguard.domain.model;

import com.optionguard.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only risk/reward view of one candidate strategy, computed once per evaluation.
 *
 * <p>Monetary values are in account currency for the whole position
 * (premium points x contract multiplier x quantity), at two decimal places.
 */
@Value
@Builder
public class StrategyAnalysis {

    String strategyId;
    String symbol;
    StrategyType strategyType;

    /** Net premium received. For debit structures this holds the maximum reward. */
    BigDecimal credit;

    BigDecimal maxRisk;

    /** max risk / credit. Lower is better. */
    double riskRewardRatio;

    /** Percent, 0-100, derived from the short-leg sensitivity. */
    double probabilityOfSuccess;

    BigDecimal expectedReturn;

    /** Expected return as a percent of max risk. */
    double expectedReturnPct;

    double ivRank;

    /** Composite 0-100 score, rounded to one decimal. */
    double score;

    LocalDateTime analyzedAt;
}
