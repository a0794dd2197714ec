package com.optionguard.strategy.builder;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.SpreadDirection;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.StrategyBuildException;
import com.optionguard.marketdata.OptionChain;
import com.optionguard.marketdata.OptionChainProvider;
import com.optionguard.strategy.selection.StrikeLadder;
import com.optionguard.strategy.selection.StrikeSelectionResult;
import com.optionguard.strategy.selection.StrikeSelector;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds two-leg vertical spreads in all four directions.
 *
 * <table>
 *   <caption>Leg layout</caption>
 *   <tr><th>Direction</th><th>Leg at delta target</th><th>Second leg</th></tr>
 *   <tr><td>BULL_PUT (credit)</td><td>sell put</td><td>buy put width below</td></tr>
 *   <tr><td>BEAR_CALL (credit)</td><td>sell call</td><td>buy call width above</td></tr>
 *   <tr><td>BULL_CALL (debit)</td><td>buy call</td><td>sell call width above</td></tr>
 *   <tr><td>BEAR_PUT (debit)</td><td>buy put</td><td>sell put width below</td></tr>
 * </table>
 *
 * <p>Legs are emitted lower strike first.
 */
@Component
public class VerticalSpreadBuilder implements StrategyBuilder<VerticalSpreadParams> {

    private static final Logger log = LoggerFactory.getLogger(VerticalSpreadBuilder.class);

    private final OptionChainProvider optionChainProvider;
    private final StrikeSelector strikeSelector;
    private final StrategyFactory strategyFactory;
    private final StrategyValidator strategyValidator;
    private final Clock clock;

    public VerticalSpreadBuilder(
            OptionChainProvider optionChainProvider,
            StrikeSelector strikeSelector,
            StrategyFactory strategyFactory,
            StrategyValidator strategyValidator,
            Clock clock) {
        this.optionChainProvider = optionChainProvider;
        this.strikeSelector = strikeSelector;
        this.strategyFactory = strategyFactory;
        this.strategyValidator = strategyValidator;
        this.clock = clock;
    }

    @Override
    public Strategy build(String symbol, double underlyingPrice, VerticalSpreadParams params) {
        SpreadDirection direction = params.getDirection();
        OptionRight right = direction.getRight();

        OptionChain chain = optionChainProvider.getChain(symbol, params.getDaysToExpiration(), underlyingPrice);
        int dte = chain.daysToExpiration(LocalDate.now(clock));

        StrikeSelectionResult anchor = strikeSelector.select(
                symbol,
                underlyingPrice,
                params.getDeltaTarget(),
                right,
                dte,
                chain.getImpliedVolatility(),
                chain.getHistoricalVolatility(),
                chain.getSensitivityProvider());

        double interval = StrikeLadder.interval(underlyingPrice);
        if (params.getWidth() < interval) {
            throw new StrategyBuildException(
                    String.format(
                            "Spread width %s narrower than strike increment %s for %s",
                            params.getWidth(), interval, symbol),
                    Map.of("symbol", symbol, "interval", interval));
        }
        double farStrike = right.isCall() ? anchor.strike() + params.getWidth() : anchor.strike() - params.getWidth();
        if (farStrike <= 0) {
            throw new StrategyBuildException(
                    String.format("Second leg strike %s is not positive for %s", farStrike, symbol),
                    Map.of("symbol", symbol, "anchor", anchor.strike()));
        }

        LegAction anchorAction = direction.isCredit() ? LegAction.SELL : LegAction.BUY;
        LegAction farAction = direction.isCredit() ? LegAction.BUY : LegAction.SELL;
        LocalDate expiration = chain.getExpiration();
        Leg anchorLeg = leg(right, anchor.strike(), anchorAction, params.getQuantity(), expiration);
        Leg farLeg = leg(right, farStrike, farAction, params.getQuantity(), expiration);
        List<Leg> legs = anchor.strike() < farStrike ? List.of(anchorLeg, farLeg) : List.of(farLeg, anchorLeg);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("direction", direction.name());
        metadata.put("width", params.getWidth());
        metadata.put("dte", dte);
        metadata.put("delta_target", params.getDeltaTarget());
        metadata.put("underlying_price", underlyingPrice);
        // POS is measured on the sold leg; for debit spreads that is the far leg
        if (direction.isCredit()) {
            metadata.put("short_delta", anchor.sensitivity());
        } else {
            metadata.put("short_delta", chain.getSensitivityProvider().getSensitivity(farStrike, right));
        }
        metadata.put("anchor_delta", anchor.sensitivity());

        Strategy strategy = Strategy.builder()
                .id(strategyFactory.generateId(StrategyType.VERTICAL_SPREAD, symbol))
                .symbol(symbol)
                .type(StrategyType.VERTICAL_SPREAD)
                .legs(legs)
                .createdAt(LocalDateTime.now(clock))
                .metadata(metadata)
                .build();
        strategyValidator.validate(strategy);

        log.info(
                "Built {} spread {}: {} {} / {} {} exp={}",
                direction,
                strategy.getId(),
                anchorAction,
                anchor.strike(),
                farAction,
                farStrike,
                expiration);
        return strategy;
    }

    private Leg leg(OptionRight right, double strike, LegAction action, int qty, LocalDate expiration) {
        return Leg.builder()
                .right(right)
                .strike(strike)
                .action(action)
                .quantity(qty)
                .expiration(expiration)
                .createdOn(LocalDate.now(clock))
                .build();
    }
}
