package com.optionguard.strategy.builder;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.StrategyBuildException;
import com.optionguard.marketdata.OptionChain;
import com.optionguard.marketdata.OptionChainProvider;
import com.optionguard.strategy.selection.SkewAdjustedTargets;
import com.optionguard.strategy.selection.StrikeLadder;
import com.optionguard.strategy.selection.StrikeSelectionResult;
import com.optionguard.strategy.selection.StrikeSelector;
import com.optionguard.strategy.selection.VolatilitySkewAnalyzer;
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
 * Builds an iron condor: sells an OTM put and an OTM call chosen by delta, and buys
 * protective wings {@code putWidth} below and {@code callWidth} above them.
 *
 * <p><b>Legs (in order):</b>
 * <ol>
 *   <li>Buy put at short put - putWidth</li>
 *   <li>Sell put at the put delta target</li>
 *   <li>Sell call at the call delta target</li>
 *   <li>Buy call at short call + callWidth</li>
 * </ol>
 *
 * <p>When skew is enabled the delta targets are first split per side by the
 * {@link VolatilitySkewAnalyzer}.
 */
@Component
public class IronCondorBuilder implements StrategyBuilder<IronCondorParams> {

    private static final Logger log = LoggerFactory.getLogger(IronCondorBuilder.class);

    private final OptionChainProvider optionChainProvider;
    private final StrikeSelector strikeSelector;
    private final VolatilitySkewAnalyzer volatilitySkewAnalyzer;
    private final StrategyFactory strategyFactory;
    private final StrategyValidator strategyValidator;
    private final Clock clock;

    public IronCondorBuilder(
            OptionChainProvider optionChainProvider,
            StrikeSelector strikeSelector,
            VolatilitySkewAnalyzer volatilitySkewAnalyzer,
            StrategyFactory strategyFactory,
            StrategyValidator strategyValidator,
            Clock clock) {
        this.optionChainProvider = optionChainProvider;
        this.strikeSelector = strikeSelector;
        this.volatilitySkewAnalyzer = volatilitySkewAnalyzer;
        this.strategyFactory = strategyFactory;
        this.strategyValidator = strategyValidator;
        this.clock = clock;
    }

    @Override
    public Strategy build(String symbol, double underlyingPrice, IronCondorParams params) {
        OptionChain chain = optionChainProvider.getChain(symbol, params.getDaysToExpiration(), underlyingPrice);
        int dte = chain.daysToExpiration(LocalDate.now(clock));
        double volatility = strikeSelector.resolveVolatility(
                symbol, chain.getImpliedVolatility(), chain.getHistoricalVolatility());

        SkewAdjustedTargets targets = resolveTargets(params, underlyingPrice, dte, volatility, chain);

        StrikeSelectionResult shortPut = strikeSelector.select(
                symbol,
                underlyingPrice,
                targets.putTarget(),
                OptionRight.PUT,
                dte,
                chain.getImpliedVolatility(),
                chain.getHistoricalVolatility(),
                chain.getSensitivityProvider());
        StrikeSelectionResult shortCall = strikeSelector.select(
                symbol,
                underlyingPrice,
                targets.callTarget(),
                OptionRight.CALL,
                dte,
                chain.getImpliedVolatility(),
                chain.getHistoricalVolatility(),
                chain.getSensitivityProvider());

        double interval = StrikeLadder.interval(underlyingPrice);
        double longPutStrike = shortPut.strike() - params.getPutWidth();
        double longCallStrike = shortCall.strike() + params.getCallWidth();
        checkGeometry(symbol, params, interval, shortPut.strike(), shortCall.strike(), longPutStrike);

        LocalDate expiration = chain.getExpiration();
        int qty = params.getQuantity();
        List<Leg> legs = List.of(
                leg(OptionRight.PUT, longPutStrike, LegAction.BUY, qty, expiration),
                leg(OptionRight.PUT, shortPut.strike(), LegAction.SELL, qty, expiration),
                leg(OptionRight.CALL, shortCall.strike(), LegAction.SELL, qty, expiration),
                leg(OptionRight.CALL, longCallStrike, LegAction.BUY, qty, expiration));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("put_width", params.getPutWidth());
        metadata.put("call_width", params.getCallWidth());
        metadata.put("dte", dte);
        metadata.put("delta_target", params.getDeltaTarget());
        metadata.put("put_delta_target", targets.putTarget());
        metadata.put("call_delta_target", targets.callTarget());
        metadata.put("skew_ratio", targets.skewRatio());
        metadata.put("underlying_price", underlyingPrice);
        metadata.put("short_put_delta", shortPut.sensitivity());
        metadata.put("short_call_delta", shortCall.sensitivity());

        Strategy strategy = Strategy.builder()
                .id(strategyFactory.generateId(StrategyType.IRON_CONDOR, symbol))
                .symbol(symbol)
                .type(StrategyType.IRON_CONDOR)
                .legs(legs)
                .createdAt(LocalDateTime.now(clock))
                .metadata(metadata)
                .build();
        strategyValidator.validate(strategy);

        log.info(
                "Built iron condor {}: {}/{}P {}/{}C exp={} (put delta {}, call delta {})",
                strategy.getId(),
                longPutStrike,
                shortPut.strike(),
                shortCall.strike(),
                longCallStrike,
                expiration,
                String.format("%.3f", shortPut.sensitivity()),
                String.format("%.3f", shortCall.sensitivity()));
        return strategy;
    }

    private SkewAdjustedTargets resolveTargets(
            IronCondorParams params, double underlyingPrice, int dte, double volatility, OptionChain chain) {
        double base = params.getDeltaTarget();
        if (!params.isUseSkew()) {
            return new SkewAdjustedTargets(base, base, VolatilitySkewAnalyzer.NEUTRAL_SKEW);
        }
        double skew = params.getSkewRatio() != null
                ? params.getSkewRatio()
                : volatilitySkewAnalyzer.skewRatio(underlyingPrice, dte, volatility, chain.getSensitivityProvider());
        return volatilitySkewAnalyzer.adjustTargets(base, skew);
    }

    private void checkGeometry(
            String symbol,
            IronCondorParams params,
            double interval,
            double shortPutStrike,
            double shortCallStrike,
            double longPutStrike) {
        if (params.getPutWidth() < interval || params.getCallWidth() < interval) {
            throw new StrategyBuildException(
                    String.format(
                            "Wing width %s/%s narrower than strike increment %s for %s",
                            params.getPutWidth(), params.getCallWidth(), interval, symbol),
                    Map.of("symbol", symbol, "interval", interval));
        }
        if (longPutStrike <= 0) {
            throw new StrategyBuildException(
                    String.format("Protective put strike %s is not positive for %s", longPutStrike, symbol),
                    Map.of("symbol", symbol, "shortPut", shortPutStrike));
        }
        if (shortPutStrike >= shortCallStrike) {
            throw new StrategyBuildException(
                    String.format(
                            "Short put %s is not below short call %s for %s", shortPutStrike, shortCallStrike, symbol),
                    Map.of("symbol", symbol, "shortPut", shortPutStrike, "shortCall", shortCallStrike));
        }
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
