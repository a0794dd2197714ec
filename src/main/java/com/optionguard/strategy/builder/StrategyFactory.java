package com.optionguard.strategy.builder;

import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.ValidationException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates strategy ids and creates custom strategies from explicit legs.
 *
 * <p>Id format: {@code {IC|VS|CU}_{SYMBOL}_{yyyyMMdd_HHmmss}}. A second id for the same
 * prefix and symbol within the same second gets a {@code _2}, {@code _3}... suffix.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    // Ids issued in the current second, with how many times each base was used
    private final Map<String, Integer> issuedThisSecond = new HashMap<>();
    private String currentSecond;

    public StrategyFactory(Clock clock) {
        this.clock = clock;
    }

    public synchronized String generateId(StrategyType type, String symbol) {
        ValidationException.require(symbol != null && !symbol.isBlank(), "Symbol is required");
        String timestamp = LocalDateTime.now(clock).format(ID_TIMESTAMP);
        if (!timestamp.equals(currentSecond)) {
            issuedThisSecond.clear();
            currentSecond = timestamp;
        }
        String baseId = type.getIdPrefix() + "_" + symbol.toUpperCase(Locale.ROOT) + "_" + timestamp;
        int count = issuedThisSecond.merge(baseId, 1, Integer::sum);
        return count == 1 ? baseId : baseId + "_" + count;
    }

    /**
     * Creates a CUSTOM strategy from caller-supplied legs, in the order given.
     *
     * @throws ValidationException if the symbol is blank or there are no legs
     */
    public Strategy custom(String symbol, List<Leg> legs, Map<String, Object> metadata) {
        Strategy strategy = Strategy.builder()
                .id(generateId(StrategyType.CUSTOM, symbol))
                .symbol(symbol)
                .type(StrategyType.CUSTOM)
                .legs(legs)
                .createdAt(LocalDateTime.now(clock))
                .metadata(metadata)
                .build();
        log.info("Created custom strategy: id={}, legs={}", strategy.getId(), legs.size());
        return strategy;
    }
}
