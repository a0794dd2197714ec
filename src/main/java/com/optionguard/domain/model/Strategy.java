package com.optionguard.domain.model;

import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.exception.ValidationException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A named multi-leg option structure on one underlying symbol.
 *
 * <p>Leg order is significant and preserved as built. For an iron condor the builder
 * emits long put, short put, short call, long call. The leg count must match the
 * {@link StrategyType}: four for an iron condor, two for a vertical spread, and at
 * least one for a custom structure.
 *
 * <p>Metadata carries build parameters (wing widths, delta target, underlying price at
 * build time, short-leg sensitivities) consumed by the scorer. Both legs and metadata
 * are exposed as unmodifiable views.
 */
@Getter
@ToString
public class Strategy {

    private final String id;
    private final String symbol;
    private final StrategyType type;
    private final List<Leg> legs;
    private final LocalDateTime createdAt;
    private final StrategyStatus status;
    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private Strategy(
            String id,
            String symbol,
            StrategyType type,
            List<Leg> legs,
            LocalDateTime createdAt,
            StrategyStatus status,
            Map<String, Object> metadata) {
        ValidationException.require(id != null && !id.isBlank(), "Strategy id is required");
        ValidationException.require(symbol != null && !symbol.isBlank(), "Strategy symbol is required");
        ValidationException.require(type != null, "Strategy type is required");
        ValidationException.require(legs != null && !legs.isEmpty(), "Strategy must have at least one leg");
        if (type.getRequiredLegCount() > 0) {
            ValidationException.require(
                    legs.size() == type.getRequiredLegCount(),
                    String.format(
                            "%s requires %d legs, got %d", type, type.getRequiredLegCount(), legs.size()));
        }
        this.id = id;
        this.symbol = symbol;
        this.type = type;
        this.legs = List.copyOf(legs);
        this.createdAt = createdAt != null ? createdAt : LocalDateTime.now();
        this.status = status != null ? status : StrategyStatus.DRAFT;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public Strategy withStatus(StrategyStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public Strategy withLegs(List<Leg> newLegs) {
        return toBuilder().legs(newLegs).build();
    }

    public List<Leg> getShortLegs() {
        return legs.stream().filter(Leg::isShort).toList();
    }

    /** Earliest leg expiration. */
    public LocalDate getExpiration() {
        return legs.stream().map(Leg::getExpiration).min(LocalDate::compareTo).orElseThrow();
    }

    /** Numeric metadata value, or {@code defaultValue} when absent or not a number. */
    public double metadataDouble(String key, double defaultValue) {
        Object value = metadata.get(key);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }

    public Optional<Object> metadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }
}
