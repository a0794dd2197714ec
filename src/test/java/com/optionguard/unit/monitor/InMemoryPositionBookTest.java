package com.optionguard.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.exception.ResourceNotFoundException;
import com.optionguard.exception.ValidationException;
import com.optionguard.monitor.InMemoryPositionBook;
import com.optionguard.unit.Fixtures;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryPositionBookTest {

    private final InMemoryPositionBook book = new InMemoryPositionBook(
            Clock.fixed(Instant.parse("2026-03-02T14:30:00Z"), ZoneOffset.UTC));

    private static OpenPosition position(String executionId) {
        return Fixtures.position(executionId, Fixtures.ironCondor("IC-" + executionId, "SPY", 30), 2.0, 1.5);
    }

    @Test
    @DisplayName("Positions iterate in opening order and are marked OPEN")
    void opensInOrder() {
        book.open(position("EX-2"));
        book.open(position("EX-1"));

        assertThat(book.getOpenPositions()).extracting(OpenPosition::getExecutionId).containsExactly("EX-2", "EX-1");
        assertThat(book.findByExecutionId("EX-1")).get()
                .extracting(p -> p.getStrategy().getStatus())
                .isEqualTo(StrategyStatus.OPEN);
    }

    @Test
    @DisplayName("Opening the same execution twice is rejected")
    void duplicate() {
        book.open(position("EX-1"));

        assertThatThrownBy(() -> book.open(position("EX-1"))).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Marks update premium and P&L; unknown executions are not found")
    void marks() {
        book.open(position("EX-1"));

        book.mark("EX-1", 1.1, 90.0);

        OpenPosition marked = book.findByExecutionId("EX-1").orElseThrow();
        assertThat(marked.getCurrentPremium()).isEqualTo(1.1);
        assertThat(marked.getUnrealizedPnl()).isEqualTo(90.0);
        assertThat(marked.getMarkedAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 14, 30));
        assertThat(marked.getOpenedAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 14, 30));
        assertThatThrownBy(() -> book.mark("EX-9", 1.0, 0.0)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Closing removes the position once")
    void close() {
        book.open(position("EX-1"));

        assertThat(book.close("EX-1")).isPresent();
        assertThat(book.close("EX-1")).isEmpty();
        assertThat(book.getOpenPositions()).isEmpty();
    }
}
