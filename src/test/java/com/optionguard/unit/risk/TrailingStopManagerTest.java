package com.optionguard.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.optionguard.domain.enums.TrailingStopAction;
import com.optionguard.event.RiskEventType;
import com.optionguard.exception.ResourceNotFoundException;
import com.optionguard.exception.ValidationException;
import com.optionguard.observability.RiskEventLog;
import com.optionguard.risk.TrailingStop;
import com.optionguard.risk.TrailingStopConfig;
import com.optionguard.risk.TrailingStopManager;
import com.optionguard.risk.TrailingStopUpdate;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TrailingStopManagerTest {

    @Mock
    private RiskEventLog riskEventLog;

    private TrailingStopManager trailingStopManager;

    @BeforeEach
    void setUp() {
        trailingStopManager = new TrailingStopManager(riskEventLog);
    }

    // ==============================
    // REGISTRATION
    // ==============================

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("add registers the stop and logs TS_ADD")
        void add_registersAndLogs() {
            TrailingStop stop = trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);

            assertThat(trailingStopManager.get("EX-1")).containsSame(stop);
            verify(riskEventLog).logTrailingStop(eq(RiskEventType.TS_ADD), eq("EX-1"), eq(stop), isNull());
        }

        @Test
        @DisplayName("A second stop for the same execution is rejected")
        void duplicate_rejected() {
            trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);

            assertThatThrownBy(() -> trailingStopManager.add("EX-1", 90.0, TrailingStopConfig.DEFAULT))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("EX-1");
        }

        @Test
        @DisplayName("remove returns false for unknown executions and logs TS_REMOVE otherwise")
        void remove() {
            trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);

            assertThat(trailingStopManager.remove("EX-1")).isTrue();
            assertThat(trailingStopManager.remove("EX-1")).isFalse();
            assertThat(trailingStopManager.getAll()).isEmpty();
            verify(riskEventLog).logTrailingStop(eq(RiskEventType.TS_REMOVE), eq("EX-1"), any(), isNull());
        }
    }

    // ==============================
    // UPDATES
    // ==============================

    @Nested
    @DisplayName("Updates")
    class Updates {

        @Test
        @DisplayName("Updating an unknown execution throws ResourceNotFoundException")
        void unknown_throws() {
            assertThatThrownBy(() -> trailingStopManager.update("missing", 100.0))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Activation and trigger are each logged once")
        void transitions_loggedOnce() {
            trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);

            trailingStopManager.update("EX-1", 101.0);
            trailingStopManager.update("EX-1", 103.0);
            TrailingStopUpdate trigger = trailingStopManager.update("EX-1", 100.0);
            TrailingStopUpdate again = trailingStopManager.update("EX-1", 99.0);

            assertThat(trigger.action()).isEqualTo(TrailingStopAction.TRIGGER);
            assertThat(again.action()).isEqualTo(TrailingStopAction.TRIGGER);
            verify(riskEventLog).logTrailingStop(eq(RiskEventType.TS_ACTIVATE), eq("EX-1"), any(), eq(103.0));
            verify(riskEventLog, times(1))
                    .logTrailingStop(eq(RiskEventType.TS_TRIGGER), eq("EX-1"), any(), anyDouble());
            verify(riskEventLog, never()).logTrailingStop(eq(RiskEventType.TS_UPDATE), any(), any(), any());
        }

        @Test
        @DisplayName("updateStops skips executions without a premium")
        void updateStops_skipsMissing() {
            trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);
            trailingStopManager.add("EX-2", 50.0, TrailingStopConfig.DEFAULT);

            Map<String, TrailingStopUpdate> results = trailingStopManager.updateStops(Map.of("EX-1", 103.0));

            assertThat(results).containsOnlyKeys("EX-1");
            assertThat(results.get("EX-1").action()).isEqualTo(TrailingStopAction.ACTIVATE);
        }

        @Test
        @DisplayName("updateStops keeps going after one stop fails")
        void updateStops_continuesAfterFailure() {
            trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);
            trailingStopManager.add("EX-2", 50.0, TrailingStopConfig.DEFAULT);
            Map<String, Double> premiums = new HashMap<>();
            premiums.put("EX-1", -1.0);
            premiums.put("EX-2", 52.0);

            Map<String, TrailingStopUpdate> results = trailingStopManager.updateStops(premiums);

            assertThat(results).containsOnlyKeys("EX-2");
            assertThat(results.get("EX-2").action()).isEqualTo(TrailingStopAction.ACTIVATE);
        }

        @Test
        @DisplayName("resetStop returns the stop to INACTIVE and logs TS_RESET")
        void resetStop() {
            TrailingStop stop = trailingStopManager.add("EX-1", 100.0, TrailingStopConfig.DEFAULT);
            trailingStopManager.update("EX-1", 110.0);

            trailingStopManager.resetStop("EX-1");

            assertThat(stop.isActive()).isFalse();
            verify(riskEventLog).logTrailingStop(eq(RiskEventType.TS_RESET), eq("EX-1"), eq(stop), isNull());
        }
    }
}
