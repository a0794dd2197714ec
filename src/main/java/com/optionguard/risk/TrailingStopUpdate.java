package com.optionguard.risk;

import com.optionguard.domain.enums.TrailingStopAction;

/**
 * Result of one {@link TrailingStop#update(double)} call: the action taken and the stop
 * level afterwards (null while the stop has never armed).
 */
public record TrailingStopUpdate(TrailingStopAction action, Double stopPremium) {

    public boolean isTriggered() {
        return action == TrailingStopAction.TRIGGER;
    }
}
