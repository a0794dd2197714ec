package com.optionguard.domain.enums;

/**
 * Decision urgency, lowest to highest. IMMEDIATE bypasses normal rule evaluation.
 */
public enum Urgency {
    LOW,
    NORMAL,
    HIGH,
    IMMEDIATE
}
