package com.optionguard.domain.enums;

public enum OrderStatus {
    PENDING,
    FILLED,
    CANCELLED,
    REJECTED
}
