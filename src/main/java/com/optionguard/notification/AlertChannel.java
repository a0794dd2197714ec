package com.optionguard.notification;

/**
 * Delivery transport for alerts (chat, e-mail, pager).
 */
public interface AlertChannel {

    void send(Alert alert);
}
