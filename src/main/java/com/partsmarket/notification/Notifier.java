package com.partsmarket.notification;

/**
 * Outbound channel to the customer (email, SMS, push). Delivery is best-effort:
 * callers never wait for it and a failure never affects an order or payment.
 */
public interface Notifier {

    void send(NotificationEvent event);
}
