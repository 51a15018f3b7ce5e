package com.partsmarket.notification;

public enum NotificationKind {
    ORDER_CONFIRMATION,
    ORDER_CANCELLED,
    PAYMENT_SUCCESS,
    PAYMENT_FAILED,
    REFUND_PROCESSED
}
