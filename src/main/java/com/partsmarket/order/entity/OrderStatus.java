package com.partsmarket.order.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle.
 *
 * <pre>
 * PENDING ──checkout──▶ PENDING_PAYMENT ──payment completed──▶ PROCESSING ──▶ DELIVERED
 *    │                                                              │
 *    └──cancel──▶ CANCELLED                                         └──refund──▶ REFUNDED
 * </pre>
 *
 * A failed payment leaves the order in PENDING_PAYMENT so the customer can retry.
 */
public enum OrderStatus {
    PENDING,
    PENDING_PAYMENT,
    PROCESSING,
    DELIVERED,
    CANCELLED,
    REFUNDED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED || this == REFUNDED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedNext().contains(next);
    }

    private Set<OrderStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(PENDING_PAYMENT, CANCELLED);
            case PENDING_PAYMENT -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(DELIVERED, REFUNDED);
            case DELIVERED, CANCELLED, REFUNDED -> EnumSet.noneOf(OrderStatus.class);
        };
    }
}
