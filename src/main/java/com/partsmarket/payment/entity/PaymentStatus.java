package com.partsmarket.payment.entity;

/**
 * PENDING moves once, to COMPLETED or FAILED. Only a COMPLETED payment can be REFUNDED.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED;

    public boolean canTransitionTo(PaymentStatus next) {
        return switch (this) {
            case PENDING -> next == COMPLETED || next == FAILED;
            case COMPLETED -> next == REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }
}
