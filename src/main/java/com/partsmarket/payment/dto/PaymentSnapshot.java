package com.partsmarket.payment.dto;

import com.partsmarket.order.entity.OrderStatus;
import com.partsmarket.payment.entity.Payment;
import com.partsmarket.payment.entity.PaymentMethod;
import com.partsmarket.payment.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * The value kept in the idempotency cache under {@code payment:{id}}.
 *
 * <p>Holds only what the payment row owns. The order status is not cached: another
 * payment of the same order can move the order on without touching this entry, so
 * readers always take the order status from the order ledger.</p>
 */
public record PaymentSnapshot(
        Long paymentId,
        Long orderId,
        BigDecimal amount,
        String currency,
        PaymentMethod method,
        PaymentStatus status,
        String transactionRef,
        Map<String, String> metadata,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static PaymentSnapshot of(Payment payment) {
        return new PaymentSnapshot(
                payment.getId(),
                payment.getOrderId(),
                payment.getAmount(),
                payment.getCurrency(),
                payment.getMethod(),
                payment.getStatus(),
                payment.getTransactionRef(),
                Map.copyOf(payment.getMetadata()),
                payment.getCreatedAt(),
                payment.getUpdatedAt());
    }

    public PaymentResponse toResponse(OrderStatus orderStatus) {
        return new PaymentResponse(paymentId, orderId, amount, currency, method, status, orderStatus,
                transactionRef, metadata, createdAt, updatedAt);
    }

    public PaymentStatusResult toStatusResult(OrderStatus orderStatus) {
        return new PaymentStatusResult(paymentId, orderId, status, orderStatus);
    }
}
