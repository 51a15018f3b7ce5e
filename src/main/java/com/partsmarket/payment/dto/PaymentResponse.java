package com.partsmarket.payment.dto;

import com.partsmarket.order.entity.Order;
import com.partsmarket.order.entity.OrderStatus;
import com.partsmarket.payment.entity.Payment;
import com.partsmarket.payment.entity.PaymentMethod;
import com.partsmarket.payment.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * A payment as returned to its owner, with the current status of its order.
 */
public record PaymentResponse(
        Long paymentId,
        Long orderId,
        BigDecimal amount,
        String currency,
        PaymentMethod method,
        PaymentStatus status,
        OrderStatus orderStatus,
        String transactionRef,
        Map<String, String> metadata,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static PaymentResponse of(Payment payment, Order order) {
        return PaymentSnapshot.of(payment).toResponse(order.getStatus());
    }

    public PaymentStatusResult toStatusResult() {
        return new PaymentStatusResult(paymentId, orderId, status, orderStatus);
    }
}
