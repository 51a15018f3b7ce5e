package com.partsmarket.payment.dto;

import com.partsmarket.order.entity.OrderStatus;
import com.partsmarket.payment.entity.PaymentStatus;

/**
 * Outcome of a status change. A repeated request yields an equal result.
 */
public record PaymentStatusResult(
        Long paymentId,
        Long orderId,
        PaymentStatus paymentStatus,
        OrderStatus orderStatus
) {}
