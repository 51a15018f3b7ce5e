package com.partsmarket.payment.dto;

import com.partsmarket.payment.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * @param expiresAt after this the customer is expected to open a new payment
 */
public record CreatePaymentResponse(
        Long paymentId,
        Long orderId,
        PaymentStatus status,
        BigDecimal amount,
        String currency,
        LocalDateTime expiresAt
) {}
