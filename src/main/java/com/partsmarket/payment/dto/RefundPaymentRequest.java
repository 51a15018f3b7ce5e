package com.partsmarket.payment.dto;

import com.partsmarket.payment.entity.Payment;
import jakarta.validation.constraints.Size;

/**
 * Optional body of a refund request.
 *
 * @param reason shown to the customer and kept in the payment metadata
 */
public record RefundPaymentRequest(
        @Size(max = Payment.REASON_MAX_LENGTH) String reason
) {}
