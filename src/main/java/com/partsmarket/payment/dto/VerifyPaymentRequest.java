package com.partsmarket.payment.dto;

import com.partsmarket.payment.entity.Payment;
import com.partsmarket.payment.entity.PaymentStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Provider callback.
 *
 * @param status         COMPLETED or FAILED
 * @param transactionRef provider reference, stored on completion
 * @param errorMessage   provider's failure text; stored cut to
 *                       {@value Payment#REASON_MAX_LENGTH} characters
 */
public record VerifyPaymentRequest(
        @NotNull PaymentStatus status,
        @Size(max = Payment.TRANSACTION_REF_MAX_LENGTH) String transactionRef,
        String errorMessage
) {}
