package com.partsmarket.payment.dto;

import com.partsmarket.payment.entity.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreatePaymentRequest(
        @NotNull Long orderId,
        @NotNull @DecimalMin(value = "0.01") BigDecimal amount,
        @NotNull PaymentMethod method,
        @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code") String currency,
        @Size(max = 32) String mobileMoneyPhone
) {}
