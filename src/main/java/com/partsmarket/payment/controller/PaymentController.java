package com.partsmarket.payment.controller;

import com.partsmarket.common.dto.ApiResponse;
import com.partsmarket.payment.dto.CreatePaymentRequest;
import com.partsmarket.payment.dto.CreatePaymentResponse;
import com.partsmarket.payment.dto.PaymentResponse;
import com.partsmarket.payment.dto.PaymentStatusResult;
import com.partsmarket.payment.dto.RefundPaymentRequest;
import com.partsmarket.payment.dto.VerifyPaymentRequest;
import com.partsmarket.payment.service.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * Payment endpoints.
 *
 * <h3>Callers</h3>
 * <pre>
 * POST /api/payments              customer opens a payment for an order awaiting payment
 * POST /api/payments/{id}/verify  payment provider reports COMPLETED or FAILED
 * POST /api/payments/{id}/refund  customer refunds a completed payment
 * GET  /api/payments/{id}         customer reads a payment with its order's current status
 * </pre>
 *
 * Customer calls carry the caller's id in {@code X-User-Id}, set by the gateway.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<CreatePaymentResponse> createPayment(@RequestHeader("X-User-Id") Long userId,
                                                            @Valid @RequestBody CreatePaymentRequest request) {
        return ApiResponse.ok(paymentService.createPayment(request, userId));
    }

    /** Provider callback; authenticated upstream by the provider's signature, not by user. */
    @PostMapping("/{id}/verify")
    public ApiResponse<PaymentStatusResult> verifyPayment(@PathVariable Long id,
                                                          @Valid @RequestBody VerifyPaymentRequest request) {
        return ApiResponse.ok(paymentService.updatePaymentStatus(id, request));
    }

    /** The body is optional; without it the refund is recorded with no reason. */
    @PostMapping("/{id}/refund")
    public ApiResponse<PaymentStatusResult> refundPayment(@RequestHeader("X-User-Id") Long userId,
                                                          @PathVariable Long id,
                                                          @Valid @RequestBody(required = false) RefundPaymentRequest request) {
        String reason = request == null ? null : request.reason();
        return ApiResponse.ok(paymentService.refundPayment(id, userId, reason), "Refund processed");
    }

    @GetMapping("/{id}")
    public ApiResponse<PaymentResponse> getPayment(@RequestHeader("X-User-Id") Long userId,
                                                   @PathVariable Long id) {
        return ApiResponse.ok(paymentService.getPayment(id, userId));
    }
}
