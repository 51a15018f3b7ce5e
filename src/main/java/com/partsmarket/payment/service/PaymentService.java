package com.partsmarket.payment.service;

import com.partsmarket.common.cache.IdempotencyCache;
import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import com.partsmarket.common.transaction.AfterCommit;
import com.partsmarket.notification.NotificationEvent;
import com.partsmarket.notification.NotificationKind;
import com.partsmarket.order.entity.Order;
import com.partsmarket.order.entity.OrderStatus;
import com.partsmarket.order.repository.OrderRepository;
import com.partsmarket.payment.dto.CreatePaymentRequest;
import com.partsmarket.payment.dto.CreatePaymentResponse;
import com.partsmarket.payment.dto.PaymentResponse;
import com.partsmarket.payment.dto.PaymentSnapshot;
import com.partsmarket.payment.dto.PaymentStatusResult;
import com.partsmarket.payment.dto.VerifyPaymentRequest;
import com.partsmarket.payment.entity.Payment;
import com.partsmarket.payment.entity.PaymentStatus;
import com.partsmarket.payment.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Payment workflow: opening a payment for an order awaiting payment, applying the
 * provider's verdict, refunding, and reading payments back.
 *
 * <h3>Idempotency</h3>
 * <p>Providers retry callbacks, so applying the status a payment already has returns the
 * same result and writes nothing. The cache answers most repeats without locking the
 * payment row; on a miss the locked payment row decides.</p>
 *
 * <h3>Cache contents</h3>
 * <p>The cache holds {@link PaymentSnapshot}s, which carry only payment-owned fields.
 * The order status in every answer is read from the order ledger, because another
 * payment of the same order may have moved the order since the entry was written.</p>
 *
 * <h3>Locking</h3>
 * <p>Payment row first, then order row, both {@code SELECT ... FOR UPDATE}. Of two
 * concurrent completions only one sees the order in PENDING_PAYMENT.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PaymentService {

    static final Duration PAYMENT_WINDOW = Duration.ofHours(24);

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final IdempotencyCache idempotencyCache;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${partsmarket.cache.payment-ttl-seconds:86400}")
    private long paymentCacheTtlSeconds;

    @Value("${partsmarket.frontend-url:http://localhost:3000}")
    private String frontendUrl;

    @Transactional
    public CreatePaymentResponse createPayment(CreatePaymentRequest request, Long userId) {
        Order order = orderRepository.findById(request.orderId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        if (!order.isOwnedBy(userId)) {
            log.warn("Payment rejected, order not owned by requester: orderId={}, userId={}",
                    order.getId(), userId);
            throw new BusinessException(ErrorCode.PAYMENT_ORDER_MISMATCH);
        }
        if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Order is not awaiting payment. Current status: " + order.getStatus());
        }
        if (request.amount().compareTo(order.getTotalAmount()) != 0) {
            log.warn("Payment rejected, amount mismatch: orderId={}, amount={}, total={}",
                    order.getId(), request.amount(), order.getTotalAmount());
            throw new BusinessException(ErrorCode.PAYMENT_AMOUNT_MISMATCH,
                    "Payment amount " + request.amount() + " does not match order total " + order.getTotalAmount());
        }

        Map<String, String> metadata = new HashMap<>();
        if (request.mobileMoneyPhone() != null && !request.mobileMoneyPhone().isBlank()) {
            metadata.put("mobileMoneyPhone", request.mobileMoneyPhone());
        }

        Payment payment = paymentRepository.save(Payment.builder()
                .orderId(order.getId())
                .amount(request.amount())
                .currency(request.currency())
                .method(request.method())
                .metadata(metadata)
                .build());

        cacheAfterCommit(payment);
        log.info("Payment created: paymentId={}, orderId={}, amount={} {}, method={}",
                payment.getId(), order.getId(), payment.getAmount(), payment.getCurrency(), payment.getMethod());

        return new CreatePaymentResponse(
                payment.getId(),
                order.getId(),
                payment.getStatus(),
                payment.getAmount(),
                payment.getCurrency(),
                LocalDateTime.now().plus(PAYMENT_WINDOW));
    }

    /**
     * Applies the provider's verdict to a PENDING payment.
     *
     * <p>COMPLETED moves the order from PENDING_PAYMENT to PROCESSING. FAILED leaves the
     * order awaiting payment so the customer can try again.</p>
     */
    @Transactional
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public PaymentStatusResult updatePaymentStatus(Long paymentId, VerifyPaymentRequest request) {
        PaymentStatus requested = request.status();
        if (requested != PaymentStatus.COMPLETED && requested != PaymentStatus.FAILED) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Payment can only be verified as COMPLETED or FAILED");
        }

        Optional<PaymentSnapshot> cached = idempotencyCache.get(cacheKey(paymentId), PaymentSnapshot.class);
        if (cached.isPresent() && cached.get().status() == requested) {
            log.info("Duplicate payment callback answered from cache: paymentId={}, status={}",
                    paymentId, requested);
            OrderStatus orderStatus = orderRepository.findStatusById(cached.get().orderId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
            return cached.get().toStatusResult(orderStatus);
        }

        Payment payment = paymentRepository.findByIdWithLock(paymentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
        Order order = orderRepository.findByIdWithLock(payment.getOrderId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        if (payment.getStatus() == requested) {
            log.warn("Duplicate payment callback: paymentId={}, status={}", paymentId, requested);
            cacheAfterCommit(payment);
            return PaymentResponse.of(payment, order).toStatusResult();
        }
        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "Payment is already " + payment.getStatus() + " and cannot become " + requested);
        }

        if (requested == PaymentStatus.COMPLETED) {
            if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
                throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                        "Order is not awaiting payment. Current status: " + order.getStatus());
            }
            payment.complete(request.transactionRef());
            order.startProcessing();
            eventPublisher.publishEvent(NotificationEvent.forPayment(
                    NotificationKind.PAYMENT_SUCCESS, order.getId(), payment.getId(), order.getUserId(),
                    Map.of("amount", payment.getAmount(), "currency", payment.getCurrency())));
            log.info("Payment completed: paymentId={}, orderId={}, transactionRef={}",
                    paymentId, order.getId(), request.transactionRef());
        } else {
            payment.fail(request.errorMessage());
            Map<String, Object> context = new HashMap<>();
            context.put("amount", payment.getAmount());
            context.put("currency", payment.getCurrency());
            context.put("failureReason", request.errorMessage());
            context.put("retryLink", frontendUrl + "/orders/" + order.getId() + "/payment");
            eventPublisher.publishEvent(NotificationEvent.forPayment(
                    NotificationKind.PAYMENT_FAILED, order.getId(), payment.getId(), order.getUserId(), context));
            log.warn("Payment failed: paymentId={}, orderId={}, reason={}",
                    paymentId, order.getId(), request.errorMessage());
        }

        cacheAfterCommit(payment);
        return PaymentResponse.of(payment, order).toStatusResult();
    }

    /**
     * Refunds a COMPLETED payment and marks its order REFUNDED.
     * Requests for payments of someone else's order are answered as not found.
     */
    @Transactional
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public PaymentStatusResult refundPayment(Long paymentId, Long userId, String reason) {
        Payment payment = paymentRepository.findByIdWithLock(paymentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
        Order order = orderRepository.findByIdWithLock(payment.getOrderId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        if (!order.isOwnedBy(userId)) {
            log.warn("Refund rejected, payment not visible to requester: paymentId={}, userId={}",
                    paymentId, userId);
            throw new BusinessException(ErrorCode.PAYMENT_NOT_FOUND);
        }
        if (payment.getStatus() == PaymentStatus.REFUNDED) {
            log.warn("Duplicate refund request: paymentId={}", paymentId);
            return PaymentResponse.of(payment, order).toStatusResult();
        }
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "Only completed payments can be refunded. Current status: " + payment.getStatus());
        }

        payment.refund(reason);
        order.refund();

        Map<String, Object> context = new HashMap<>();
        context.put("amount", payment.getAmount());
        context.put("currency", payment.getCurrency());
        context.put("reason", reason);
        eventPublisher.publishEvent(NotificationEvent.forPayment(
                NotificationKind.REFUND_PROCESSED, order.getId(), payment.getId(), order.getUserId(), context));

        cacheAfterCommit(payment);
        log.info("Payment refunded: paymentId={}, orderId={}, amount={}",
                paymentId, order.getId(), payment.getAmount());
        return PaymentResponse.of(payment, order).toStatusResult();
    }

    /**
     * Reads a payment, from the cache when possible. Ownership is always checked
     * against the order ledger.
     */
    public PaymentResponse getPayment(Long paymentId, Long userId) {
        Optional<PaymentSnapshot> cached = idempotencyCache.get(cacheKey(paymentId), PaymentSnapshot.class);
        if (cached.isPresent()) {
            OrderStatus orderStatus = orderRepository.findStatusByIdAndUserId(cached.get().orderId(), userId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
            return cached.get().toResponse(orderStatus);
        }

        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
        Order order = orderRepository.findById(payment.getOrderId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (!order.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_FOUND);
        }

        cacheAfterCommit(payment);
        return PaymentResponse.of(payment, order);
    }

    static String cacheKey(Long paymentId) {
        return "payment:" + paymentId;
    }

    // Taken after commit so the snapshot carries the flushed audit timestamps.
    private void cacheAfterCommit(Payment payment) {
        AfterCommit.run(() -> idempotencyCache.set(
                cacheKey(payment.getId()), PaymentSnapshot.of(payment), paymentCacheTtlSeconds));
    }
}
