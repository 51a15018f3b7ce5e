package com.partsmarket.payment.entity;

import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A payment attempt for one order. An order may collect several attempts
 * (a failed one followed by a retry), but only one of them can complete.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payment_order", columnList = "order_id"),
        @Index(name = "idx_payment_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Payment {

    public static final String DEFAULT_CURRENCY = "XOF";

    /** Longest provider reference the column holds. */
    public static final int TRANSACTION_REF_MAX_LENGTH = 255;

    /** Failure and refund reasons are cut to this length so metadata always fits its column. */
    public static final int REASON_MAX_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "payment_seq")
    @SequenceGenerator(name = "payment_seq", sequenceName = "payment_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    // Plain id, no association; the order is loaded with its own lock when needed.
    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    // Provider reference, set on completion.
    @Column(length = TRANSACTION_REF_MAX_LENGTH)
    private String transactionRef;

    // Free-form details: mobileMoneyPhone, failureReason, refundReason.
    @Convert(converter = MetadataConverter.class)
    @Column(length = 2000)
    private Map<String, String> metadata = new HashMap<>();

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Payment(Long orderId, BigDecimal amount, String currency, PaymentMethod method,
                   Map<String, String> metadata) {
        this.orderId = orderId;
        this.amount = amount;
        this.currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency;
        this.method = method;
        this.status = PaymentStatus.PENDING;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
    }

    public void complete(String transactionRef) {
        transitionTo(PaymentStatus.COMPLETED);
        this.transactionRef = transactionRef;
    }

    public void fail(String reason) {
        transitionTo(PaymentStatus.FAILED);
        putMetadata("failureReason", truncate(reason));
    }

    public void refund(String reason) {
        transitionTo(PaymentStatus.REFUNDED);
        putMetadata("refundReason", truncate(reason));
    }

    public Map<String, String> getMetadata() {
        return metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
    }

    private void transitionTo(PaymentStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "Cannot change payment status from " + status + " to " + next);
        }
        this.status = next;
    }

    private static String truncate(String reason) {
        return reason == null || reason.length() <= REASON_MAX_LENGTH
                ? reason
                : reason.substring(0, REASON_MAX_LENGTH);
    }

    // Replaced rather than mutated so dirty checking sees the change.
    private void putMetadata(String key, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        Map<String, String> updated = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        updated.put(key, value);
        this.metadata = updated;
    }
}
