package com.partsmarket.order.entity;

import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A customer's order and its lines.
 *
 * <h3>Status changes</h3>
 * Status only moves through the transition methods, which enforce the graph in
 * {@link OrderStatus}. Stock is not touched here; the services reserve and release it
 * in the same transaction as the status change.
 *
 * <h3>Total</h3>
 * {@code totalAmount} is the sum of the line totals, recomputed whenever a line is added.
 * Prices are captured on the lines at order time, so later catalog changes do not move it.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_created", columnList = "user_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_seq")
    @SequenceGenerator(name = "order_seq", sequenceName = "order_seq", allocationSize = 50)
    private Long id;

    // Owner; every read and write checks it.
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    // Concurrent checkout, cancel and payment on the same order collide here.
    @Version
    private Long version;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Order(Long userId) {
        this.userId = userId;
        this.status = OrderStatus.PENDING;
        this.totalAmount = BigDecimal.ZERO;
    }

    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
        recalculateTotal();
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    public void requestPayment() {
        transitionTo(OrderStatus.PENDING_PAYMENT);
    }

    public void startProcessing() {
        transitionTo(OrderStatus.PROCESSING);
    }

    public void cancel() {
        transitionTo(OrderStatus.CANCELLED);
    }

    public void refund() {
        transitionTo(OrderStatus.REFUNDED);
    }

    /**
     * Line quantities summed per part, the amounts a cancellation gives back.
     */
    public Map<Long, Integer> quantitiesByPart() {
        Map<Long, Integer> quantities = new TreeMap<>();
        for (OrderItem item : items) {
            quantities.merge(item.getPart().getId(), item.getQuantity(), Math::addExact);
        }
        return quantities;
    }

    private void transitionTo(OrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Cannot change order status from " + status + " to " + next);
        }
        this.status = next;
    }

    private void recalculateTotal() {
        this.totalAmount = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order other)) return false;
        return id != null && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
