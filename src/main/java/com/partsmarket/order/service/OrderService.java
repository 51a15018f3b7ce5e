package com.partsmarket.order.service;

import com.partsmarket.common.dto.PageResponse;
import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import com.partsmarket.notification.NotificationEvent;
import com.partsmarket.notification.NotificationKind;
import com.partsmarket.order.dto.OrderItemRequest;
import com.partsmarket.order.dto.OrderResponse;
import com.partsmarket.order.entity.Order;
import com.partsmarket.order.entity.OrderItem;
import com.partsmarket.order.entity.OrderStatus;
import com.partsmarket.order.repository.OrderRepository;
import com.partsmarket.part.entity.Part;
import com.partsmarket.part.service.InventoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Order workflow: placing, cancelling, checking out and reading orders.
 *
 * <h3>Transactions</h3>
 * Each mutation is a single transaction over the inventory and the order ledger.
 * Either the order row, its items and every stock change are committed together,
 * or none of them are. Customer notifications are published as events and only
 * leave the process after commit.
 *
 * <h3>Concurrency</h3>
 * Orders are loaded with a pessimistic lock before a status change, so a cancel racing a
 * checkout or a payment sees the other's result. A lost optimistic lock surfaces as
 * {@link ConcurrencyFailureException} and the whole method is retried with backoff.
 *
 * <h3>Ownership</h3>
 * Every operation takes the caller's user id. Another user's order answers
 * {@code ORDER_ACCESS_DENIED}; the order is left untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final InventoryService inventoryService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Places an order in PENDING and reserves its stock.
     *
     * <p>The same part may appear on several lines; its quantities are summed before
     * the stock check, and each line is still stored as its own item. The total uses
     * the parts' current prices.</p>
     */
    @Transactional
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public OrderResponse createOrder(Long userId, List<OrderItemRequest> items) {
        validateItems(items);
        log.info("Creating order: userId={}, lines={}", userId, items.size());

        Map<Long, Integer> requested = sumByPart(items);

        Map<Long, Part> parts = inventoryService.reserve(requested);

        Order order = Order.builder()
                .userId(userId)
                .build();
        for (OrderItemRequest line : items) {
            order.addItem(OrderItem.builder()
                    .part(parts.get(line.partId()))
                    .quantity(line.quantity())
                    .build());
        }
        order = orderRepository.save(order);

        eventPublisher.publishEvent(NotificationEvent.forOrder(
                NotificationKind.ORDER_CONFIRMATION, order.getId(), userId,
                Map.of("totalAmount", order.getTotalAmount(), "itemCount", order.getItems().size())));

        log.info("Order created: orderId={}, userId={}, total={}",
                order.getId(), userId, order.getTotalAmount());
        return OrderResponse.from(order);
    }

    /**
     * Cancels a PENDING order and gives its stock back, line for line.
     */
    @Transactional
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public OrderResponse cancelOrder(Long orderId, Long userId) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        verifyOwner(order, userId);

        if (order.getStatus() != OrderStatus.PENDING) {
            log.warn("Cancel rejected: orderId={}, status={}", orderId, order.getStatus());
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Cannot cancel order with status: " + order.getStatus()
                            + ". Only PENDING orders can be cancelled.");
        }

        order.cancel();
        inventoryService.release(order.quantitiesByPart());

        eventPublisher.publishEvent(NotificationEvent.forOrder(
                NotificationKind.ORDER_CANCELLED, order.getId(), userId,
                Map.of("totalAmount", order.getTotalAmount())));

        log.info("Order cancelled: orderId={}", orderId);
        return OrderResponse.from(order);
    }

    /**
     * Checkout: moves a PENDING order to PENDING_PAYMENT so a payment can be opened for it.
     * Repeating the call on an order that is already awaiting payment changes nothing.
     */
    @Transactional
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public OrderResponse requestPayment(Long orderId, Long userId) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        verifyOwner(order, userId);

        if (order.getStatus() == OrderStatus.PENDING_PAYMENT) {
            return OrderResponse.from(order);
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Cannot check out order with status: " + order.getStatus());
        }

        order.requestPayment();
        log.info("Order awaiting payment: orderId={}, total={}", orderId, order.getTotalAmount());
        return OrderResponse.from(order);
    }

    public OrderResponse getOrder(Long orderId, Long userId) {
        Order order = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        verifyOwner(order, userId);
        return OrderResponse.from(order);
    }

    /**
     * The user's orders, newest first.
     *
     * @param page     1-based page number
     * @param pageSize between 1 and {@value #MAX_PAGE_SIZE}
     */
    public PageResponse<OrderResponse> listOrders(Long userId, int page, int pageSize) {
        if (page < 1 || pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "page must be >= 1 and pageSize between 1 and " + MAX_PAGE_SIZE);
        }
        return PageResponse.from(orderRepository
                .findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(page - 1, pageSize))
                .map(OrderResponse::from));
    }

    private void validateItems(List<OrderItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order must contain at least one item");
        }
        for (OrderItemRequest line : items) {
            if (line == null || line.partId() == null || line.quantity() == null
                    || line.quantity() <= 0 || line.quantity() > OrderItem.MAX_QUANTITY) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Each item needs a partId and a quantity between 1 and " + OrderItem.MAX_QUANTITY);
            }
        }
    }

    private Map<Long, Integer> sumByPart(List<OrderItemRequest> items) {
        Map<Long, Integer> requested = new TreeMap<>();
        try {
            for (OrderItemRequest line : items) {
                requested.merge(line.partId(), line.quantity(), Math::addExact);
            }
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Requested quantity for one part is too large");
        }
        return requested;
    }

    private void verifyOwner(Order order, Long userId) {
        if (!order.isOwnedBy(userId)) {
            log.warn("Order access denied: orderId={}, userId={}", order.getId(), userId);
            throw new BusinessException(ErrorCode.ORDER_ACCESS_DENIED);
        }
    }
}
