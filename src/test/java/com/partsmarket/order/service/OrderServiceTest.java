package com.partsmarket.order.service;

import com.partsmarket.common.dto.PageResponse;
import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import com.partsmarket.common.exception.ErrorKind;
import com.partsmarket.notification.NotificationEvent;
import com.partsmarket.notification.NotificationKind;
import com.partsmarket.order.dto.OrderItemRequest;
import com.partsmarket.order.dto.OrderItemResponse;
import com.partsmarket.order.dto.OrderResponse;
import com.partsmarket.order.entity.Order;
import com.partsmarket.order.entity.OrderItem;
import com.partsmarket.order.entity.OrderStatus;
import com.partsmarket.order.repository.OrderRepository;
import com.partsmarket.part.entity.Part;
import com.partsmarket.part.service.InventoryService;
import com.partsmarket.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final long USER_ID = 7L;

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private InventoryService inventoryService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private OrderService orderService;

    @Test
    @DisplayName("order creation reserves stock, prices the lines and announces the order")
    void createOrder_Success() {
        // Given
        Part brakePad = TestFixtures.part(1L, "Brake pad", "25.00", 10);
        Part oilFilter = TestFixtures.part(2L, "Oil filter", "15.50", 10);
        given(inventoryService.reserve(Map.of(1L, 2, 2L, 1)))
                .willReturn(Map.of(1L, brakePad, 2L, oilFilter));
        given(orderRepository.save(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        OrderResponse response = orderService.createOrder(USER_ID, List.of(
                new OrderItemRequest(1L, 2),
                new OrderItemRequest(2L, 1)));

        // Then
        assertThat(response.status()).isEqualTo(OrderStatus.PENDING);
        assertThat(response.totalAmount()).isEqualByComparingTo(new BigDecimal("65.50"));
        assertThat(response.items()).hasSize(2);
        assertThat(response.items().get(0).partTitle()).isEqualTo("Brake pad");
        assertThat(response.items().get(0).lineTotal()).isEqualByComparingTo("50.00");

        ArgumentCaptor<NotificationEvent> event = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().kind()).isEqualTo(NotificationKind.ORDER_CONFIRMATION);
        assertThat(event.getValue().recipientUserId()).isEqualTo(USER_ID);
    }

    @Test
    @DisplayName("repeated part ids are checked against stock as one summed quantity")
    void createOrder_DuplicatePartIds_SummedBeforeReservation() {
        // Given: 8 + 5 of the same part, only 10 in stock
        given(inventoryService.reserve(Map.of(1L, 13)))
                .willThrow(new BusinessException(ErrorCode.INSUFFICIENT_STOCK));

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(USER_ID, List.of(
                new OrderItemRequest(1L, 8),
                new OrderItemRequest(1L, 5))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.INSUFFICIENT_STOCK));

        verify(orderRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("each requested line is kept as its own item even when parts repeat")
    void createOrder_DuplicatePartIds_KeepsLines() {
        Part brakePad = TestFixtures.part(1L, "Brake pad", "25.00", 10);
        given(inventoryService.reserve(Map.of(1L, 3))).willReturn(Map.of(1L, brakePad));
        given(orderRepository.save(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        OrderResponse response = orderService.createOrder(USER_ID, List.of(
                new OrderItemRequest(1L, 1),
                new OrderItemRequest(1L, 2)));

        assertThat(response.items()).extracting(OrderItemResponse::quantity).containsExactly(1, 2);
        assertThat(response.totalAmount()).isEqualByComparingTo("75.00");
    }

    @Test
    void createOrder_EmptyItems_InvalidInput() {
        assertThatThrownBy(() -> orderService.createOrder(USER_ID, List.of()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));

        verifyNoInteractions(inventoryService, orderRepository, eventPublisher);
    }

    @Test
    @DisplayName("lines of Integer.MAX_VALUE are rejected before any stock is touched")
    void createOrder_HugeQuantities_InvalidInput() {
        assertThatThrownBy(() -> orderService.createOrder(USER_ID, List.of(
                new OrderItemRequest(1L, Integer.MAX_VALUE),
                new OrderItemRequest(1L, Integer.MAX_VALUE))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));

        verifyNoInteractions(inventoryService, orderRepository, eventPublisher);
    }

    @Test
    @DisplayName("a per-part sum past the int range is rejected instead of wrapping around")
    void createOrder_SummedQuantityOverflows_InvalidInput() {
        List<OrderItemRequest> lines = Collections.nCopies(
                Integer.MAX_VALUE / OrderItem.MAX_QUANTITY + 1, new OrderItemRequest(1L, OrderItem.MAX_QUANTITY));

        assertThatThrownBy(() -> orderService.createOrder(USER_ID, lines))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Requested quantity for one part is too large")
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));

        verifyNoInteractions(inventoryService);
    }

    @Test
    void createOrder_ZeroQuantity_InvalidInput() {
        assertThatThrownBy(() -> orderService.createOrder(USER_ID, List.of(new OrderItemRequest(1L, 0))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));

        verifyNoInteractions(inventoryService);
    }

    @Test
    @DisplayName("cancelling returns exactly the order's own quantities")
    void cancelOrder_Success() {
        // Given
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 3);
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        // When
        OrderResponse response = orderService.cancelOrder(1L, USER_ID);

        // Then
        assertThat(response.status()).isEqualTo(OrderStatus.CANCELLED);
        verify(inventoryService).release(Map.of(1L, 3));

        ArgumentCaptor<NotificationEvent> event = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().kind()).isEqualTo(NotificationKind.ORDER_CANCELLED);
    }

    @Test
    void cancelOrder_NotFound() {
        given(orderRepository.findByIdWithLock(99L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> orderService.cancelOrder(99L, USER_ID))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ORDER_NOT_FOUND));
    }

    @Test
    @DisplayName("another user's order cannot be cancelled")
    void cancelOrder_NotOwner_Forbidden() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 3);
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.cancelOrder(1L, 8L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        verifyNoInteractions(inventoryService);
    }

    @Test
    @DisplayName("only PENDING orders can be cancelled; stock is left alone otherwise")
    void cancelOrder_NotPending_InvalidState() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 3);
        order.requestPayment();
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.cancelOrder(1L, USER_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Only PENDING orders can be cancelled")
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.INVALID_STATE));

        verify(inventoryService, never()).release(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void requestPayment_MovesToPendingPayment() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 1);
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        OrderResponse response = orderService.requestPayment(1L, USER_ID);

        assertThat(response.status()).isEqualTo(OrderStatus.PENDING_PAYMENT);
    }

    @Test
    @DisplayName("checking out twice leaves the order awaiting payment")
    void requestPayment_Repeated_NoChange() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 1);
        order.requestPayment();
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        OrderResponse response = orderService.requestPayment(1L, USER_ID);

        assertThat(response.status()).isEqualTo(OrderStatus.PENDING_PAYMENT);
    }

    @Test
    void requestPayment_Cancelled_InvalidState() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 1);
        order.cancel();
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.requestPayment(1L, USER_ID))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_ORDER_STATUS));
    }

    @Test
    void getOrder_NotOwner_Forbidden() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 1);
        given(orderRepository.findWithItemsById(1L)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.getOrder(1L, 8L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ORDER_ACCESS_DENIED));
    }

    @Test
    void getOrder_ReturnsItemsWithPartTitles() {
        Order order = TestFixtures.order(1L, USER_ID, TestFixtures.part(1L, "Brake pad", "25.00", 7), 2);
        given(orderRepository.findWithItemsById(1L)).willReturn(Optional.of(order));

        OrderResponse response = orderService.getOrder(1L, USER_ID);

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.items()).singleElement()
                .satisfies(item -> assertThat(item.partTitle()).isEqualTo("Brake pad"));
    }

    @Test
    @DisplayName("listing reports 1-based paging and whether more pages follow")
    void listOrders_Paged() {
        Part part = TestFixtures.part(1L, "Brake pad", "25.00", 7);
        List<Order> firstPage = List.of(
                TestFixtures.order(3L, USER_ID, part, 1),
                TestFixtures.order(2L, USER_ID, part, 1));
        given(orderRepository.findByUserIdOrderByCreatedAtDescIdDesc(USER_ID, PageRequest.of(0, 2)))
                .willReturn(new PageImpl<>(firstPage, PageRequest.of(0, 2), 3));

        PageResponse<OrderResponse> page = orderService.listOrders(USER_ID, 1, 2);

        assertThat(page.items()).extracting(OrderResponse::id).containsExactly(3L, 2L);
        assertThat(page.page()).isEqualTo(1);
        assertThat(page.pageSize()).isEqualTo(2);
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void listOrders_PageSizeTooLarge_InvalidInput() {
        assertThatThrownBy(() -> orderService.listOrders(USER_ID, 1, OrderService.MAX_PAGE_SIZE + 1))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }
}
