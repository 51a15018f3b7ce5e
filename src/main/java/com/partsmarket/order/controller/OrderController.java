package com.partsmarket.order.controller;

import com.partsmarket.common.dto.ApiResponse;
import com.partsmarket.common.dto.PageResponse;
import com.partsmarket.order.dto.CreateOrderRequest;
import com.partsmarket.order.dto.OrderResponse;
import com.partsmarket.order.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * Order endpoints. The caller's identity arrives in {@code X-User-Id},
 * set by the authentication layer in front of this service.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderResponse> createOrder(@RequestHeader("X-User-Id") Long userId,
                                                  @Valid @RequestBody CreateOrderRequest request) {
        return ApiResponse.ok(orderService.createOrder(userId, request.items()));
    }

    @GetMapping
    public ApiResponse<PageResponse<OrderResponse>> listOrders(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize) {
        return ApiResponse.ok(orderService.listOrders(userId, page, pageSize));
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderResponse> getOrder(@RequestHeader("X-User-Id") Long userId,
                                               @PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrder(id, userId));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<OrderResponse> cancelOrder(@RequestHeader("X-User-Id") Long userId,
                                                  @PathVariable Long id) {
        return ApiResponse.ok(orderService.cancelOrder(id, userId), "Order cancelled");
    }

    @PostMapping("/{id}/checkout")
    public ApiResponse<OrderResponse> checkout(@RequestHeader("X-User-Id") Long userId,
                                               @PathVariable Long id) {
        return ApiResponse.ok(orderService.requestPayment(id, userId));
    }
}
