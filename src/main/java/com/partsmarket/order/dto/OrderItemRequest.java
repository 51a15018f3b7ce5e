package com.partsmarket.order.dto;

import com.partsmarket.order.entity.OrderItem;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * One requested line. The same part may appear on several lines of an order.
 *
 * @param partId   part to reserve
 * @param quantity units for this line, 1 to {@value OrderItem#MAX_QUANTITY}
 */
public record OrderItemRequest(
        @NotNull Long partId,
        @NotNull
        @Min(value = 1, message = "Quantity must be at least 1")
        @Max(value = OrderItem.MAX_QUANTITY, message = "Quantity must be at most " + OrderItem.MAX_QUANTITY)
        Integer quantity
) {}
