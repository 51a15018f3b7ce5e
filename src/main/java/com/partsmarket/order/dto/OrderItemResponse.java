package com.partsmarket.order.dto;

import com.partsmarket.order.entity.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
        Long id,
        Long partId,
        String partTitle,
        Long vendorId,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal lineTotal
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getId(),
                item.getPart().getId(),
                item.getPart().getTitle(),
                item.getVendorId(),
                item.getQuantity(),
                item.getUnitPrice(),
                item.getLineTotal());
    }
}
