package com.partsmarket.support;

import com.partsmarket.order.entity.Order;
import com.partsmarket.order.entity.OrderItem;
import com.partsmarket.part.entity.Part;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static Part part(long id, String title, String price, int stock) {
        Part part = Part.builder()
                .title(title)
                .price(new BigDecimal(price))
                .stock(stock)
                .vendorId(100L)
                .build();
        ReflectionTestUtils.setField(part, "id", id);
        return part;
    }

    public static Order order(long id, long userId, Part part, int quantity) {
        Order order = Order.builder().userId(userId).build();
        order.addItem(OrderItem.builder().part(part).quantity(quantity).build());
        ReflectionTestUtils.setField(order, "id", id);
        return order;
    }
}
