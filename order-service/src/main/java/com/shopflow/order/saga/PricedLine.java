package com.shopflow.order.saga;

import com.shopflow.order.entity.OrderItem;

import java.math.BigDecimal;

/** 배송비 견적까지 끝난 주문 한 줄 */
public record PricedLine(String productId, int quantity, BigDecimal unitPrice, BigDecimal shippingCost,
                         int estimatedDays, String shippingMode, String category) {

    public BigDecimal total() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity)).add(shippingCost);
    }

    public OrderItem toOrderItem() {
        return OrderItem.builder()
                .productId(productId)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .shippingCost(shippingCost)
                .estimatedDays(estimatedDays)
                .shippingMode(shippingMode)
                .category(category)
                .build();
    }
}
