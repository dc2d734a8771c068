package com.shopflow.order.dto;

import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderItem;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.PaymentMethod;
import com.shopflow.order.entity.ShippingAddress;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/** 주문 조회 응답. 엔티티를 그대로 직렬화하지 않는다 (지연 로딩/순환 참조 방지) */
public record OrderResponse(
        String orderId,
        String userId,
        OrderStatus status,
        PaymentMethod paymentMethod,
        BigDecimal totalAmount,
        String paymentReference,
        Address shippingAddress,
        List<Item> items,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getUserId(),
                order.getStatus(),
                order.getPaymentMethod(),
                order.getTotalAmount(),
                order.getPaymentReference(),
                Address.from(order.getShippingAddress()),
                order.getItems().stream().map(Item::from).toList(),
                order.getCreatedAt(),
                order.getUpdatedAt());
    }

    public record Item(String productId, int quantity, BigDecimal unitPrice, BigDecimal shippingCost,
                       int estimatedDays, String shippingMode) {
        static Item from(OrderItem item) {
            return new Item(item.getProductId(), item.getQuantity(), item.getUnitPrice(),
                    item.getShippingCost(), item.getEstimatedDays(), item.getShippingMode());
        }
    }

    public record Address(String zipCode, String city, String state) {
        static Address from(ShippingAddress address) {
            return address == null ? null : new Address(address.getZipCode(), address.getCity(), address.getState());
        }
    }
}
