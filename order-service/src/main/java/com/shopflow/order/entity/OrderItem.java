package com.shopflow.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * 주문 항목 - Order 애그리거트의 구성 요소
 *
 * <ul>
 *   <li>productId만 저장 (카탈로그/재고 서비스의 ID, FK 없음)</li>
 *   <li>unitPrice, shippingCost는 주문 시점 스냅샷. 이후 가격이 바뀌어도 주문 금액은 불변</li>
 * </ul>
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_item_seq")
    @SequenceGenerator(name = "order_item_seq", sequenceName = "order_item_seq", allocationSize = 50)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id")
    @Setter(AccessLevel.PACKAGE)  // Order.addItem()에서만 설정
    private Order order;

    @Column(nullable = false, length = 64)
    private String productId;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal shippingCost;

    private int estimatedDays;

    @Column(length = 32)
    private String shippingMode;

    @Column(length = 64)
    private String category;

    @Builder
    public OrderItem(String productId, int quantity, BigDecimal unitPrice, BigDecimal shippingCost,
                     int estimatedDays, String shippingMode, String category) {
        this.productId = productId;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.shippingCost = shippingCost == null ? BigDecimal.ZERO : shippingCost;
        this.estimatedDays = estimatedDays;
        this.shippingMode = shippingMode;
        this.category = category;
    }

    /** 소계: 단가 x 수량 + 배송비 */
    public BigDecimal getLineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity)).add(shippingCost);
    }
}
