package com.shopflow.order.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 주문(Order) 엔티티 - 주문 도메인의 애그리거트 루트
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>id: 생성 시점에 만드는 UUID 문자열. 저장 전에도 재고 예약 키로 쓸 수 있다</li>
 *   <li>상태 변경은 엔티티 setter가 아닌 {@code OrderRepository.transitionStatus()} 조건부 UPDATE로만 한다
 *       → 동시에 들어온 capture/cancel 중 정확히 하나만 이긴다</li>
 *   <li>@Version: 조건부 UPDATE가 version도 올리므로 오래된 엔티티의 덮어쓰기를 감지</li>
 *   <li>복합 인덱스(status, createdAt): 방치된 결제 대기 주문 조회용</li>
 *   <li>주문은 삭제하지 않는다</li>
 * </ul>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_id", columnList = "userId"),
        @Index(name = "idx_order_status_created", columnList = "status, createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @Column(length = 36)
    private String id;

    @Version
    private Long version;

    @Column(nullable = false, length = 64)
    private String userId;

    @Column(length = 64)
    private String cartId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    // PayPal 주문 ID (COD는 null)
    @Column(length = 64)
    private String paymentReference;

    @Embedded
    private ShippingAddress shippingAddress;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Order(String userId, String cartId, PaymentMethod paymentMethod,
                 String paymentReference, ShippingAddress shippingAddress) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.cartId = cartId;
        this.paymentMethod = paymentMethod;
        this.paymentReference = paymentReference;
        this.shippingAddress = shippingAddress;
        this.status = OrderStatus.PENDING;
        this.totalAmount = BigDecimal.ZERO;
    }

    /** 주문 항목 추가 + 양방향 관계 설정 + 총액 재계산 */
    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
        this.totalAmount = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
