package com.shopflow.order.repository;

import com.shopflow.order.config.JpaConfig;
import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderItem;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.PaymentMethod;
import com.shopflow.order.entity.ShippingAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaConfig.class)
class OrderRepositoryTest {

    @Autowired
    private OrderRepository orderRepository;

    private Order saveOrder(String userId, PaymentMethod method) {
        Order order = Order.builder()
                .userId(userId)
                .cartId("cart-" + userId)
                .paymentMethod(method)
                .paymentReference(method == PaymentMethod.PAYPAL ? "PAYPAL-" + userId : null)
                .shippingAddress(new ShippingAddress("560001", "Bengaluru", "KA"))
                .build();
        order.addItem(OrderItem.builder()
                .productId("P1")
                .quantity(2)
                .unitPrice(BigDecimal.valueOf(500))
                .shippingCost(BigDecimal.valueOf(40))
                .estimatedDays(3)
                .shippingMode("standard")
                .category("electronics")
                .build());
        return orderRepository.saveAndFlush(order);
    }

    @Test
    @DisplayName("저장하면 항목, 총액, 감사 시각이 함께 남는다")
    void save_WithItems() {
        // Given
        Order saved = saveOrder("user-1", PaymentMethod.PAYPAL);

        // When
        Order found = orderRepository.findWithItemsById(saved.getId()).orElseThrow();

        // Then
        assertThat(found.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(found.getItems()).hasSize(1);
        assertThat(found.getTotalAmount()).isEqualByComparingTo("1040");
        assertThat(found.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("조건부 전이는 기대 상태일 때만 성공하고, 종료 상태에서는 아무것도 바꾸지 않는다")
    void transitionStatus_CompareAndSet() {
        // Given
        String id = saveOrder("user-1", PaymentMethod.PAYPAL).getId();
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);

        // When
        int claimed = orderRepository.transitionStatus(id, EnumSet.of(OrderStatus.PENDING), OrderStatus.PROCESSING, now);
        int claimedAgain = orderRepository.transitionStatus(id, EnumSet.of(OrderStatus.PENDING), OrderStatus.PROCESSING, now);
        int cancelled = orderRepository.transitionStatus(id,
                EnumSet.of(OrderStatus.PENDING, OrderStatus.PROCESSING), OrderStatus.CANCELLED, now);
        int completed = orderRepository.transitionStatus(id, EnumSet.of(OrderStatus.PROCESSING), OrderStatus.COMPLETED, now);

        // Then
        assertThat(claimed).isEqualTo(1);
        assertThat(claimedAgain).isZero();
        assertThat(cancelled).isEqualTo(1);
        assertThat(completed).isZero();
        assertThat(orderRepository.findStatusById(id)).contains(OrderStatus.CANCELLED);
    }

    @Test
    @DisplayName("방치 주문 조회는 기준 시각 이전의 PENDING PayPal 주문만 찾는다")
    void findStaleIds() {
        // Given
        String stalePaypal = saveOrder("user-1", PaymentMethod.PAYPAL).getId();
        saveOrder("user-2", PaymentMethod.COD);
        String completed = saveOrder("user-3", PaymentMethod.PAYPAL).getId();
        orderRepository.transitionStatus(completed, EnumSet.of(OrderStatus.PENDING), OrderStatus.COMPLETED,
                LocalDateTime.now(ZoneOffset.UTC));

        // When
        List<String> stale = orderRepository.findStaleIds(OrderStatus.PENDING, PaymentMethod.PAYPAL,
                LocalDateTime.now(ZoneOffset.UTC).plusMinutes(1), PageRequest.of(0, 10));
        List<String> notYet = orderRepository.findStaleIds(OrderStatus.PENDING, PaymentMethod.PAYPAL,
                LocalDateTime.now(ZoneOffset.UTC).minusHours(1), PageRequest.of(0, 10));

        // Then
        assertThat(stale).containsExactly(stalePaypal);
        assertThat(notYet).isEmpty();
    }

    @Test
    @DisplayName("사용자별 목록은 상태로 거를 수 있고 페이지 정보를 돌려준다")
    void findByUser_Paged() {
        // Given
        for (int i = 0; i < 3; i++) {
            saveOrder("user-1", PaymentMethod.COD);
        }
        String cancelled = saveOrder("user-1", PaymentMethod.PAYPAL).getId();
        orderRepository.transitionStatus(cancelled, EnumSet.of(OrderStatus.PENDING), OrderStatus.CANCELLED,
                LocalDateTime.now(ZoneOffset.UTC));
        saveOrder("user-2", PaymentMethod.COD);

        // When
        Page<Order> firstPage = orderRepository.findByUserId("user-1", PageRequest.of(0, 2));
        Page<Order> onlyCancelled = orderRepository.findByUserIdAndStatus("user-1", OrderStatus.CANCELLED,
                PageRequest.of(0, 10));

        // Then
        assertThat(firstPage.getContent()).hasSize(2);
        assertThat(firstPage.getTotalElements()).isEqualTo(4);
        assertThat(firstPage.getTotalPages()).isEqualTo(2);
        assertThat(onlyCancelled.getContent()).extracting(Order::getId).containsExactly(cancelled);
    }
}
