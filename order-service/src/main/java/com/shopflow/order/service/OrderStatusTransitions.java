package com.shopflow.order.service;

import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.event.OrderStatusPublisher;
import com.shopflow.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * 주문 상태 전이 = 조건부 UPDATE + 실시간 알림.
 *
 * <pre>
 *   claim(id, PENDING → PROCESSING)              capture 시작
 *   move(id, {PENDING, PROCESSING} → CANCELLED)  cancel
 *   move(id, PROCESSING → COMPLETED)             capture 완료
 *   fail(id)                                     종료 상태가 아니면 FAILED
 * </pre>
 * 전이에 성공했을 때만 알림을 발행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusTransitions {

    static final Set<OrderStatus> ACTIVE = EnumSet.of(OrderStatus.PENDING, OrderStatus.PROCESSING);

    private final OrderRepository orderRepository;
    private final OrderStatusPublisher statusPublisher;
    private final Clock clock;

    public boolean move(String orderId, String userId, Set<OrderStatus> from, OrderStatus to) {
        int updated = orderRepository.transitionStatus(orderId, from, to, LocalDateTime.now(clock));
        if (updated == 0) {
            log.info("Order status transition skipped: orderId={}, expected={}, target={}", orderId, from, to);
            return false;
        }
        log.info("Order status changed: orderId={}, status={}", orderId, to);
        statusPublisher.publish(orderId, userId, to);
        return true;
    }

    public boolean move(String orderId, String userId, OrderStatus from, OrderStatus to) {
        return move(orderId, userId, EnumSet.of(from), to);
    }

    /** 종료 상태가 아니면 FAILED. 이미 종료됐으면 그대로 둔다 */
    public boolean fail(String orderId, String userId) {
        return move(orderId, userId, ACTIVE, OrderStatus.FAILED);
    }

    public boolean cancel(String orderId, String userId) {
        return move(orderId, userId, ACTIVE, OrderStatus.CANCELLED);
    }
}
