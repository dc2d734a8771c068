package com.shopflow.order.saga;

import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.repository.OrderRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * 맵 기반 OrderRepository 목. transitionStatus는 DB 조건부 UPDATE처럼 원자적으로 동작한다.
 */
class InMemoryOrders {

    private final Map<String, Order> orders = new HashMap<>();
    private final OrderRepository repository = mock(OrderRepository.class);

    @SuppressWarnings("unchecked")
    InMemoryOrders() {
        given(repository.save(any(Order.class))).willAnswer(invocation -> {
            Order order = invocation.getArgument(0);
            synchronized (orders) {
                orders.put(order.getId(), order);
            }
            return order;
        });
        given(repository.findWithItemsById(anyString()))
                .willAnswer(invocation -> Optional.ofNullable(find(invocation.getArgument(0))));
        given(repository.findStatusById(anyString()))
                .willAnswer(invocation -> Optional.ofNullable(find(invocation.getArgument(0))).map(Order::getStatus));
        given(repository.transitionStatus(anyString(), anyCollection(), any(OrderStatus.class), any(LocalDateTime.class)))
                .willAnswer(invocation -> {
                    String id = invocation.getArgument(0);
                    Collection<OrderStatus> from = invocation.getArgument(1);
                    OrderStatus to = invocation.getArgument(2);
                    synchronized (orders) {
                        Order order = orders.get(id);
                        if (order == null || !from.contains(order.getStatus())) {
                            return 0;
                        }
                        ReflectionTestUtils.setField(order, "status", to);
                        return 1;
                    }
                });
    }

    OrderRepository repository() {
        return repository;
    }

    Order find(String orderId) {
        synchronized (orders) {
            return orders.get(orderId);
        }
    }

    OrderStatus statusOf(String orderId) {
        synchronized (orders) {
            return orders.get(orderId).getStatus();
        }
    }

    int size() {
        synchronized (orders) {
            return orders.size();
        }
    }
}
