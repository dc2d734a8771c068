package com.shopflow.order.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.order.entity.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redis Pub/Sub 주문 상태 발행자 - 실시간 알림용
 *
 * <p>주문 상태가 바뀔 때마다 {@code order:status} 채널로 한 건씩 발행한다.
 * 구독자(알림/SSE 서버)가 없으면 메시지는 버려진다 (fire-and-forget).</p>
 *
 * <pre>
 *   {"orderId":"3f0c...","status":"COMPLETED","userId":"u-1","timestamp":1767225600000}
 * </pre>
 *
 * 발행 실패는 주문 흐름을 막지 않는다. 상태의 원본은 DB이고 알림은 부가 기능이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusPublisher {

    public static final String CHANNEL = "order:status";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void publish(String orderId, String userId, OrderStatus status) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("orderId", orderId);
        message.put("status", status.name());
        message.put("userId", userId);
        message.put("timestamp", clock.millis());

        try {
            redisTemplate.convertAndSend(CHANNEL, objectMapper.writeValueAsString(message));
            log.debug("Order status published: orderId={}, status={}", orderId, status);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Order status notification dropped: orderId={}, status={}, error={}",
                    orderId, status, e.getMessage());
        }
    }
}
