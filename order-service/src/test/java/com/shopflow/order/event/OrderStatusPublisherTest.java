package com.shopflow.order.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.order.entity.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class OrderStatusPublisherTest {

    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1767225600000L), ZoneOffset.UTC);
    private final OrderStatusPublisher publisher = new OrderStatusPublisher(redisTemplate, new ObjectMapper(), clock);

    @Test
    @DisplayName("order:status 채널로 JSON 한 건을 발행한다")
    void publish_Json() {
        publisher.publish("order-1", "user-1", OrderStatus.COMPLETED);

        verify(redisTemplate).convertAndSend("order:status",
                "{\"orderId\":\"order-1\",\"status\":\"COMPLETED\",\"userId\":\"user-1\",\"timestamp\":1767225600000}");
    }

    @Test
    @DisplayName("Redis 장애는 주문 흐름으로 전파하지 않는다")
    void publish_RedisDown() {
        willThrow(new RedisConnectionFailureException("connection refused"))
                .given(redisTemplate).convertAndSend(eq(OrderStatusPublisher.CHANNEL), anyString());

        assertThatCode(() -> publisher.publish("order-1", "user-1", OrderStatus.FAILED))
                .doesNotThrowAnyException();
    }
}
