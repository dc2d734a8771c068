package com.shopflow.order.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * ShedLock 분산 락 - 여러 order-service 인스턴스 중 하나만 스케줄 작업 실행
 *
 * <pre>
 *   Instance A: @Scheduled → SET lock:order-service:abandonedCheckoutSweep NX → 획득 → 실행
 *   Instance B: @Scheduled → SET ... NX → 실패 → 건너뜀
 * </pre>
 *
 * @see com.shopflow.order.scheduler.AbandonedCheckoutSweeper
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "5m")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(RedisConnectionFactory connectionFactory) {
        return new RedisLockProvider(connectionFactory, "order-service");
    }
}
