package com.shopflow.order.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * JPA Auditing (Order.createdAt / updatedAt)
 *
 * <p>감사 시각도 애플리케이션 Clock(UTC)으로 찍는다. 상태 전이 UPDATE와 방치 주문 기준 시각이
 * 같은 시계를 쓰도록 맞춘다.</p>
 * <p>애플리케이션 클래스가 아닌 별도 설정에 두어야 @WebMvcTest 슬라이스가 JPA 없이 뜬다.</p>
 */
@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "auditingDateTimeProvider")
public class JpaConfig {

    @Bean
    public DateTimeProvider auditingDateTimeProvider(ObjectProvider<Clock> clock) {
        return () -> Optional.of(LocalDateTime.now(clock.getIfAvailable(Clock::systemUTC)));
    }
}
