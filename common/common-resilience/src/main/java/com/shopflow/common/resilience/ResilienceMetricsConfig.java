package com.shopflow.common.resilience;

import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRateLimiterMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j 메트릭 설정 (Micrometer 바인딩)
 *
 * <p>order-service가 사용하는 Resilience4j 인스턴스 메트릭을 Micrometer에 등록한다.
 * {@code /actuator/prometheus}에서 수집된다.</p>
 *
 * <pre>
 *   ┌──────────────────────┬────────────────────┬───────────────────────────────────────┐
 *   │ 인스턴스             │ 패턴               │ 보호 대상                             │
 *   ├──────────────────────┼────────────────────┼───────────────────────────────────────┤
 *   │ catalogService       │ Circuit Breaker    │ 상품 카테고리 조회 (실패 시 기본값)   │
 *   │ pricingService       │ Retry              │ 배송비/배송일 계산                    │
 *   │ orderCreation        │ Bulkhead           │ 체크아웃 Saga 동시 실행 수            │
 *   │ orderApi             │ Rate Limiter       │ 주문 생성 API                         │
 *   └──────────────────────┴────────────────────┴───────────────────────────────────────┘
 * </pre>
 *
 * ★ Example: resilience4j_circuitbreaker_state{name="catalogService",state="open"} 1
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(
            MeterRegistry meterRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            RateLimiterRegistry rateLimiterRegistry,
            BulkheadRegistry bulkheadRegistry) {

        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry)
                .bindTo(meterRegistry);
        TaggedRetryMetrics.ofRetryRegistry(retryRegistry)
                .bindTo(meterRegistry);
        TaggedRateLimiterMetrics.ofRateLimiterRegistry(rateLimiterRegistry)
                .bindTo(meterRegistry);
        TaggedBulkheadMetrics.ofBulkheadRegistry(bulkheadRegistry)
                .bindTo(meterRegistry);
    }
}
