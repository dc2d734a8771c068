package com.shopflow.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShopFlow Order Service - 주문 Saga 코디네이터
 *
 * <h3>역할</h3>
 * 장바구니 → 배송비 견적 → 결제 생성 → 주문 저장 → 재고 예약을 하나의 Saga로 묶고,
 * 실패하면 이미 끝난 단계를 역순으로 보상한다.
 *
 * <h3>scanBasePackages</h3>
 * <ul>
 *   <li>com.shopflow.order - 서비스 자체</li>
 *   <li>com.shopflow.common.exception - GlobalExceptionHandler (ProblemDetail)</li>
 *   <li>com.shopflow.common.tracing - CorrelationIdFilter (MDC)</li>
 *   <li>com.shopflow.common.resilience - Resilience4j 메트릭 바인딩</li>
 * </ul>
 *
 * <h3>포트</h3>
 * Order Service: 8084
 */
@SpringBootApplication(scanBasePackages = {
        "com.shopflow.order",
        "com.shopflow.common.exception",
        "com.shopflow.common.tracing",
        "com.shopflow.common.resilience"
})
@EnableScheduling  // AbandonedCheckoutSweeper
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
