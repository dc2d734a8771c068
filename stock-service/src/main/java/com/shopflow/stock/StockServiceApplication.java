package com.shopflow.stock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShopFlow Stock Service - 재고 원장 + 상품별 예약 액터
 *
 * <h3>역할</h3>
 * 상품별 on-hand 수량(StockLedger)과 TTL이 있는 예약(hold)을 관리한다.
 * order-service의 Saga가 reserve → reduce / release 순서로 호출한다.
 *
 * <h3>scanBasePackages</h3>
 * <ul>
 *   <li>com.shopflow.stock - 서비스 자체</li>
 *   <li>com.shopflow.common.exception - GlobalExceptionHandler (ProblemDetail)</li>
 *   <li>com.shopflow.common.security - ServiceKeyFilter (X-API-Key)</li>
 *   <li>com.shopflow.common.tracing - CorrelationIdFilter (MDC)</li>
 * </ul>
 *
 * <h3>배포 제약</h3>
 * 예약은 프로세스 메모리에 있으므로 단일 인스턴스로 운영하거나 productId 기준으로 파티셔닝해야 한다.
 * 재시작 시 예약은 사라지고 on-hand는 원장에 남는다.
 *
 * <h3>포트</h3>
 * Stock Service: 8085
 */
@SpringBootApplication(scanBasePackages = {
        "com.shopflow.stock",
        "com.shopflow.common.exception",
        "com.shopflow.common.security",
        "com.shopflow.common.tracing"
})
@EnableScheduling  // ReservationSweeper
public class StockServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockServiceApplication.class, args);
    }
}
