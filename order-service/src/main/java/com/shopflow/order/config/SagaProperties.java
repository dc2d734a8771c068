package com.shopflow.order.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * saga.* 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "saga")
public class SagaProperties {

    /** 체크아웃 시 재고 예약 유효 시간 */
    private Duration reservationTtl = Duration.ofMinutes(15);

    /** PayPal 결제 통화 */
    private String currency = "INR";

    /** PayPal returnUrl / cancelUrl의 기준 주소 */
    private String frontendOrigin = "http://localhost:3000";

    /** 카탈로그 조회 실패 시 사용할 카테고리 */
    private String defaultCategory = "accessories";

    /** 상품별 배송 모드가 없을 때 */
    private String defaultShippingMode = "standard";

    /** 팬아웃 단계 하나의 합류 대기 한도. 넘은 항목은 실패로 본다 */
    private Duration stepTimeout = Duration.ofSeconds(10);

    /** 팬아웃 실행 스레드 수 */
    private int fanOutThreads = 16;

    /** 결제 승인 없이 PENDING으로 남은 PayPal 주문을 취소하기까지의 시간 (예약 TTL + 여유) */
    private Duration abandonedAfter = Duration.ofMinutes(20);
}
