package com.shopflow.stock.reservation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * stock.reservation.* 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "stock.reservation")
public class ReservationProperties {

    /** ttlMinutes 없이 들어온 예약의 유효 시간 */
    private Duration defaultTtl = Duration.ofMinutes(15);

    /** 메일박스 응답 대기 한도. 넘으면 REQUEST_TIMEOUT */
    private Duration operationTimeout = Duration.ofSeconds(5);

    /** 상품별 대기 작업 수 한도. 넘으면 STOCK_BUSY */
    private int mailboxCapacity = 1_000;

    /** 모든 메일박스가 공유하는 워커 스레드 수 */
    private int workerThreads = 8;
}
