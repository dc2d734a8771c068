package com.shopflow.stock.reservation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료 예약 주기 정리.
 *
 * <p>만료 예약은 모든 작업 직전에 지연 정리되지만, 한동안 요청이 없는 상품의
 * 예약도 메모리에서 내려가도록 주기적으로 한 번 더 쓴다.
 * 예약은 인스턴스 메모리에 있으므로 분산 락(ShedLock) 없이 인스턴스마다 실행한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationSweeper {

    private final StockReservationActor actor;

    @Scheduled(fixedDelayString = "${stock.reservation.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = actor.cleanupAllExpired();
        if (removed > 0) {
            log.info("Reservation sweep removed {} expired holds", removed);
        }
    }
}
