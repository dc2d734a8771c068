package com.shopflow.stock.reservation;

import java.time.Instant;

/**
 * 예약(hold) - 특정 주문이 특정 상품 수량을 expiresAt까지 잡아 두는 것.
 * on-hand를 줄이지 않는다.
 */
public record Reservation(String orderId, int quantity, Instant expiresAt) {

    /** expiresAt 시각부터 만료로 본다 */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
