package com.shopflow.stock.reservation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 한 상품의 예약 장부. orderId당 예약은 최대 하나.
 *
 * <p>스레드 안전하지 않다. 자신을 소유한 {@link ProductMailbox}의 작업 안에서만 접근한다.</p>
 */
public class ReservationBook {

    private final Map<String, Reservation> byOrder = new LinkedHashMap<>();

    /** 만료된 예약을 제거하고 제거한 건수를 돌려준다 */
    public int purgeExpired(Instant now) {
        int before = byOrder.size();
        byOrder.values().removeIf(reservation -> reservation.isExpiredAt(now));
        return before - byOrder.size();
    }

    public int reservedTotal() {
        return byOrder.values().stream()
                .mapToInt(Reservation::quantity)
                .sum();
    }

    public int quantityFor(String orderId) {
        Reservation reservation = byOrder.get(orderId);
        return reservation == null ? 0 : reservation.quantity();
    }

    public Optional<Reservation> find(String orderId) {
        return Optional.ofNullable(byOrder.get(orderId));
    }

    /** 같은 orderId의 기존 예약은 교체된다 (이중 계산 없음) */
    public void put(Reservation reservation) {
        byOrder.remove(reservation.orderId());
        byOrder.put(reservation.orderId(), reservation);
    }

    public Optional<Reservation> remove(String orderId) {
        return Optional.ofNullable(byOrder.remove(orderId));
    }

    public List<Reservation> snapshot() {
        return new ArrayList<>(byOrder.values());
    }

    public int size() {
        return byOrder.size();
    }
}
