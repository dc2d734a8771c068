package com.shopflow.stock.service;

import com.shopflow.common.dto.stock.CleanupResponse;
import com.shopflow.common.dto.stock.ReduceStockRequest;
import com.shopflow.common.dto.stock.ReleaseResponse;
import com.shopflow.common.dto.stock.ReleaseStockRequest;
import com.shopflow.common.dto.stock.ReservationResponse;
import com.shopflow.common.dto.stock.ReserveStockRequest;
import com.shopflow.common.dto.stock.RestoreStockRequest;
import com.shopflow.common.dto.stock.SetStockRequest;
import com.shopflow.common.dto.stock.StockStatusResponse;
import com.shopflow.stock.reservation.ReservationProperties;
import com.shopflow.stock.reservation.StockReservationActor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * 재고 서비스 파사드 - HTTP 요청을 StockReservationActor 호출로 바꾼다.
 *
 * <h3>역할 분담</h3>
 * <pre>
 *   StockService          : 요청 DTO 해석, 기본 TTL 적용
 *   StockReservationActor : 동시성 판단 (가용 수량, 예약 교체/해제/만료)
 *   StockLedger           : 영구 on-hand 변경 (액터 안에서만 호출)
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockService {

    private final StockReservationActor actor;
    private final ReservationProperties properties;

    public ReservationResponse reserve(String productId, ReserveStockRequest request) {
        Duration ttl = request.ttlMinutes() == null
                ? properties.getDefaultTtl()
                : Duration.ofMinutes(request.ttlMinutes());
        return actor.reserve(productId, request.orderId(), request.quantity(), ttl);
    }

    public ReleaseResponse release(String productId, ReleaseStockRequest request) {
        return actor.release(productId, request.orderId());
    }

    public StockStatusResponse reduce(String productId, ReduceStockRequest request) {
        return actor.reduce(productId, request.orderId(), request.quantity());
    }

    public StockStatusResponse restore(String productId, RestoreStockRequest request) {
        return actor.restore(productId, request.orderId(), request.quantity());
    }

    public StockStatusResponse status(String productId) {
        return actor.status(productId);
    }

    public StockStatusResponse setStock(String productId, SetStockRequest request) {
        return actor.setOnHand(productId, request.onHand());
    }

    public CleanupResponse cleanup(String productId) {
        return actor.cleanupExpired(productId);
    }

    public List<ReservationResponse> reservations(String productId) {
        return actor.reservations(productId);
    }
}
