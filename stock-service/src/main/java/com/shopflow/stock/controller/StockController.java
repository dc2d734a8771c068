package com.shopflow.stock.controller;

import com.shopflow.common.dto.ApiResponse;
import com.shopflow.common.dto.stock.CleanupResponse;
import com.shopflow.common.dto.stock.ReduceStockRequest;
import com.shopflow.common.dto.stock.ReleaseResponse;
import com.shopflow.common.dto.stock.ReleaseStockRequest;
import com.shopflow.common.dto.stock.ReservationResponse;
import com.shopflow.common.dto.stock.ReserveStockRequest;
import com.shopflow.common.dto.stock.RestoreStockRequest;
import com.shopflow.common.dto.stock.SetStockRequest;
import com.shopflow.common.dto.stock.StockStatusResponse;
import com.shopflow.stock.service.StockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 재고 REST API (서비스 간 전용, X-API-Key 필요)
 *
 * <pre>
 *   POST /stock/{productId}/reserve       {quantity, orderId, ttlMinutes?} → 200 | 409 insufficient_stock
 *   POST /stock/{productId}/release       {orderId}                        → 200 (멱등)
 *   POST /stock/{productId}/reduce        {quantity, orderId}              → 200 | 409 reservation_expired
 *   POST /stock/{productId}/restore       {quantity, orderId}              → 200 (reduce 보상)
 *   GET  /stock/{productId}                                                → {onHand, reserved, available}
 *   PUT  /stock/{productId}               {onHand}                         → 200 | 409 stock_below_reserved
 *   POST /stock/{productId}/cleanup                                        → 만료 예약 즉시 정리
 *   GET  /stock/{productId}/reservations                                   → 진단용 예약 목록
 * </pre>
 */
@RestController
@RequestMapping("/stock/{productId}")
@RequiredArgsConstructor
public class StockController {

    private final StockService stockService;

    @PostMapping("/reserve")
    public ApiResponse<ReservationResponse> reserve(@PathVariable String productId,
                                                    @Valid @RequestBody ReserveStockRequest request) {
        return ApiResponse.ok(stockService.reserve(productId, request));
    }

    @PostMapping("/release")
    public ApiResponse<ReleaseResponse> release(@PathVariable String productId,
                                                @Valid @RequestBody ReleaseStockRequest request) {
        return ApiResponse.ok(stockService.release(productId, request));
    }

    @PostMapping("/reduce")
    public ApiResponse<StockStatusResponse> reduce(@PathVariable String productId,
                                                   @Valid @RequestBody ReduceStockRequest request) {
        return ApiResponse.ok(stockService.reduce(productId, request));
    }

    @PostMapping("/restore")
    public ApiResponse<StockStatusResponse> restore(@PathVariable String productId,
                                                    @Valid @RequestBody RestoreStockRequest request) {
        return ApiResponse.ok(stockService.restore(productId, request));
    }

    @GetMapping
    public ApiResponse<StockStatusResponse> status(@PathVariable String productId) {
        return ApiResponse.ok(stockService.status(productId));
    }

    @PutMapping
    public ApiResponse<StockStatusResponse> setStock(@PathVariable String productId,
                                                     @Valid @RequestBody SetStockRequest request) {
        return ApiResponse.ok(stockService.setStock(productId, request));
    }

    @PostMapping("/cleanup")
    public ApiResponse<CleanupResponse> cleanup(@PathVariable String productId) {
        return ApiResponse.ok(stockService.cleanup(productId));
    }

    @GetMapping("/reservations")
    public ApiResponse<List<ReservationResponse>> reservations(@PathVariable String productId) {
        return ApiResponse.ok(stockService.reservations(productId));
    }
}
