package com.shopflow.order.client;

import com.shopflow.common.dto.ApiResponse;
import com.shopflow.common.dto.stock.ReduceStockRequest;
import com.shopflow.common.dto.stock.ReleaseResponse;
import com.shopflow.common.dto.stock.ReleaseStockRequest;
import com.shopflow.common.dto.stock.ReservationResponse;
import com.shopflow.common.dto.stock.ReserveStockRequest;
import com.shopflow.common.dto.stock.RestoreStockRequest;
import com.shopflow.common.dto.stock.StockStatusResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * stock-service Feign 클라이언트. 요청/응답 DTO는 common-dto의 stock 계약을 그대로 쓴다.
 *
 * 409 insufficient_stock / reservation_expired 는 RemoteErrorDecoder가 같은 ErrorCode로 되돌린다.
 */
@FeignClient(name = "stock-service", url = "${stock-service.url:http://localhost:8085}")
public interface StockClient {

    @PostMapping("/stock/{productId}/reserve")
    ApiResponse<ReservationResponse> reserve(@PathVariable String productId,
                                             @RequestBody ReserveStockRequest request);

    @PostMapping("/stock/{productId}/release")
    ApiResponse<ReleaseResponse> release(@PathVariable String productId,
                                         @RequestBody ReleaseStockRequest request);

    @PostMapping("/stock/{productId}/reduce")
    ApiResponse<StockStatusResponse> reduce(@PathVariable String productId,
                                            @RequestBody ReduceStockRequest request);

    @PostMapping("/stock/{productId}/restore")
    ApiResponse<StockStatusResponse> restore(@PathVariable String productId,
                                             @RequestBody RestoreStockRequest request);
}
