package com.shopflow.order.controller;

import com.shopflow.common.dto.ApiResponse;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.order.dto.CancelResult;
import com.shopflow.order.dto.CaptureRequest;
import com.shopflow.order.dto.CaptureResult;
import com.shopflow.order.dto.CheckoutRequest;
import com.shopflow.order.dto.CheckoutResult;
import com.shopflow.order.dto.CodOrderResult;
import com.shopflow.order.dto.OrderPageResponse;
import com.shopflow.order.dto.OrderResponse;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.ShippingAddress;
import com.shopflow.order.saga.CheckoutCommand;
import com.shopflow.order.saga.OrderSagaOrchestrator;
import com.shopflow.order.saga.ShippingSelection;
import com.shopflow.order.service.OrderService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 주문 REST API
 *
 * <pre>
 *   POST /api/orders                    PayPal 체크아웃 → {orderId, approvalUrl}   (Idempotency-Key 지원)
 *   POST /api/orders/cod                착불 주문 → {orderId, totalAmount}         (Idempotency-Key 지원)
 *   POST /api/orders/{orderId}/capture  PayPal 승인 후 결제 확정
 *   POST /api/orders/{orderId}/cancel   취소 (이미 끝난 주문이면 ok=false)
 *   GET  /api/orders/{orderId}
 *   GET  /api/orders?userId=&amp;status=&amp;page=&amp;size=
 * </pre>
 *
 * <h3>Idempotency-Key</h3>
 * Redis SETNX(24h)로 같은 키의 두 번째 요청을 DUPLICATE_REQUEST(409)로 막는다.
 * 성공하면 값을 주문 ID로 바꾸고, 실패하면 키를 지워 재시도를 허용한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    static final String IDEMPOTENCY_PREFIX = "idempotency:order:";
    static final Duration IDEMPOTENCY_TTL = Duration.ofHours(24);

    private final OrderSagaOrchestrator orchestrator;
    private final OrderService orderService;
    private final StringRedisTemplate redisTemplate;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "orderApi")
    public ApiResponse<CheckoutResult> createOrder(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CheckoutRequest request) {
        CheckoutResult result = idempotent(idempotencyKey,
                () -> orchestrator.createOrder(toCommand(request, authorization)),
                CheckoutResult::orderId);
        return ApiResponse.ok(result);
    }

    @PostMapping("/cod")
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "orderApi")
    public ApiResponse<CodOrderResult> createCodOrder(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CheckoutRequest request) {
        CodOrderResult result = idempotent(idempotencyKey,
                () -> orchestrator.createCodOrder(toCommand(request, authorization)),
                CodOrderResult::orderId);
        return ApiResponse.ok(result);
    }

    @PostMapping("/{orderId}/capture")
    public ApiResponse<CaptureResult> capture(@PathVariable String orderId,
                                              @Valid @RequestBody CaptureRequest request) {
        return ApiResponse.ok(orchestrator.capturePayment(orderId, request.paymentReference()));
    }

    @PostMapping("/{orderId}/cancel")
    public ApiResponse<CancelResult> cancel(@PathVariable String orderId) {
        return ApiResponse.ok(orchestrator.cancelOrder(orderId));
    }

    @GetMapping("/{orderId}")
    public ApiResponse<OrderResponse> getOrder(@PathVariable String orderId) {
        return ApiResponse.ok(orderService.getOrder(orderId));
    }

    @GetMapping
    public ApiResponse<OrderPageResponse> listOrders(@RequestParam String userId,
                                                     @RequestParam(required = false) OrderStatus status,
                                                     @RequestParam(defaultValue = "0") int page,
                                                     @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(orderService.listOrders(userId, status, page, size));
    }

    private <T> T idempotent(String idempotencyKey, Supplier<T> action, Function<T, String> orderIdOf) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return action.get();
        }

        String redisKey = IDEMPOTENCY_PREFIX + idempotencyKey;
        Boolean isNew = redisTemplate.opsForValue().setIfAbsent(redisKey, "processing", IDEMPOTENCY_TTL);
        if (Boolean.FALSE.equals(isNew)) {
            throw new BusinessException(ErrorCode.DUPLICATE_REQUEST,
                    "Duplicate order request detected for key: " + idempotencyKey);
        }

        try {
            T result = action.get();
            redisTemplate.opsForValue().set(redisKey, orderIdOf.apply(result), IDEMPOTENCY_TTL);
            return result;
        } catch (RuntimeException e) {
            redisTemplate.delete(redisKey);
            log.info("Idempotency key released after failure: key={}", idempotencyKey);
            throw e;
        }
    }

    private static CheckoutCommand toCommand(CheckoutRequest request, String authorization) {
        CheckoutRequest.AddressRequest address = request.address();
        ShippingAddress shippingAddress = address == null
                ? null
                : new ShippingAddress(address.zipCode(), address.city(), address.state());
        return new CheckoutCommand(request.userId(), authorization,
                new ShippingSelection(request.shippingMode(), request.itemShippingModes(), shippingAddress));
    }
}
