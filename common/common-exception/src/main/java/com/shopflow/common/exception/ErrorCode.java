package com.shopflow.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.Optional;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>모든 서비스가 공유하는 에러 코드. 각 코드는 HTTP 상태와 기본 메시지를 가진다.</p>
 *
 * <h3>에러 분류</h3>
 * <ul>
 *   <li><b>Validation (400)</b>: 부수 효과 전에 걸러지는 입력 오류 → 보상 불필요</li>
 *   <li><b>Conflict (409)</b>: 빈 장바구니, 재고 부족, 잘못된 주문 상태, 만료된 예약</li>
 *   <li><b>External (502/503/504)</b>: 협력 서비스 장애, 타임아웃, Resilience4j 차단</li>
 * </ul>
 *
 * <p>ProblemDetail의 type URI 마지막 경로는 코드명을 소문자로 바꾼 값이다
 * ({@code .../errors/insufficient_stock}). Feign ErrorDecoder는 {@link #fromType(String)}으로
 * 이를 다시 ErrorCode로 복원하여 서비스 경계를 넘어도 같은 코드가 유지된다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Entity not found"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),
    EXTERNAL_SERVICE_ERROR(HttpStatus.BAD_GATEWAY, "External service returned an error"),

    // ── Resilience4j 트래픽 제어 ──
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Please try again later"),
    DUPLICATE_REQUEST(HttpStatus.CONFLICT, "Duplicate request detected"),
    BULKHEAD_FULL(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent requests. Please try again later"),
    CIRCUIT_BREAKER_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "Service circuit breaker is open"),
    REQUEST_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Request timed out"),

    // ── Stock (재고/예약) ──
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "Insufficient stock"),
    RESERVATION_EXPIRED(HttpStatus.CONFLICT, "No active reservation for this order"),
    STOCK_BELOW_RESERVED(HttpStatus.CONFLICT, "On-hand quantity cannot drop below reserved quantity"),
    STOCK_BUSY(HttpStatus.SERVICE_UNAVAILABLE, "Too many pending stock operations for this product"),

    // ── Cart / Checkout ──
    CART_EMPTY(HttpStatus.CONFLICT, "Cart is empty"),
    CART_INVALID(HttpStatus.CONFLICT, "Cart validation failed"),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "Invalid amount"),

    // ── Order ──
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.CONFLICT, "Invalid order status transition"),

    // ── Payment ──
    PAYMENT_FAILED(HttpStatus.BAD_GATEWAY, "Payment processing failed"),
    PAYMENT_REFERENCE_MISMATCH(HttpStatus.CONFLICT, "Payment reference does not match the order");

    private final HttpStatus status;
    private final String message;

    /** ProblemDetail type 경로의 마지막 세그먼트 (소문자 코드명) */
    public String typeSlug() {
        return name().toLowerCase();
    }

    /**
     * type URI 또는 slug로부터 ErrorCode를 찾는다.
     * 알 수 없는 값이면 비어 있는 Optional.
     */
    public static Optional<ErrorCode> fromType(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        String slug = type.substring(type.lastIndexOf('/') + 1);
        return Arrays.stream(values())
                .filter(code -> code.typeSlug().equals(slug))
                .findFirst();
    }
}
