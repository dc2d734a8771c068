package com.shopflow.common.exception;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>stock-service와 order-service가 공유하는 중앙 예외 처리.
 * 모든 에러를 RFC 7807 ProblemDetail로 통일한다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: 도메인/Saga 실패 (재고 부족, 예약 만료, 결제 실패 등)</li>
 *   <li><b>Bean Validation / 요청 바인딩 실패</b>: INVALID_INPUT (400)</li>
 *   <li><b>RequestNotPermitted</b>: Rate Limiter 초과 (429)</li>
 *   <li><b>BulkheadFullException</b>: 동시 요청 초과 (503)</li>
 *   <li><b>CallNotPermittedException</b>: Circuit Breaker OPEN (503)</li>
 *   <li><b>TimeoutException</b>: 타임아웃 (504)</li>
 * </ol>
 *
 * <p>응답 예시:</p>
 * <pre>
 *   {
 *     "type": "https://shopflow.dev/errors/insufficient_stock",
 *     "status": 409,
 *     "detail": "Insufficient stock for product P1: requested=10, available=9, shortfall=1",
 *     "code": "INSUFFICIENT_STOCK"
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String TYPE_BASE = "https://shopflow.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.warn("Business exception: code={}, message={}", errorCode, e.getMessage());
        }
        ProblemDetail problem = problem(errorCode, e.getMessage());
        e.getProperties().forEach(problem::setProperty);
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }

    /** @Valid 본문 검증 실패 → 필드별 메시지를 합쳐 400 */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest(detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            ServletRequestBindingException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadableRequest(Exception e) {
        return badRequest(e.getMessage());
    }

    // Resilience4j Rate Limiter exceeded
    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return respond(ErrorCode.RATE_LIMIT_EXCEEDED);
    }

    // Resilience4j Bulkhead full
    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<ProblemDetail> handleBulkheadFull(BulkheadFullException e) {
        log.warn("Bulkhead full: {}", e.getMessage());
        return respond(ErrorCode.BULKHEAD_FULL);
    }

    // Resilience4j Circuit Breaker open
    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return respond(ErrorCode.CIRCUIT_BREAKER_OPEN);
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(TimeoutException e) {
        log.warn("Request timeout: {}", e.getMessage());
        return respond(ErrorCode.REQUEST_TIMEOUT);
    }

    private ResponseEntity<ProblemDetail> badRequest(String detail) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(problem(ErrorCode.INVALID_INPUT, detail));
    }

    private ResponseEntity<ProblemDetail> respond(ErrorCode errorCode) {
        return ResponseEntity.status(errorCode.getStatus())
                .body(problem(errorCode, errorCode.getMessage()));
    }

    private ProblemDetail problem(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(TYPE_BASE + errorCode.typeSlug()));
        problem.setProperty("code", errorCode.name());
        return problem;
    }
}
