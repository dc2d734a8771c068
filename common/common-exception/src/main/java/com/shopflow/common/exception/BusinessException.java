package com.shopflow.common.exception;

import lombok.Getter;

import java.util.Map;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>도메인 규칙 위반 또는 협력 서비스 실패 시 발생하는 unchecked 예외.
 * ErrorCode와 결합하여 HTTP 상태 코드와 에러 메시지를 함께 전달한다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 장바구니가 비어 있는 경우
 *   throw new BusinessException(ErrorCode.CART_EMPTY);
 *
 *   // 상세 메시지가 필요한 경우
 *   throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK,
 *           "requested=5, available=3, shortfall=2");
 * </pre>
 *
 * <p>GlobalExceptionHandler가 RFC 7807 ProblemDetail로 변환하며,
 * {@link #getProperties()}의 값은 ProblemDetail 확장 필드로 노출된다.</p>
 */
@Getter
public class BusinessException extends RuntimeException {

    /** 에러 코드 (HTTP 상태 코드 + 기본 메시지) */
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * ProblemDetail에 추가로 실을 속성. 기본은 없음.
     * 하위 예외(예: 실패한 Saga 단계)가 오버라이드한다.
     */
    public Map<String, Object> getProperties() {
        return Map.of();
    }
}
