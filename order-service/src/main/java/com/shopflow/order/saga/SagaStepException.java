package com.shopflow.order.saga;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import lombok.Getter;

import java.util.Map;

/**
 * 실패한 Saga 단계가 표시된 BusinessException.
 *
 * <p>원래 예외의 ErrorCode와 메시지를 그대로 유지하므로 HTTP 응답 상태는 바뀌지 않고,
 * ProblemDetail에 {@code "step": "reserve-stock"} 속성만 추가된다.
 * BusinessException이 아닌 예외(Feign 연결 실패 등)는 EXTERNAL_SERVICE_ERROR로 감싼다.</p>
 */
@Getter
public class SagaStepException extends BusinessException {

    private final SagaStep step;

    public SagaStepException(SagaStep step, ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.step = step;
    }

    public SagaStepException(SagaStep step, ErrorCode errorCode, String message) {
        this(step, errorCode, message, null);
    }

    public static SagaStepException of(SagaStep step, Throwable failure) {
        if (failure instanceof SagaStepException stepException) {
            return stepException;
        }
        if (failure instanceof BusinessException business) {
            return new SagaStepException(step, business.getErrorCode(), business.getMessage(), business);
        }
        String message = failure.getMessage() != null
                ? failure.getMessage()
                : failure.getClass().getSimpleName();
        return new SagaStepException(step, ErrorCode.EXTERNAL_SERVICE_ERROR, message, failure);
    }

    @Override
    public Map<String, Object> getProperties() {
        return Map.of("step", step.slug());
    }
}
