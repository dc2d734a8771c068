package com.shopflow.common.tracing;

import org.slf4j.MDC;

import java.util.Optional;

/** 상관관계 ID 헤더/MDC 키 상수와 현재 값 조회 */
public final class CorrelationIds {

    public static final String HEADER = "X-Correlation-Id";
    public static final String MDC_KEY = "correlationId";

    private CorrelationIds() {
    }

    public static Optional<String> current() {
        return Optional.ofNullable(MDC.get(MDC_KEY));
    }
}
