package com.shopflow.order.entity;

/**
 * 주문 상태 - 단방향으로만 진행한다.
 *
 * <pre>
 *   PENDING ──▶ PROCESSING ──▶ COMPLETED
 *      │            │
 *      └────────────┴──▶ FAILED | CANCELLED
 * </pre>
 * COMPLETED, FAILED, CANCELLED는 종료 상태. 종료 상태에서 나가는 전이는 거부된다.
 */
public enum OrderStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** 응답 메시지용 소문자 표기 ("already completed") */
    public String label() {
        return name().toLowerCase();
    }
}
