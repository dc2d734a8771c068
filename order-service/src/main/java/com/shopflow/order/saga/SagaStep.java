package com.shopflow.order.saga;

/** Saga 단계. 실패 응답의 "step" 속성과 로그에 slug로 남는다 */
public enum SagaStep {
    FETCH_CART,
    VALIDATE_CART,
    QUOTE_SHIPPING,
    CHECK_AMOUNT,
    CREATE_PAYMENT,
    PERSIST_ORDER,
    RESERVE_STOCK,
    LOAD_ORDER,
    CAPTURE_PAYMENT,
    CLAIM_ORDER,
    REDUCE_STOCK,
    CLEAR_CART,
    COMPLETE_ORDER;

    public String slug() {
        return name().toLowerCase().replace('_', '-');
    }
}
