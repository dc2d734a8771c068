package com.shopflow.order.saga;

import com.shopflow.order.entity.Order;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/** 결제 확정 Saga 실행 하나의 상태 */
@Getter
@Setter
@RequiredArgsConstructor
class CaptureState {

    private final String orderId;
    private final String paymentReference;
    private final CompensationLog compensations = new CompensationLog();

    private SagaStep step = SagaStep.LOAD_ORDER;
    private Order order;
    private boolean captured;
    private boolean claimed;
}
