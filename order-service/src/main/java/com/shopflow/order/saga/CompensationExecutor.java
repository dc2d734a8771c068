package com.shopflow.order.saga;

import com.shopflow.common.dto.stock.ReleaseStockRequest;
import com.shopflow.common.dto.stock.RestoreStockRequest;
import com.shopflow.order.client.StockClient;
import com.shopflow.order.saga.CompensationStep.MarkOrderCancelled;
import com.shopflow.order.saga.CompensationStep.MarkOrderFailed;
import com.shopflow.order.saga.CompensationStep.ReleaseReservation;
import com.shopflow.order.saga.CompensationStep.RestoreStock;
import com.shopflow.order.saga.CompensationStep.VoidPaymentNote;
import com.shopflow.order.service.OrderStatusTransitions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 보상 실행기 - CompensationLog를 역순으로 풀어낸다.
 *
 * <h3>실패 처리</h3>
 * 보상 하나가 실패해도 나머지는 계속 실행한다. 실패는 ERROR로 남기고
 * 원래 Saga 오류를 덮어쓰지 않는다. 남은 예약은 TTL로 풀린다.
 *
 * <pre>
 *   createOrder 실패:  release(C) → release(B) → release(A) → cancel order → void payment note
 *   capture 실패:      restore(B) → restore(A) → release(*) → fail order → refund note
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompensationExecutor {

    static final String MANUAL_RECONCILIATION = "MANUAL_RECONCILIATION";

    private final StockClient stockClient;
    private final OrderStatusTransitions transitions;

    /** @return 실패한 보상 수 */
    public int unwind(CompensationLog compensations, SagaStepException cause) {
        int failures = 0;
        for (CompensationStep step : compensations.drain()) {
            try {
                apply(step, cause);
            } catch (RuntimeException e) {
                failures++;
                log.error("Compensation failed: {} (saga step={}, error={})",
                        step.describe(), cause.getStep().slug(), e.getMessage(), e);
            }
        }
        if (failures > 0) {
            log.error("Saga unwound with {} failed compensation(s): failedStep={}", failures, cause.getStep().slug());
        }
        return failures;
    }

    private void apply(CompensationStep step, SagaStepException cause) {
        if (step instanceof ReleaseReservation release) {
            stockClient.release(release.productId(), new ReleaseStockRequest(release.orderId()));
            log.info("Compensated: {}", step.describe());
        } else if (step instanceof RestoreStock restore) {
            stockClient.restore(restore.productId(),
                    new RestoreStockRequest(restore.quantity(), restore.orderId()));
            log.warn("Compensated: {}", step.describe());
        } else if (step instanceof MarkOrderCancelled cancel) {
            transitions.cancel(cancel.orderId(), cancel.userId());
        } else if (step instanceof MarkOrderFailed fail) {
            transitions.fail(fail.orderId(), fail.userId());
        } else if (step instanceof VoidPaymentNote note) {
            if (note.captured()) {
                log.error("{}: payment captured but order {} failed at step {}. "
                                + "Refund {} for payment {} manually. cause={}",
                        MANUAL_RECONCILIATION, note.orderId(), cause.getStep().slug(),
                        note.amount(), note.paymentReference(), cause.getMessage());
            } else {
                log.warn("Payment {} ({}) left unapproved by failed checkout; void it if the provider keeps it open",
                        note.paymentReference(), note.amount());
            }
        }
    }
}
