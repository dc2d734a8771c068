package com.shopflow.order.scheduler;

import com.shopflow.order.config.SagaProperties;
import com.shopflow.order.dto.CancelResult;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.PaymentMethod;
import com.shopflow.order.repository.OrderRepository;
import com.shopflow.order.saga.OrderSagaOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 방치된 체크아웃 정리 - 결제 승인 없이 PENDING으로 남은 PayPal 주문을 취소한다.
 *
 * <h3>동작</h3>
 * <pre>
 *   createdAt &lt; now - saga.abandoned-after (예약 TTL 15분 + 여유 5분)
 *     → cancelOrder(orderId): CANCELLED 전이 + 예약 해제 (이미 TTL로 풀렸으면 no-op)
 * </pre>
 * 여러 인스턴스 중 하나만 실행한다 (ShedLock). 한 번에 최대 BATCH_SIZE건.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AbandonedCheckoutSweeper {

    static final int BATCH_SIZE = 100;

    private final OrderRepository orderRepository;
    private final OrderSagaOrchestrator orchestrator;
    private final SagaProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${saga.abandoned-sweep-interval-ms:60000}")
    @SchedulerLock(name = "abandonedCheckoutSweep", lockAtMostFor = "5m", lockAtLeastFor = "10s")
    public void sweep() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getAbandonedAfter());
        List<String> staleIds = orderRepository.findStaleIds(
                OrderStatus.PENDING, PaymentMethod.PAYPAL, cutoff, PageRequest.of(0, BATCH_SIZE));
        if (staleIds.isEmpty()) {
            return;
        }

        int cancelled = 0;
        for (String orderId : staleIds) {
            try {
                CancelResult result = orchestrator.cancelOrder(orderId);
                if (result.ok()) {
                    cancelled++;
                }
            } catch (RuntimeException e) {
                log.error("Abandoned checkout cancel failed: orderId={}", orderId, e);
            }
        }
        log.info("Abandoned checkout sweep: candidates={}, cancelled={}", staleIds.size(), cancelled);
    }
}
