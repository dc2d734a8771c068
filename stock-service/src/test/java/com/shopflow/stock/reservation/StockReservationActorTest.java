package com.shopflow.stock.reservation;

import com.shopflow.common.dto.stock.CleanupResponse;
import com.shopflow.common.dto.stock.ReleaseResponse;
import com.shopflow.common.dto.stock.ReservationResponse;
import com.shopflow.common.dto.stock.StockStatusResponse;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.stock.ledger.InMemoryStockLedger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ★ 예약 액터 테스트
 *
 * 메모리 원장 + 조작 가능한 Clock으로 TTL 만료와 동시 예약을 검증한다.
 */
class StockReservationActorTest {

    private static final String PRODUCT = "P1";
    private static final Duration TTL = Duration.ofMinutes(15);

    private InMemoryStockLedger ledger;
    private MutableClock clock;
    private StockReservationActor actor;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryStockLedger();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        actor = new StockReservationActor(ledger, new ReservationProperties(), clock);
        ledger.setOnHand(PRODUCT, 10);
    }

    @AfterEach
    void tearDown() {
        actor.shutdown();
    }

    @Test
    @DisplayName("가용 수량을 넘는 예약은 부족분과 함께 INSUFFICIENT_STOCK")
    void reserve_Conflict() {
        // Given
        actor.reserve(PRODUCT, "order-A", 7, TTL);

        // When & Then
        assertThatThrownBy(() -> actor.reserve(PRODUCT, "order-B", 5, TTL))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INSUFFICIENT_STOCK))
                .hasMessageContaining("available=3")
                .hasMessageContaining("shortfall=2");

        StockStatusResponse status = actor.status(PRODUCT);
        assertThat(status.reserved()).isEqualTo(7);
        assertThat(status.available()).isEqualTo(3);
    }

    @Test
    @DisplayName("같은 주문의 재예약은 기존 예약을 교체한다 (이중 계산 없음)")
    void reserve_SameOrderReplaces() {
        // Given
        actor.reserve(PRODUCT, "order-A", 8, TTL);

        // When: 본인 예약 8개는 가용 수량 계산에서 빠진다
        ReservationResponse replaced = actor.reserve(PRODUCT, "order-A", 10, TTL);

        // Then
        assertThat(replaced.quantity()).isEqualTo(10);
        assertThat(actor.status(PRODUCT).reserved()).isEqualTo(10);
        assertThat(actor.reservations(PRODUCT)).hasSize(1);
    }

    @Test
    @DisplayName("교체 예약이 실패하면 기존 예약은 그대로 남는다")
    void reserve_FailedReplacementKeepsHold() {
        actor.reserve(PRODUCT, "order-A", 4, TTL);
        actor.reserve(PRODUCT, "order-B", 4, TTL);

        assertThatThrownBy(() -> actor.reserve(PRODUCT, "order-A", 7, TTL))
                .isInstanceOf(BusinessException.class);

        assertThat(actor.status(PRODUCT).reserved()).isEqualTo(8);
    }

    @Test
    @DisplayName("release는 멱등 - 두 번째 호출은 released=false")
    void release_Idempotent() {
        actor.reserve(PRODUCT, "order-A", 3, TTL);

        ReleaseResponse first = actor.release(PRODUCT, "order-A");
        ReleaseResponse second = actor.release(PRODUCT, "order-A");

        assertThat(first.released()).isTrue();
        assertThat(second.released()).isFalse();
        assertThat(actor.status(PRODUCT).available()).isEqualTo(10);
    }

    @Test
    @DisplayName("TTL이 지나면 예약이 풀리고 reduce는 RESERVATION_EXPIRED")
    void ttlExpiry_ReleasesHold() {
        // Given
        actor.reserve(PRODUCT, "order-A", 10, Duration.ofMinutes(1));
        assertThat(actor.status(PRODUCT).available()).isZero();

        // When
        clock.advance(Duration.ofMinutes(1));

        // Then
        assertThat(actor.status(PRODUCT).available()).isEqualTo(10);
        assertThatThrownBy(() -> actor.reduce(PRODUCT, "order-A", 10))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESERVATION_EXPIRED));
        assertThat(ledger.onHand(PRODUCT)).isEqualTo(10);
    }

    @Test
    @DisplayName("reserve → reduce 후 on-hand가 줄고, 이후 release는 no-op")
    void reduce_ConvertsHold() {
        // Given
        actor.reserve(PRODUCT, "order-A", 4, TTL);

        // When
        StockStatusResponse afterReduce = actor.reduce(PRODUCT, "order-A", 4);
        ReleaseResponse release = actor.release(PRODUCT, "order-A");

        // Then
        assertThat(afterReduce.onHand()).isEqualTo(6);
        assertThat(afterReduce.reserved()).isZero();
        assertThat(afterReduce.available()).isEqualTo(6);
        assertThat(release.released()).isFalse();
    }

    @Test
    @DisplayName("예약보다 많이 차감하려 하면 INVALID_INPUT, 예약은 유지")
    void reduce_MoreThanReserved() {
        actor.reserve(PRODUCT, "order-A", 2, TTL);

        assertThatThrownBy(() -> actor.reduce(PRODUCT, "order-A", 3))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));

        assertThat(actor.status(PRODUCT).reserved()).isEqualTo(2);
        assertThat(ledger.onHand(PRODUCT)).isEqualTo(10);
    }

    @Test
    @DisplayName("예약 없이 reduce하면 RESERVATION_EXPIRED (조용히 차감하지 않음)")
    void reduce_WithoutHold() {
        assertThatThrownBy(() -> actor.reduce(PRODUCT, "order-X", 1))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESERVATION_EXPIRED));
        assertThat(ledger.onHand(PRODUCT)).isEqualTo(10);
    }

    @Test
    @DisplayName("restore는 reduce를 되돌린다")
    void restore_AfterReduce() {
        actor.reserve(PRODUCT, "order-A", 3, TTL);
        actor.reduce(PRODUCT, "order-A", 3);

        StockStatusResponse restored = actor.restore(PRODUCT, "order-A", 3);

        assertThat(restored.onHand()).isEqualTo(10);
        assertThat(restored.available()).isEqualTo(10);
    }

    @Test
    @DisplayName("on-hand가 예약 합계보다 작아져도 available은 0 미만으로 내려가지 않는다")
    void available_NeverNegative() {
        actor.reserve(PRODUCT, "order-A", 8, TTL);
        ledger.setOnHand(PRODUCT, 5);  // 액터 밖에서 원장이 줄어든 경우

        StockStatusResponse status = actor.status(PRODUCT);

        assertThat(status.available()).isZero();
        assertThatThrownBy(() -> actor.reserve(PRODUCT, "order-B", 1, TTL))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("예약 합계보다 작은 on-hand 설정은 STOCK_BELOW_RESERVED")
    void setOnHand_BelowReserved() {
        actor.reserve(PRODUCT, "order-A", 6, TTL);

        assertThatThrownBy(() -> actor.setOnHand(PRODUCT, 5))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.STOCK_BELOW_RESERVED));

        assertThat(actor.setOnHand(PRODUCT, 6).available()).isZero();
    }

    @Test
    @DisplayName("cleanup은 만료 예약만 정리하고, 목록은 정리 전 만료 예약을 expired=true로 보여준다")
    void cleanup_RemovesOnlyExpired() {
        actor.reserve(PRODUCT, "short", 2, Duration.ofMinutes(1));
        actor.reserve(PRODUCT, "long", 3, Duration.ofMinutes(30));
        clock.advance(Duration.ofMinutes(5));

        List<ReservationResponse> listed = actor.reservations(PRODUCT);
        assertThat(listed).filteredOn(ReservationResponse::expired)
                .extracting(ReservationResponse::orderId).containsExactly("short");

        CleanupResponse cleanup = actor.cleanupExpired(PRODUCT);

        assertThat(cleanup.removed()).isEqualTo(1);
        assertThat(actor.reservations(PRODUCT)).extracting(ReservationResponse::orderId)
                .containsExactly("long");
        assertThat(actor.cleanupAllExpired()).isZero();
    }

    @Test
    @DisplayName("잘못된 입력은 메일박스에 들어가기 전에 INVALID_INPUT")
    void invalidInput() {
        assertThatThrownBy(() -> actor.reserve(PRODUCT, "order-A", 0, TTL))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
        assertThatThrownBy(() -> actor.reserve(PRODUCT, " ", 1, TTL))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> actor.reserve(PRODUCT, "order-A", 1, Duration.ZERO))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("동시 예약 경쟁에서도 예약 합계는 on-hand를 넘지 않는다")
    void concurrentReserve_NeverOversells() throws Exception {
        // Given: 재고 10, 50개 주문이 각각 1개씩 동시 예약
        int orders = 50;
        ExecutorService callers = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < orders; i++) {
            String orderId = "order-" + i;
            futures.add(callers.submit(() -> {
                start.await();
                try {
                    actor.reserve(PRODUCT, orderId, 1, TTL);
                    succeeded.incrementAndGet();
                } catch (BusinessException e) {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_STOCK);
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        callers.shutdown();

        // Then
        assertThat(succeeded.get()).isEqualTo(10);
        assertThat(rejected.get()).isEqualTo(40);
        StockStatusResponse status = actor.status(PRODUCT);
        assertThat(status.reserved()).isEqualTo(10);
        assertThat(status.available()).isZero();
    }

    @Test
    @DisplayName("서로 다른 상품의 예약은 서로의 가용 수량에 영향을 주지 않는다")
    void productsAreIndependent() {
        ledger.setOnHand("P2", 1);

        actor.reserve(PRODUCT, "order-A", 10, TTL);
        actor.reserve("P2", "order-A", 1, TTL);

        assertThat(actor.status(PRODUCT).available()).isZero();
        assertThat(actor.status("P2").available()).isZero();
        assertThat(actor.status("P3").onHand()).isZero();
    }
}
