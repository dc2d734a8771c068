package com.shopflow.stock.reservation;

import com.shopflow.common.dto.stock.CleanupResponse;
import com.shopflow.common.dto.stock.ReleaseResponse;
import com.shopflow.common.dto.stock.ReservationResponse;
import com.shopflow.common.dto.stock.StockStatusResponse;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.stock.ledger.StockLedger;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 상품별 예약 액터 (Stock Reservation Actor) - 단일 작성자 상태 머신
 *
 * <h3>역할</h3>
 * 같은 상품에 대한 예약/해제/차감이 동시에 들어와도 "가용 수량보다 많이 예약하지 않는다"를 지킨다.
 * DB 트랜잭션이나 락 없이, 상품마다 메일박스 하나로 작업을 한 줄로 세운다.
 *
 * <h3>구조</h3>
 * <pre>
 *   reserve(P1, order-A) ─┐
 *   reserve(P1, order-B) ─┼─▶ ProductMailbox(P1) ─▶ 한 번에 하나씩 ReservationBook(P1) 수정
 *   reduce (P1, order-A) ─┘
 *   reserve(P2, order-C) ───▶ ProductMailbox(P2) ─▶ P1과 병렬 진행
 * </pre>
 *
 * <h3>불변식</h3>
 * 모든 상품, 모든 시점에서 Σ(만료되지 않은 예약 수량) ≤ onHand.
 * available = max(0, onHand - Σ예약). 만료된 예약은 모든 작업 직전에 먼저 정리된다.
 *
 * <h3>실패 의미</h3>
 * <ul>
 *   <li>reserve 실패(INSUFFICIENT_STOCK)는 재시도하지 않고 호출자에게 보고</li>
 *   <li>reduce 시 활성 예약이 없으면 RESERVATION_EXPIRED. 조용히 차감하지 않는다</li>
 *   <li>메일박스 포화 → STOCK_BUSY, 응답 지연 → REQUEST_TIMEOUT</li>
 * </ul>
 *
 * ★ One mailbox per productId: no two operations on the same product interleave
 *   their read-modify-write, different products run fully in parallel.
 */
@Slf4j
@Component
public class StockReservationActor {

    private final StockLedger ledger;
    private final ReservationProperties properties;
    private final Clock clock;
    private final ExecutorService workers;
    private final ConcurrentMap<String, ProductMailbox> mailboxes = new ConcurrentHashMap<>();

    public StockReservationActor(StockLedger ledger, ReservationProperties properties, Clock clock) {
        this.ledger = ledger;
        this.properties = properties;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(properties.getWorkerThreads(),
                new CustomizableThreadFactory("stock-actor-"));
    }

    /**
     * 예약 생성. 같은 (productId, orderId)의 활성 예약이 있으면 교체한다.
     * 교체 시 가용 수량은 기존 예약을 뺀 상태로 계산하므로 이중 계산이 없다.
     * 실패하면 기존 예약은 그대로 남는다.
     */
    public ReservationResponse reserve(String productId, String orderId, int quantity, Duration ttl) {
        requireId(productId, "productId");
        requireId(orderId, "orderId");
        requirePositive(quantity);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "ttl must be positive");
        }

        return ask(productId, book -> {
            Instant now = clock.instant();
            book.purgeExpired(now);

            int onHand = ledger.onHand(productId);
            int heldByOthers = book.reservedTotal() - book.quantityFor(orderId);
            int available = Math.max(0, onHand - heldByOthers);
            if (quantity > available) {
                throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, String.format(
                        "Insufficient stock for product %s: requested=%d, available=%d, shortfall=%d",
                        productId, quantity, available, quantity - available));
            }

            Reservation reservation = new Reservation(orderId, quantity, now.plus(ttl));
            book.put(reservation);
            log.info("Stock reserved: productId={}, orderId={}, quantity={}, expiresAt={}",
                    productId, orderId, quantity, reservation.expiresAt());
            return toResponse(productId, reservation, now);
        });
    }

    /** 예약 해제. 없으면 no-op (보상 단계에서 몇 번이고 호출해도 안전) */
    public ReleaseResponse release(String productId, String orderId) {
        requireId(productId, "productId");
        requireId(orderId, "orderId");

        return ask(productId, book -> {
            book.purgeExpired(clock.instant());
            boolean released = book.remove(orderId).isPresent();
            if (released) {
                log.info("Stock reservation released: productId={}, orderId={}", productId, orderId);
            }
            return new ReleaseResponse(productId, orderId, released);
        });
    }

    /**
     * 예약을 영구 차감으로 전환. 원장 차감이 성공한 뒤에 예약을 지운다.
     * 예약보다 적은 수량을 차감하면 남은 예약분은 함께 풀린다.
     */
    public StockStatusResponse reduce(String productId, String orderId, int quantity) {
        requireId(productId, "productId");
        requireId(orderId, "orderId");
        requirePositive(quantity);

        return ask(productId, book -> {
            book.purgeExpired(clock.instant());
            Reservation reservation = book.find(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.RESERVATION_EXPIRED,
                            "No active reservation for order " + orderId + " on product " + productId));
            if (quantity > reservation.quantity()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, String.format(
                        "Cannot reduce %d units of product %s: order %s reserved %d",
                        quantity, productId, orderId, reservation.quantity()));
            }

            ledger.decrement(productId, quantity);
            book.remove(orderId);
            log.info("Stock reduced: productId={}, orderId={}, quantity={}", productId, orderId, quantity);
            return snapshot(productId, book);
        });
    }

    /** reduce 보상. on-hand를 되돌린다. */
    public StockStatusResponse restore(String productId, String orderId, int quantity) {
        requireId(productId, "productId");
        requirePositive(quantity);

        return ask(productId, book -> {
            book.purgeExpired(clock.instant());
            ledger.increment(productId, quantity);
            log.warn("Stock restored: productId={}, orderId={}, quantity={}", productId, orderId, quantity);
            return snapshot(productId, book);
        });
    }

    public StockStatusResponse status(String productId) {
        requireId(productId, "productId");
        return ask(productId, book -> {
            book.purgeExpired(clock.instant());
            return snapshot(productId, book);
        });
    }

    public CleanupResponse cleanupExpired(String productId) {
        requireId(productId, "productId");
        return ask(productId, book -> {
            int removed = book.purgeExpired(clock.instant());
            if (removed > 0) {
                log.info("Expired reservations removed: productId={}, count={}", productId, removed);
            }
            return new CleanupResponse(productId, removed);
        });
    }

    /** 진단용 목록. 아직 정리되지 않은 만료 예약도 expired=true로 보여준다. */
    public List<ReservationResponse> reservations(String productId) {
        requireId(productId, "productId");
        return ask(productId, book -> {
            Instant now = clock.instant();
            return book.snapshot().stream()
                    .map(reservation -> toResponse(productId, reservation, now))
                    .toList();
        });
    }

    /** 관리자 on-hand 설정. 현재 예약 합계보다 작게 만들 수 없다. */
    public StockStatusResponse setOnHand(String productId, int onHand) {
        requireId(productId, "productId");
        if (onHand < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "onHand must not be negative");
        }

        return ask(productId, book -> {
            book.purgeExpired(clock.instant());
            int reserved = book.reservedTotal();
            if (onHand < reserved) {
                throw new BusinessException(ErrorCode.STOCK_BELOW_RESERVED, String.format(
                        "Cannot set product %s on-hand to %d: %d units are reserved",
                        productId, onHand, reserved));
            }
            ledger.setOnHand(productId, onHand);
            log.info("Stock on-hand set: productId={}, onHand={}", productId, onHand);
            return snapshot(productId, book);
        });
    }

    /** 메일박스가 있는 모든 상품의 만료 예약 정리. 바쁜 상품은 다음 주기로 넘긴다. */
    public int cleanupAllExpired() {
        int removed = 0;
        for (String productId : new ArrayList<>(mailboxes.keySet())) {
            try {
                removed += cleanupExpired(productId).removed();
            } catch (BusinessException e) {
                log.warn("Skipped expiry sweep for product {}: {}", productId, e.getMessage());
            }
        }
        return removed;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }

    private <T> T ask(String productId, Function<ReservationBook, T> operation) {
        ProductMailbox mailbox = mailboxes.computeIfAbsent(productId,
                id -> new ProductMailbox(id, workers, properties.getMailboxCapacity()));

        CompletableFuture<T> reply;
        try {
            reply = CompletableFuture.supplyAsync(() -> operation.apply(mailbox.book()), mailbox);
        } catch (RejectedExecutionException e) {
            throw new BusinessException(ErrorCode.STOCK_BUSY,
                    "Too many pending stock operations for product " + productId, e);
        }

        try {
            return reply.get(properties.getOperationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Stock operation failed for product " + productId, e.getCause());
        } catch (TimeoutException e) {
            throw new BusinessException(ErrorCode.REQUEST_TIMEOUT,
                    "Stock operation timed out for product " + productId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Interrupted while waiting for product " + productId, e);
        }
    }

    private StockStatusResponse snapshot(String productId, ReservationBook book) {
        int onHand = ledger.onHand(productId);
        int reserved = book.reservedTotal();
        return new StockStatusResponse(productId, onHand, reserved, Math.max(0, onHand - reserved));
    }

    private ReservationResponse toResponse(String productId, Reservation reservation, Instant now) {
        return new ReservationResponse(productId, reservation.orderId(), reservation.quantity(),
                reservation.expiresAt(), reservation.isExpiredAt(now));
    }

    private static void requireId(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, name + " is required");
        }
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "quantity must be positive");
        }
    }
}
