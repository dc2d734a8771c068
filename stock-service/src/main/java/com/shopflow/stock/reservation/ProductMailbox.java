package com.shopflow.stock.reservation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 상품 하나의 메일박스 - 공유 워커 풀 위에서 동작하는 직렬 Executor.
 *
 * <pre>
 *   execute(task) → 큐에 적재 (capacity 초과 시 RejectedExecutionException)
 *   앞 작업이 끝나야 다음 작업을 워커 풀에 넘긴다 → 같은 상품 작업은 절대 겹치지 않음
 *   다른 상품의 메일박스는 같은 풀에서 병렬로 진행
 * </pre>
 *
 * <p>작업 사이의 인계가 synchronized 블록과 Executor 제출을 거치므로
 * 이전 작업이 {@link ReservationBook}에 쓴 내용은 다음 작업에서 보인다.</p>
 */
final class ProductMailbox implements Executor {

    private final String productId;
    private final Executor workers;
    private final int capacity;
    private final ReservationBook book = new ReservationBook();
    private final Deque<Runnable> pending = new ArrayDeque<>();
    private Runnable active;

    ProductMailbox(String productId, Executor workers, int capacity) {
        this.productId = productId;
        this.workers = workers;
        this.capacity = capacity;
    }

    @Override
    public synchronized void execute(Runnable task) {
        if (pending.size() >= capacity) {
            throw new RejectedExecutionException("Mailbox for product " + productId + " is full");
        }
        pending.offer(() -> {
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    /** 워커 풀이 제출을 거부하면 다음 execute가 다시 시작할 수 있도록 active를 비운다 */
    private synchronized void scheduleNext() {
        active = pending.poll();
        if (active != null) {
            try {
                workers.execute(active);
            } catch (RejectedExecutionException e) {
                active = null;
                throw e;
            }
        }
    }

    ReservationBook book() {
        return book;
    }
}
