package com.shopflow.order.saga;

import com.shopflow.order.config.SagaProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 상품별 작업을 병렬 실행하고 모두 끝나거나 단계 타임아웃이 될 때까지 기다린다 (barrier).
 *
 * <p>항목마다 성공, 실패, 시간 초과 중 하나의 결과를 돌려준다. 일부가 실패해도
 * 나머지 결과를 버리지 않으므로 호출자는 성공한 항목만큼 정확히 보상을 기록할 수 있다.</p>
 */
@Component
public class SagaFanOut {

    private final Executor executor;
    private final SagaProperties properties;

    public SagaFanOut(@Qualifier("sagaExecutor") Executor executor, SagaProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    public <T, R> List<Outcome<T, R>> run(List<T> inputs, Function<T, R> task) {
        List<CompletableFuture<R>> futures = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(input), executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .exceptionally(ignored -> null)  // 항목별 결과는 아래에서 개별 확인
                .completeOnTimeout(null, properties.getStepTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .join();

        List<Outcome<T, R>> outcomes = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            outcomes.add(outcomeOf(inputs.get(i), futures.get(i)));
        }
        return outcomes;
    }

    private static <T, R> Outcome<T, R> outcomeOf(T input, CompletableFuture<R> future) {
        if (!future.isDone()) {
            future.cancel(false);
            return new Outcome<>(input, null, null, true);
        }
        if (future.isCompletedExceptionally()) {
            Throwable error = future.handle((value, ex) -> ex).join();
            if (error instanceof CompletionException && error.getCause() != null) {
                error = error.getCause();
            }
            return new Outcome<>(input, null, error, false);
        }
        return new Outcome<>(input, future.join(), null, false);
    }

    /** 항목 하나의 결과. error와 timedOut이 모두 없으면 성공 */
    public record Outcome<T, R>(T input, R result, Throwable error, boolean timedOut) {

        public boolean succeeded() {
            return error == null && !timedOut;
        }
    }
}
