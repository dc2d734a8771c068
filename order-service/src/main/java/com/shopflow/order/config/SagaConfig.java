package com.shopflow.order.config;

import com.shopflow.common.tracing.MdcTaskDecorator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Saga 실행 인프라
 *
 * <h3>sagaExecutor</h3>
 * 상품별 배송비 견적, 예약, 차감을 병렬로 실행하는 팬아웃 풀.
 * 요청 스레드는 단계마다 모든 항목이 끝날 때까지 기다린다 (barrier).
 * 풀이 가득 차면 호출 스레드에서 직접 실행해 작업을 잃지 않는다.
 * MdcTaskDecorator로 correlationId가 워커 스레드 로그에도 찍힌다.
 */
@Configuration
@EnableConfigurationProperties(SagaProperties.class)
public class SagaConfig {

    @Bean
    public ThreadPoolTaskExecutor sagaExecutor(SagaProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFanOutThreads());
        executor.setMaxPoolSize(properties.getFanOutThreads());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("saga-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
